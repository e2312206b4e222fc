package dev.pekelund.medinterp.extraction;

import dev.pekelund.medinterp.model.ObservationSet;

/**
 * Observations returned by an extraction attempt and their confidence. {@code failure} describes
 * why nothing usable came back, and is {@code null} when the collaborator answered.
 */
public record ExtractionOutcome(ObservationSet data, double confidence, String failure) {

    public ExtractionOutcome {
        data = data != null ? data : ObservationSet.empty();
    }

    public static ExtractionOutcome failed(String failure) {
        return new ExtractionOutcome(ObservationSet.empty(), 0.0, failure);
    }

    public boolean isFailure() {
        return failure != null;
    }
}
