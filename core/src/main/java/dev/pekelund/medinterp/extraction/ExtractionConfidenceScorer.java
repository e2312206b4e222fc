package dev.pekelund.medinterp.extraction;

import dev.pekelund.medinterp.model.Observation;
import dev.pekelund.medinterp.model.ObservationSet;
import dev.pekelund.medinterp.model.ReferenceRange;
import org.springframework.util.StringUtils;

/**
 * Completeness score of extracted observations: the mean of per-observation scores, 0 for an empty
 * set.
 */
public final class ExtractionConfidenceScorer {

    static final double IDENTITY_WEIGHT = 0.3;
    static final double VALUE_WEIGHT = 0.2;
    static final double UNIT_WEIGHT = 0.2;
    static final double RANGE_WEIGHT = 0.2;
    static final double COLLECTED_AT_WEIGHT = 0.1;

    private ExtractionConfidenceScorer() {
    }

    public static double score(ObservationSet observationSet) {
        if (observationSet == null || observationSet.isEmpty()) {
            return 0.0;
        }
        return observationSet.observations().stream()
            .mapToDouble(ExtractionConfidenceScorer::scoreObservation)
            .average()
            .orElse(0.0);
    }

    static double scoreObservation(Observation observation) {
        double score = 0.0;
        if (StringUtils.hasText(observation.code()) && StringUtils.hasText(observation.display())) {
            score += IDENTITY_WEIGHT;
        }
        if (observation.value().isPresent()) {
            score += VALUE_WEIGHT;
        }
        if (StringUtils.hasText(observation.unit())) {
            score += UNIT_WEIGHT;
        }
        ReferenceRange range = observation.referenceRange();
        if (range != null && range.hasBound()) {
            score += RANGE_WEIGHT;
        }
        if (observation.collectedAt() != null) {
            score += COLLECTED_AT_WEIGHT;
        }
        return Math.min(1.0, score);
    }
}
