package dev.pekelund.medinterp.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.pekelund.medinterp.model.Measurement;
import dev.pekelund.medinterp.model.Observation;
import dev.pekelund.medinterp.model.ObservationSet;
import dev.pekelund.medinterp.model.ObservedValue;
import dev.pekelund.medinterp.model.ReferenceRange;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExtractionConfidenceScorerTest {

    @Test
    void completeObservationScoresOne() {
        Observation complete = new Observation("LDL", "LDL cholesterol",
            Measurement.raw(ObservedValue.of(3.1), "mmol/L"), new ReferenceRange(null, 3.4, "mmol/L"),
            Instant.parse("2024-01-01T00:00:00Z"), List.of());

        assertThat(ExtractionConfidenceScorer.scoreObservation(complete)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void scoresAreAveragedAcrossObservations() {
        Observation valueAndUnit = new Observation(null, "Glucose", Measurement.raw(ObservedValue.of(5.0), "mmol/L"),
            null, null, List.of());
        Observation identityOnly = new Observation("HDL", "HDL cholesterol",
            Measurement.raw(ObservedValue.missing(), null), null, null, List.of());

        double score = ExtractionConfidenceScorer.score(new ObservationSet(null, List.of(valueAndUnit, identityOnly)));

        assertThat(score).isCloseTo((0.4 + 0.3) / 2, within(1e-9));
    }

    @Test
    void emptySetScoresZero() {
        assertThat(ExtractionConfidenceScorer.score(ObservationSet.empty())).isZero();
        assertThat(ExtractionConfidenceScorer.score(null)).isZero();
    }
}
