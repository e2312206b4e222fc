package dev.pekelund.medinterp.normalization;

import static dev.pekelund.medinterp.pipeline.PipelineFixtures.observation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.pekelund.medinterp.model.Measurement;
import dev.pekelund.medinterp.model.Observation;
import dev.pekelund.medinterp.model.ObservationSet;
import dev.pekelund.medinterp.model.ReferenceRange;
import dev.pekelund.medinterp.model.UnitConversionRecord;
import dev.pekelund.medinterp.pipeline.PipelineFixtures;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class UnitNormalizerTest {

    private final UnitNormalizer normalizer =
        new UnitNormalizer(PipelineFixtures.CONVERSIONS, PipelineFixtures.CANONICAL_UNITS);

    @Test
    void convertsValueAndReferenceRange() {
        ObservationSet set = new ObservationSet("Lipids",
            List.of(observation("LDL", 160, "mg/dL", new ReferenceRange(0.0, 100.0, "mg/dL"))));

        NormalizationOutcome outcome = normalizer.normalize(set);

        Observation ldl = outcome.data().observations().get(0);
        assertThat(ldl.measurement()).isInstanceOf(Measurement.Normalized.class);
        assertThat(ldl.value().number()).isCloseTo(4.144, within(1e-9));
        assertThat(ldl.unit()).isEqualTo("mmol/L");
        assertThat(ldl.referenceRange().high()).isCloseTo(2.59, within(1e-9));
        assertThat(ldl.referenceRange().unit()).isEqualTo(ldl.unit());
        assertThat(outcome.conversions()).containsExactly(new UnitConversionRecord("LDL", "mg/dL", "mmol/L", 0.0259));
        assertThat(outcome.confidence()).isEqualTo(1.0);
        assertThat(outcome.data().panelName()).isEqualTo("Lipids");
    }

    @Test
    void unitMatchIsCaseInsensitiveAndAnalyteMatchesDisplay() {
        Observation glucose = new Observation("GLU-F", "Fasting glucose",
            Measurement.raw(dev.pekelund.medinterp.model.ObservedValue.of(90.0), " MG/DL "), null, null, List.of());

        NormalizationOutcome outcome = normalizer.normalize(new ObservationSet(null, List.of(glucose)));

        assertThat(outcome.data().observations().get(0).value().number()).isCloseTo(4.995, within(1e-9));
        assertThat(outcome.conversions()).hasSize(1);
    }

    @Test
    void canonicalUnitIsMarkedNormalizedWithoutConversionRecord() {
        ObservationSet set = new ObservationSet(null,
            List.of(observation("HbA1c", 5.9, "%", new ReferenceRange(4.0, 5.6, null))));

        NormalizationOutcome outcome = normalizer.normalize(set);

        Observation a1c = outcome.data().observations().get(0);
        assertThat(a1c.measurement().isNormalized()).isTrue();
        assertThat(a1c.value().number()).isEqualTo(5.9);
        assertThat(a1c.referenceRange().unit()).isEqualTo("%");
        assertThat(outcome.conversions()).isEmpty();
        assertThat(outcome.confidence()).isEqualTo(1.0);
    }

    @Test
    void unknownUnitIsLeftRawAndLowersConfidence() {
        ObservationSet set = new ObservationSet(null, List.of(
            observation("LDL", 3.1, "mmol/L"),
            observation("Ferritin", 80, "ng/mL"),
            observation("Note", "see comment", null),
            observation("TSH", 2.1, "mIU/L")));

        NormalizationOutcome outcome = normalizer.normalize(set);

        assertThat(outcome.confidence()).isEqualTo(0.25);
        assertThat(outcome.data().observations().get(1).measurement()).isInstanceOf(Measurement.Raw.class);
        assertThat(outcome.failures()).hasSize(3);
    }

    @Test
    void nonNumericValueWithConvertibleUnitIsNotConverted() {
        NormalizationOutcome outcome = normalizer.normalize(
            new ObservationSet(null, List.of(observation("LDL", "pending", "mg/dL"))));

        assertThat(outcome.conversions()).isEmpty();
        assertThat(outcome.confidence()).isZero();
    }

    @Test
    void emptySetHasFullConfidence() {
        assertThat(normalizer.normalize(ObservationSet.empty()).confidence()).isEqualTo(1.0);
    }

    @Test
    void normalizingTwiceIsANoOp() {
        ObservationSet set = new ObservationSet("Lipids", List.of(
            observation("LDL", 160, "mg/dL", new ReferenceRange(0.0, 100.0, "mg/dL")),
            observation("Glucose", 99, "mg/dL"),
            observation("HbA1c", 5.4, "%")));

        NormalizationOutcome first = normalizer.normalize(set);
        NormalizationOutcome second = normalizer.normalize(first.data());

        assertThat(second.data()).isEqualTo(first.data());
        assertThat(second.conversions()).isEmpty();
        assertThat(second.confidence()).isEqualTo(1.0);
    }

    @Test
    void convertingThroughTheInverseRecoversTheValue() {
        UnitConversion forward = new UnitConversion("creatinine", "mg/dL", "µmol/L", 88.4);
        UnitNormalizer there = new UnitNormalizer(List.of(forward), Set.of());
        UnitNormalizer back = new UnitNormalizer(List.of(forward.inverse()), Set.of());
        double original = 1.13;

        Observation converted = there.normalize(
            new ObservationSet(null, List.of(observation("creatinine", original, "mg/dL")))).data().observations().get(0);
        Observation restored = back.normalize(new ObservationSet(null,
            List.of(observation("creatinine", converted.value().number(), converted.unit())))).data().observations().get(0);

        assertThat(restored.unit()).isEqualTo("mg/dL");
        assertThat(Math.abs(restored.value().number() - original) / original).isLessThan(1e-6);
    }

    @Test
    void rejectsNonPositiveFactor() {
        assertThatThrownBy(() -> new UnitConversion("ldl", "mg/dL", "mmol/L", 0.0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
