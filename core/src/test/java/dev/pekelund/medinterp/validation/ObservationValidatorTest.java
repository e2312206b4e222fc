package dev.pekelund.medinterp.validation;

import static dev.pekelund.medinterp.pipeline.PipelineFixtures.observation;
import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.medinterp.model.Measurement;
import dev.pekelund.medinterp.model.Observation;
import dev.pekelund.medinterp.model.ObservationSet;
import dev.pekelund.medinterp.model.ObservedValue;
import dev.pekelund.medinterp.model.ReferenceRange;
import dev.pekelund.medinterp.model.ValidationFinding;
import dev.pekelund.medinterp.model.ValidationOutcome;
import dev.pekelund.medinterp.pipeline.PipelineFixtures;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ObservationValidatorTest {

    private static final Instant INGESTED_AT = Instant.parse("2024-05-01T12:00:00Z");

    private final ObservationValidator validator = ObservationValidator.withDefaultChecks(PipelineFixtures.NUMERIC_UNITS);

    @Test
    void cleanSetYieldsSinglePass() {
        List<ValidationFinding> findings = validate(observation("LDL", 3.1, "mmol/L",
            new ReferenceRange(0.0, 3.4, "mmol/L")));

        assertThat(findings).containsExactly(ValidationFinding.pass("All validation checks passed"));
        assertThat(ObservationValidator.hasFailure(findings)).isFalse();
    }

    @Test
    void nonNumericValueWithNumericUnitFails() {
        List<ValidationFinding> findings = validate(observation("LDL", "high", "mmol/L"));

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.outcome()).isEqualTo(ValidationOutcome.FAIL);
            assertThat(finding.field()).isEqualTo("LDL");
        });
    }

    @Test
    void textWithLeadingNumberCountsAsNumeric() {
        assertThat(validate(observation("LDL", "3.1 H", "mmol/L")))
            .extracting(ValidationFinding::outcome)
            .containsExactly(ValidationOutcome.PASS);
    }

    @Test
    void missingUnitFails() {
        List<ValidationFinding> findings = validate(observation("Culture", "negative", " "));

        assertThat(findings).extracting(ValidationFinding::outcome).containsExactly(ValidationOutcome.FAIL);
        assertThat(ObservationValidator.hasFailure(findings)).isTrue();
    }

    @Test
    void rangeUnitMismatchWarns() {
        List<ValidationFinding> findings = validate(observation("LDL", 3.1, "mmol/L",
            new ReferenceRange(0.0, 130.0, "mg/dL")));

        assertThat(findings).extracting(ValidationFinding::outcome).containsExactly(ValidationOutcome.WARN);
    }

    @Test
    void futureCollectionTimeWarns() {
        Observation future = new Observation("LDL", "LDL", Measurement.raw(ObservedValue.of(3.1), "mmol/L"), null,
            INGESTED_AT.plusSeconds(3600), List.of());

        assertThat(validate(future)).extracting(ValidationFinding::outcome).containsExactly(ValidationOutcome.WARN);
    }

    @Test
    void outlierWarnsOnlyBeyondFourRangeWidths() {
        ReferenceRange range = new ReferenceRange(1.0, 2.0, "mmol/L");

        assertThat(validate(observation("HDL", 5.5, "mmol/L", range)))
            .extracting(ValidationFinding::outcome).containsExactly(ValidationOutcome.PASS);
        assertThat(validate(observation("HDL", 5.6, "mmol/L", range)))
            .extracting(ValidationFinding::outcome).containsExactly(ValidationOutcome.WARN);
    }

    @Test
    void checksRunIndependently() {
        List<ValidationFinding> findings = validate(
            observation("LDL", "n/a", "mmol/L", new ReferenceRange(0.0, 130.0, "mg/dL")),
            observation("Note", 1, null));

        assertThat(findings).extracting(ValidationFinding::outcome)
            .containsExactly(ValidationOutcome.FAIL, ValidationOutcome.WARN, ValidationOutcome.FAIL);
    }

    private List<ValidationFinding> validate(Observation... observations) {
        return validator.validate(new ObservationSet(null, List.of(observations)), INGESTED_AT);
    }
}
