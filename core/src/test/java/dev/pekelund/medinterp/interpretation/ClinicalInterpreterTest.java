package dev.pekelund.medinterp.interpretation;

import static dev.pekelund.medinterp.pipeline.PipelineFixtures.observation;
import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.medinterp.model.Interpretation;
import dev.pekelund.medinterp.model.InterpretationCategory;
import dev.pekelund.medinterp.model.Observation;
import dev.pekelund.medinterp.model.ObservationSet;
import dev.pekelund.medinterp.model.ReferenceRange;
import dev.pekelund.medinterp.normalization.UnitNormalizer;
import dev.pekelund.medinterp.pipeline.PipelineFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ClinicalInterpreterTest {

    private final ClinicalInterpreter interpreter = new ClinicalInterpreter(PipelineFixtures.RULES, InterpreterTexts.DEFAULT);
    private final UnitNormalizer normalizer =
        new UnitNormalizer(PipelineFixtures.CONVERSIONS, PipelineFixtures.CANONICAL_UNITS);

    @ParameterizedTest
    @CsvSource({
        "160, Borderline, LDL cholesterol is above optimal levels",
        "200, Abnormal, 'LDL cholesterol is significantly elevated, which may increase cardiovascular risk'",
        "90, Normal, LDL cholesterol is within optimal range"
    })
    void ldlInMilligramsIsNormalizedThenBanded(double mgPerDl, String category, String insight) {
        ObservationSet normalized = normalizer.normalize(new ObservationSet(null,
            List.of(observation("LDL", mgPerDl, "mg/dL", new ReferenceRange(0.0, 100.0, "mg/dL"))))).data();

        InterpretationOutcome outcome = interpreter.interpret(normalized);

        assertThat(outcome.interpretation().category()).isEqualTo(InterpretationCategory.fromLabel(category));
        assertThat(outcome.interpretation().insights()).containsExactly(insight);
        assertThat(outcome.rulesTriggered()).containsExactly("LipidRiskSimple");
    }

    @Test
    void ldlStillInMilligramsIsConvertedByTheRule() {
        InterpretationOutcome outcome = interpret(observation("LDL cholesterol", 200, "mg/dL"));

        assertThat(outcome.interpretation().category()).isEqualTo(InterpretationCategory.ABNORMAL);
        assertThat(outcome.interpretation().nextBestActions())
            .containsExactly("Consult with a healthcare provider about lipid management strategies");
    }

    @ParameterizedTest
    @CsvSource({"7.0, Abnormal", "5.9, Borderline", "5.0, Normal", "6.5, Abnormal", "5.7, Borderline"})
    void hba1cBands(double percent, String category) {
        InterpretationOutcome outcome = interpret(observation("HbA1c", percent, "%"));

        assertThat(outcome.interpretation().category()).isEqualTo(InterpretationCategory.fromLabel(category));
        assertThat(outcome.rulesTriggered()).containsExactly("A1cGlycemia");
    }

    @Test
    void glucoseIsSuppressedWhenHba1cWasInterpreted() {
        InterpretationOutcome outcome = interpret(
            observation("HbA1c", 5.0, "%"),
            observation("Glucose", 8.0, "mmol/L"));

        assertThat(outcome.rulesTriggered()).containsExactly("A1cGlycemia");
        assertThat(outcome.interpretation().category()).isEqualTo(InterpretationCategory.NORMAL);
    }

    @Test
    void glucoseBandsApplyWithoutHba1c() {
        assertThat(interpret(observation("Glucose", 7.2, "mmol/L")).interpretation().insights())
            .containsExactly("Fasting glucose is elevated");
        assertThat(interpret(observation("Glucose", 3.5, "mmol/L")).interpretation().category())
            .isEqualTo(InterpretationCategory.BORDERLINE);
        assertThat(interpret(observation("Glucose", 90, "mg/dL")).interpretation().insights())
            .containsExactly("Fasting glucose is within normal range");
    }

    @Test
    void mostSevereCategoryWins() {
        InterpretationOutcome outcome = interpret(
            observation("LDL", 5.2, "mmol/L"),
            observation("HbA1c", 5.9, "%"),
            observation("Total cholesterol", 4.0, "mmol/L"));

        Interpretation interpretation = outcome.interpretation();
        assertThat(outcome.rulesTriggered()).containsExactly("LipidRiskSimple", "A1cGlycemia", "TotalCholesterol");
        assertThat(interpretation.category()).isEqualTo(InterpretationCategory.ABNORMAL);
        assertThat(interpretation.nextBestActions()).containsExactly(
            "Consult with a healthcare provider about lipid management strategies",
            "Consider lifestyle modifications to improve glycemic control");
        assertThat(interpretation.caveats()).isEmpty();
    }

    @Test
    void totalCholesterolRuleIgnoresLdlAndHdl() {
        InterpretationOutcome outcome = interpret(
            observation("HDL cholesterol", 1.5, "mmol/L"),
            observation("LDL cholesterol", 2.0, "mmol/L"),
            observation("Cholesterol", 6.5, "mmol/L"));

        assertThat(outcome.rulesTriggered()).containsExactly("LipidRiskSimple", "TotalCholesterol");
        assertThat(outcome.interpretation().insights())
            .containsExactly("LDL cholesterol is within optimal range", "Total cholesterol is high");
    }

    @Test
    void noRuleWithValueInsideRangeIsNormal() {
        InterpretationOutcome outcome = interpret(
            observation("Ferritin", 80, "µg/L", new ReferenceRange(30.0, 400.0, "µg/L")),
            observation("Sodium", 140, "mmol/L"),
            observation("Potassium", 4.1, "mmol/L"));

        assertThat(outcome.rulesTriggered()).isEmpty();
        assertThat(outcome.interpretation().category()).isEqualTo(InterpretationCategory.NORMAL);
        assertThat(outcome.interpretation().insights())
            .containsExactly("All measured values appear within typical ranges");
        assertThat(outcome.interpretation().nextBestActions()).isEmpty();
        assertThat(outcome.interpretation().caveats()).isEmpty();
    }

    @Test
    void noRuleAndNoRangeIsIndeterminateWithDefaultAction() {
        InterpretationOutcome outcome = interpret(observation("Ferritin", 80, "µg/L"));

        assertThat(outcome.interpretation().category()).isEqualTo(InterpretationCategory.INDETERMINATE);
        assertThat(outcome.interpretation().nextBestActions())
            .containsExactly("Discuss results with your healthcare provider");
        assertThat(outcome.interpretation().caveats())
            .containsExactly("Limited data available - interpretations based on partial panel");
    }

    @Test
    void unconvertibleUnitSkipsRuleWithCaveat() {
        InterpretationOutcome outcome = interpret(observation("LDL", 3.0, "mg/mL"));

        assertThat(outcome.rulesTriggered()).isEmpty();
        assertThat(outcome.interpretation().caveats())
            .anyMatch(caveat -> caveat.contains("cannot be converted to mmol/L"));
    }

    @Test
    void borderlineWithoutBandActionGetsDefaultAction() {
        InterpretationOutcome outcome = interpret(observation("Glucose", 6.1, "mmol/L"));

        assertThat(outcome.interpretation().category()).isEqualTo(InterpretationCategory.BORDERLINE);
        assertThat(outcome.interpretation().nextBestActions())
            .containsExactly("Discuss results with your healthcare provider");
    }

    private InterpretationOutcome interpret(Observation... observations) {
        return interpreter.interpret(new ObservationSet(null, List.of(observations)));
    }
}
