package dev.pekelund.medinterp.reportservice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.medinterp.interpretation.AnalyteRule;
import dev.pekelund.medinterp.interpretation.ClinicalInterpreter;
import dev.pekelund.medinterp.model.InterpretationCategory;
import dev.pekelund.medinterp.model.Measurement;
import dev.pekelund.medinterp.model.Observation;
import dev.pekelund.medinterp.model.ObservationSet;
import dev.pekelund.medinterp.model.ObservedValue;
import dev.pekelund.medinterp.model.ReportType;
import dev.pekelund.medinterp.pipeline.DiscardReason;
import dev.pekelund.medinterp.pipeline.PipelineConfiguration;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;

class InterpreterPropertiesTest {

    private InterpreterProperties properties;

    @BeforeEach
    void bindShippedDefaults() throws IOException {
        StandardEnvironment environment = new StandardEnvironment();
        new YamlPropertySourceLoader().load("application", new ClassPathResource("application.yml"))
            .forEach(environment.getPropertySources()::addLast);
        properties = Binder.get(environment).bind("interpreter", InterpreterProperties.class)
            .orElseThrow(() -> new IllegalStateException("interpreter properties missing"));
    }

    @Test
    void shippedDefaultsConvertIntoPipelineConfiguration() {
        PipelineConfiguration configuration = properties.toPipelineConfiguration();

        assertThat(configuration.thresholds().qualityFloor()).isEqualTo(0.15);
        assertThat(configuration.thresholds().typeDetection()).isEqualTo(0.30);
        assertThat(configuration.thresholds().overallAcceptMin()).isEqualTo(0.50);
        assertThat(configuration.extractionTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(configuration.heuristics()).extracting(heuristic -> heuristic.label())
            .containsExactly(ReportType.OBSERVATION_LABS, ReportType.CARDIAC_ECG, ReportType.DIAGNOSTIC_REPORT_IMAGING);
        assertThat(configuration.heuristics().get(0).exclusions()).containsExactly("echocardiogram");
        assertThat(configuration.conversions()).hasSize(6);
        assertThat(configuration.canonicalUnits()).contains("mmol/L", "µmol/L", "%");
        assertThat(configuration.numericUnits()).contains("mg/dL", "x10^9/L");
        assertThat(configuration.references()).hasSize(3);
        assertThat(properties.getPersistence().isEnabled()).isFalse();
    }

    @Test
    void analyteRulesKeepOrderSuppressionAndUnitFactors() {
        List<AnalyteRule> rules = properties.toPipelineConfiguration().analyteRules();

        assertThat(rules).extracting(AnalyteRule::name)
            .containsExactly("LipidRiskSimple", "A1cGlycemia", "FastingGlucose", "TotalCholesterol");
        assertThat(rules.get(0).unitFactors()).containsEntry("mg/dl", 0.0259);
        assertThat(rules.get(2).suppressedBy()).containsExactly("A1cGlycemia");
        assertThat(rules.get(3).excludeTerms()).contains("ldl", "hdl");
        assertThat(rules.get(2).bands()).hasSize(4);
    }

    @Test
    void boundRulesInterpretAnElevatedLdlAsBorderline() {
        PipelineConfiguration configuration = properties.toPipelineConfiguration();
        ClinicalInterpreter interpreter = new ClinicalInterpreter(configuration.analyteRules(),
            configuration.interpreterTexts());
        Observation ldl = new Observation("LDL", "LDL cholesterol", Measurement.raw(ObservedValue.of(160), "mg/dL"),
            null, null, List.of());

        InterpretationCategory category = interpreter.interpret(new ObservationSet("Lipids", List.of(ldl)))
            .interpretation().category();

        assertThat(category).isEqualTo(InterpretationCategory.BORDERLINE);
    }

    @Test
    void feedbackTemplatesCoverEveryDiscardReason() {
        PipelineConfiguration configuration = properties.toPipelineConfiguration();

        for (DiscardReason reason : DiscardReason.values()) {
            assertThat(configuration.feedback().messageFor(reason)).isNotBlank();
        }
        assertThat(configuration.feedback().messageFor(DiscardReason.LOW_QUALITY_INPUT))
            .startsWith("The document could not be read clearly");
    }

    @Test
    void unknownReportTypeLabelFailsFast() {
        InterpreterProperties.Heuristic heuristic = new InterpreterProperties.Heuristic();
        heuristic.setLabel("Astrology");
        heuristic.setPatterns(List.of("horoscope"));
        List<InterpreterProperties.Heuristic> heuristics = new ArrayList<>(properties.getHeuristics());
        heuristics.add(heuristic);
        properties.setHeuristics(heuristics);

        assertThatThrownBy(properties::toPipelineConfiguration)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Astrology");
    }

    @Test
    void thresholdOutsideUnitIntervalFailsFast() {
        properties.getThresholds().setOverallAcceptMin(1.5);

        assertThatThrownBy(properties::toPipelineConfiguration).isInstanceOf(IllegalArgumentException.class);
    }
}
