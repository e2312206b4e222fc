package dev.pekelund.medinterp.pipeline;

import dev.pekelund.medinterp.classification.ReportTypeHeuristic;
import dev.pekelund.medinterp.interpretation.AnalyteRule;
import dev.pekelund.medinterp.interpretation.InterpreterTexts;
import dev.pekelund.medinterp.normalization.UnitConversion;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable configuration of a pipeline, loaded once at startup.
 */
public record PipelineConfiguration(
    PipelineThresholds thresholds,
    Duration extractionTimeout,
    List<ReportTypeHeuristic> heuristics,
    List<UnitConversion> conversions,
    Set<String> canonicalUnits,
    Set<String> numericUnits,
    List<AnalyteRule> analyteRules,
    InterpreterTexts interpreterTexts,
    FeedbackTemplates feedback,
    List<String> references
) {

    public PipelineConfiguration {
        Objects.requireNonNull(thresholds, "thresholds");
        Objects.requireNonNull(extractionTimeout, "extractionTimeout");
        Objects.requireNonNull(feedback, "feedback");
        if (heuristics == null || heuristics.isEmpty()) {
            throw new IllegalArgumentException("At least one report type heuristic must be configured");
        }
        heuristics = List.copyOf(heuristics);
        conversions = conversions == null ? List.of() : List.copyOf(conversions);
        canonicalUnits = canonicalUnits == null ? Set.of() : Set.copyOf(canonicalUnits);
        numericUnits = numericUnits == null ? Set.of() : Set.copyOf(numericUnits);
        analyteRules = analyteRules == null ? List.of() : List.copyOf(analyteRules);
        interpreterTexts = interpreterTexts != null ? interpreterTexts : InterpreterTexts.DEFAULT;
        references = references == null ? List.of() : List.copyOf(references);
    }
}
