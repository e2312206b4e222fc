package dev.pekelund.medinterp.classification;

import dev.pekelund.medinterp.model.ReportText;
import dev.pekelund.medinterp.model.ReportType;
import dev.pekelund.medinterp.model.TypeDetection;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guesses the report type of OCR text by scoring it against a fixed list of weighted heuristics.
 * Instances are immutable and safe to share between concurrent submissions.
 */
public class ReportTypeClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportTypeClassifier.class);

    static final double EXCLUSION_PENALTY = 0.5;
    private static final int RATIONALE_TERMS = 3;

    private final List<CompiledHeuristic> heuristics;
    private final double typeDetectionMin;

    public ReportTypeClassifier(List<ReportTypeHeuristic> heuristics, double typeDetectionMin) {
        if (heuristics == null || heuristics.isEmpty()) {
            throw new IllegalArgumentException("At least one report type heuristic is required");
        }
        this.heuristics = heuristics.stream().map(CompiledHeuristic::compile).toList();
        this.typeDetectionMin = typeDetectionMin;
        LOGGER.info("Report type classifier initialised with {} heuristics (type detection minimum {})",
            heuristics.size(), typeDetectionMin);
    }

    public TypeDetection classify(ReportText reportText) {
        String text = reportText != null ? reportText.text() : "";
        double qualityScore = reportText != null ? reportText.qualityScore() : 0.0;

        LabelScores scores = score(heuristics, text);
        ReportType bestLabel = ReportType.OTHER;
        double bestScore = 0.0;
        for (Map.Entry<ReportType, Double> entry : scores.normalizedScores().entrySet()) {
            if (entry.getValue() > bestScore) {
                bestLabel = entry.getKey();
                bestScore = entry.getValue();
            }
        }

        if (bestScore <= 0.0) {
            LOGGER.info("No report type heuristic matched the submitted text");
            return TypeDetection.none();
        }

        double confidence = Math.min(1.0, bestScore * qualityScore);
        String rationale = rationale(bestLabel, scores.matchedTerms().getOrDefault(bestLabel, List.of()));
        if (confidence < typeDetectionMin) {
            LOGGER.info("Best report type {} scored {} with confidence {} below minimum {}; classifying as {}",
                bestLabel, bestScore, confidence, typeDetectionMin, ReportType.OTHER);
            return new TypeDetection(ReportType.OTHER, confidence, rationale);
        }

        LOGGER.info("Classified report as {} (score {}, confidence {})", bestLabel, bestScore, confidence);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Report type scores: {}", scores.normalizedScores());
        }
        return new TypeDetection(bestLabel, confidence, rationale);
    }

    /**
     * Scores {@code text} against every heuristic and accumulates the weighted scores per label.
     * The returned map keeps the order in which labels first appear in the heuristic list.
     */
    static LabelScores score(List<CompiledHeuristic> heuristics, String text) {
        String subject = text != null ? text : "";
        Map<ReportType, Double> labelScore = new LinkedHashMap<>();
        Map<ReportType, Double> labelWeight = new LinkedHashMap<>();
        Map<ReportType, List<String>> matchedTerms = new LinkedHashMap<>();

        for (CompiledHeuristic heuristic : heuristics) {
            int matchCount = 0;
            List<String> terms = matchedTerms.computeIfAbsent(heuristic.label(), key -> new ArrayList<>());
            for (int i = 0; i < heuristic.patterns().size(); i++) {
                if (heuristic.patterns().get(i).matcher(subject).find()) {
                    matchCount++;
                    terms.add(heuristic.source().patterns().get(i));
                }
            }
            long exclusionHits = heuristic.exclusions().stream()
                .filter(pattern -> pattern.matcher(subject).find())
                .count();

            double matchRatio = (double) matchCount / heuristic.patterns().size();
            double weighted = Math.max(0.0,
                matchRatio * heuristic.source().weight() - EXCLUSION_PENALTY * exclusionHits);

            labelScore.merge(heuristic.label(), weighted, Double::sum);
            labelWeight.merge(heuristic.label(), heuristic.source().weight(), Double::sum);
        }

        Map<ReportType, Double> normalized = new LinkedHashMap<>();
        labelScore.forEach((label, total) -> normalized.put(label, total / labelWeight.get(label)));
        return new LabelScores(Collections.unmodifiableMap(normalized), Collections.unmodifiableMap(matchedTerms));
    }

    List<CompiledHeuristic> heuristics() {
        return heuristics;
    }

    private static String rationale(ReportType label, List<String> terms) {
        if (terms.isEmpty()) {
            return TypeDetection.NO_MATCH_RATIONALE;
        }
        List<String> shown = terms.subList(0, Math.min(RATIONALE_TERMS, terms.size()));
        return "Detected " + label.label() + " based on keywords: " + String.join(", ", shown);
    }

    record LabelScores(Map<ReportType, Double> normalizedScores, Map<ReportType, List<String>> matchedTerms) { }

    record CompiledHeuristic(ReportTypeHeuristic source, List<Pattern> patterns, List<Pattern> exclusions) {

        ReportType label() {
            return source.label();
        }

        static CompiledHeuristic compile(ReportTypeHeuristic heuristic) {
            return new CompiledHeuristic(heuristic,
                heuristic.patterns().stream().map(CompiledHeuristic::toPattern).toList(),
                heuristic.exclusions().stream().map(CompiledHeuristic::toPattern).toList());
        }

        private static Pattern toPattern(String expression) {
            int flags = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
            try {
                return Pattern.compile(expression, flags);
            } catch (PatternSyntaxException ex) {
                LOGGER.warn("Heuristic pattern '{}' is not a valid regular expression; matching it literally", expression);
                return Pattern.compile(Pattern.quote(expression), flags);
            }
        }
    }
}
