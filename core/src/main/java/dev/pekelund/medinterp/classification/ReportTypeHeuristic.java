package dev.pekelund.medinterp.classification;

import dev.pekelund.medinterp.model.ReportType;
import java.util.List;
import java.util.Objects;

/**
 * Weighted keyword heuristic voting for one report type. Patterns and exclusions are regular
 * expressions matched case-insensitively.
 */
public record ReportTypeHeuristic(ReportType label, List<String> patterns, double weight, List<String> exclusions) {

    public static final double DEFAULT_WEIGHT = 1.0;

    public ReportTypeHeuristic {
        Objects.requireNonNull(label, "label");
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("Heuristic for " + label + " must declare at least one pattern");
        }
        if (!(weight > 0.0)) {
            throw new IllegalArgumentException("Heuristic weight for " + label + " must be positive but was " + weight);
        }
        patterns = List.copyOf(patterns);
        exclusions = exclusions == null ? List.of() : List.copyOf(exclusions);
    }

    public ReportTypeHeuristic(ReportType label, List<String> patterns) {
        this(label, patterns, DEFAULT_WEIGHT, List.of());
    }
}
