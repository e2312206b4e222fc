package dev.pekelund.medinterp.interpretation;

import dev.pekelund.medinterp.model.InterpretationCategory;
import java.util.Objects;

/**
 * Half-open value interval {@code [min, max)} in the rule's canonical unit. A missing bound is
 * unbounded on that side.
 */
public record DecisionBand(InterpretationCategory category, Double min, Double max, String insight, String action) {

    public DecisionBand {
        Objects.requireNonNull(category, "category");
        if (insight == null || insight.isBlank()) {
            throw new IllegalArgumentException("Decision band for " + category + " requires an insight");
        }
        if (min != null && max != null && min >= max) {
            throw new IllegalArgumentException("Decision band minimum " + min + " must be below maximum " + max);
        }
        action = action == null || action.isBlank() ? null : action;
    }

    public boolean contains(double value) {
        return (min == null || value >= min) && (max == null || value < max);
    }
}
