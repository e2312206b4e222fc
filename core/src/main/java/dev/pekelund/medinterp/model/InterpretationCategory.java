package dev.pekelund.medinterp.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Clinical category of an interpretation. Severity orders the categories that can be escalated;
 * {@link #INDETERMINATE} sits below {@link #NORMAL} so any recognised finding replaces it.
 */
public enum InterpretationCategory {

    INDETERMINATE("Indeterminate", 0),
    NORMAL("Normal", 1),
    BORDERLINE("Borderline", 2),
    ABNORMAL("Abnormal", 3);

    private final String label;
    private final int severity;

    InterpretationCategory(String label, int severity) {
        this.label = label;
        this.severity = severity;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int severity() {
        return severity;
    }

    public boolean isMoreSevereThan(InterpretationCategory other) {
        return other == null || severity > other.severity;
    }

    public static InterpretationCategory fromLabel(String label) {
        for (InterpretationCategory category : values()) {
            if (category.label.equalsIgnoreCase(label) || category.name().equalsIgnoreCase(label)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown interpretation category: " + label);
    }
}
