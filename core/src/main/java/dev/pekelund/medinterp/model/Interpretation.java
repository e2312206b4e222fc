package dev.pekelund.medinterp.model;

import java.util.List;

/**
 * Clinical reading of a normalized observation set. The category is {@code null} only on discarded
 * results.
 */
public record Interpretation(
    InterpretationCategory category,
    List<String> insights,
    List<String> caveats,
    List<String> nextBestActions
) {

    private static final Interpretation NONE = new Interpretation(null, List.of(), List.of(), List.of());

    public Interpretation {
        insights = insights == null ? List.of() : List.copyOf(insights);
        caveats = caveats == null ? List.of() : List.copyOf(caveats);
        nextBestActions = nextBestActions == null ? List.of() : List.copyOf(nextBestActions);
    }

    public static Interpretation none() {
        return NONE;
    }
}
