package dev.pekelund.medinterp.interpretation;

/**
 * Fixed wording the interpreter uses outside of analyte rules.
 *
 * @param genericInsight        insight used when no rule triggered
 * @param limitedPanelCaveat    caveat for panels smaller than {@code limitedPanelSize}
 * @param defaultAction         action attached to a non-normal result that has none
 * @param limitedPanelSize      observation count below which the panel is considered partial
 */
public record InterpreterTexts(String genericInsight, String limitedPanelCaveat, String defaultAction,
    int limitedPanelSize) {

    public static final InterpreterTexts DEFAULT = new InterpreterTexts(
        "All measured values appear within typical ranges",
        "Limited data available - interpretations based on partial panel",
        "Discuss results with your healthcare provider",
        3);
}
