package dev.pekelund.medinterp.model;

/**
 * Text recovered from a submitted document by the OCR collaborator.
 *
 * @param text          extracted text, never {@code null}
 * @param qualityScore  fidelity estimate of the recovered text in {@code [0, 1]}
 * @param confidence    the collaborator's own confidence in {@code [0, 1]}
 */
public record ReportText(String text, double qualityScore, double confidence) {

    public ReportText {
        text = text != null ? text : "";
        qualityScore = clamp(qualityScore);
        confidence = clamp(confidence);
    }

    public ReportText(String text, double qualityScore) {
        this(text, qualityScore, qualityScore);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
