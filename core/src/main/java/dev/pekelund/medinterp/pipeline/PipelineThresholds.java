package dev.pekelund.medinterp.pipeline;

/**
 * Confidence gates of the pipeline, each in {@code [0, 1]}.
 */
public record PipelineThresholds(
    double qualityFloor,
    double typeDetection,
    double extractionMin,
    double normalizationMin,
    double overallAcceptMin
) {

    public PipelineThresholds {
        requireUnit("quality-floor", qualityFloor);
        requireUnit("type-detection", typeDetection);
        requireUnit("extraction-min", extractionMin);
        requireUnit("normalization-min", normalizationMin);
        requireUnit("overall-accept-min", overallAcceptMin);
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("Threshold " + name + " must be within [0, 1] but was " + value);
        }
    }
}
