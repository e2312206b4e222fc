package dev.pekelund.medinterp.model;

/**
 * Outcome of report type classification.
 */
public record TypeDetection(ReportType label, double confidence, String rationale) {

    public static final String NO_MATCH_RATIONALE = "No strong pattern matches found";

    public TypeDetection {
        label = label != null ? label : ReportType.OTHER;
        rationale = rationale != null ? rationale : NO_MATCH_RATIONALE;
    }

    public static TypeDetection none() {
        return new TypeDetection(ReportType.OTHER, 0.0, NO_MATCH_RATIONALE);
    }
}
