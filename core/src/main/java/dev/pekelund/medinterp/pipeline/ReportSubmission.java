package dev.pekelund.medinterp.pipeline;

import dev.pekelund.medinterp.model.ReportText;

/**
 * One report handed to the pipeline: recovered text plus caller supplied metadata.
 *
 * @param reportText        text and quality score from the OCR collaborator
 * @param pseudoId          opaque patient identifier passed through untouched
 * @param sourceFormatHint  optional source format label
 * @param userRegion        optional region of the submitting user
 * @param preserveHighRes   whether the caller asked to keep the high resolution source
 */
public record ReportSubmission(
    ReportText reportText,
    String pseudoId,
    String sourceFormatHint,
    String userRegion,
    boolean preserveHighRes
) {

    public ReportSubmission {
        reportText = reportText != null ? reportText : new ReportText("", 0.0, 0.0);
    }

    public static ReportSubmission of(ReportText reportText, String pseudoId) {
        return new ReportSubmission(reportText, pseudoId, null, null, false);
    }
}
