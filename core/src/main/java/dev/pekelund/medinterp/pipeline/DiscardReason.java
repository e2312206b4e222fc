package dev.pekelund.medinterp.pipeline;

/**
 * Why a report was discarded, with the key of the user-facing message for it.
 */
public enum DiscardReason {

    LOW_QUALITY_INPUT("low_quality_ocr"),
    UNRECOGNIZED_TYPE("unrecognized_type"),
    UNSUPPORTED_TYPE("unsupported_type"),
    LOW_EXTRACTION_CONFIDENCE("partial_parse"),
    LOW_NORMALIZATION_CONFIDENCE("missing_units"),
    VALIDATION_FAILURE("partial_parse"),
    LOW_OVERALL_CONFIDENCE("partial_parse"),
    SYSTEM_ERROR("system_error");

    private final String templateKey;

    DiscardReason(String templateKey) {
        this.templateKey = templateKey;
    }

    public String templateKey() {
        return templateKey;
    }
}
