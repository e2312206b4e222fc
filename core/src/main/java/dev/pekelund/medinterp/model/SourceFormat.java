package dev.pekelund.medinterp.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Format of the submitted document as reported by the caller.
 */
public enum SourceFormat {

    PDF("PDF"),
    PDF_OCR("PDF_OCR"),
    IMAGE_OCR("Image_OCR"),
    FHIR_JSON("FHIR_JSON"),
    HL7("HL7"),
    CSV("CSV"),
    JSON("JSON"),
    XML("XML"),
    DICOM("DICOM"),
    TXT("TXT");

    public static final SourceFormat DEFAULT = PDF_OCR;

    private final String label;

    SourceFormat(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolves a caller supplied hint, falling back to {@link #DEFAULT} for blank or unknown values.
     */
    public static SourceFormat fromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return DEFAULT;
        }
        String normalised = hint.trim().toLowerCase(Locale.ROOT);
        for (SourceFormat format : values()) {
            if (format.label.toLowerCase(Locale.ROOT).equals(normalised)) {
                return format;
            }
        }
        return DEFAULT;
    }
}
