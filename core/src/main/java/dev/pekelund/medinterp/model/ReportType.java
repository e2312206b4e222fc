package dev.pekelund.medinterp.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/**
 * Report categories a document can be classified into. The label is the value used in configuration
 * and in serialized results.
 */
public enum ReportType {

    OBSERVATION_LABS("Observation_Labs"),
    CARDIAC_ECG("Cardiac_ECG"),
    CARDIAC_ECHO("Cardiac_Echo"),
    DIAGNOSTIC_REPORT_IMAGING("DiagnosticReport_Imaging"),
    GENOMIC("Genomic"),
    WEARABLE("Wearable"),
    VITALS_ANTHRO("VitalsAnthro"),
    MEDICATION_STATEMENT("MedicationStatement"),
    PROCEDURE("Procedure"),
    IMMUNIZATION("Immunization"),
    CLINICAL_NOTE("ClinicalNote"),
    OTHER("Other");

    private final String label;

    ReportType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<ReportType> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalised = label.trim().toLowerCase(Locale.ROOT);
        for (ReportType type : values()) {
            if (type.label.toLowerCase(Locale.ROOT).equals(normalised)
                || type.name().toLowerCase(Locale.ROOT).equals(normalised)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
