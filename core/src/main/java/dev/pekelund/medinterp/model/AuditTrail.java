package dev.pekelund.medinterp.model;

import java.util.List;

/**
 * Everything the pipeline decided on the way to a terminal result.
 */
public record AuditTrail(
    TypeDetection typeClassifier,
    double extractionConfidence,
    double normalizationConfidence,
    double overallConfidence,
    List<String> rulesTriggered,
    List<UnitConversionRecord> unitConversions,
    List<String> validationFindings
) {

    public AuditTrail {
        typeClassifier = typeClassifier != null ? typeClassifier : TypeDetection.none();
        rulesTriggered = rulesTriggered == null ? List.of() : List.copyOf(rulesTriggered);
        unitConversions = unitConversions == null ? List.of() : List.copyOf(unitConversions);
        validationFindings = validationFindings == null ? List.of() : List.copyOf(validationFindings);
    }

    /**
     * The overall confidence is the weakest of the three stage confidences.
     */
    public static double overall(double typeConfidence, double extractionConfidence, double normalizationConfidence) {
        return Math.min(typeConfidence, Math.min(extractionConfidence, normalizationConfidence));
    }
}
