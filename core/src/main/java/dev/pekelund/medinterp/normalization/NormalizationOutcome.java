package dev.pekelund.medinterp.normalization;

import dev.pekelund.medinterp.model.ObservationSet;
import dev.pekelund.medinterp.model.UnitConversionRecord;
import java.util.List;

/**
 * Normalized observations, the share that could be normalized, the conversions applied and the
 * observations left in their reported unit.
 */
public record NormalizationOutcome(
    ObservationSet data,
    double confidence,
    List<UnitConversionRecord> conversions,
    List<String> failures
) {

    public NormalizationOutcome {
        conversions = conversions == null ? List.of() : List.copyOf(conversions);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
