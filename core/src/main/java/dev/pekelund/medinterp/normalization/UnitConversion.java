package dev.pekelund.medinterp.normalization;

import java.util.Locale;
import java.util.Objects;

/**
 * One row of the conversion table: observations whose code or display contains {@code analyte}
 * and whose unit is {@code fromUnit} are multiplied by {@code factor} into {@code toUnit}.
 */
public record UnitConversion(String analyte, String fromUnit, String toUnit, double factor) {

    public UnitConversion {
        Objects.requireNonNull(analyte, "analyte");
        Objects.requireNonNull(fromUnit, "fromUnit");
        Objects.requireNonNull(toUnit, "toUnit");
        analyte = analyte.trim().toLowerCase(Locale.ROOT);
        if (analyte.isEmpty()) {
            throw new IllegalArgumentException("Unit conversion analyte must not be blank");
        }
        if (!(factor > 0.0) || Double.isInfinite(factor)) {
            throw new IllegalArgumentException("Unit conversion factor for " + analyte + " must be positive but was " + factor);
        }
    }

    boolean appliesTo(String unit) {
        return unit != null && fromUnit.trim().equalsIgnoreCase(unit.trim());
    }

    /**
     * The conversion that undoes this one.
     */
    public UnitConversion inverse() {
        return new UnitConversion(analyte, toUnit, fromUnit, 1.0 / factor);
    }
}
