package dev.pekelund.medinterp.model;

/**
 * Value and unit of an observation, tagged with whether unit normalization has already been
 * applied. Only {@link Raw} measurements are eligible for conversion; a {@link Normalized}
 * measurement is never converted again.
 */
public sealed interface Measurement permits Measurement.Raw, Measurement.Normalized {

    ObservedValue value();

    String unit();

    boolean isNormalized();

    static Raw raw(ObservedValue value, String unit) {
        return new Raw(value, unit);
    }

    /**
     * Measurement as extracted from the report, in whatever unit the report used.
     */
    record Raw(ObservedValue value, String unit) implements Measurement {

        public Raw {
            value = value != null ? value : ObservedValue.missing();
        }

        @Override
        public boolean isNormalized() {
            return false;
        }

        /**
         * Marks this measurement as already expressed in a canonical unit.
         */
        public Normalized asCanonical() {
            return new Normalized(value, unit);
        }

        public Normalized convert(double factor, String targetUnit) {
            return new Normalized(value.scale(factor), targetUnit);
        }
    }

    /**
     * Measurement expressed in a canonical unit.
     */
    record Normalized(ObservedValue value, String unit) implements Measurement {

        public Normalized {
            value = value != null ? value : ObservedValue.missing();
        }

        @Override
        public boolean isNormalized() {
            return true;
        }
    }
}
