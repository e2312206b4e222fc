package dev.pekelund.medinterp.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Clinically normal bounds reported alongside an observation. Either bound may be missing.
 */
public record ReferenceRange(Double low, Double high, String unit) {

    public boolean hasBound() {
        return low != null || high != null;
    }

    @JsonIgnore
    public boolean isComplete() {
        return low != null && high != null;
    }

    public double midpoint() {
        requireComplete();
        return (low + high) / 2.0;
    }

    public double width() {
        requireComplete();
        return high - low;
    }

    public boolean contains(double value) {
        return isComplete() && value >= low && value <= high;
    }

    public ReferenceRange scale(double factor, String targetUnit) {
        return new ReferenceRange(
            low != null ? low * factor : null,
            high != null ? high * factor : null,
            targetUnit);
    }

    public ReferenceRange withUnit(String targetUnit) {
        return new ReferenceRange(low, high, targetUnit);
    }

    private void requireComplete() {
        if (!isComplete()) {
            throw new IllegalStateException("Reference range requires both bounds");
        }
    }
}
