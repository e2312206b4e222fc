package dev.pekelund.medinterp.model;

/**
 * Audit record of one unit conversion applied by the normalizer.
 */
public record UnitConversionRecord(String field, String from, String to, double factor) {
}
