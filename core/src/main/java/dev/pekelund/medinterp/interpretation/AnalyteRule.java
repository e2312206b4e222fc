package dev.pekelund.medinterp.interpretation;

import dev.pekelund.medinterp.model.Observation;
import dev.pekelund.medinterp.model.ObservationSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Decision table for one analyte. Values are brought to {@code canonicalUnit} (directly or through
 * {@code unitFactors}) before the bands are consulted in order.
 */
public record AnalyteRule(
    String name,
    List<String> searchTerms,
    List<String> excludeTerms,
    String canonicalUnit,
    Map<String, Double> unitFactors,
    Set<String> suppressedBy,
    List<DecisionBand> bands
) {

    public AnalyteRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(canonicalUnit, "canonicalUnit");
        if (searchTerms == null || searchTerms.isEmpty()) {
            throw new IllegalArgumentException("Analyte rule " + name + " requires at least one search term");
        }
        if (bands == null || bands.isEmpty()) {
            throw new IllegalArgumentException("Analyte rule " + name + " requires at least one decision band");
        }
        searchTerms = searchTerms.stream().map(AnalyteRule::lower).toList();
        excludeTerms = excludeTerms == null ? List.of() : excludeTerms.stream().map(AnalyteRule::lower).toList();
        Map<String, Double> factors = new LinkedHashMap<>();
        if (unitFactors != null) {
            unitFactors.forEach((unit, factor) -> {
                if (factor == null || !(factor > 0.0)) {
                    throw new IllegalArgumentException("Analyte rule " + name + " has non-positive factor for " + unit);
                }
                factors.put(lower(unit), factor);
            });
        }
        unitFactors = Map.copyOf(factors);
        suppressedBy = suppressedBy == null ? Set.of() : Set.copyOf(suppressedBy);
        bands = List.copyOf(bands);
    }

    /**
     * First observation naming this analyte and none of the excluded terms.
     */
    public Optional<Observation> findObservation(ObservationSet observationSet) {
        return observationSet.observations().stream()
            .filter(observation -> searchTerms.stream().anyMatch(observation::mentions))
            .filter(observation -> excludeTerms.stream().noneMatch(observation::mentions))
            .findFirst();
    }

    public OptionalDouble toCanonical(double value, String unit) {
        if (unit == null) {
            return OptionalDouble.empty();
        }
        if (unit.trim().equalsIgnoreCase(canonicalUnit)) {
            return OptionalDouble.of(value);
        }
        Double factor = unitFactors.get(lower(unit));
        return factor == null ? OptionalDouble.empty() : OptionalDouble.of(value * factor);
    }

    public Optional<DecisionBand> bandFor(double canonicalValue) {
        return bands.stream().filter(band -> band.contains(canonicalValue)).findFirst();
    }

    private static String lower(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
