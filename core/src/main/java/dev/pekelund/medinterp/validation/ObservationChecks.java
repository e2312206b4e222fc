package dev.pekelund.medinterp.validation;

import dev.pekelund.medinterp.model.Observation;
import dev.pekelund.medinterp.model.ReferenceRange;
import dev.pekelund.medinterp.model.ValidationFinding;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.util.StringUtils;

/**
 * The built-in observation checks.
 */
public final class ObservationChecks {

    static final double OUTLIER_RANGE_MULTIPLE = 4.0;

    private ObservationChecks() {
    }

    /**
     * Fails observations whose unit is a numeric unit but whose value has no numeric reading.
     */
    public static ValidationCheck numericValueForNumericUnit(Set<String> numericUnits) {
        Set<String> units = numericUnits.stream()
            .filter(StringUtils::hasText)
            .map(unit -> unit.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        return (observation, ingestedAt) -> {
            String unit = observation.unit();
            if (!StringUtils.hasText(unit) || !units.contains(unit.trim().toLowerCase(Locale.ROOT))) {
                return Optional.empty();
            }
            if (observation.value().asNumber().isPresent()) {
                return Optional.empty();
            }
            return Optional.of(ValidationFinding.fail(
                "Non-numeric value '" + observation.value() + "' for " + observation.label() + " with numeric unit " + unit,
                observation.code()));
        };
    }

    public static ValidationCheck rangeUnitMatchesObservationUnit() {
        return (observation, ingestedAt) -> {
            ReferenceRange range = observation.referenceRange();
            if (range == null || range.unit() == null || range.unit().equals(observation.unit())) {
                return Optional.empty();
            }
            return Optional.of(ValidationFinding.warn(
                "Reference range unit " + range.unit() + " does not match observation unit " + observation.unit()
                    + " for " + observation.label(),
                observation.code()));
        };
    }

    public static ValidationCheck collectedNotAfterIngestion() {
        return (observation, ingestedAt) -> {
            if (observation.collectedAt() == null || ingestedAt == null || !observation.collectedAt().isAfter(ingestedAt)) {
                return Optional.empty();
            }
            return Optional.of(ValidationFinding.warn(
                "Collection time " + observation.collectedAt() + " of " + observation.label() + " is in the future",
                observation.code()));
        };
    }

    public static ValidationCheck unitPresent() {
        return (observation, ingestedAt) -> {
            if (StringUtils.hasText(observation.unit())) {
                return Optional.empty();
            }
            return Optional.of(ValidationFinding.fail("Missing unit for " + observation.label(), observation.code()));
        };
    }

    /**
     * Warns when the value lies more than four range widths from the middle of a complete range.
     */
    public static ValidationCheck outlier() {
        return (observation, ingestedAt) -> {
            ReferenceRange range = observation.referenceRange();
            OptionalDouble value = observation.value().asNumber();
            if (range == null || !range.isComplete() || value.isEmpty()) {
                return Optional.empty();
            }
            double deviation = Math.abs(value.getAsDouble() - range.midpoint());
            if (deviation <= OUTLIER_RANGE_MULTIPLE * range.width()) {
                return Optional.empty();
            }
            return Optional.of(ValidationFinding.warn(
                String.format(Locale.ROOT, "%s value %s is far outside its reference range [%s, %s]",
                    observation.label(), observation.value(), range.low(), range.high()),
                observation.code()));
        };
    }
}
