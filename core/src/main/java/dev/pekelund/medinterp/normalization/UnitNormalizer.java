package dev.pekelund.medinterp.normalization;

import dev.pekelund.medinterp.model.Measurement;
import dev.pekelund.medinterp.model.Observation;
import dev.pekelund.medinterp.model.ObservationSet;
import dev.pekelund.medinterp.model.ReferenceRange;
import dev.pekelund.medinterp.model.UnitConversionRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Converts observations to canonical units using a fixed conversion table.
 */
public class UnitNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(UnitNormalizer.class);

    private final List<UnitConversion> conversions;
    private final Set<String> canonicalUnits;

    public UnitNormalizer(List<UnitConversion> conversions, Set<String> canonicalUnits) {
        this.conversions = conversions == null ? List.of() : List.copyOf(conversions);
        this.canonicalUnits = canonicalUnits == null ? Set.of() : canonicalUnits.stream()
            .filter(StringUtils::hasText)
            .map(UnitNormalizer::unitKey)
            .collect(Collectors.toUnmodifiableSet());
    }

    public NormalizationOutcome normalize(ObservationSet observationSet) {
        ObservationSet source = observationSet != null ? observationSet : ObservationSet.empty();
        if (source.isEmpty()) {
            return new NormalizationOutcome(source, 1.0, List.of(), List.of());
        }

        List<Observation> normalized = new ArrayList<>(source.size());
        List<UnitConversionRecord> records = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        int successes = 0;

        for (Observation observation : source.observations()) {
            if (!(observation.measurement() instanceof Measurement.Raw raw)) {
                normalized.add(observation);
                successes++;
                continue;
            }
            Optional<Observation> converted = convert(observation, raw, records);
            if (converted.isPresent()) {
                normalized.add(converted.get());
                successes++;
            } else {
                normalized.add(observation);
                failures.add(observation.label() + " has unrecognised unit '" + raw.unit() + "'");
            }
        }

        double confidence = (double) successes / source.size();
        LOGGER.info("Normalized {}/{} observations with {} unit conversions (confidence {})",
            successes, source.size(), records.size(), confidence);
        if (!failures.isEmpty() && LOGGER.isDebugEnabled()) {
            LOGGER.debug("Normalization failures: {}", failures);
        }
        return new NormalizationOutcome(new ObservationSet(source.panelName(), normalized), confidence, records, failures);
    }

    /**
     * Converts a raw measurement. Returns empty when the unit is neither convertible nor canonical.
     */
    Optional<Observation> convert(Observation observation, Measurement.Raw raw, List<UnitConversionRecord> records) {
        Optional<UnitConversion> conversion = findConversion(observation, raw.unit());
        if (conversion.isPresent() && raw.value().asNumber().isPresent()) {
            UnitConversion applied = conversion.get();
            ReferenceRange range = observation.referenceRange();
            ReferenceRange convertedRange = range == null ? null : range.scale(applied.factor(), applied.toUnit());
            records.add(new UnitConversionRecord(fieldName(observation), raw.unit(), applied.toUnit(), applied.factor()));
            return Optional.of(observation.withMeasurement(raw.convert(applied.factor(), applied.toUnit()), convertedRange));
        }
        if (isCanonical(raw.unit())) {
            ReferenceRange range = observation.referenceRange();
            ReferenceRange alignedRange = range != null && range.unit() == null ? range.withUnit(raw.unit()) : range;
            return Optional.of(observation.withMeasurement(raw.asCanonical(), alignedRange));
        }
        return Optional.empty();
    }

    private Optional<UnitConversion> findConversion(Observation observation, String unit) {
        if (!StringUtils.hasText(unit)) {
            return Optional.empty();
        }
        return conversions.stream()
            .filter(conversion -> conversion.appliesTo(unit))
            .filter(conversion -> observation.mentions(conversion.analyte()))
            .findFirst();
    }

    private boolean isCanonical(String unit) {
        return StringUtils.hasText(unit) && canonicalUnits.contains(unitKey(unit));
    }

    private static String fieldName(Observation observation) {
        return StringUtils.hasText(observation.code()) ? observation.code() : observation.label();
    }

    private static String unitKey(String unit) {
        return unit.trim().toLowerCase(Locale.ROOT);
    }
}
