package dev.pekelund.medinterp.extraction;

import dev.pekelund.medinterp.model.ReportType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Report types that have an extractor wired. A classified type without a registration is
 * unsupported.
 */
public class ObservationExtractorRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ObservationExtractorRegistry.class);

    private final Map<ReportType, ObservationExtractor> registrations;

    public ObservationExtractorRegistry(Map<ReportType, ObservationExtractor> registrations) {
        Map<ReportType, ObservationExtractor> mutable = new EnumMap<>(ReportType.class);
        if (registrations != null) {
            mutable.putAll(registrations);
        }
        mutable.remove(ReportType.OTHER);
        this.registrations = Collections.unmodifiableMap(mutable);
        LOGGER.info("Initialised observation extractor registry for report types: {}", this.registrations.keySet());
    }

    public static ObservationExtractorRegistry of(ReportType reportType, ObservationExtractor extractor) {
        return new ObservationExtractorRegistry(Map.of(reportType, extractor));
    }

    public Optional<ObservationExtractor> find(ReportType reportType) {
        if (reportType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registrations.get(reportType));
    }

    public Set<ReportType> supportedTypes() {
        return registrations.keySet();
    }
}
