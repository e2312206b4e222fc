package dev.pekelund.medinterp.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.pekelund.medinterp.model.Measurement;
import dev.pekelund.medinterp.model.Observation;
import dev.pekelund.medinterp.model.ObservationSet;
import dev.pekelund.medinterp.model.ObservedValue;
import dev.pekelund.medinterp.model.ReferenceRange;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Parses an extractor response into an {@link ObservationSet}. A response that cannot be parsed is
 * repaired once (trailing separators and control characters removed) before giving up.
 */
public class ExtractionResponseParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionResponseParser.class);

    private static final Pattern TRAILING_OBJECT_SEPARATOR = Pattern.compile(",\\s*}");
    private static final Pattern TRAILING_ARRAY_SEPARATOR = Pattern.compile(",\\s*]");
    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\u0000-\\u001F\\u007F-\\u009F]");

    private static final List<Function<String, Instant>> TIMESTAMP_FORMATS = List.of(
        value -> OffsetDateTime.parse(value).toInstant(),
        value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
        value -> LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant());

    private final ObjectMapper objectMapper;

    public ExtractionResponseParser() {
        this(JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build());
    }

    public ExtractionResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the parsed observation set, or empty when the response is blank or does not match the
     * expected shape even after repair.
     */
    public Optional<ObservationSet> parse(String response) {
        if (!StringUtils.hasText(response)) {
            LOGGER.info("Extractor returned an empty response");
            return Optional.empty();
        }
        try {
            return Optional.of(toObservationSet(read(response)));
        } catch (ShapeMismatchException | JsonProcessingException ex) {
            LOGGER.info("Extractor response could not be parsed ({}); attempting repair", ex.getMessage());
        }

        String repaired = repair(response);
        try {
            return Optional.of(toObservationSet(read(repaired)));
        } catch (ShapeMismatchException | JsonProcessingException ex) {
            LOGGER.warn("Extractor response still invalid after repair: {}. Payload begins with: {}",
                ex.getMessage(), preview(response));
            return Optional.empty();
        }
    }

    static String repair(String response) {
        String repaired = TRAILING_OBJECT_SEPARATOR.matcher(response).replaceAll("}");
        repaired = TRAILING_ARRAY_SEPARATOR.matcher(repaired).replaceAll("]");
        return CONTROL_CHARACTERS.matcher(repaired).replaceAll("");
    }

    private ExtractedPanel read(String payload) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(payload);
        if (root == null || !root.isObject()) {
            throw new ShapeMismatchException("response is not a JSON object");
        }
        return objectMapper.treeToValue(root, ExtractedPanel.class);
    }

    private ObservationSet toObservationSet(ExtractedPanel panel) {
        List<Observation> observations = new ArrayList<>();
        if (panel.observations() != null) {
            for (ExtractedPanel.ExtractedObservation extracted : panel.observations()) {
                if (extracted == null) {
                    throw new ShapeMismatchException("observation entry is null");
                }
                observations.add(toObservation(extracted));
            }
        }
        return new ObservationSet(StringUtils.hasText(panel.panelName()) ? panel.panelName() : null, observations);
    }

    private Observation toObservation(ExtractedPanel.ExtractedObservation extracted) {
        ExtractedPanel.ExtractedRange range = extracted.referenceRange();
        ReferenceRange referenceRange = range == null ? null : new ReferenceRange(range.low(), range.high(), range.unit());
        List<String> flags = extracted.flags() == null ? List.of()
            : extracted.flags().stream().filter(StringUtils::hasText).toList();
        return new Observation(
            extracted.code(),
            extracted.display(),
            Measurement.raw(toValue(extracted.value()), StringUtils.hasText(extracted.unit()) ? extracted.unit() : null),
            referenceRange,
            toInstant(extracted.collectedAt()),
            flags);
    }

    private ObservedValue toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ObservedValue.missing();
        }
        if (node.isNumber()) {
            return ObservedValue.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return StringUtils.hasText(node.textValue()) ? ObservedValue.of(node.textValue().trim()) : ObservedValue.missing();
        }
        throw new ShapeMismatchException("observation value must be a number or a string but was " + node.getNodeType());
    }

    private Instant toInstant(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        String trimmed = value.trim();
        for (Function<String, Instant> format : TIMESTAMP_FORMATS) {
            try {
                return format.apply(trimmed);
            } catch (DateTimeParseException ex) {
                LOGGER.trace("Collection timestamp '{}' did not match format: {}", trimmed, ex.getMessage());
            }
        }
        LOGGER.debug("Ignoring unparseable collection timestamp '{}'", trimmed);
        return null;
    }

    private static String preview(String response) {
        int max = Math.min(response.length(), 256);
        return response.substring(0, max);
    }

    private static final class ShapeMismatchException extends RuntimeException {

        private ShapeMismatchException(String message) {
            super(message);
        }
    }
}
