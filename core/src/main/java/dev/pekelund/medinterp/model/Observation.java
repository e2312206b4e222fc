package dev.pekelund.medinterp.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One measured analyte within a report.
 */
@JsonPropertyOrder({"code", "display", "value", "unit", "referenceRange", "collectedAt", "flags"})
public record Observation(
    String code,
    String display,
    @JsonIgnore Measurement measurement,
    ReferenceRange referenceRange,
    Instant collectedAt,
    List<String> flags
) {

    public Observation {
        Objects.requireNonNull(measurement, "measurement");
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    @JsonProperty("value")
    public ObservedValue value() {
        return measurement.value();
    }

    @JsonProperty("unit")
    public String unit() {
        return measurement.unit();
    }

    /**
     * Whether {@code term} (already lower case) occurs in the lower-cased code or display name.
     */
    public boolean mentions(String term) {
        if (term == null || term.isEmpty()) {
            return false;
        }
        return lower(code).contains(term) || lower(display).contains(term);
    }

    /**
     * Label used in audit records and validation messages.
     */
    @JsonIgnore
    public String label() {
        if (display != null && !display.isBlank()) {
            return display;
        }
        return code != null ? code : "(unnamed observation)";
    }

    public Observation withMeasurement(Measurement replacement, ReferenceRange range) {
        return new Observation(code, display, replacement, range, collectedAt, flags);
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
