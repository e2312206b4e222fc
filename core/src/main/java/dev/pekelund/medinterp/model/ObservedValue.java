package dev.pekelund.medinterp.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A measured value as reported: either a number or free text (for example {@code "<0.1"} or
 * {@code "negative"}). At most one of the two components is set.
 */
public record ObservedValue(Double number, String text) {

    private static final Pattern LEADING_NUMBER =
        Pattern.compile("^\\s*([-+]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][-+]?\\d+)?)");

    private static final ObservedValue MISSING = new ObservedValue(null, null);

    public ObservedValue {
        if (number != null && (number.isNaN() || number.isInfinite())) {
            number = null;
        }
        if (number != null) {
            text = null;
        }
    }

    public static ObservedValue of(double number) {
        return new ObservedValue(number, null);
    }

    public static ObservedValue of(String text) {
        return text == null ? MISSING : new ObservedValue(null, text);
    }

    public static ObservedValue missing() {
        return MISSING;
    }

    public boolean isPresent() {
        return number != null || text != null;
    }

    public boolean isNumber() {
        return number != null;
    }

    /**
     * Numeric reading of the value. Text is read up to its first non-numeric character, so
     * {@code "5.4 H"} reads as {@code 5.4} while {@code "negative"} has no numeric reading.
     */
    public OptionalDouble asNumber() {
        if (number != null) {
            return OptionalDouble.of(number);
        }
        if (text == null) {
            return OptionalDouble.empty();
        }
        Matcher matcher = LEADING_NUMBER.matcher(text);
        if (!matcher.find()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(matcher.group(1)));
        } catch (NumberFormatException ex) {
            return OptionalDouble.empty();
        }
    }

    public ObservedValue scale(double factor) {
        OptionalDouble numeric = asNumber();
        if (numeric.isEmpty()) {
            return this;
        }
        return of(numeric.getAsDouble() * factor);
    }

    @JsonValue
    public Object jsonValue() {
        return number != null ? number : text;
    }

    @Override
    public String toString() {
        Object value = jsonValue();
        return value != null ? value.toString() : "<missing>";
    }
}
