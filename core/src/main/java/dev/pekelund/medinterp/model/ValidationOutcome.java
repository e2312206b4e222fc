package dev.pekelund.medinterp.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ValidationOutcome {

    PASS,
    WARN,
    FAIL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
