package dev.pekelund.medinterp.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReportStatus {

    ACCEPTED("accepted"),
    DISCARDED("discarded");

    private final String value;

    ReportStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
