package com.whereq.courier.diagnostics;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Shape of a platform timestamp field
 */
public enum TimestampFormat {
    VALID,
    INVALID,
    NOT_PRESENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
