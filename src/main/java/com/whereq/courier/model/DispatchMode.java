package com.whereq.courier.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How an answer was (or would have been) delivered
 */
public enum DispatchMode {
    STANDARD,
    STREAMING,
    RESPONSE_URL,
    DIAGNOSTIC;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
