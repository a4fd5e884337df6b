package com.whereq.courier.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Conversation kinds reported by the messaging platform.
 *
 * Direct conversations (IM, MPIM) are never threaded.
 */
public enum ChannelType {
    /**
     * Public channel
     */
    CHANNEL,

    /**
     * Private channel
     */
    GROUP,

    /**
     * Direct message between two people
     */
    IM,

    /**
     * Multi-person direct message
     */
    MPIM;

    /**
     * Check if replies in this kind of conversation may carry a thread reference
     */
    public boolean supportsThreads() {
        return this == CHANNEL || this == GROUP;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ChannelType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return ChannelType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
