package com.example.messenger.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AgentStatus {
    ONLINE,
    AWAY,
    BUSY,
    OFFLINE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AgentStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Agent status is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown agent status: " + value, ex);
        }
    }
}
