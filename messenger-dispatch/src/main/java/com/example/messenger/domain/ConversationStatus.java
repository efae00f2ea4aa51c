package com.example.messenger.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ConversationStatus {
    OPEN,
    PENDING,
    RESOLVED,
    CLOSED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isActive() {
        return this == OPEN || this == PENDING;
    }
}
