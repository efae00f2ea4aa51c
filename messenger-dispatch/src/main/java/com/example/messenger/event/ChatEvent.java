package com.example.messenger.event;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatEvent implements Serializable {

    private String eventId;
    private ChatEventType type;
    private Instant occurredAt;
    private Map<String, Object> payload;

    public Long longValue(String key) {
        Object value = payload != null ? payload.get(key) : null;
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Long.parseLong(text.trim());
        }
        return null;
    }

    public String stringValue(String key) {
        Object value = payload != null ? payload.get(key) : null;
        return value != null ? value.toString() : null;
    }
}
