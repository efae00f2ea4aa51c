package com.example.messenger.dto;

import com.example.messenger.domain.Message;
import com.example.messenger.domain.MessageDirection;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WidgetMessagePayload {

    private long id;
    private long conversationId;
    private MessageDirection direction;
    private String body;
    private Long senderAgentId;
    private Instant createdAt;

    public static WidgetMessagePayload from(Message message) {
        return WidgetMessagePayload.builder()
                .id(message.getId())
                .conversationId(message.getConversationId())
                .direction(message.getDirection())
                .body(message.getBody())
                .senderAgentId(message.getSenderAgentId())
                .createdAt(message.getCreatedAt())
                .build();
    }
}
