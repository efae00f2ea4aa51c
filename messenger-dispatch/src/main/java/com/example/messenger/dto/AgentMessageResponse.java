package com.example.messenger.dto;

import com.example.messenger.domain.Message;
import com.example.messenger.domain.MessageDirection;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AgentMessageResponse {
    long id;
    long conversationId;
    MessageDirection direction;
    Instant createdAt;

    public static AgentMessageResponse from(Message message) {
        return AgentMessageResponse.builder()
                .id(message.getId())
                .conversationId(message.getConversationId())
                .direction(message.getDirection())
                .createdAt(message.getCreatedAt())
                .build();
    }
}
