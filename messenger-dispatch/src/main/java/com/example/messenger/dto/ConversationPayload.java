package com.example.messenger.dto;

import com.example.messenger.domain.Conversation;
import com.example.messenger.domain.ConversationStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConversationPayload {
    long id;
    long inboxId;
    String contactId;
    Long branchId;
    ConversationStatus status;
    Long assigneeId;
    Instant assignedAt;
    Instant assigneeOpenedAt;
    Instant firstReplyAt;
    Instant lastActivityAt;

    public static ConversationPayload from(Conversation conversation) {
        return ConversationPayload.builder()
                .id(conversation.getId())
                .inboxId(conversation.getInboxId())
                .contactId(conversation.getContactId())
                .branchId(conversation.getBranchId())
                .status(conversation.getStatus())
                .assigneeId(conversation.getAssigneeId())
                .assignedAt(conversation.getAssignedAt())
                .assigneeOpenedAt(conversation.getAssigneeOpenedAt())
                .firstReplyAt(conversation.getFirstReplyAt())
                .lastActivityAt(conversation.getLastActivityAt())
                .build();
    }
}
