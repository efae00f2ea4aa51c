package com.example.messenger.domain;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A single chat message. The sender always matches the direction: visitor messages carry a contact
 * and no agent, agent messages and notes carry an agent and no contact.
 */
@Value
public class Message {

    public static final int MAX_BODY_LENGTH = 150_000;

    Long id;
    long conversationId;
    MessageDirection direction;
    String body;
    String senderContactId;
    Long senderAgentId;
    Instant createdAt;

    @Builder(toBuilder = true)
    private Message(
            Long id,
            long conversationId,
            MessageDirection direction,
            String body,
            String senderContactId,
            Long senderAgentId,
            Instant createdAt) {
        if (direction == null) {
            throw new IllegalArgumentException("Message direction is required");
        }
        if (body == null) {
            throw new IllegalArgumentException("Message body is required");
        }
        if (body.length() > MAX_BODY_LENGTH) {
            throw new IllegalArgumentException(
                    "Message body exceeds %d characters".formatted(MAX_BODY_LENGTH));
        }
        if (direction == MessageDirection.IN) {
            if (senderContactId == null) {
                throw new IllegalArgumentException("Inbound message requires a contact sender");
            }
            if (senderAgentId != null) {
                throw new IllegalArgumentException("Inbound message cannot have an agent sender");
            }
        } else {
            if (senderAgentId == null) {
                throw new IllegalArgumentException("Agent message requires an agent sender");
            }
            if (senderContactId != null) {
                throw new IllegalArgumentException("Agent message cannot have a contact sender");
            }
        }
        this.id = id;
        this.conversationId = conversationId;
        this.direction = direction;
        this.body = body;
        this.senderContactId = senderContactId;
        this.senderAgentId = senderAgentId;
        this.createdAt = createdAt;
    }
}
