package com.example.messenger.persistence;

import com.example.messenger.domain.MessageDirection;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "messenger_messages",
        indexes = @Index(name = "idx_messenger_messages_conversation", columnList = "conversation_id, direction, id"))
public class MessageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "conversation_id", nullable = false)
    private Long conversationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false, length = 16)
    private MessageDirection direction;

    @Column(name = "body", nullable = false, columnDefinition = "text")
    private String body;

    @Column(name = "sender_contact_id", length = 64)
    private String senderContactId;

    @Column(name = "sender_agent_id")
    private Long senderAgentId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
