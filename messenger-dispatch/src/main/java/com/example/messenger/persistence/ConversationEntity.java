package com.example.messenger.persistence;

import com.example.messenger.domain.ConversationStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "messenger_conversations",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_messenger_conversations_active_contact", columnNames = "active_contact_key"),
        indexes = {
            @Index(name = "idx_messenger_conversations_contact", columnList = "inbox_id, contact_id, status"),
            @Index(name = "idx_messenger_conversations_assignee", columnList = "status, assignee_id, assignee_opened_at")
        })
public class ConversationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "inbox_id", nullable = false)
    private Long inboxId;

    @Column(name = "contact_id", nullable = false, length = 64)
    private String contactId;

    @Column(name = "branch_id")
    private Long branchId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ConversationStatus status;

    @Column(name = "assignee_id")
    private Long assigneeId;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Column(name = "assignee_opened_at")
    private Instant assigneeOpenedAt;

    @Column(name = "waiting_since")
    private Instant waitingSince;

    @Column(name = "first_reply_at")
    private Instant firstReplyAt;

    @Column(name = "last_activity_at")
    private Instant lastActivityAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    /**
     * {@code inboxId:contactId} while the conversation is OPEN or PENDING, {@code null} afterwards.
     * The unique constraint allows one active conversation per contact and inbox.
     */
    @Column(name = "active_contact_key", length = 96)
    private String activeContactKey;

    @Version
    @Column(name = "version")
    private Long version;
}
