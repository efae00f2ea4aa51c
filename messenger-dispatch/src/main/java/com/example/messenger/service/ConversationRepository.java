package com.example.messenger.service;

import com.example.messenger.domain.Conversation;
import com.example.messenger.domain.ConversationStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Conversation records. Every mutating operation is a single conditional update so that
 * concurrent workers never overwrite each other's assignment.
 */
public interface ConversationRepository {

    Optional<Conversation> findById(long conversationId);

    Optional<Conversation> findActiveForContact(long inboxId, String contactId);

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException when the contact already has
     *         an OPEN or PENDING conversation in the inbox
     */
    Conversation create(Conversation conversation);

    /**
     * Sets the assignee only when the stored assignee still equals {@code expectedAssigneeId}
     * ({@code null} meaning unassigned). Taking a conversation away from an assignee additionally
     * requires that assignee not to have opened it. Only OPEN and PENDING conversations are
     * assigned. A successful swap stamps {@code assignedAt} and
     * clears {@code assigneeOpenedAt} and {@code waitingSince}.
     *
     * @return {@code true} when this call won the update
     */
    boolean compareAndSetAssignee(long conversationId, Long expectedAssigneeId, long newAssigneeId, Instant now);

    boolean markOpened(long conversationId, long agentId, Instant now);

    boolean markFirstReply(long conversationId, Instant now);

    void touchActivity(long conversationId, Instant now);

    boolean updateStatus(long conversationId, ConversationStatus status, Instant now);

    boolean moveToBranch(long conversationId, long branchId, Instant now);

    /**
     * Assigned, unopened OPEN or PENDING conversations whose assignment (or creation, for rows
     * without an assignment timestamp) is at or before {@code cutoff}, oldest first.
     */
    List<Conversation> findEscalationCandidates(Instant cutoff, int limit);

    List<Conversation> findResolvedInactiveSince(Instant cutoff, int limit);
}
