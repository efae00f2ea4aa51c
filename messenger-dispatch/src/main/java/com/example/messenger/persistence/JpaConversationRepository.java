package com.example.messenger.persistence;

import com.example.messenger.domain.Conversation;
import com.example.messenger.domain.ConversationStatus;
import com.example.messenger.service.ConversationRepository;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JpaConversationRepository implements ConversationRepository {

    private static final Set<ConversationStatus> ACTIVE_STATUSES =
            EnumSet.of(ConversationStatus.OPEN, ConversationStatus.PENDING);

    private final ConversationJpaRepository conversationJpaRepository;
    private final MessengerEntityMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<Conversation> findById(long conversationId) {
        return conversationJpaRepository.findById(conversationId).map(mapper::toConversation);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Conversation> findActiveForContact(long inboxId, String contactId) {
        return conversationJpaRepository
                .findFirstByInboxIdAndContactIdAndStatusInOrderByIdDesc(inboxId, contactId, ACTIVE_STATUSES)
                .map(mapper::toConversation);
    }

    @Override
    @Transactional
    public Conversation create(Conversation conversation) {
        ConversationEntity saved = conversationJpaRepository.saveAndFlush(mapper.toNewEntity(conversation));
        return mapper.toConversation(saved);
    }

    @Override
    @Transactional
    public boolean compareAndSetAssignee(long conversationId, Long expectedAssigneeId, long newAssigneeId, Instant now) {
        int updated = expectedAssigneeId == null
                ? conversationJpaRepository.assignIfUnassigned(conversationId, newAssigneeId, now, ACTIVE_STATUSES)
                : conversationJpaRepository.reassignIfUnopened(
                        conversationId, expectedAssigneeId, newAssigneeId, now, ACTIVE_STATUSES);
        return updated == 1;
    }

    @Override
    @Transactional
    public boolean markOpened(long conversationId, long agentId, Instant now) {
        return conversationJpaRepository.markOpened(conversationId, agentId, now) == 1;
    }

    @Override
    @Transactional
    public boolean markFirstReply(long conversationId, Instant now) {
        return conversationJpaRepository.markFirstReply(conversationId, now) == 1;
    }

    @Override
    @Transactional
    public void touchActivity(long conversationId, Instant now) {
        conversationJpaRepository.touchActivity(conversationId, now);
    }

    @Override
    @Transactional
    public boolean updateStatus(long conversationId, ConversationStatus status, Instant now) {
        int updated = status.isActive()
                ? conversationJpaRepository.updateStatus(conversationId, status, now)
                : conversationJpaRepository.finish(conversationId, status, now);
        return updated == 1;
    }

    @Override
    @Transactional
    public boolean moveToBranch(long conversationId, long branchId, Instant now) {
        return conversationJpaRepository.moveToBranch(conversationId, branchId, now, ACTIVE_STATUSES) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Conversation> findEscalationCandidates(Instant cutoff, int limit) {
        return conversationJpaRepository
                .findEscalationCandidates(ACTIVE_STATUSES, cutoff, PageRequest.of(0, Math.max(1, limit)))
                .stream()
                .map(mapper::toConversation)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Conversation> findResolvedInactiveSince(Instant cutoff, int limit) {
        return conversationJpaRepository
                .findInactiveWithStatus(ConversationStatus.RESOLVED, cutoff, PageRequest.of(0, Math.max(1, limit)))
                .stream()
                .map(mapper::toConversation)
                .toList();
    }
}
