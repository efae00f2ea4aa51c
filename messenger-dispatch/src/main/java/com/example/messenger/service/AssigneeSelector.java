package com.example.messenger.service;

import com.example.messenger.domain.Conversation;
import com.example.messenger.store.SharedStoreException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Candidate filtering shared by automatic assignment and escalation: eligible agents of the inbox,
 * minus an excluded agent, restricted to online agents of the conversation's branch that are under
 * their assignment rate.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssigneeSelector {

    private final AgentDirectory agentDirectory;
    private final PresenceTracker presenceTracker;
    private final AssignmentRateLimiter rateLimiter;
    private final RoundRobinQueueService queueService;

    public List<Long> allowedCandidates(Conversation conversation, Long excludedAgentId) {
        Set<Long> eligible = agentDirectory.eligibleAgentIds(conversation.getInboxId());
        Set<Long> online = presenceTracker.onlineAgentIds(conversation.getBranchId());
        return eligible.stream()
                .filter(agentId -> !agentId.equals(excludedAgentId))
                .filter(online::contains)
                .filter(rateLimiter::checkLimit)
                .sorted()
                .toList();
    }

    public Optional<Long> select(Conversation conversation, Long excludedAgentId) {
        List<Long> allowed = allowedCandidates(conversation, excludedAgentId);
        if (allowed.isEmpty()) {
            return Optional.empty();
        }
        return queueService.next(conversation.getInboxId(), allowed);
    }

    public Optional<Long> preview(Conversation conversation, Long excludedAgentId) {
        List<Long> allowed = allowedCandidates(conversation, excludedAgentId);
        if (allowed.isEmpty()) {
            return Optional.empty();
        }
        return queueService.peek(conversation.getInboxId(), allowed);
    }

    /**
     * Undoes the rotation of an agent whose assignment lost the optimistic commit, so it keeps its
     * turn. Best effort: a failure only costs the agent one turn.
     */
    public void giveTurnBack(Conversation conversation, long agentId) {
        try {
            queueService.requeueFirst(conversation.getInboxId(), agentId);
        } catch (QueueContentionException | SharedStoreException ex) {
            log.warn("Agent {} loses its turn in inbox {}: {}", agentId, conversation.getInboxId(), ex.getMessage());
        }
    }
}
