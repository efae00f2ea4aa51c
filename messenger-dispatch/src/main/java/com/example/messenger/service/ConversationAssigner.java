package com.example.messenger.service;

import com.example.messenger.domain.Conversation;
import com.example.messenger.event.ChatEventType;
import com.example.messenger.event.EventBus;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Commits an assignee change with an optimistic check on the assignee read earlier and announces
 * it with {@code assignee.changed}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationAssigner {

    public static final String REASON_AUTO = "auto";
    public static final String REASON_ESCALATION = "escalation";
    public static final String REASON_MANUAL = "manual";

    private final ConversationRepository conversationRepository;
    private final AssignmentRateLimiter rateLimiter;
    private final EventBus eventBus;
    private final Clock clock;

    public boolean assign(Conversation conversation, long newAssigneeId, String reason, boolean countTowardsLimit) {
        Long previousAssigneeId = conversation.getAssigneeId();
        Instant now = clock.instant();
        if (!conversationRepository.compareAndSetAssignee(conversation.getId(), previousAssigneeId, newAssigneeId, now)) {
            log.debug(
                    "Lost assignment race on conversation {} (expected assignee {}, wanted {})",
                    conversation.getId(),
                    previousAssigneeId,
                    newAssigneeId);
            return false;
        }
        if (countTowardsLimit) {
            rateLimiter.increment(newAssigneeId);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("conversation_id", conversation.getId());
        payload.put("previous_assignee_id", previousAssigneeId);
        payload.put("assignee_id", newAssigneeId);
        payload.put("reason", reason);
        eventBus.dispatch(ChatEventType.ASSIGNEE_CHANGED, now, payload, true);
        log.info("Conversation {} assigned to agent {} ({}), previously {}", conversation.getId(), newAssigneeId, reason, previousAssigneeId);
        return true;
    }
}
