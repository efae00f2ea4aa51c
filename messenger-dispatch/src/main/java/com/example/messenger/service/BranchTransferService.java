package com.example.messenger.service;

import com.example.messenger.domain.Conversation;
import com.example.messenger.domain.Inbox;
import com.example.messenger.event.ChatEventType;
import com.example.messenger.event.EventBus;
import com.example.messenger.service.exception.ServiceException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Hands a conversation of a branch-less inbox over to another branch. The assignment is cleared
 * and the conversation goes through automatic assignment again, now among the new branch's agents.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BranchTransferService {

    private final ConversationRepository conversationRepository;
    private final InboxRepository inboxRepository;
    private final AutoAssignmentService autoAssignmentService;
    private final EventBus eventBus;
    private final Clock clock;

    public Conversation transfer(long conversationId, long branchId, long requestedBy) {
        Conversation conversation = conversationRepository.findById(conversationId)
                .orElseThrow(() -> new ServiceException(HttpStatus.NOT_FOUND, "Conversation not found", "conversation_not_found"));
        if (!conversation.getStatus().isActive()) {
            throw notActive();
        }
        Inbox inbox = inboxRepository.findById(conversation.getInboxId())
                .orElseThrow(() -> new ServiceException(HttpStatus.NOT_FOUND, "Inbox not found", "inbox_not_found"));
        if (!inbox.isGlobal()) {
            throw new ServiceException(
                    HttpStatus.CONFLICT, "Conversations of a branch inbox stay in its branch", "inbox_has_branch");
        }
        if (Objects.equals(conversation.getBranchId(), branchId)) {
            return conversation;
        }

        Instant now = clock.instant();
        if (!conversationRepository.moveToBranch(conversationId, branchId, now)) {
            throw notActive();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("conversation_id", conversationId);
        payload.put("from_branch_id", conversation.getBranchId());
        payload.put("to_branch_id", branchId);
        payload.put("previous_assignee_id", conversation.getAssigneeId());
        payload.put("transferred_by", requestedBy);
        eventBus.dispatch(ChatEventType.CONVERSATION_TRANSFERRED, now, payload, true);
        log.info("Conversation {} transferred from branch {} to branch {} by agent {}",
                conversationId, conversation.getBranchId(), branchId, requestedBy);

        autoAssignmentService.autoAssign(conversationId);
        return conversationRepository.findById(conversationId).orElseThrow();
    }

    private ServiceException notActive() {
        return new ServiceException(HttpStatus.CONFLICT, "Conversation is no longer active", "conversation_not_active");
    }
}
