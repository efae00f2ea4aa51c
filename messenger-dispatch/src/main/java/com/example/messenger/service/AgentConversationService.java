package com.example.messenger.service;

import com.example.messenger.domain.Conversation;
import com.example.messenger.domain.ConversationStatus;
import com.example.messenger.domain.Message;
import com.example.messenger.domain.MessageDirection;
import com.example.messenger.event.ChatEventPayloads;
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
import org.springframework.util.StringUtils;

@Slf4j
@Service
@RequiredArgsConstructor
public class AgentConversationService {

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final ConversationAssigner conversationAssigner;
    private final EventBus eventBus;
    private final Clock clock;

    public Conversation open(long conversationId, long agentId) {
        Conversation conversation = requireConversation(conversationId);
        if (!Objects.equals(conversation.getAssigneeId(), agentId)) {
            throw new ServiceException(HttpStatus.FORBIDDEN, "Only the assignee can open this conversation", "not_assignee");
        }
        markOpened(conversation, agentId);
        return requireConversation(conversationId);
    }

    public Message reply(long conversationId, long agentId, String body, MessageDirection direction) {
        if (direction == null || !direction.isAgentAuthored()) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Agents can only send out or internal messages", "invalid_direction");
        }
        if (!StringUtils.hasText(body)) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Message body must not be empty", "empty_body");
        }
        if (body.length() > Message.MAX_BODY_LENGTH) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Message body is too long", "body_too_long");
        }
        Conversation conversation = requireConversation(conversationId);
        if (conversation.getStatus() == ConversationStatus.CLOSED) {
            throw new ServiceException(HttpStatus.CONFLICT, "Conversation is closed", "conversation_closed");
        }

        Instant now = clock.instant();
        Message message = messageRepository.save(Message.builder()
                .conversationId(conversationId)
                .direction(direction)
                .body(body)
                .senderAgentId(agentId)
                .createdAt(now)
                .build());
        conversationRepository.touchActivity(conversationId, now);
        if (Objects.equals(conversation.getAssigneeId(), agentId)) {
            markOpened(conversation, agentId);
        }

        if (direction == MessageDirection.OUT && conversationRepository.markFirstReply(conversationId, now)) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("conversation_id", conversationId);
            payload.put("message_id", message.getId());
            payload.put("agent_id", agentId);
            eventBus.dispatch(ChatEventType.FIRST_REPLY_CREATED, now, payload, true);
        }
        eventBus.dispatch(ChatEventType.MESSAGE_CREATED, now, ChatEventPayloads.messageCreated(message), true);
        return message;
    }

    public boolean resolve(long conversationId) {
        return transition(conversationId, ConversationStatus.RESOLVED, ChatEventType.CONVERSATION_RESOLVED);
    }

    public boolean close(long conversationId) {
        return transition(conversationId, ConversationStatus.CLOSED, ChatEventType.CONVERSATION_CLOSED);
    }

    /**
     * Hands an unassigned conversation to {@code agentId}. Assigning it to its current assignee is
     * a no-op; taking it from another agent is refused.
     */
    public Conversation assign(long conversationId, long agentId) {
        Conversation conversation = requireConversation(conversationId);
        if (Objects.equals(conversation.getAssigneeId(), agentId)) {
            return conversation;
        }
        if (conversation.getAssigneeId() != null) {
            throw new ServiceException(HttpStatus.CONFLICT, "Conversation already assigned to another agent", "already_assigned");
        }
        if (!conversationAssigner.assign(conversation, agentId, ConversationAssigner.REASON_MANUAL, false)) {
            throw new ServiceException(HttpStatus.CONFLICT, "Conversation was assigned concurrently", "already_assigned");
        }
        return requireConversation(conversationId);
    }

    private void markOpened(Conversation conversation, long agentId) {
        Instant now = clock.instant();
        if (conversationRepository.markOpened(conversation.getId(), agentId, now)) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("conversation_id", conversation.getId());
            payload.put("agent_id", agentId);
            eventBus.dispatch(ChatEventType.CONVERSATION_OPENED, now, payload, true);
        }
    }

    private boolean transition(long conversationId, ConversationStatus status, ChatEventType eventType) {
        requireConversation(conversationId);
        Instant now = clock.instant();
        if (!conversationRepository.updateStatus(conversationId, status, now)) {
            return false;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("conversation_id", conversationId);
        payload.put("status", status.wireValue());
        eventBus.dispatch(eventType, now, payload, true);
        eventBus.dispatch(ChatEventType.CONVERSATION_STATUS_CHANGED, now, payload, true);
        log.debug("Conversation {} moved to {}", conversationId, status);
        return true;
    }

    private Conversation requireConversation(long conversationId) {
        return conversationRepository.findById(conversationId)
                .orElseThrow(() -> new ServiceException(HttpStatus.NOT_FOUND, "Conversation not found", "conversation_not_found"));
    }
}
