package com.example.messenger.service;

import com.example.messenger.config.MessengerProperties;
import com.example.messenger.domain.Conversation;
import com.example.messenger.domain.MessageDirection;
import com.example.messenger.event.ChatEvent;
import com.example.messenger.event.ChatEventListener;
import com.example.messenger.event.ChatEventType;
import com.example.messenger.event.EventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AutoAssignmentService implements ChatEventListener {

    private final EventBus eventBus;
    private final ConversationRepository conversationRepository;
    private final AssigneeSelector assigneeSelector;
    private final ConversationAssigner conversationAssigner;
    private final MessengerProperties messengerProperties;

    @PostConstruct
    public void register() {
        eventBus.subscribe(ChatEventType.CONVERSATION_CREATED, this, false);
        eventBus.subscribe(ChatEventType.MESSAGE_CREATED, this, false);
    }

    @PreDestroy
    public void unregister() {
        eventBus.unsubscribe(ChatEventType.CONVERSATION_CREATED, this, false);
        eventBus.unsubscribe(ChatEventType.MESSAGE_CREATED, this, false);
    }

    @Override
    public void onEvent(ChatEvent event) {
        if (!messengerProperties.getAssignment().isAutoAssignEnabled()) {
            return;
        }
        if (event.getType() == ChatEventType.MESSAGE_CREATED
                && !MessageDirection.IN.wireValue().equals(event.stringValue("direction"))) {
            return;
        }
        Long conversationId = event.longValue("conversation_id");
        if (conversationId != null) {
            autoAssign(conversationId);
        }
    }

    public Optional<Long> autoAssign(long conversationId) {
        Optional<Conversation> found = conversationRepository.findById(conversationId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Conversation conversation = found.get();
        if (!conversation.getStatus().isActive() || !conversation.isUnassigned()) {
            return Optional.empty();
        }

        Optional<Long> selected;
        try {
            selected = assigneeSelector.select(conversation, null);
        } catch (QueueContentionException ex) {
            log.debug("Skipping auto assignment of conversation {}: {}", conversationId, ex.getMessage());
            return Optional.empty();
        }
        if (selected.isEmpty()) {
            log.debug("No available agent for conversation {} in inbox {}", conversationId, conversation.getInboxId());
            return Optional.empty();
        }
        boolean assigned = conversationAssigner.assign(
                conversation, selected.get(), ConversationAssigner.REASON_AUTO, true);
        if (!assigned) {
            assigneeSelector.giveTurnBack(conversation, selected.get());
            return Optional.empty();
        }
        return selected;
    }
}
