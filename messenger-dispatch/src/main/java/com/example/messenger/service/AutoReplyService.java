package com.example.messenger.service;

import com.example.messenger.config.MessengerProperties;
import com.example.messenger.domain.Conversation;
import com.example.messenger.domain.ConversationStatus;
import com.example.messenger.domain.Inbox;
import com.example.messenger.domain.Message;
import com.example.messenger.domain.MessageDirection;
import com.example.messenger.event.ChatEvent;
import com.example.messenger.event.ChatEventListener;
import com.example.messenger.event.ChatEventPayloads;
import com.example.messenger.event.ChatEventType;
import com.example.messenger.event.EventBus;
import com.example.messenger.store.RedisKeyFactory;
import com.example.messenger.store.SharedStore;
import com.example.messenger.store.SharedStoreException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Answers the first visitor message of an assigned conversation with the inbox's configured text,
 * sent in the name of the assignee. Runs asynchronously, after automatic assignment had its chance.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutoReplyService implements ChatEventListener {

    private final EventBus eventBus;
    private final ConversationRepository conversationRepository;
    private final InboxRepository inboxRepository;
    private final MessageRepository messageRepository;
    private final SharedStore sharedStore;
    private final RedisKeyFactory keyFactory;
    private final MessengerProperties messengerProperties;
    private final Clock clock;

    @PostConstruct
    public void register() {
        eventBus.subscribe(ChatEventType.MESSAGE_CREATED, this, true);
    }

    @PreDestroy
    public void unregister() {
        eventBus.unsubscribe(ChatEventType.MESSAGE_CREATED, this, true);
    }

    @Override
    public void onEvent(ChatEvent event) {
        if (!MessageDirection.IN.wireValue().equals(event.stringValue("direction"))) {
            return;
        }
        Long conversationId = event.longValue("conversation_id");
        if (conversationId != null) {
            replyIfFirst(conversationId);
        }
    }

    public Optional<Message> replyIfFirst(long conversationId) {
        Optional<Conversation> found = conversationRepository.findById(conversationId)
                .filter(conversation -> conversation.getStatus() == ConversationStatus.OPEN)
                .filter(conversation -> conversation.getAssigneeId() != null);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Conversation conversation = found.get();
        Optional<Inbox> inbox = inboxRepository.findById(conversation.getInboxId())
                .filter(Inbox::isAutoReplyEnabled)
                .filter(candidate -> StringUtils.hasText(candidate.getAutoReplyBody()));
        if (inbox.isEmpty() || messageRepository.findLatestOutboundId(conversationId).isPresent()) {
            return Optional.empty();
        }
        if (!claim(conversationId)) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        Message message = messageRepository.save(Message.builder()
                .conversationId(conversationId)
                .direction(MessageDirection.OUT)
                .body(inbox.get().getAutoReplyBody().trim())
                .senderAgentId(conversation.getAssigneeId())
                .createdAt(now)
                .build());
        conversationRepository.touchActivity(conversationId, now);
        eventBus.dispatch(ChatEventType.MESSAGE_CREATED, now, ChatEventPayloads.messageCreated(message), true);
        log.info("Sent auto reply {} in conversation {} for agent {}", message.getId(), conversationId, conversation.getAssigneeId());
        return Optional.of(message);
    }

    private boolean claim(long conversationId) {
        String key = keyFactory.autoReplyKey(conversationId);
        try {
            return sharedStore.compareAndSet(key, null, "1", messengerProperties.getWidget().getSessionTtl());
        } catch (SharedStoreException ex) {
            log.warn("operation=autoReply key={} policy=skip: auto reply not sent", key, ex);
            return false;
        }
    }
}
