package com.example.messenger.widget;

import com.example.messenger.domain.MessageDirection;
import com.example.messenger.dto.WidgetMessagePayload;
import com.example.messenger.event.ChatEvent;
import com.example.messenger.event.ChatEventListener;
import com.example.messenger.event.ChatEventType;
import com.example.messenger.event.EventBus;
import com.example.messenger.service.MessageRepository;
import com.example.messenger.store.RedisKeyFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.codec.TypedJsonJacksonCodec;
import org.springframework.stereotype.Component;

/**
 * Carries visitor-facing events to the node holding the widget's stream. Outbound messages and
 * assignment changes are published on a Redisson topic; every node delivers what it receives to
 * its local {@link WidgetStreamRegistry}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WidgetStreamRelay implements ChatEventListener {

    private final EventBus eventBus;
    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final MessageRepository messageRepository;
    private final WidgetStreamRegistry streamRegistry;
    private final ObjectMapper objectMapper;

    private RTopic streamTopic;
    private int topicListenerId;

    @PostConstruct
    public void subscribe() {
        streamTopic = redissonClient.getTopic(
                keyFactory.widgetStreamTopicName(),
                new TypedJsonJacksonCodec(WidgetStreamNotification.class, objectMapper));
        topicListenerId = streamTopic.addListener(WidgetStreamNotification.class, (channel, notification) -> deliver(notification));
        eventBus.subscribe(ChatEventType.MESSAGE_CREATED, this, true);
        eventBus.subscribe(ChatEventType.ASSIGNEE_CHANGED, this, true);
    }

    @PreDestroy
    public void shutdown() {
        eventBus.unsubscribe(ChatEventType.MESSAGE_CREATED, this, true);
        eventBus.unsubscribe(ChatEventType.ASSIGNEE_CHANGED, this, true);
        if (streamTopic != null) {
            streamTopic.removeListener(topicListenerId);
        }
    }

    @Override
    public void onEvent(ChatEvent event) {
        Long conversationId = event.longValue("conversation_id");
        if (conversationId == null) {
            return;
        }
        if (event.getType() == ChatEventType.MESSAGE_CREATED) {
            if (!MessageDirection.OUT.wireValue().equals(event.stringValue("direction"))) {
                return;
            }
            Long messageId = event.longValue("message_id");
            if (messageId == null) {
                return;
            }
            messageRepository.findById(messageId)
                    .map(WidgetMessagePayload::from)
                    .ifPresent(message -> publish(WidgetStreamNotification.builder()
                            .conversationId(conversationId)
                            .message(message)
                            .build()));
        } else if (event.getType() == ChatEventType.ASSIGNEE_CHANGED) {
            Map<String, Object> assignment = new LinkedHashMap<>();
            assignment.put("conversation_id", conversationId);
            assignment.put("assignee_id", event.longValue("assignee_id"));
            publish(WidgetStreamNotification.builder()
                    .conversationId(conversationId)
                    .assignment(assignment)
                    .build());
        }
    }

    void deliver(WidgetStreamNotification notification) {
        if (notification.getMessage() != null) {
            streamRegistry.publishMessage(notification.getMessage());
        } else if (notification.getAssignment() != null) {
            streamRegistry.publishAssignment(notification.getConversationId(), notification.getAssignment());
        }
    }

    private void publish(WidgetStreamNotification notification) {
        try {
            streamTopic.publish(notification);
        } catch (RuntimeException ex) {
            log.warn("Cross-node stream publish failed for conversation {}, delivering locally", notification.getConversationId(), ex);
            deliver(notification);
        }
    }
}
