package com.example.messenger.event;

import com.example.messenger.config.MessengerProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "messenger.kafka", name = "relay-enabled", havingValue = "true", matchIfMissing = true)
public class KafkaEventRelay implements ChatEventListener {

    private final EventBus eventBus;
    private final KafkaTemplate<String, ChatEvent> chatEventKafkaTemplate;
    private final MessengerProperties messengerProperties;

    @PostConstruct
    public void register() {
        for (ChatEventType type : ChatEventType.values()) {
            eventBus.subscribe(type, this, true);
        }
    }

    @PreDestroy
    public void unregister() {
        for (ChatEventType type : ChatEventType.values()) {
            eventBus.unsubscribe(type, this, true);
        }
    }

    @Override
    public void onEvent(ChatEvent event) {
        String topic = messengerProperties.getKafka().getEventsTopic();
        chatEventKafkaTemplate.send(topic, partitionKey(event), event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to relay event {} ({}) to {}", event.getType().getWireName(), event.getEventId(), topic, ex);
                    }
                });
    }

    private String partitionKey(ChatEvent event) {
        Long conversationId = event.longValue("conversation_id");
        if (conversationId != null) {
            return conversationId.toString();
        }
        return event.stringValue("agent_id");
    }
}
