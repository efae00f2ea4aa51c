package com.example.messenger.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class InProcessEventBus implements EventBus {

    private final Map<ChatEventType, List<ChatEventListener>> syncListeners = new ConcurrentHashMap<>();
    private final Map<ChatEventType, List<ChatEventListener>> asyncListeners = new ConcurrentHashMap<>();
    private final Executor asyncExecutor;

    public InProcessEventBus(@Qualifier("eventDispatcherExecutor") Executor asyncExecutor) {
        this.asyncExecutor = asyncExecutor;
    }

    @Override
    public void subscribe(ChatEventType type, ChatEventListener listener, boolean async) {
        registry(async).computeIfAbsent(type, key -> new CopyOnWriteArrayList<>()).add(listener);
    }

    @Override
    public void unsubscribe(ChatEventType type, ChatEventListener listener, boolean async) {
        List<ChatEventListener> listeners = registry(async).get(type);
        if (listeners != null) {
            listeners.remove(listener);
        }
    }

    @Override
    public void dispatch(ChatEventType type, Instant timestamp, Map<String, Object> payload, boolean async) {
        ChatEvent event = ChatEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .occurredAt(timestamp)
                .payload(payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of())
                .build();

        for (ChatEventListener listener : syncListeners.getOrDefault(type, List.of())) {
            invoke(listener, event);
        }
        if (!async) {
            return;
        }
        for (ChatEventListener listener : asyncListeners.getOrDefault(type, List.of())) {
            try {
                asyncExecutor.execute(() -> invoke(listener, event));
            } catch (RejectedExecutionException ex) {
                log.error("Dropped async delivery of {} to {}: executor rejected the task", type.getWireName(), listener, ex);
            }
        }
    }

    private void invoke(ChatEventListener listener, ChatEvent event) {
        try {
            listener.onEvent(event);
        } catch (Exception ex) {
            log.error("Listener {} failed for event {} ({})", listener, event.getType().getWireName(), event.getEventId(), ex);
        }
    }

    private Map<ChatEventType, List<ChatEventListener>> registry(boolean async) {
        return async ? asyncListeners : syncListeners;
    }
}
