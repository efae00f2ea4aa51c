package com.example.messenger.widget;

import com.example.messenger.config.MessengerProperties;
import com.example.messenger.dto.WidgetMessagePayload;
import com.example.messenger.service.MessageRepository;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Server-sent event streams opened by widgets on this node, grouped by conversation. A stream ends
 * after its maximum lifetime, or earlier when nothing was sent for the idle timeout; the widget
 * then reconnects with the last id it saw.
 */
@Slf4j
@Component
public class WidgetStreamRegistry {

    public static final String READY_EVENT = "ready";
    public static final String MESSAGE_EVENT = "message";
    public static final String ASSIGNMENT_EVENT = "assignment";

    private final MessageRepository messageRepository;
    private final MessengerProperties messengerProperties;
    private final Clock clock;
    private final ConcurrentMap<Long, ConcurrentMap<String, Subscriber>> subscribersByConversation =
            new ConcurrentHashMap<>();

    public WidgetStreamRegistry(
            MessageRepository messageRepository, MessengerProperties messengerProperties, Clock clock) {
        this.messageRepository = messageRepository;
        this.messengerProperties = messengerProperties;
        this.clock = clock;
    }

    public SseEmitter open(long conversationId, Long sinceId) {
        MessengerProperties.Stream config = messengerProperties.getWidget().getStream();
        SseEmitter emitter = newEmitter(config.getMaxLifetime().toMillis());
        long cursor = sinceId != null
                ? Math.max(sinceId, 0L)
                : messageRepository.findLatestOutboundId(conversationId).orElse(0L);
        String subscriberId = UUID.randomUUID().toString();
        Subscriber subscriber = new Subscriber(emitter, cursor, clock.instant());

        Map<String, Object> ready = new LinkedHashMap<>();
        ready.put("conversation_id", conversationId);
        ready.put("since_id", cursor);
        // Publishers wait on the subscriber until ready is out.
        synchronized (subscriber) {
            subscribersByConversation.computeIfAbsent(conversationId, key -> new ConcurrentHashMap<>())
                    .put(subscriberId, subscriber);
            if (!send(emitter, READY_EVENT, ready, null)) {
                remove(conversationId, subscriberId);
                return emitter;
            }
        }
        emitter.onCompletion(() -> remove(conversationId, subscriberId));
        emitter.onTimeout(() -> remove(conversationId, subscriberId));
        emitter.onError(ex -> remove(conversationId, subscriberId));

        List<WidgetMessagePayload> missed = messageRepository
                .findOutboundAfter(conversationId, cursor, messengerProperties.getWidget().getPollLimit())
                .stream()
                .map(WidgetMessagePayload::from)
                .toList();
        for (WidgetMessagePayload message : missed) {
            deliver(conversationId, subscriberId, subscriber, message);
        }
        return emitter;
    }

    SseEmitter newEmitter(long timeoutMillis) {
        return new SseEmitter(timeoutMillis);
    }

    public void publishMessage(WidgetMessagePayload message) {
        Map<String, Subscriber> subscribers = subscribersByConversation.get(message.getConversationId());
        if (subscribers == null) {
            return;
        }
        subscribers.forEach((subscriberId, subscriber) ->
                deliver(message.getConversationId(), subscriberId, subscriber, message));
    }

    public void publishAssignment(long conversationId, Map<String, Object> assignment) {
        Map<String, Subscriber> subscribers = subscribersByConversation.get(conversationId);
        if (subscribers == null) {
            return;
        }
        subscribers.forEach((subscriberId, subscriber) -> {
            synchronized (subscriber) {
                if (send(subscriber.emitter, ASSIGNMENT_EVENT, assignment, null)) {
                    subscriber.lastDataAt = clock.instant();
                } else {
                    remove(conversationId, subscriberId);
                }
            }
        });
    }

    @Scheduled(fixedDelayString = "#{T(java.time.Duration).parse('${messenger.widget.stream.sweep-interval:PT5S}').toMillis()}")
    public void closeIdleStreams() {
        Duration idleTimeout = messengerProperties.getWidget().getStream().getIdleTimeout();
        Instant idleBefore = clock.instant().minus(idleTimeout);
        subscribersByConversation.forEach((conversationId, subscribers) -> {
            if (subscribers.isEmpty()) {
                subscribersByConversation.remove(conversationId, subscribers);
                return;
            }
            subscribers.forEach((subscriberId, subscriber) -> {
                if (!subscriber.lastDataAt.isAfter(idleBefore)) {
                    log.debug("Closing idle widget stream {} of conversation {}", subscriberId, conversationId);
                    remove(conversationId, subscriberId);
                    subscriber.emitter.complete();
                }
            });
        });
    }

    public int activeStreams(long conversationId) {
        Map<String, Subscriber> subscribers = subscribersByConversation.get(conversationId);
        return subscribers != null ? subscribers.size() : 0;
    }

    private void deliver(long conversationId, String subscriberId, Subscriber subscriber, WidgetMessagePayload message) {
        synchronized (subscriber) {
            if (message.getId() <= subscriber.lastEventId.get()) {
                return;
            }
            if (!send(subscriber.emitter, MESSAGE_EVENT, message, String.valueOf(message.getId()))) {
                remove(conversationId, subscriberId);
                return;
            }
            subscriber.lastEventId.set(message.getId());
            subscriber.lastDataAt = clock.instant();
        }
    }

    private boolean send(SseEmitter emitter, String name, Object data, String id) {
        try {
            SseEmitter.SseEventBuilder event = SseEmitter.event().name(name).data(data);
            if (id != null) {
                event.id(id);
            }
            emitter.send(event);
            return true;
        } catch (IOException | IllegalStateException ex) {
            log.debug("Widget stream send of {} failed: {}", name, ex.getMessage());
            return false;
        }
    }

    private void remove(long conversationId, String subscriberId) {
        ConcurrentMap<String, Subscriber> subscribers = subscribersByConversation.get(conversationId);
        if (subscribers == null) {
            return;
        }
        subscribers.remove(subscriberId);
        if (subscribers.isEmpty()) {
            subscribersByConversation.remove(conversationId, subscribers);
        }
    }

    private static final class Subscriber {

        private final SseEmitter emitter;
        private final AtomicLong lastEventId;
        private volatile Instant lastDataAt;

        private Subscriber(SseEmitter emitter, long lastEventId, Instant openedAt) {
            this.emitter = emitter;
            this.lastEventId = new AtomicLong(lastEventId);
            this.lastDataAt = openedAt;
        }
    }
}
