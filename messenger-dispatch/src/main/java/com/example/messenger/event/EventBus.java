package com.example.messenger.event;

import java.time.Instant;
import java.util.Map;

/**
 * In-process publish/subscribe hub for domain events.
 *
 * <p>Synchronous listeners run on the dispatching thread in registration order before
 * {@link #dispatch} returns. Asynchronous listeners run on a worker pool and only when the event is
 * dispatched with {@code async = true}. A failing listener never affects the dispatcher or the
 * other listeners. Events are not persisted and are never replayed.
 */
public interface EventBus {

    void subscribe(ChatEventType type, ChatEventListener listener, boolean async);

    void unsubscribe(ChatEventType type, ChatEventListener listener, boolean async);

    void dispatch(ChatEventType type, Instant timestamp, Map<String, Object> payload, boolean async);
}
