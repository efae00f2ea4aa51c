package com.example.messenger.widget;

import com.example.messenger.config.MessengerProperties;
import com.example.messenger.domain.WidgetSession;
import com.example.messenger.store.RedisKeyFactory;
import com.example.messenger.store.SharedStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Widget sessions kept as JSON in the shared store. Every successful lookup extends the
 * inactivity TTL; a session whose TTL elapsed is gone.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WidgetSessionStore {

    private static final SecureRandom TOKEN_RANDOM = new SecureRandom();

    private final SharedStore sharedStore;
    private final RedisKeyFactory keyFactory;
    private final MessengerProperties messengerProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WidgetSession create(long inboxId, long conversationId, String contactId) {
        WidgetSession session = WidgetSession.builder()
                .token(newToken())
                .inboxId(inboxId)
                .conversationId(conversationId)
                .contactId(contactId)
                .createdAt(clock.instant())
                .build();
        sharedStore.set(keyFactory.widgetSessionKey(session.getToken()), writeJson(session), ttl());
        sharedStore.set(keyFactory.widgetSessionLookupKey(inboxId, contactId), session.getToken(), ttl());
        return session;
    }

    public Optional<WidgetSession> find(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        String key = keyFactory.widgetSessionKey(token);
        Optional<WidgetSession> session = sharedStore.get(key).flatMap(this::readJson);
        session.ifPresent(found -> {
            sharedStore.touch(key, ttl());
            sharedStore.touch(keyFactory.widgetSessionLookupKey(found.getInboxId(), found.getContactId()), ttl());
        });
        return session;
    }

    public Optional<WidgetSession> findForContact(long inboxId, String contactId) {
        return sharedStore.get(keyFactory.widgetSessionLookupKey(inboxId, contactId)).flatMap(this::find);
    }

    public void delete(WidgetSession session) {
        sharedStore.delete(keyFactory.widgetSessionKey(session.getToken()));
        sharedStore.delete(keyFactory.widgetSessionLookupKey(session.getInboxId(), session.getContactId()));
    }

    private String newToken() {
        byte[] bytes = new byte[32];
        TOKEN_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private Duration ttl() {
        return messengerProperties.getWidget().getSessionTtl();
    }

    private String writeJson(WidgetSession session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize widget session", e);
        }
    }

    private Optional<WidgetSession> readJson(String json) {
        try {
            return Optional.of(objectMapper.readValue(json, WidgetSession.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable widget session record", e);
            return Optional.empty();
        }
    }
}
