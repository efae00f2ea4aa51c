package com.example.messenger.widget;

import com.example.messenger.config.MessengerProperties;
import com.example.messenger.store.RedisKeyFactory;
import com.example.messenger.store.SharedStore;
import com.example.messenger.store.SharedStoreException;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Fixed-window abuse limits of the public widget endpoints, shared by every node through the
 * store. Fails closed: a store error throttles the request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WidgetThrottleService {

    private static final int SESSION_KEY_LENGTH = 16;

    private final SharedStore sharedStore;
    private final RedisKeyFactory keyFactory;
    private final MessengerProperties messengerProperties;

    public boolean allowBootstrap(String clientIp, String widgetToken) {
        MessengerProperties.Throttle throttle = throttle();
        return withinLimit("bootstrap:ip", clientIp, throttle.getBootstrapPerIp())
                && (!StringUtils.hasText(widgetToken)
                        || withinLimit("bootstrap:token", widgetToken, throttle.getBootstrapPerToken()));
    }

    public boolean allowSend(String clientIp, String sessionToken) {
        MessengerProperties.Throttle throttle = throttle();
        return withinLimit("send:ip", clientIp, throttle.getSendPerIp())
                && withinLimit("send:session", shorten(sessionToken), throttle.getSendPerSession());
    }

    public boolean allowPoll(String sessionToken) {
        MessengerProperties.Throttle throttle = throttle();
        if (!withinLimit("poll:session", shorten(sessionToken), throttle.getPollPerSession())) {
            return false;
        }
        Duration minInterval = throttle.getPollMinInterval();
        if (minInterval == null || minInterval.isZero() || minInterval.isNegative()) {
            return true;
        }
        String key = keyFactory.pollIntervalKey(shorten(sessionToken));
        try {
            return sharedStore.compareAndSet(key, null, "1", minInterval);
        } catch (SharedStoreException ex) {
            log.error("operation=pollInterval key={} policy=fail-closed: throttling request", key, ex);
            return false;
        }
    }

    private boolean withinLimit(String scope, String subject, int limit) {
        String key = keyFactory.throttleKey(scope, StringUtils.hasText(subject) ? subject : "unknown");
        try {
            return sharedStore.incrementAndGet(key, throttle().getWindow()) <= limit;
        } catch (SharedStoreException ex) {
            log.error("operation=throttle key={} policy=fail-closed: throttling request", key, ex);
            return false;
        }
    }

    private String shorten(String sessionToken) {
        if (sessionToken == null || sessionToken.length() <= SESSION_KEY_LENGTH) {
            return sessionToken;
        }
        return sessionToken.substring(0, SESSION_KEY_LENGTH);
    }

    private MessengerProperties.Throttle throttle() {
        return messengerProperties.getWidget().getThrottle();
    }
}
