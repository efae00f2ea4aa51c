package com.example.messenger.widget;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.messenger.config.MessengerProperties;
import com.example.messenger.store.RedisKeyFactory;
import com.example.messenger.support.InMemorySharedStore;
import com.example.messenger.support.MessengerFixture;
import com.example.messenger.support.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WidgetThrottleServiceTest {

    private static final String SESSION = "sessiontoken-0123456789-abcdefghij";

    private MutableClock clock;
    private MessengerProperties properties;
    private InMemorySharedStore store;
    private WidgetThrottleService throttle;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(MessengerFixture.T0);
        properties = new MessengerProperties();
        store = new InMemorySharedStore(clock);
        throttle = new WidgetThrottleService(store, new RedisKeyFactory(properties), properties);
    }

    @Test
    void bootstrapIsLimitedPerAddressWithinTheWindow() {
        properties.getWidget().getThrottle().setBootstrapPerIp(2);

        assertThat(throttle.allowBootstrap("198.51.100.1", "widget")).isTrue();
        assertThat(throttle.allowBootstrap("198.51.100.1", "widget")).isTrue();
        assertThat(throttle.allowBootstrap("198.51.100.1", "widget")).isFalse();
        assertThat(throttle.allowBootstrap("198.51.100.2", "widget")).isTrue();

        clock.advance(Duration.ofSeconds(60));
        assertThat(throttle.allowBootstrap("198.51.100.1", "widget")).isTrue();
    }

    @Test
    void bootstrapIsLimitedPerWidgetToken() {
        properties.getWidget().getThrottle().setBootstrapPerToken(1);

        assertThat(throttle.allowBootstrap("198.51.100.1", "widget")).isTrue();
        assertThat(throttle.allowBootstrap("198.51.100.2", "widget")).isFalse();
        assertThat(throttle.allowBootstrap("198.51.100.2", "other-widget")).isTrue();
    }

    @Test
    void sendIsLimitedPerSession() {
        properties.getWidget().getThrottle().setSendPerSession(2);

        assertThat(throttle.allowSend("198.51.100.1", SESSION)).isTrue();
        assertThat(throttle.allowSend("198.51.100.2", SESSION)).isTrue();
        assertThat(throttle.allowSend("198.51.100.3", SESSION)).isFalse();
    }

    @Test
    void pollsMustBeSpacedOut() {
        assertThat(throttle.allowPoll(SESSION)).isTrue();
        assertThat(throttle.allowPoll(SESSION)).isFalse();

        clock.advance(Duration.ofSeconds(2));
        assertThat(throttle.allowPoll(SESSION)).isTrue();
    }

    @Test
    void pollCountIsCappedEvenWithoutSpacing() {
        properties.getWidget().getThrottle().setPollMinInterval(Duration.ZERO);
        properties.getWidget().getThrottle().setPollPerSession(3);

        assertThat(throttle.allowPoll(SESSION)).isTrue();
        assertThat(throttle.allowPoll(SESSION)).isTrue();
        assertThat(throttle.allowPoll(SESSION)).isTrue();
        assertThat(throttle.allowPoll(SESSION)).isFalse();
    }

    @Test
    void storeFailureThrottles() {
        store.setUnavailable(true);

        assertThat(throttle.allowBootstrap("198.51.100.1", "widget")).isFalse();
        assertThat(throttle.allowSend("198.51.100.1", SESSION)).isFalse();
        assertThat(throttle.allowPoll(SESSION)).isFalse();
    }
}
