package com.example.messenger.widget;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.messenger.config.MessengerProperties;
import com.example.messenger.domain.CaptchaChallenge;
import com.example.messenger.store.RedisKeyFactory;
import com.example.messenger.support.InMemorySharedStore;
import com.example.messenger.support.MessengerFixture;
import com.example.messenger.support.MutableClock;
import java.time.Duration;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CaptchaServiceTest {

    private MutableClock clock;
    private MessengerProperties properties;
    private InMemorySharedStore store;
    private CaptchaService captchaService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(MessengerFixture.T0);
        properties = new MessengerProperties();
        properties.getWidget().getCaptcha().setIpThreshold(3);
        store = new InMemorySharedStore(clock);
        captchaService = new CaptchaService(store, new RedisKeyFactory(properties), properties, new Random(42));
    }

    @Test
    void requiredOnceAddressReachesThreshold() {
        captchaService.recordActivity("203.0.113.5");
        captchaService.recordActivity("203.0.113.5");
        assertThat(captchaService.isRequired("203.0.113.5")).isFalse();

        captchaService.recordActivity("203.0.113.5");
        assertThat(captchaService.isRequired("203.0.113.5")).isTrue();
        assertThat(captchaService.isRequired("203.0.113.6")).isFalse();

        clock.advance(Duration.ofMinutes(11));
        assertThat(captchaService.isRequired("203.0.113.5")).isFalse();
    }

    @Test
    void issuedChallengeHasSmallNonNegativeAnswer() {
        for (int i = 0; i < 50; i++) {
            CaptchaChallenge challenge = captchaService.issue();
            assertThat(challenge.getQuestion()).matches("\\d \\S \\d = \\?");
            assertThat(Integer.parseInt(challenge.getAnswer())).isBetween(0, 18);
            assertThat(challenge.getToken()).isNotBlank();
        }
    }

    @Test
    void correctAnswerIsAcceptedOnce() {
        CaptchaChallenge challenge = captchaService.issue();

        assertThat(captchaService.verify(challenge.getToken(), "not a number")).isFalse();
        assertThat(captchaService.verify(challenge.getToken(), " " + challenge.getAnswer() + " ")).isTrue();
        assertThat(captchaService.verify(challenge.getToken(), challenge.getAnswer())).isFalse();
    }

    @Test
    void challengeExpires() {
        CaptchaChallenge challenge = captchaService.issue();
        clock.advance(Duration.ofMinutes(10));

        assertThat(captchaService.verify(challenge.getToken(), challenge.getAnswer())).isFalse();
    }

    @Test
    void missingInputNeverVerifies() {
        assertThat(captchaService.verify(null, "4")).isFalse();
        assertThat(captchaService.verify("unknown", null)).isFalse();
        assertThat(captchaService.verify("unknown", "4")).isFalse();
    }

    @Test
    void passedFlagIsPerSession() {
        captchaService.markPassed("session-a");

        assertThat(captchaService.isPassed("session-a")).isTrue();
        assertThat(captchaService.isPassed("session-b")).isFalse();
    }
}
