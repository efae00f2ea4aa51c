package com.example.messenger.widget;

import com.example.messenger.config.MessengerProperties;
import com.example.messenger.domain.CaptchaChallenge;
import com.example.messenger.store.RedisKeyFactory;
import com.example.messenger.store.SharedStore;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import java.util.random.RandomGenerator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class CaptchaService {

    private static final String PASSED = "1";
    private static final SecureRandom TOKEN_RANDOM = new SecureRandom();

    private final SharedStore sharedStore;
    private final RedisKeyFactory keyFactory;
    private final MessengerProperties messengerProperties;
    private final RandomGenerator random;

    @Autowired
    public CaptchaService(SharedStore sharedStore, RedisKeyFactory keyFactory, MessengerProperties messengerProperties) {
        this(sharedStore, keyFactory, messengerProperties, new SecureRandom());
    }

    CaptchaService(
            SharedStore sharedStore,
            RedisKeyFactory keyFactory,
            MessengerProperties messengerProperties,
            RandomGenerator random) {
        this.sharedStore = sharedStore;
        this.keyFactory = keyFactory;
        this.messengerProperties = messengerProperties;
        this.random = random;
    }

    public long recordActivity(String clientIp) {
        return sharedStore.incrementAndGet(keyFactory.captchaIpCounterKey(clientIp), captcha().getIpWindow());
    }

    public boolean isRequired(String clientIp) {
        return sharedStore.getCounter(keyFactory.captchaIpCounterKey(clientIp)) >= captcha().getIpThreshold();
    }

    public CaptchaChallenge issue() {
        int a = 2 + random.nextInt(8);
        int b = 2 + random.nextInt(8);
        boolean plus = random.nextBoolean();
        if (!plus && b > a) {
            int swap = a;
            a = b;
            b = swap;
        }
        String answer = String.valueOf(plus ? a + b : a - b);
        String token = newToken();
        sharedStore.set(keyFactory.captchaTokenKey(token), answer, captcha().getChallengeTtl());
        return CaptchaChallenge.builder()
                .token(token)
                .question("%d %s %d = ?".formatted(a, plus ? "+" : "-", b))
                .answer(answer)
                .build();
    }

    public boolean verify(String captchaToken, String answer) {
        if (!StringUtils.hasText(captchaToken) || answer == null) {
            return false;
        }
        String key = keyFactory.captchaTokenKey(captchaToken);
        Optional<String> expected = sharedStore.get(key);
        if (expected.isEmpty() || !expected.get().trim().equals(answer.trim())) {
            return false;
        }
        sharedStore.delete(key);
        return true;
    }

    public void markPassed(String sessionToken) {
        sharedStore.set(keyFactory.captchaPassedKey(sessionToken), PASSED, messengerProperties.getWidget().getSessionTtl());
    }

    public boolean isPassed(String sessionToken) {
        return sharedStore.get(keyFactory.captchaPassedKey(sessionToken)).filter(PASSED::equals).isPresent();
    }

    private String newToken() {
        byte[] bytes = new byte[16];
        TOKEN_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private MessengerProperties.Captcha captcha() {
        return messengerProperties.getWidget().getCaptcha();
    }
}
