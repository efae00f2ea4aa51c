package com.example.messenger.store;

import com.example.messenger.config.MessengerProperties;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final MessengerProperties messengerProperties;

    public RedisKeyFactory(MessengerProperties messengerProperties) {
        this.messengerProperties = messengerProperties;
    }

    private String prefix() {
        return messengerProperties.getRedis().getKeyPrefix();
    }

    public String roundRobinQueueKey(long inboxId) {
        return "%s:rr:queue:%d".formatted(prefix(), inboxId);
    }

    public String assignmentRateKey(long agentId) {
        return "%s:assignment_rate:%d".formatted(prefix(), agentId);
    }

    public String agentStatusKey(long agentId) {
        return "%s:agent:status:%d".formatted(prefix(), agentId);
    }

    public String widgetSessionKey(String token) {
        return "%s:widget_session:%s".formatted(prefix(), token);
    }

    public String widgetSessionLookupKey(long inboxId, String contactId) {
        return "%s:widget_session:by_contact:%d:%s".formatted(prefix(), inboxId, contactId);
    }

    public String captchaPassedKey(String sessionToken) {
        return "%s:captcha:passed:%s".formatted(prefix(), sessionToken);
    }

    public String captchaTokenKey(String captchaToken) {
        return "%s:captcha:token:%s".formatted(prefix(), captchaToken);
    }

    public String captchaIpCounterKey(String clientIp) {
        return "%s:captcha:ip:%s".formatted(prefix(), clientIp);
    }

    public String throttleKey(String scope, String subject) {
        return "%s:throttle:%s:%s".formatted(prefix(), scope, subject);
    }

    public String pollIntervalKey(String sessionToken) {
        return "%s:throttle:poll_last:%s".formatted(prefix(), sessionToken);
    }

    public String autoReplyKey(long conversationId) {
        return "%s:auto_reply:%d".formatted(prefix(), conversationId);
    }

    public String widgetStreamTopicName() {
        return "%s:widget:stream".formatted(prefix());
    }
}
