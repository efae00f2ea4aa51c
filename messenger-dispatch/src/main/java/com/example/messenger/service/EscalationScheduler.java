package com.example.messenger.service;

import com.example.messenger.config.MessengerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class EscalationScheduler {

    private final EscalationScanner escalationScanner;
    private final MessengerProperties messengerProperties;

    @Scheduled(
            fixedDelayString = "#{T(java.time.Duration).parse('${messenger.escalation.interval:PT1M}').toMillis()}",
            initialDelayString = "#{T(java.time.Duration).parse('${messenger.escalation.interval:PT1M}').toMillis()}")
    public void escalateUnopenedConversations() {
        if (!messengerProperties.getEscalation().isEnabled()) {
            return;
        }
        try {
            escalationScanner.scan(EscalationRequest.builder().build());
        } catch (Exception ex) {
            log.warn("Scheduled escalation scan failed", ex);
        }
    }
}
