package com.example.messenger.service;

import com.example.messenger.config.MessengerProperties;
import com.example.messenger.domain.Conversation;
import com.example.messenger.service.exception.ServiceException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationRetentionScheduler {

    private final MessengerProperties messengerProperties;
    private final ConversationRepository conversationRepository;
    private final AgentConversationService agentConversationService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "#{T(java.time.Duration).parse('${messenger.retention.interval:PT24H}').toMillis()}")
    public void closeOldConversations() {
        MessengerProperties.Retention retention = messengerProperties.getRetention();
        if (!retention.isEnabled()) {
            return;
        }
        int closed = closeResolvedOlderThan(retention.getResolvedToClosed(), retention.getBatchSize());
        if (closed > 0) {
            log.info("Closed {} resolved conversations older than {}", closed, retention.getResolvedToClosed());
        }
    }

    public int closeResolvedOlderThan(Duration age, int batchSize) {
        if (age == null || age.isNegative() || age.isZero() || batchSize <= 0) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(age);
        List<Conversation> conversations = conversationRepository.findResolvedInactiveSince(cutoff, batchSize);
        int closed = 0;
        for (Conversation conversation : conversations) {
            try {
                if (agentConversationService.close(conversation.getId())) {
                    closed++;
                }
            } catch (ServiceException ex) {
                log.trace("Conversation {} disappeared before retention processed it", conversation.getId(), ex);
            } catch (Exception ex) {
                log.warn("Failed to close resolved conversation {}", conversation.getId(), ex);
            }
        }
        return closed;
    }
}
