package com.example.messenger.service;

import com.example.messenger.config.MessengerProperties;
import com.example.messenger.store.RedisKeyFactory;
import com.example.messenger.store.SharedStore;
import com.example.messenger.store.SharedStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fixed-window cap on how many conversations one agent receives. When the shared store is
 * unreachable the limiter fails open: assignment keeps flowing and the failure is logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssignmentRateLimiter {

    private final SharedStore sharedStore;
    private final RedisKeyFactory keyFactory;
    private final MessengerProperties messengerProperties;

    public boolean checkLimit(long agentId) {
        String key = keyFactory.assignmentRateKey(agentId);
        try {
            return sharedStore.getCounter(key) < messengerProperties.getAssignment().getRateLimit();
        } catch (SharedStoreException ex) {
            log.error("operation=checkLimit key={} policy=fail-open: allowing assignment", key, ex);
            return true;
        }
    }

    public void increment(long agentId) {
        String key = keyFactory.assignmentRateKey(agentId);
        try {
            sharedStore.incrementAndGet(key, messengerProperties.getAssignment().getRateWindow());
        } catch (SharedStoreException ex) {
            log.error("operation=increment key={} policy=fail-open: assignment not counted", key, ex);
        }
    }

    public void reset(long agentId) {
        String key = keyFactory.assignmentRateKey(agentId);
        try {
            sharedStore.delete(key);
        } catch (SharedStoreException ex) {
            log.error("operation=reset key={} policy=fail-open: counter left to expire", key, ex);
        }
    }
}
