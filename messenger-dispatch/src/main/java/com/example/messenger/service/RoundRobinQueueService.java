package com.example.messenger.service;

import com.example.messenger.config.MessengerProperties;
import com.example.messenger.domain.RoundRobinQueue;
import com.example.messenger.store.RedisKeyFactory;
import com.example.messenger.store.SharedStore;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Per-inbox rotation of eligible agents. Each mutation reads the serialised queue, computes the
 * new order and commits it with a single compare-and-set, retrying on conflict up to
 * {@code messenger.assignment.max-cas-attempts} times.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundRobinQueueService {

    private final SharedStore sharedStore;
    private final RedisKeyFactory keyFactory;
    private final AgentDirectory agentDirectory;
    private final MessengerProperties messengerProperties;

    /**
     * Picks the first agent of the queue that is in {@code allowedAgentIds} and moves it to the tail
     * of the full queue. A queue whose members no longer match the eligible set is rebuilt first.
     *
     * @throws QueueContentionException when every compare-and-set attempt lost
     */
    public Optional<Long> next(long inboxId, Collection<Long> allowedAgentIds) {
        if (allowedAgentIds == null || allowedAgentIds.isEmpty()) {
            return Optional.empty();
        }
        String key = keyFactory.roundRobinQueueKey(inboxId);
        Set<Long> eligible = agentDirectory.eligibleAgentIds(inboxId);
        int maxAttempts = maxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String current = sharedStore.get(key).orElse(null);
            RoundRobinQueue queue = validated(inboxId, RoundRobinQueue.parse(current), eligible);
            Optional<Long> selected = queue.firstAllowed(allowedAgentIds);
            if (selected.isEmpty()) {
                return Optional.empty();
            }
            RoundRobinQueue rotated = queue.moveToTail(selected.get());
            if (sharedStore.compareAndSet(key, current, rotated.serialize(), queueTtl())) {
                return selected;
            }
            log.debug("Round-robin queue {} changed concurrently (attempt {}/{})", key, attempt, maxAttempts);
        }
        throw new QueueContentionException(inboxId, maxAttempts);
    }

    public Optional<Long> peek(long inboxId, Collection<Long> allowedAgentIds) {
        RoundRobinQueue queue = RoundRobinQueue.parse(
                sharedStore.get(keyFactory.roundRobinQueueKey(inboxId)).orElse(null));
        return validated(inboxId, queue, agentDirectory.eligibleAgentIds(inboxId)).firstAllowed(allowedAgentIds);
    }

    public void requeueFirst(long inboxId, long agentId) {
        update(inboxId, queue -> queue.moveToHead(agentId));
    }

    public void add(long inboxId, long agentId) {
        update(inboxId, queue -> queue.append(agentId));
    }

    public void remove(long inboxId, long agentId) {
        update(inboxId, queue -> queue.without(agentId));
    }

    public void reset(long inboxId, List<Long> memberIds) {
        RoundRobinQueue replacement = RoundRobinQueue.of(memberIds);
        update(inboxId, queue -> replacement);
        log.info("Reset round-robin queue of inbox {} to {}", inboxId, replacement);
    }

    public List<Long> snapshot(long inboxId) {
        return RoundRobinQueue.parse(sharedStore.get(keyFactory.roundRobinQueueKey(inboxId)).orElse(null)).agentIds();
    }

    public void clear(long inboxId) {
        sharedStore.delete(keyFactory.roundRobinQueueKey(inboxId));
    }

    private void update(long inboxId, UnaryOperator<RoundRobinQueue> mutation) {
        String key = keyFactory.roundRobinQueueKey(inboxId);
        int maxAttempts = maxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String current = sharedStore.get(key).orElse(null);
            RoundRobinQueue queue = RoundRobinQueue.parse(current);
            RoundRobinQueue updated = mutation.apply(queue);
            if (updated.equals(queue) && (current != null || updated.isEmpty())) {
                return;
            }
            if (sharedStore.compareAndSet(key, current, updated.serialize(), queueTtl())) {
                return;
            }
            log.debug("Round-robin queue {} changed concurrently (attempt {}/{})", key, attempt, maxAttempts);
        }
        throw new QueueContentionException(inboxId, maxAttempts);
    }

    private RoundRobinQueue validated(long inboxId, RoundRobinQueue queue, Set<Long> eligible) {
        if (queue.hasMembers(eligible)) {
            return queue;
        }
        RoundRobinQueue rebuilt = RoundRobinQueue.sorted(eligible);
        log.debug("Rebuilding round-robin queue of inbox {}: {} -> {}", inboxId, queue, rebuilt);
        return rebuilt;
    }

    private int maxAttempts() {
        return Math.max(messengerProperties.getAssignment().getMaxCasAttempts(), 1);
    }

    private Duration queueTtl() {
        return messengerProperties.getRedis().getQueueTtl();
    }
}
