package com.example.messenger.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Low-latency key/value store shared by every worker of the cluster. Each operation maps to a
 * single atomic command. Implementations report every failure as {@link SharedStoreException}.
 */
public interface SharedStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * Atomically replaces the value of {@code key} when it still equals {@code expected}.
     *
     * @param expected the value the caller read, or {@code null} when the key was absent
     * @param ttl expiry applied to the key after a successful swap, ignored when {@code null}
     * @return {@code true} when the swap happened
     */
    boolean compareAndSet(String key, String expected, String updated, Duration ttl);

    /**
     * Increments the counter at {@code key}. The expiry is applied in the same atomic step whenever
     * the counter has none, so a new counter always opens a fixed window.
     */
    long incrementAndGet(String key, Duration ttl);

    long getCounter(String key);

    boolean touch(String key, Duration ttl);
}
