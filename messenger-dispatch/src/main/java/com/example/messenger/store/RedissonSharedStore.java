package com.example.messenger.store;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RBucket;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.springframework.stereotype.Component;

/**
 * Mutations that combine a write with an expiry run as one Lua script, so a counter or queue can
 * never be left behind without its TTL.
 */
@Component
@RequiredArgsConstructor
public class RedissonSharedStore implements SharedStore {

    static final String INCREMENT_SCRIPT =
            "local value = redis.call('incr', KEYS[1]) "
            + "if tonumber(ARGV[1]) > 0 and redis.call('pttl', KEYS[1]) < 0 then "
            + "redis.call('pexpire', KEYS[1], ARGV[1]) end "
            + "return value";

    static final String COMPARE_AND_SET_SCRIPT =
            "local current = redis.call('get', KEYS[1]) "
            + "if ARGV[1] == '1' then "
            + "if current then return 0 end "
            + "elseif current ~= ARGV[2] then return 0 end "
            + "if tonumber(ARGV[4]) > 0 then "
            + "redis.call('set', KEYS[1], ARGV[3], 'px', ARGV[4]) "
            + "else "
            + "local ttl = redis.call('pttl', KEYS[1]) "
            + "redis.call('set', KEYS[1], ARGV[3]) "
            + "if ttl > 0 then redis.call('pexpire', KEYS[1], ttl) end "
            + "end "
            + "return 1";

    private final RedissonClient redissonClient;

    @Override
    public Optional<String> get(String key) {
        return call("get", key, () -> Optional.ofNullable(bucket(key).get()));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call("set", key, () -> {
            if (isPositive(ttl)) {
                bucket(key).set(value, ttl.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                bucket(key).set(value);
            }
            return null;
        });
    }

    @Override
    public void delete(String key) {
        call("delete", key, () -> bucket(key).delete());
    }

    @Override
    public boolean compareAndSet(String key, String expected, String updated, Duration ttl) {
        return call("compareAndSet", key, () -> {
            Boolean swapped = script().eval(
                    RScript.Mode.READ_WRITE,
                    COMPARE_AND_SET_SCRIPT,
                    RScript.ReturnType.BOOLEAN,
                    keys(key),
                    expected == null ? "1" : "0",
                    expected == null ? "" : expected,
                    updated,
                    ttlMillis(ttl));
            return Boolean.TRUE.equals(swapped);
        });
    }

    @Override
    public long incrementAndGet(String key, Duration ttl) {
        return call("incrementAndGet", key, () -> {
            Long value = script().eval(
                    RScript.Mode.READ_WRITE,
                    INCREMENT_SCRIPT,
                    RScript.ReturnType.INTEGER,
                    keys(key),
                    ttlMillis(ttl));
            return value != null ? value : 0L;
        });
    }

    @Override
    public long getCounter(String key) {
        return call("getCounter", key, () -> redissonClient.getAtomicLong(key).get());
    }

    @Override
    public boolean touch(String key, Duration ttl) {
        return call("touch", key, () -> isPositive(ttl) && bucket(key).expire(ttl));
    }

    private RBucket<String> bucket(String key) {
        return redissonClient.getBucket(key, StringCodec.INSTANCE);
    }

    private RScript script() {
        return redissonClient.getScript(StringCodec.INSTANCE);
    }

    private static List<Object> keys(String key) {
        return Collections.singletonList(key);
    }

    private static String ttlMillis(Duration ttl) {
        return String.valueOf(isPositive(ttl) ? ttl.toMillis() : 0L);
    }

    private static boolean isPositive(Duration ttl) {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }

    private <T> T call(String operation, String key, Supplier<T> command) {
        try {
            return command.get();
        } catch (RuntimeException ex) {
            throw new SharedStoreException(operation, key, ex);
        }
    }
}
