package com.example.messenger.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(RedisProperties redisProperties) {
        Config config = new Config();
        config.useSingleServer()
                .setAddress(redisAddress(redisProperties))
                .setDatabase(redisProperties.getDatabase())
                .setUsername(StringUtils.hasText(redisProperties.getUsername()) ? redisProperties.getUsername() : null)
                .setPassword(StringUtils.hasText(redisProperties.getPassword()) ? redisProperties.getPassword() : null)
                .setConnectTimeout(connectTimeoutMillis(redisProperties));
        return Redisson.create(config);
    }

    private String redisAddress(RedisProperties redisProperties) {
        boolean ssl = redisProperties.getSsl() != null && redisProperties.getSsl().isEnabled();
        return "%s%s:%d".formatted(ssl ? "rediss://" : "redis://", redisProperties.getHost(), redisProperties.getPort());
    }

    private int connectTimeoutMillis(RedisProperties redisProperties) {
        if (redisProperties.getConnectTimeout() == null) {
            return 10_000;
        }
        return (int) redisProperties.getConnectTimeout().toMillis();
    }
}
