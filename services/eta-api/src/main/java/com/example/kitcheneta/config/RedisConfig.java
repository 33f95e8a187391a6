package com.example.kitcheneta.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.scripting.support.ResourceScriptSource;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Redis 计数存储所需的 Bean：三个原子 Lua 脚本和用于缓存重建锁的 Redisson 客户端。
 * 仅在 kitchen-load.store=redis（默认）时生效。
 */
@Configuration
@ConditionalOnProperty(prefix = "kitchen-load", name = "store", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    /**
     * GET + EXPIRE：命中时顺带续期。
     */
    @Bean("loadReadScript")
    public DefaultRedisScript<Long> loadReadScript() {
        return script("scripts/load-read.lua");
    }

    /**
     * INCR + EXPIRE，一次往返内完成。
     */
    @Bean("loadIncrementScript")
    public DefaultRedisScript<Long> loadIncrementScript() {
        return script("scripts/load-increment.lua");
    }

    /**
     * DECR + 下限截断为 0 + EXPIRE。截断时返回 -1 通知调用方回源。
     */
    @Bean("loadDecrementScript")
    public DefaultRedisScript<Long> loadDecrementScript() {
        return script("scripts/load-decrement.lua");
    }

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(RedisProperties redisProperties) {
        Config config = new Config();
        String scheme = redisProperties.isSsl() ? "rediss://" : "redis://";
        SingleServerConfig server = config.useSingleServer()
                .setAddress(scheme + redisProperties.getHost() + ":" + redisProperties.getPort())
                .setDatabase(redisProperties.getDatabase());
        if (StringUtils.hasText(redisProperties.getPassword())) {
            server.setPassword(redisProperties.getPassword());
        }
        Duration timeout = redisProperties.getTimeout();
        if (timeout != null) {
            server.setTimeout((int) timeout.toMillis());
        }
        return Redisson.create(config);
    }

    private DefaultRedisScript<Long> script(String location) {
        DefaultRedisScript<Long> redisScript = new DefaultRedisScript<>();
        redisScript.setScriptSource(new ResourceScriptSource(new ClassPathResource(location)));
        redisScript.setResultType(Long.class);
        return redisScript;
    }
}
