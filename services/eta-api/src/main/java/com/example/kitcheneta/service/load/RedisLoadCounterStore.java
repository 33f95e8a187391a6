package com.example.kitcheneta.service.load;

import com.example.kitcheneta.service.props.KitchenLoadProperties;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 多实例共享的 Redis 计数存储。
 * 增减都通过 Lua 脚本在服务端一次完成（读-改-写 + 续期），避免 GET/SET 分离带来的丢失更新。
 */
@Component
@ConditionalOnProperty(prefix = "kitchen-load", name = "store", havingValue = "redis", matchIfMissing = true)
public class RedisLoadCounterStore implements LoadCounterStore {

    private static final Logger log = LoggerFactory.getLogger(RedisLoadCounterStore.class);

    private static final long CLAMPED = -1L;
    private static final long SCAN_BATCH = 500;

    private final StringRedisTemplate redisTemplate;
    private final RedissonClient redissonClient;
    private final DefaultRedisScript<Long> readScript;
    private final DefaultRedisScript<Long> incrementScript;
    private final DefaultRedisScript<Long> decrementScript;
    private final KitchenLoadProperties properties;

    public RedisLoadCounterStore(StringRedisTemplate redisTemplate,
                                 RedissonClient redissonClient,
                                 @Qualifier("loadReadScript") DefaultRedisScript<Long> readScript,
                                 @Qualifier("loadIncrementScript") DefaultRedisScript<Long> incrementScript,
                                 @Qualifier("loadDecrementScript") DefaultRedisScript<Long> decrementScript,
                                 KitchenLoadProperties properties) {
        this.redisTemplate = redisTemplate;
        this.redissonClient = redissonClient;
        this.readScript = readScript;
        this.incrementScript = incrementScript;
        this.decrementScript = decrementScript;
        this.properties = properties;
    }

    @Override
    public Long read(String key) {
        return executeScript(readScript, key);
    }

    @Override
    public void write(String key, long count) {
        try {
            redisTemplate.opsForValue().set(key, String.valueOf(count), properties.cacheTtl());
        } catch (RuntimeException e) {
            throw unavailable("SET", key, e);
        }
    }

    @Override
    public long increment(String key) {
        Long newCount = executeScript(incrementScript, key);
        if (newCount == null) {
            throw new CounterStoreUnavailableException("Increment script returned null for " + key, null);
        }
        return newCount;
    }

    @Override
    public DecrementResult decrement(String key) {
        Long newCount = executeScript(decrementScript, key);
        if (newCount == null) {
            throw new CounterStoreUnavailableException("Decrement script returned null for " + key, null);
        }
        if (newCount == CLAMPED) {
            return DecrementResult.clampedToZero();
        }
        return DecrementResult.of(newCount);
    }

    @Override
    public boolean tryLock(String lockKey) {
        RLock lock = redissonClient.getLock(lockKey);
        try {
            // waitTime=0：拿不到就直接回源，不排队
            return lock.tryLock(0, properties.lockLease().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while acquiring rebuild lock {}", lockKey);
            return false;
        } catch (RuntimeException e) {
            throw unavailable("LOCK", lockKey, e);
        }
    }

    @Override
    public void unlock(String lockKey) {
        RLock lock = redissonClient.getLock(lockKey);
        try {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            } else {
                log.debug("Rebuild lock {} already released by its lease", lockKey);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to release rebuild lock {}, it will expire after {}s: {}",
                    lockKey, properties.getLockLeaseSeconds(), e.getMessage());
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (RuntimeException e) {
            throw unavailable("DEL", key, e);
        }
    }

    @Override
    public Map<String, Long> snapshot() {
        try {
            List<String> keys = scanCounterKeys();
            if (keys.isEmpty()) {
                return Collections.emptyMap();
            }
            List<String> values = redisTemplate.opsForValue().multiGet(keys);
            Map<String, Long> counts = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                String value = values == null ? null : values.get(i);
                if (value != null) {
                    counts.put(keys.get(i), Long.parseLong(value));
                }
            }
            return counts;
        } catch (RuntimeException e) {
            throw unavailable("SCAN", properties.getCacheKeyPrefix() + "*", e);
        }
    }

    // 锁 key 与计数 key 共用前缀，但锁是 Redisson 的 hash 结构，不能 GET
    private List<String> scanCounterKeys() {
        ScanOptions options = ScanOptions.scanOptions()
                .match(properties.getCacheKeyPrefix() + "*")
                .count(SCAN_BATCH)
                .build();
        List<String> keys = redisTemplate.execute((RedisCallback<List<String>>) connection -> collect(connection, options));
        return keys == null ? Collections.emptyList() : keys;
    }

    private List<String> collect(RedisConnection connection, ScanOptions options) {
        List<String> keys = new ArrayList<>();
        try (Cursor<byte[]> cursor = connection.scan(options)) {
            while (cursor.hasNext()) {
                String key = new String(cursor.next(), StandardCharsets.UTF_8);
                if (!key.endsWith(properties.getLockKeySuffix())) {
                    keys.add(key);
                }
            }
        }
        return keys;
    }

    private Long executeScript(DefaultRedisScript<Long> script, String key) {
        try {
            return redisTemplate.execute(script, List.of(key), String.valueOf(properties.cacheTtl().getSeconds()));
        } catch (RuntimeException e) {
            throw unavailable("EVALSHA", key, e);
        }
    }

    private CounterStoreUnavailableException unavailable(String operation, String key, RuntimeException cause) {
        return new CounterStoreUnavailableException(
                "Redis " + operation + " failed for " + key + ": " + cause.getMessage(), cause);
    }
}
