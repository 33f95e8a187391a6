package com.example.kitcheneta.service.load;

import com.example.kitcheneta.service.props.KitchenLoadProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单实例部署用的 Caffeine 计数存储。
 * 原子性依赖 {@code asMap().compute}/{@code merge} 的单 key 互斥；TTL 用 expireAfterAccess，读写都续期。
 */
@Component
@ConditionalOnProperty(prefix = "kitchen-load", name = "store", havingValue = "local")
public class LocalLoadCounterStore implements LoadCounterStore {

    private final Cache<String, Long> counts;
    private final Cache<String, Boolean> locks;
    private final KitchenLoadProperties properties;

    @Autowired
    public LocalLoadCounterStore(KitchenLoadProperties properties) {
        this(properties, Ticker.systemTicker());
    }

    public LocalLoadCounterStore(KitchenLoadProperties properties, Ticker ticker) {
        this.properties = properties;
        this.counts = Caffeine.newBuilder()
                .maximumSize(properties.getLocalCacheMaximumSize())
                .expireAfterAccess(properties.cacheTtl())
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
        this.locks = Caffeine.newBuilder()
                .expireAfterWrite(properties.lockLease())
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Long read(String key) {
        return counts.getIfPresent(key);
    }

    @Override
    public void write(String key, long count) {
        counts.put(key, count);
    }

    @Override
    public long increment(String key) {
        return counts.asMap().merge(key, 1L, Long::sum);
    }

    @Override
    public DecrementResult decrement(String key) {
        AtomicBoolean clamped = new AtomicBoolean(false);
        Long newCount = counts.asMap().compute(key, (k, current) -> {
            long next = (current == null ? 0L : current) - 1;
            if (next < 0) {
                clamped.set(true);
                return 0L;
            }
            return next;
        });
        return clamped.get() ? DecrementResult.clampedToZero() : DecrementResult.of(newCount);
    }

    @Override
    public boolean tryLock(String lockKey) {
        return locks.asMap().putIfAbsent(lockKey, Boolean.TRUE) == null;
    }

    @Override
    public void unlock(String lockKey) {
        locks.invalidate(lockKey);
    }

    @Override
    public void delete(String key) {
        counts.invalidate(key);
    }

    @Override
    public Map<String, Long> snapshot() {
        Map<String, Long> snapshot = new LinkedHashMap<>();
        counts.asMap().forEach((key, value) -> {
            if (key.startsWith(properties.getCacheKeyPrefix())) {
                snapshot.put(key, value);
            }
        });
        return snapshot;
    }
}
