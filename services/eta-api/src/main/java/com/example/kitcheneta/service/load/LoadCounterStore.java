package com.example.kitcheneta.service.load;

import java.util.Map;

/**
 * 计数存储抽象：负责单个 key 上的原子读写与重建锁，不关心回源逻辑。
 * 实现类在共享存储不可达时抛出 {@link CounterStoreUnavailableException}，
 * 由 {@link LoadCacheService} 统一降级。
 */
public interface LoadCounterStore {

    /**
     * Reads the counter and refreshes its TTL on a hit.
     *
     * @return the cached count, or {@code null} when the key is absent or expired
     */
    Long read(String key);

    /**
     * Overwrites the counter and resets its TTL.
     */
    void write(String key, long count);

    /**
     * Atomically increments the counter and refreshes its TTL. An absent key starts at zero.
     */
    long increment(String key);

    /**
     * Atomically decrements the counter, clamping at zero, and refreshes its TTL.
     */
    DecrementResult decrement(String key);

    /**
     * Non-blocking attempt to take the miss-resolution lock. The lock expires on its own
     * after the configured lease even if never released.
     */
    boolean tryLock(String lockKey);

    /**
     * Releases a lock taken by {@link #tryLock(String)}. Never throws.
     */
    void unlock(String lockKey);

    void delete(String key);

    /**
     * Snapshot of every live counter key under the configured prefix, lock keys excluded.
     */
    Map<String, Long> snapshot();
}
