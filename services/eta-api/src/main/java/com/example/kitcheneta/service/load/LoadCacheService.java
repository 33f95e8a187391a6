package com.example.kitcheneta.service.load;

import com.example.kitcheneta.service.dto.LoadCacheStats;
import com.example.kitcheneta.service.props.KitchenLoadProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.Map;

/**
 * Per-location active order counter kept in a shared store.
 *
 * <p>Readers ({@code PrepTimeEstimator}) only call {@link #getActiveOrderCount(Long)};
 * the lifecycle listener is the only caller of increment/decrement. Store failures never
 * leave this class: reads degrade to the authoritative count, writes degrade to
 * {@link #resync(Long)}.
 *
 * 缓存三防里这里只管击穿：缓存缺失时用短租约锁保证同一门店只有一个请求回源重建，
 * 抢不到锁的请求直接查库、不写缓存。
 */
@Service
public class LoadCacheService {

    private static final Logger log = LoggerFactory.getLogger(LoadCacheService.class);

    private final LoadCounterStore store;
    private final ActiveOrderCounter activeOrderCounter;
    private final KitchenLoadProperties properties;

    public LoadCacheService(LoadCounterStore store,
                            ActiveOrderCounter activeOrderCounter,
                            KitchenLoadProperties properties) {
        this.store = store;
        this.activeOrderCounter = activeOrderCounter;
        this.properties = properties;
    }

    public long getActiveOrderCount(Long locationId) {
        try {
            return readThrough(locationId);
        } catch (CounterStoreUnavailableException e) {
            log.warn("Counter store unavailable, falling back to database for location {}: {}",
                    locationId, e.getMessage());
            return countFromDatabaseOrZero(locationId);
        } catch (DataAccessException | TransactionException e) {
            // 连不上库时事务本身开不起来，抛的是 TransactionException 而不是 DataAccessException
            log.error("Database unavailable while rebuilding counter for location {}", locationId, e);
            return 0;
        }
    }

    public void setActiveOrderCount(Long locationId, long count) {
        try {
            store.write(properties.countKey(locationId), Math.max(0, count));
            log.debug("Set cache for location {}: {} active orders", locationId, count);
        } catch (CounterStoreUnavailableException e) {
            log.warn("Failed to set cache for location {}: {}", locationId, e.getMessage());
        }
    }

    public long incrementActiveOrders(Long locationId) {
        try {
            long newCount = store.increment(properties.countKey(locationId));
            log.debug("Incremented active orders for location {} to {}", locationId, newCount);
            return newCount;
        } catch (CounterStoreUnavailableException e) {
            log.warn("Failed to increment cache for location {}, resyncing: {}", locationId, e.getMessage());
            return resync(locationId);
        }
    }

    public long decrementActiveOrders(Long locationId) {
        DecrementResult result;
        try {
            result = store.decrement(properties.countKey(locationId));
        } catch (CounterStoreUnavailableException e) {
            log.warn("Failed to decrement cache for location {}, resyncing: {}", locationId, e.getMessage());
            return resync(locationId);
        }
        if (result.clamped()) {
            // 计数已经和订单表背离（漏掉了一次 increment 或事件乱序），以数据库为准重建
            log.info("Decrement for location {} would go negative, clamped to 0 and resyncing", locationId);
            return resync(locationId);
        }
        log.debug("Decremented active orders for location {} to {}", locationId, result.count());
        return result.count();
    }

    public void invalidate(Long locationId) {
        try {
            store.delete(properties.countKey(locationId));
            log.debug("Cleared cache for location {}", locationId);
        } catch (CounterStoreUnavailableException e) {
            log.warn("Failed to clear cache for location {}: {}", locationId, e.getMessage());
        }
    }

    /**
     * Recomputes the count from the database and overwrites the cache entry. A decrement or
     * increment racing with this overwrite may be lost; the next resync or TTL expiry heals it.
     *
     * @return the authoritative count, or 0 when the database is unreachable
     */
    public long resync(Long locationId) {
        long actualCount;
        try {
            actualCount = activeOrderCounter.countActive(locationId);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to sync cache from database for location {}, dropping entry", locationId, e);
            invalidate(locationId);
            return 0;
        }
        setActiveOrderCount(locationId, actualCount);
        log.info("Synced cache from database for location {}: {} active orders", locationId, actualCount);
        return actualCount;
    }

    public LoadCacheStats stats() {
        try {
            Map<String, Long> snapshot = store.snapshot();
            long total = snapshot.values().stream().mapToLong(Long::longValue).sum();
            return LoadCacheStats.healthy(snapshot.size(), total);
        } catch (CounterStoreUnavailableException e) {
            log.warn("Counter store unavailable while collecting stats: {}", e.getMessage());
            return LoadCacheStats.unavailable(e.getMessage());
        }
    }

    private long readThrough(Long locationId) {
        String countKey = properties.countKey(locationId);
        Long cached = store.read(countKey);
        if (cached != null) {
            log.debug("Cache hit for location {}: {} active orders", locationId, cached);
            return cached;
        }

        String lockKey = properties.lockKey(locationId);
        if (!store.tryLock(lockKey)) {
            log.debug("Could not acquire cache lock for location {}, falling back to database", locationId);
            return activeOrderCounter.countActive(locationId);
        }
        try {
            cached = store.read(countKey);
            if (cached != null) {
                log.debug("Cache hit after lock for location {}: {} active orders", locationId, cached);
                return cached;
            }
            long actualCount = activeOrderCounter.countActive(locationId);
            store.write(countKey, actualCount);
            log.info("Cache miss for location {}, cached DB result: {} active orders", locationId, actualCount);
            return actualCount;
        } finally {
            store.unlock(lockKey);
        }
    }

    private long countFromDatabaseOrZero(Long locationId) {
        try {
            return activeOrderCounter.countActive(locationId);
        } catch (DataAccessException | TransactionException e) {
            log.error("Database also unavailable for location {}, assuming no load", locationId, e);
            return 0;
        }
    }
}
