package com.example.kitcheneta.service.props;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "kitchen-load")
public class KitchenLoadProperties {

    /**
     * 计数存储实现：redis（多实例共享）或 local（单实例 Caffeine）。
     */
    private String store = "redis";

    /**
     * Key prefix for the per-location active order counter.
     */
    private String cacheKeyPrefix = "location_load:";

    /**
     * Suffix appended to the counter key to build the miss-resolution lock key.
     */
    private String lockKeySuffix = ":lock";

    /**
     * 计数缓存 TTL（秒），每次读命中与写入都会续期，作为自愈兜底。
     */
    private long cacheTtlSeconds = 3600;

    /**
     * 缓存重建锁的租约秒数，持有者崩溃时依靠租约自动释放。
     */
    private long lockLeaseSeconds = 10;

    /**
     * local 模式下计数缓存的最大条数。
     */
    private long localCacheMaximumSize = 10_000;

    /**
     * 本地 Caffeine 门店菜品缓存最大条数。
     */
    private long offeringCacheMaximumSize = 1024;

    /**
     * 本地 Caffeine 门店菜品缓存写入后过期时间（秒）。
     */
    private long offeringCacheExpireAfterWriteSeconds = 60;

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public String getCacheKeyPrefix() {
        return cacheKeyPrefix;
    }

    public void setCacheKeyPrefix(String cacheKeyPrefix) {
        this.cacheKeyPrefix = cacheKeyPrefix;
    }

    public String getLockKeySuffix() {
        return lockKeySuffix;
    }

    public void setLockKeySuffix(String lockKeySuffix) {
        this.lockKeySuffix = lockKeySuffix;
    }

    public long getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public void setCacheTtlSeconds(long cacheTtlSeconds) {
        this.cacheTtlSeconds = cacheTtlSeconds;
    }

    public long getLockLeaseSeconds() {
        return lockLeaseSeconds;
    }

    public void setLockLeaseSeconds(long lockLeaseSeconds) {
        this.lockLeaseSeconds = lockLeaseSeconds;
    }

    public long getLocalCacheMaximumSize() {
        return localCacheMaximumSize;
    }

    public void setLocalCacheMaximumSize(long localCacheMaximumSize) {
        this.localCacheMaximumSize = localCacheMaximumSize;
    }

    public long getOfferingCacheMaximumSize() {
        return offeringCacheMaximumSize;
    }

    public void setOfferingCacheMaximumSize(long offeringCacheMaximumSize) {
        this.offeringCacheMaximumSize = offeringCacheMaximumSize;
    }

    public long getOfferingCacheExpireAfterWriteSeconds() {
        return offeringCacheExpireAfterWriteSeconds;
    }

    public void setOfferingCacheExpireAfterWriteSeconds(long offeringCacheExpireAfterWriteSeconds) {
        this.offeringCacheExpireAfterWriteSeconds = offeringCacheExpireAfterWriteSeconds;
    }

    public Duration cacheTtl() {
        return Duration.ofSeconds(Math.max(1, cacheTtlSeconds));
    }

    public Duration lockLease() {
        return Duration.ofSeconds(Math.max(1, lockLeaseSeconds));
    }

    public String countKey(Long locationId) {
        return cacheKeyPrefix + locationId;
    }

    public String lockKey(Long locationId) {
        return countKey(locationId) + lockKeySuffix;
    }
}
