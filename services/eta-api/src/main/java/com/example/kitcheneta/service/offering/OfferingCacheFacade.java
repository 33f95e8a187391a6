package com.example.kitcheneta.service.offering;

import com.example.kitcheneta.config.CacheConfig;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

/**
 * 封装本地 Caffeine 缓存访问，避免估算服务产生 self-invocation。
 * 返回 null 表示不存在，null 不入缓存。
 */
@Component
public class OfferingCacheFacade {

    private final OfferingLoader loader;

    public OfferingCacheFacade(OfferingLoader loader) {
        this.loader = loader;
    }

    @Cacheable(cacheNames = CacheConfig.OFFERINGS_CACHE, key = "#offeringId", unless = "#result == null")
    public OfferingSnapshot load(Long offeringId) {
        return loader.load(offeringId).orElse(null);
    }

    @Cacheable(cacheNames = CacheConfig.LOCATION_OFFERINGS_CACHE,
            key = "#locationId + ':' + #menuItemId", unless = "#result == null")
    public OfferingSnapshot loadByLocationAndMenuItem(Long locationId, Long menuItemId) {
        return loader.loadByLocationAndMenuItem(locationId, menuItemId).orElse(null);
    }
}
