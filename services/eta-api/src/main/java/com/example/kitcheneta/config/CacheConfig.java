package com.example.kitcheneta.config;

import com.example.kitcheneta.service.props.KitchenLoadProperties;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Configuration
public class CacheConfig {

    public static final String OFFERINGS_CACHE = "offerings";
    public static final String LOCATION_OFFERINGS_CACHE = "locationOfferings";

    /**
     * 门店菜品目录变化不频繁，用本地 Caffeine 挡住估算路径上的重复查询。
     */
    @Bean
    public CacheManager caffeineCacheManager(KitchenLoadProperties properties) {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(OFFERINGS_CACHE, LOCATION_OFFERINGS_CACHE);
        cacheManager.setAllowNullValues(false);
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(properties.getOfferingCacheMaximumSize())
                .expireAfterWrite(properties.getOfferingCacheExpireAfterWriteSeconds(), TimeUnit.SECONDS));
        return cacheManager;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
