package com.example.kitcheneta.service.dto;

public record LoadCacheStats(int cachedLocations, long totalCachedOrders, String cacheStatus, String error) {

    public static LoadCacheStats healthy(int cachedLocations, long totalCachedOrders) {
        return new LoadCacheStats(cachedLocations, totalCachedOrders, "healthy", null);
    }

    public static LoadCacheStats unavailable(String error) {
        return new LoadCacheStats(0, 0, "unavailable", error);
    }
}
