package com.example.kitcheneta.controller;

import com.example.kitcheneta.service.dto.LoadCacheStats;
import com.example.kitcheneta.service.load.LoadCacheService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 运维入口：查看计数缓存、手动按数据库重建或清除某个门店的计数。
 */
@RestController
@RequestMapping("/api/admin/load-cache")
public class LoadCacheAdminController {

    private static final Logger log = LoggerFactory.getLogger(LoadCacheAdminController.class);

    private final LoadCacheService loadCacheService;

    public LoadCacheAdminController(LoadCacheService loadCacheService) {
        this.loadCacheService = loadCacheService;
    }

    @GetMapping("/stats")
    public LoadCacheStats stats() {
        return loadCacheService.stats();
    }

    @PostMapping("/{locationId}/resync")
    public Map<String, Long> resync(@PathVariable Long locationId) {
        log.info("Manual resync requested for location {}", locationId);
        long count = loadCacheService.resync(locationId);
        return Map.of("locationId", locationId, "activeOrdersCount", count);
    }

    @DeleteMapping("/{locationId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void invalidate(@PathVariable Long locationId) {
        log.info("Manual invalidation requested for location {}", locationId);
        loadCacheService.invalidate(locationId);
    }
}
