package com.example.kitcheneta.service.offering;

/**
 * 门店菜品快照，估算只需要这些字段，避免把 JPA 实体放进本地缓存。
 */
public record OfferingSnapshot(Long id,
                               Long locationId,
                               Long menuItemId,
                               String name,
                               boolean available,
                               int basePrepTimeSeconds) {

    public boolean orderableAt(Long location) {
        return available && locationId != null && locationId.equals(location);
    }
}
