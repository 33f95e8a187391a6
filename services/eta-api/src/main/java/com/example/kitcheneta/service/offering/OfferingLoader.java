package com.example.kitcheneta.service.offering;

import java.util.List;
import java.util.Optional;

/**
 * 门店菜品数据源抽象。
 */
public interface OfferingLoader {

    Optional<OfferingSnapshot> load(Long offeringId);

    Optional<OfferingSnapshot> loadByLocationAndMenuItem(Long locationId, Long menuItemId);

    /**
     * @return offerings at the location with availability=true
     */
    List<OfferingSnapshot> loadAvailable(Long locationId);
}
