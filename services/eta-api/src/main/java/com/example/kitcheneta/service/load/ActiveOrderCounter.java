package com.example.kitcheneta.service.load;

/**
 * 权威数据源抽象：在计数缓存缺失、竞争或失效时回源统计门店进行中的订单数。
 */
public interface ActiveOrderCounter {

    /**
     * Counts orders at the location whose status is in the active set and which are not deleted.
     *
     * @param locationId 门店 ID
     * @return 进行中订单数
     * @throws org.springframework.dao.DataAccessException if the order store cannot be queried
     */
    long countActive(Long locationId);
}
