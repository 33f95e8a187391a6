package com.example.kitcheneta.repository;

import com.example.kitcheneta.model.Order;
import com.example.kitcheneta.model.OrderStatus;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.Optional;

public interface OrderRepository extends JpaRepository<Order, Long> {

    // 权威计数：走 (location_id, status) 索引
    long countByLocationIdAndStatusInAndDeletedFalse(Long locationId, Collection<OrderStatus> statuses);

    @EntityGraph(attributePaths = "lines")
    Optional<Order> findByIdAndDeletedFalse(Long id);

    @Override
    @EntityGraph(attributePaths = "lines")
    Optional<Order> findById(Long id);
}
