package com.example.kitcheneta.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import javax.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_order_location_status", columnList = "location_id, status"),
        @Index(name = "idx_order_location_created", columnList = "location_id, created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Order {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "location_id", nullable = false, updatable = false)
    private Long locationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OrderSource source;

    @Setter
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OrderStatus status;

    // 下单时计算一次，之后负载变化也不再改写
    @Column(name = "estimated_ready_at", nullable = false, updatable = false)
    private Instant estimatedReadyAt;

    @Setter
    @Column(nullable = false)
    private boolean deleted;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<OrderLine> lines = new ArrayList<>();

    public Order(Long locationId, OrderSource source, Instant estimatedReadyAt, Instant createdAt) {
        this.locationId = locationId;
        this.source = source;
        this.status = OrderStatus.RECEIVED;
        this.estimatedReadyAt = estimatedReadyAt;
        this.createdAt = createdAt;
    }

    public void addLine(Long offeringId, int quantity) {
        lines.add(new OrderLine(this, offeringId, quantity));
    }

    public boolean isActive() {
        return !deleted && status.isActive();
    }
}
