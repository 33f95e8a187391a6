package com.example.kitcheneta.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import javax.persistence.*;

@Entity
@Table(name = "order_lines")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderLine {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "order_id", nullable = false)
    private Order order;

    @Column(name = "offering_id", nullable = false)
    private Long offeringId;

    @Column(nullable = false)
    private int quantity;

    OrderLine(Order order, Long offeringId, int quantity) {
        this.order = order;
        this.offeringId = offeringId;
        this.quantity = quantity;
    }
}
