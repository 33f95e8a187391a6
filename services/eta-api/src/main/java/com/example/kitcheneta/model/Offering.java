package com.example.kitcheneta.model;

import lombok.Data;

import javax.persistence.*;

/**
 * 门店上架的菜品。只有 available=true 的才能下单或参与估算。
 */
@Entity
@Table(name = "offerings",
        indexes = @Index(name = "idx_offering_location_available", columnList = "location_id, available"))
@Data
public class Offering {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "location_id", nullable = false)
    private Long locationId;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "menu_item_id", nullable = false)
    private MenuItem menuItem;

    @Column(nullable = false)
    private boolean available;
}
