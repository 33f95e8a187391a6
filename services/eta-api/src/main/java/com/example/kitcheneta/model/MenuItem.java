package com.example.kitcheneta.model;

import lombok.Data;

import javax.persistence.*;

@Entity
@Table(name = "menu_items")
@Data
public class MenuItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(nullable = false)
    private String name;

    @Column(name = "base_prep_time_seconds", nullable = false)
    private int basePrepTimeSeconds;
}
