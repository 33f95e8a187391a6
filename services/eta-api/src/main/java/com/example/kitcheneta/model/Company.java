package com.example.kitcheneta.model;

import lombok.Data;

import javax.persistence.*;

/**
 * 品牌/公司。菜品主目录和门店都挂在公司下面。
 */
@Entity
@Table(name = "companies")
@Data
public class Company {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;
}
