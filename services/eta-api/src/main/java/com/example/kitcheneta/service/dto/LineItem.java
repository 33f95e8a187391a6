package com.example.kitcheneta.service.dto;

/**
 * 一行下单/估算请求：门店菜品 ID 与份数。
 */
public record LineItem(Long offeringId, int quantity) {
}
