package com.example.kitcheneta.controller.dto;

import javax.validation.constraints.Min;

/**
 * 一行请求。下单只接受 offeringId；估算还可以用 menuItemId 指定菜品。
 */
public record LineItemRequest(
        Long offeringId,

        Long menuItemId,

        @Min(value = 1, message = "quantity must be at least 1")
        int quantity
) {}
