package com.example.kitcheneta.service.dto;

/**
 * 门店当前负载快照，用于估算结果展示与监控。
 *
 * @param loadMultiplier rounded to two decimals
 */
public record LoadInfo(long activeOrdersCount, double loadMultiplier, boolean highLoad) {
}
