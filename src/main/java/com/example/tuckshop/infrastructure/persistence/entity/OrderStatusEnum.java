package com.example.tuckshop.infrastructure.persistence.entity;

/**
 * Persistence representation of the order status.
 */
public enum OrderStatusEnum {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    CANCELLED_ACKNOWLEDGED
}
