package com.example.tuckshop.infrastructure.persistence.entity;

/**
 * Status of an order creation request tracked by idempotency key.
 */
public enum IdempotencyStatus {
    IN_PROGRESS,
    COMPLETED
}
