package com.example.tuckshop.infrastructure.persistence.entity;

/**
 * Delivery state of an outbox event.
 */
public enum OutboxEventStatus {
    PENDING,
    PROCESSING,
    PROCESSED,
    FAILED
}
