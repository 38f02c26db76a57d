package com.example.tuckshop.infrastructure.persistence.entity;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Remembers the response to an order creation request so that a client retrying
 * with the same key gets the same answer instead of a second order.
 */
@Entity
@Table(name = "idempotency_records", indexes = {
    @Index(name = "idx_idempotency_expires", columnList = "expires_at")
})
public class IdempotencyRecord implements Persistable<String> {

    @Id
    @Column(name = "idempotency_key", length = 64)
    private String idempotencyKey;

    @Column(name = "user_id", length = 128, nullable = false)
    private String userId;

    @Column(name = "order_number")
    private Long orderNumber;

    @Column(name = "response", columnDefinition = "TEXT")
    private String response;

    @Column(name = "status", length = 32, nullable = false)
    @Enumerated(EnumType.STRING)
    private IdempotencyStatus status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    // Saving a new record must INSERT so a concurrent claim on the same key fails
    @Transient
    private boolean isNew = true;

    protected IdempotencyRecord() {
    }

    public IdempotencyRecord(String idempotencyKey, String userId, Instant expiresAt) {
        this.idempotencyKey = idempotencyKey;
        this.userId = userId;
        this.expiresAt = expiresAt;
        this.status = IdempotencyStatus.IN_PROGRESS;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    @PostLoad
    @PostPersist
    protected void markNotNew() {
        isNew = false;
    }

    @Override
    public String getId() {
        return idempotencyKey;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public String getUserId() {
        return userId;
    }

    public Long getOrderNumber() {
        return orderNumber;
    }

    public String getResponse() {
        return response;
    }

    public IdempotencyStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void complete(Long orderNumber, String response) {
        this.orderNumber = orderNumber;
        this.response = response;
        this.status = IdempotencyStatus.COMPLETED;
    }
}
