package com.example.tuckshop.infrastructure.exception;

/**
 * A request with the same idempotency key is still being processed.
 */
public class IdempotencyConflictException extends RuntimeException {

    private final String idempotencyKey;

    public IdempotencyConflictException(String idempotencyKey) {
        super("Request with this idempotency key is already being processed");
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
