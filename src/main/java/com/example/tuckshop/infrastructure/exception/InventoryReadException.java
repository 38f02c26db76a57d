package com.example.tuckshop.infrastructure.exception;

/**
 * Thrown when the batch read of inventory records fails before any stock was planned.
 */
public class InventoryReadException extends RuntimeException {

    public InventoryReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
