package com.example.tuckshop.domain.exception;

/**
 * Thrown when a caller touches an order, or order list, that is not theirs to touch.
 * Raised only for records that exist; a missing order is reported as not found.
 */
public class OrderAccessDeniedException extends DomainException {

    public OrderAccessDeniedException(String message) {
        super(message);
    }
}
