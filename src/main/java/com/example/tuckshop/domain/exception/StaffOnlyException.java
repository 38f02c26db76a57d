package com.example.tuckshop.domain.exception;

/**
 * Thrown when a customer calls an operation reserved for employees and owners.
 */
public class StaffOnlyException extends DomainException {

    public StaffOnlyException(String operation) {
        super("Forbidden: Employee or Owner access required to " + operation);
    }
}
