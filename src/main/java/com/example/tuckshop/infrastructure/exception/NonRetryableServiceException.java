package com.example.tuckshop.infrastructure.exception;

/**
 * Downstream rejection that will not change on retry, typically a 4xx response.
 */
public class NonRetryableServiceException extends RuntimeException {

    private final String serviceName;
    private final int statusCode;

    public NonRetryableServiceException(String serviceName, int statusCode, String message) {
        super(message);
        this.serviceName = serviceName;
        this.statusCode = statusCode;
    }

    public String getServiceName() {
        return serviceName;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
