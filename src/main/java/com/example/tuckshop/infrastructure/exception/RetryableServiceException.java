package com.example.tuckshop.infrastructure.exception;

/**
 * Downstream failure worth another attempt: 5xx responses and connection problems.
 */
public class RetryableServiceException extends RuntimeException {

    private final String serviceName;
    private final int statusCode;

    public RetryableServiceException(String serviceName, int statusCode, String message) {
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
