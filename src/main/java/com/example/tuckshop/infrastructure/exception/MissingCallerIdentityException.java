package com.example.tuckshop.infrastructure.exception;

/**
 * The request carried no usable caller identity headers.
 */
public class MissingCallerIdentityException extends RuntimeException {

    public MissingCallerIdentityException(String message) {
        super(message);
    }
}
