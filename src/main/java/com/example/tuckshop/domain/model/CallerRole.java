package com.example.tuckshop.domain.model;

import java.util.Arrays;

/**
 * Role of the caller as reported by the external access verifier.
 */
public enum CallerRole {

    CUSTOMER("customer"),
    EMPLOYEE("employee"),
    OWNER("owner");

    private final String value;

    CallerRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Employees and owners are staff; they share every order permission.
     */
    public boolean isStaff() {
        return this == EMPLOYEE || this == OWNER;
    }

    public static CallerRole fromValue(String value) {
        return Arrays.stream(values())
                .filter(role -> role.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown caller role: " + value));
    }
}
