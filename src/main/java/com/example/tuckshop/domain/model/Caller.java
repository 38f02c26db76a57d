package com.example.tuckshop.domain.model;

import java.util.Objects;

/**
 * Verified identity of whoever is calling a use case.
 * Every operation receives it explicitly; nothing reads it from ambient context.
 */
public record Caller(
        String uid,
        CallerRole role
) {
    public Caller {
        Objects.requireNonNull(role, "Role cannot be null");
        if (uid == null || uid.isBlank()) {
            throw new IllegalArgumentException("Caller uid cannot be blank");
        }
    }

    public static Caller customer(String uid) {
        return new Caller(uid, CallerRole.CUSTOMER);
    }

    public static Caller employee(String uid) {
        return new Caller(uid, CallerRole.EMPLOYEE);
    }

    public static Caller owner(String uid) {
        return new Caller(uid, CallerRole.OWNER);
    }

    public boolean isStaff() {
        return role.isStaff();
    }
}
