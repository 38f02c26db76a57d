package com.example.tuckshop.domain.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Value Object representing the stable key of an inventory record.
 */
public final class ItemId {

    private static final int MAX_LENGTH = 64;

    private final String value;

    private ItemId(String value) {
        this.value = value;
    }

    /**
     * Creates a new ItemId with the given value.
     *
     * @param value item key
     * @return new ItemId instance
     * @throws IllegalArgumentException if value is blank or longer than 64 characters
     */
    public static ItemId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ItemId cannot be blank");
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("ItemId is longer than " + MAX_LENGTH + " characters: " + trimmed);
        }
        return new ItemId(trimmed);
    }

    public static ItemId generate() {
        return new ItemId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ItemId itemId = (ItemId) o;
        return Objects.equals(value, itemId.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
