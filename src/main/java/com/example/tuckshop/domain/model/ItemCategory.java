package com.example.tuckshop.domain.model;

import java.util.Arrays;

public enum ItemCategory {

    FOOD("food"),
    DRINK("drink"),
    SNACK("snack"),
    HEALTH_AND_WELLNESS("health-and-wellness"),
    HOME_CARE("home-care");

    private final String value;

    ItemCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolves a category from its wire value. Spaces are accepted in place of hyphens
     * ("health and wellness").
     *
     * @throws IllegalArgumentException if the value names no category
     */
    public static ItemCategory fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Category cannot be null");
        }
        String normalized = value.trim().replace(' ', '-');
        return Arrays.stream(values())
                .filter(category -> category.value.equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown item category: " + value));
    }
}
