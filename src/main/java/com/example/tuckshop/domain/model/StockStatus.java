package com.example.tuckshop.domain.model;

/**
 * Stock level classification of an inventory record.
 * Always derived from quantity and threshold, never stored independently of them.
 */
public enum StockStatus {

    IN_STOCK("in-stock"),
    LOW_STOCK("low-stock"),
    OUT_OF_STOCK("out-of-stock");

    private final String value;

    StockStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Derives the status for a quantity and low-stock threshold.
     *
     * @param quantity          units on hand
     * @param minStockThreshold low-stock boundary (inclusive)
     * @return OUT_OF_STOCK at zero, LOW_STOCK up to the threshold, IN_STOCK above it
     */
    public static StockStatus derive(int quantity, int minStockThreshold) {
        if (quantity <= 0) {
            return OUT_OF_STOCK;
        }
        if (quantity <= minStockThreshold) {
            return LOW_STOCK;
        }
        return IN_STOCK;
    }
}
