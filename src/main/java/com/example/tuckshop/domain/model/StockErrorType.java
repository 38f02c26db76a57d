package com.example.tuckshop.domain.model;

/**
 * Kinds of stock error a deduction can report.
 */
public enum StockErrorType {

    INSUFFICIENT_STOCK("insufficient_stock"),
    ITEM_NOT_FOUND("item_not_found"),
    PROCESSING_ERROR("processing_error");

    private final String value;

    StockErrorType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
