package com.example.tuckshop.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A user-facing stock problem found while deducting an order.
 * Stock problems are data, never exceptions.
 */
public record StockError(
        StockErrorType type,
        String itemName,
        String message,
        Integer requested,
        Integer available
) {
    static final String ORDER_ITEM_NAME = "Order";

    public StockError {
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(itemName, "ItemName cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
    }

    public static StockError itemNotFound(String itemName) {
        return new StockError(StockErrorType.ITEM_NOT_FOUND, itemName,
                "\"" + itemName + "\" is no longer available in our inventory.", null, null);
    }

    public static StockError insufficientStock(String itemName, int requested, int available) {
        String message = available == 0
                ? "\"" + itemName + "\" is out of stock."
                : "Only " + available + " \"" + itemName + "\" available, but you requested " + requested + ".";
        return new StockError(StockErrorType.INSUFFICIENT_STOCK, itemName, message, requested, available);
    }

    public static StockError readFailed() {
        return new StockError(StockErrorType.PROCESSING_ERROR, ORDER_ITEM_NAME,
                "Failed to verify inventory. Please try again.", null, null);
    }

    public static StockError commitFailed() {
        return new StockError(StockErrorType.PROCESSING_ERROR, ORDER_ITEM_NAME,
                "Failed to update inventory. Please try again.", null, null);
    }

    public static StockError orderNotSaved() {
        return new StockError(StockErrorType.PROCESSING_ERROR, ORDER_ITEM_NAME,
                "Failed to save your order. Please try again.", null, null);
    }

    public boolean isProcessingError() {
        return type == StockErrorType.PROCESSING_ERROR;
    }

    /**
     * Joins errors into one human-readable sentence group: stock messages first, then the
     * names of vanished items, then a generic retry hint for processing errors.
     */
    public static String summarize(List<StockError> errors) {
        List<String> parts = new ArrayList<>();

        String stock = errors.stream()
                .filter(e -> e.type == StockErrorType.INSUFFICIENT_STOCK)
                .map(StockError::message)
                .collect(Collectors.joining(" "));
        if (!stock.isEmpty()) {
            parts.add(stock);
        }

        String missing = errors.stream()
                .filter(e -> e.type == StockErrorType.ITEM_NOT_FOUND)
                .map(e -> "\"" + e.itemName + "\"")
                .collect(Collectors.joining(", "));
        if (!missing.isEmpty()) {
            parts.add("The following item(s) are no longer available: " + missing + ".");
        }

        if (errors.stream().anyMatch(StockError::isProcessingError)) {
            parts.add("Some items could not be processed. Please try again.");
        }

        return parts.isEmpty() ? "Unable to process your order." : String.join(" ", parts);
    }
}
