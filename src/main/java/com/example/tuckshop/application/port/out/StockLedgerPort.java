package com.example.tuckshop.application.port.out;

import com.example.tuckshop.domain.model.Money;
import com.example.tuckshop.domain.model.OrderLine;
import com.example.tuckshop.domain.model.RequestedItem;
import com.example.tuckshop.domain.model.StockError;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for atomic stock movements.
 * Expected business conditions come back as results; the futures only fail on programming errors.
 */
public interface StockLedgerPort {

    /**
     * Deducts all lines in one atomic batch, or nothing at all.
     *
     * @param items the order contents
     * @param actor uid recorded as {@code updatedBy}
     * @return future containing the deduction result
     */
    CompletableFuture<DeductionResult> deduct(List<RequestedItem> items, String actor);

    /**
     * Adds all lines back in one atomic batch. Items that no longer exist are skipped.
     *
     * @param items the contents of a cancelled order
     * @param actor uid recorded as {@code updatedBy}
     * @return future containing the restoration result
     */
    CompletableFuture<RestorationResult> restore(List<RequestedItem> items, String actor);

    /**
     * Result of a deduction. Prices and names in {@code pricedLines} come from the inventory.
     */
    record DeductionResult(
            boolean success,
            List<StockError> errors,
            Money calculatedPrice,
            List<OrderLine> pricedLines
    ) {
        public static DeductionResult success(Money calculatedPrice, List<OrderLine> pricedLines) {
            return new DeductionResult(true, List.of(), calculatedPrice, pricedLines);
        }

        public static DeductionResult failure(List<StockError> errors) {
            return new DeductionResult(false, errors, null, List.of());
        }
    }

    /**
     * Result of a restoration.
     */
    record RestorationResult(
            boolean success,
            String error,
            List<RequestedItem> skippedItems
    ) {
        public static RestorationResult success(List<RequestedItem> skippedItems) {
            return new RestorationResult(true, null, skippedItems);
        }

        public static RestorationResult failure(String error) {
            return new RestorationResult(false, error, List.of());
        }
    }
}
