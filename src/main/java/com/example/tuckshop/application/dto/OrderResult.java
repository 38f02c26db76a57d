package com.example.tuckshop.application.dto;

import com.example.tuckshop.domain.model.Order;
import com.example.tuckshop.domain.model.StockError;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of order creation.
 */
public record OrderResult(
        Outcome outcome,
        Long orderId,
        String documentId,
        BigDecimal totalPrice,
        List<StockError> errors,
        String message
) {
    public enum Outcome {
        CREATED,
        /** Stock problems; nothing was written. */
        REJECTED,
        /** Infrastructure failure; safe to retry. */
        FAILED
    }

    public static OrderResult created(Order order) {
        return new OrderResult(Outcome.CREATED, order.getOrderNumber().getValue(), order.getDocumentId(),
                order.getTotalPrice().getAmount(), List.of(), "Order created successfully");
    }

    /**
     * Creates a result for a deduction that failed. Processing errors make the whole
     * result {@link Outcome#FAILED}; stock errors alone make it {@link Outcome#REJECTED}.
     */
    public static OrderResult rejected(List<StockError> errors) {
        Outcome outcome = errors.stream().anyMatch(StockError::isProcessingError)
                ? Outcome.FAILED
                : Outcome.REJECTED;
        return new OrderResult(outcome, null, null, null, List.copyOf(errors), StockError.summarize(errors));
    }
}
