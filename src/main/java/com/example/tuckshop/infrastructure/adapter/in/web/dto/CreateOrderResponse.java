package com.example.tuckshop.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.List;

/**
 * Response for order creation. Successful responses carry the order identifiers,
 * failed ones the summary in {@code error} and one entry per problem in {@code details}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateOrderResponse(
        boolean success,
        Long orderId,
        String documentId,
        BigDecimal totalPrice,
        String message,
        String error,
        List<StockErrorResponse> details
) {
    public static CreateOrderResponse created(long orderId, String documentId, BigDecimal totalPrice, String message) {
        return new CreateOrderResponse(true, orderId, documentId, totalPrice, message, null, null);
    }

    public static CreateOrderResponse failed(String error, List<StockErrorResponse> details) {
        return new CreateOrderResponse(false, null, null, null, null, error, details);
    }

    public static CreateOrderResponse error(String error) {
        return new CreateOrderResponse(false, null, null, null, null, error, null);
    }
}
