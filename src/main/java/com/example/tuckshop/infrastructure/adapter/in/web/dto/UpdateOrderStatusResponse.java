package com.example.tuckshop.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response for a status update. Rejections fill {@code error} with
 * {@code forbidden}, {@code not-found}, {@code invalid-transition} or
 * {@code processing_error} and give the
 * human-readable cause in {@code reason}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateOrderStatusResponse(
        boolean success,
        long orderId,
        String status,
        Boolean inventoryRestored,
        String message,
        String error,
        String reason
) {}
