package com.example.tuckshop.application.port.in;

import com.example.tuckshop.application.dto.CreateOrderCommand;
import com.example.tuckshop.application.dto.OrderResult;
import com.example.tuckshop.domain.model.Caller;

import java.util.concurrent.CompletableFuture;

/**
 * Inbound port for order creation use case.
 */
public interface CreateOrderUseCase {

    /**
     * Deducts stock for the requested items and, if every line can be served, records a
     * pending order priced from the inventory.
     *
     * @param caller  verified identity; must be the order's user
     * @param command the order request
     * @return future containing the order result; completes exceptionally with
     *         {@code OrderAccessDeniedException} when the caller is not the order's user
     */
    CompletableFuture<OrderResult> createOrder(Caller caller, CreateOrderCommand command);
}
