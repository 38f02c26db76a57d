package com.example.tuckshop.application.port.in;

import com.example.tuckshop.domain.model.Caller;
import com.example.tuckshop.domain.model.OrderNumber;

import java.util.concurrent.CompletableFuture;

public interface DeleteOrderUseCase {

    /**
     * Hard-deletes an order record. Staff only; inventory is left untouched.
     */
    CompletableFuture<Void> deleteOrder(Caller caller, OrderNumber orderNumber);
}
