package com.example.tuckshop.application.port.in;

import com.example.tuckshop.application.dto.StatusUpdateResult;
import com.example.tuckshop.application.dto.UpdateOrderStatusCommand;
import com.example.tuckshop.domain.model.Caller;

import java.util.concurrent.CompletableFuture;

/**
 * Inbound port for moving an order through its lifecycle.
 */
public interface UpdateOrderStatusUseCase {

    /**
     * Applies a status change if the caller's role allows it. Rejections are returned,
     * not thrown.
     */
    CompletableFuture<StatusUpdateResult> updateStatus(Caller caller, UpdateOrderStatusCommand command);
}
