package com.example.tuckshop.application.port.out;

import com.example.tuckshop.domain.model.InventoryItem;
import com.example.tuckshop.domain.model.ItemId;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * Outbound port for manual stock-record maintenance. Order-driven quantity changes go
 * through {@link StockLedgerPort} instead.
 */
public interface InventoryStorePort {

    CompletableFuture<InventoryItem> insert(InventoryItem item);

    CompletableFuture<Optional<InventoryItem>> findById(ItemId itemId);

    CompletableFuture<List<InventoryItem>> findAll();

    /**
     * Reads the record, applies {@code change} and writes the result back in one
     * transaction, failing on a concurrent modification.
     *
     * @return future containing the updated record, or empty if it does not exist
     */
    CompletableFuture<Optional<InventoryItem>> update(ItemId itemId, UnaryOperator<InventoryItem> change);

    CompletableFuture<Boolean> delete(ItemId itemId);
}
