package com.example.tuckshop.application.port.in;

import com.example.tuckshop.application.dto.CreateInventoryItemCommand;
import com.example.tuckshop.application.dto.UpdateInventoryItemCommand;
import com.example.tuckshop.domain.model.Caller;
import com.example.tuckshop.domain.model.InventoryItem;
import com.example.tuckshop.domain.model.ItemId;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Inbound port for staff stock management.
 */
public interface ManageInventoryUseCase {

    CompletableFuture<InventoryItem> addItem(Caller caller, CreateInventoryItemCommand command);

    CompletableFuture<InventoryItem> updateItem(Caller caller, ItemId itemId, UpdateInventoryItemCommand command);

    CompletableFuture<InventoryItem> getItem(Caller caller, ItemId itemId);

    CompletableFuture<List<InventoryItem>> listItems(Caller caller);

    CompletableFuture<Void> deleteItem(Caller caller, ItemId itemId);
}
