package com.example.tuckshop.application.service;

import com.example.tuckshop.application.dto.CreateInventoryItemCommand;
import com.example.tuckshop.application.dto.UpdateInventoryItemCommand;
import com.example.tuckshop.application.port.in.ManageInventoryUseCase;
import com.example.tuckshop.application.port.out.InventoryStorePort;
import com.example.tuckshop.domain.exception.InventoryItemNotFoundException;
import com.example.tuckshop.domain.exception.StaffOnlyException;
import com.example.tuckshop.domain.model.Caller;
import com.example.tuckshop.domain.model.InventoryItem;
import com.example.tuckshop.domain.model.ItemId;
import com.example.tuckshop.domain.model.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Staff maintenance of stock-keeping records.
 */
@Service
public class InventoryService implements ManageInventoryUseCase {

    private static final Logger log = LoggerFactory.getLogger(InventoryService.class);

    private final InventoryStorePort inventoryStorePort;
    private final Clock clock;

    public InventoryService(InventoryStorePort inventoryStorePort, Clock clock) {
        this.inventoryStorePort = inventoryStorePort;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<InventoryItem> addItem(Caller caller, CreateInventoryItemCommand command) {
        if (!caller.isStaff()) {
            return CompletableFuture.failedFuture(new StaffOnlyException("manage inventory"));
        }

        InventoryItem item = InventoryItem.create(
                ItemId.generate(),
                command.name(),
                command.description(),
                command.category(),
                Money.of(command.price()),
                toMoney(command.costPrice()),
                command.quantity(),
                command.minStockThreshold(),
                caller.uid(),
                Instant.now(clock)
        );

        return inventoryStorePort.insert(item).thenApply(saved -> {
            log.info("Inventory item {} \"{}\" added by {} with quantity {} ({})",
                    saved.getId(), saved.getName(), caller.uid(), saved.getQuantity(), saved.getStatus().getValue());
            return saved;
        });
    }

    @Override
    public CompletableFuture<InventoryItem> updateItem(Caller caller, ItemId itemId,
                                                       UpdateInventoryItemCommand command) {
        if (!caller.isStaff()) {
            return CompletableFuture.failedFuture(new StaffOnlyException("manage inventory"));
        }

        Instant now = Instant.now(clock);
        return inventoryStorePort.update(itemId, current -> current.revise(
                        command.name(),
                        command.description(),
                        command.category(),
                        toMoney(command.price()),
                        toMoney(command.costPrice()),
                        command.quantity(),
                        command.minStockThreshold(),
                        caller.uid(),
                        now))
                .thenApply(updated -> {
                    InventoryItem item = updated.orElseThrow(() -> new InventoryItemNotFoundException(itemId));
                    log.info("Inventory item {} updated by {}: quantity {}, status {}",
                            itemId, caller.uid(), item.getQuantity(), item.getStatus().getValue());
                    return item;
                });
    }

    @Override
    public CompletableFuture<InventoryItem> getItem(Caller caller, ItemId itemId) {
        if (!caller.isStaff()) {
            return CompletableFuture.failedFuture(new StaffOnlyException("manage inventory"));
        }
        return inventoryStorePort.findById(itemId)
                .thenApply(found -> found.orElseThrow(() -> new InventoryItemNotFoundException(itemId)));
    }

    @Override
    public CompletableFuture<List<InventoryItem>> listItems(Caller caller) {
        if (!caller.isStaff()) {
            return CompletableFuture.failedFuture(new StaffOnlyException("manage inventory"));
        }
        return inventoryStorePort.findAll();
    }

    @Override
    public CompletableFuture<Void> deleteItem(Caller caller, ItemId itemId) {
        if (!caller.isStaff()) {
            return CompletableFuture.failedFuture(new StaffOnlyException("manage inventory"));
        }
        return inventoryStorePort.delete(itemId).thenAccept(deleted -> {
            if (!deleted) {
                throw new InventoryItemNotFoundException(itemId);
            }
            log.info("Inventory item {} deleted by {}", itemId, caller.uid());
        });
    }

    private static Money toMoney(BigDecimal amount) {
        return amount == null ? null : Money.of(amount);
    }
}
