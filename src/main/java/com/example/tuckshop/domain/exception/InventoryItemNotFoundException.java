package com.example.tuckshop.domain.exception;

import com.example.tuckshop.domain.model.ItemId;

public class InventoryItemNotFoundException extends DomainException {

    private final ItemId itemId;

    public InventoryItemNotFoundException(ItemId itemId) {
        super("Inventory item not found: " + itemId);
        this.itemId = itemId;
    }

    public ItemId getItemId() {
        return itemId;
    }
}
