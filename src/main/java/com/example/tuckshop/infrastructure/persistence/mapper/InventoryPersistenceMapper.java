package com.example.tuckshop.infrastructure.persistence.mapper;

import com.example.tuckshop.domain.model.InventoryItem;
import com.example.tuckshop.domain.model.ItemCategory;
import com.example.tuckshop.domain.model.ItemId;
import com.example.tuckshop.domain.model.Money;
import com.example.tuckshop.infrastructure.persistence.entity.InventoryItemEntity;
import org.springframework.stereotype.Component;

/**
 * Mapper between domain InventoryItem and persistence InventoryItemEntity.
 */
@Component
public class InventoryPersistenceMapper {

    public InventoryItemEntity toEntity(InventoryItem item) {
        InventoryItemEntity entity = new InventoryItemEntity();
        entity.setId(item.getId().getValue());
        copyInto(item, entity);
        return entity;
    }

    /**
     * Copies every mutable field onto a managed entity, keeping its id and version.
     */
    public void copyInto(InventoryItem item, InventoryItemEntity entity) {
        entity.setName(item.getName());
        entity.setDescription(item.getDescription());
        entity.setCategory(item.getCategory().getValue());
        entity.setPrice(item.getPrice().getAmount());
        entity.setCostPrice(item.getCostPrice().getAmount());
        copyStock(item, entity);
    }

    /**
     * Copies only what the stock ledger changes.
     */
    public void copyStock(InventoryItem item, InventoryItemEntity entity) {
        entity.setQuantity(item.getQuantity());
        entity.setMinStockThreshold(item.getMinStockThreshold());
        entity.setStatus(item.getStatus().getValue());
        entity.setLastUpdated(item.getLastUpdated());
        entity.setUpdatedBy(item.getUpdatedBy());
    }

    public InventoryItem toDomain(InventoryItemEntity entity) {
        return InventoryItem.reconstitute(
                ItemId.of(entity.getId()),
                entity.getName(),
                entity.getDescription(),
                ItemCategory.fromValue(entity.getCategory()),
                Money.of(entity.getPrice()),
                Money.of(entity.getCostPrice()),
                entity.getQuantity(),
                entity.getMinStockThreshold(),
                entity.getLastUpdated(),
                entity.getUpdatedBy()
        );
    }
}
