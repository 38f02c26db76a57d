package com.example.tuckshop.infrastructure.adapter.in.web.mapper;

import com.example.tuckshop.application.dto.CreateInventoryItemCommand;
import com.example.tuckshop.application.dto.UpdateInventoryItemCommand;
import com.example.tuckshop.domain.model.InventoryItem;
import com.example.tuckshop.domain.model.ItemCategory;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.InventoryItemRequest;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.InventoryItemResponse;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.UpdateInventoryItemRequest;
import org.springframework.stereotype.Component;

@Component
public class InventoryWebMapper {

    public CreateInventoryItemCommand toCommand(InventoryItemRequest request) {
        return new CreateInventoryItemCommand(
                request.name(),
                request.description(),
                ItemCategory.fromValue(request.category()),
                request.price(),
                request.costPrice(),
                request.quantity(),
                request.minStockThreshold());
    }

    public UpdateInventoryItemCommand toCommand(UpdateInventoryItemRequest request) {
        return new UpdateInventoryItemCommand(
                request.name(),
                request.description(),
                request.category() == null ? null : ItemCategory.fromValue(request.category()),
                request.price(),
                request.costPrice(),
                request.quantity(),
                request.minStockThreshold());
    }

    public InventoryItemResponse toResponse(InventoryItem item) {
        return new InventoryItemResponse(
                item.getId().getValue(),
                item.getName(),
                item.getDescription(),
                item.getCategory().getValue(),
                item.getPrice().getAmount(),
                item.getCostPrice().getAmount(),
                item.getQuantity(),
                item.getMinStockThreshold(),
                item.getStatus().getValue(),
                item.getLastUpdated(),
                item.getUpdatedBy());
    }
}
