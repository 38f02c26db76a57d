package com.example.tuckshop.infrastructure.persistence.mapper;

import com.example.tuckshop.domain.model.*;
import com.example.tuckshop.infrastructure.persistence.entity.OrderEntity;
import com.example.tuckshop.infrastructure.persistence.entity.OrderLineEmbeddable;
import com.example.tuckshop.infrastructure.persistence.entity.OrderStatusEnum;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper between domain Order and persistence OrderEntity.
 */
@Component
public class OrderPersistenceMapper {

    public OrderEntity toEntity(Order order) {
        OrderEntity entity = new OrderEntity();
        entity.setDocumentId(order.getDocumentId());
        entity.setOrderNumber(order.getOrderNumber().getValue());
        entity.setOrderTime(order.getOrderTime());
        entity.setUserId(order.getUserId());
        entity.setDisplayName(order.getDisplayName());
        entity.setTotalPrice(order.getTotalPrice().getAmount());
        entity.setStatus(toStatusEnum(order.getStatus()));

        for (OrderLine line : order.getLines()) {
            entity.getLines().add(new OrderLineEmbeddable(
                    line.getItemId().getValue(),
                    line.getName(),
                    line.getQuantity(),
                    line.getPriceAtPurchase().getAmount()));
        }

        return entity;
    }

    public Order toDomain(OrderEntity entity) {
        List<OrderLine> lines = entity.getLines().stream()
                .map(this::toOrderLine)
                .toList();

        return Order.reconstitute(
                entity.getDocumentId(),
                OrderNumber.of(entity.getOrderNumber()),
                entity.getOrderTime(),
                entity.getUserId(),
                entity.getDisplayName(),
                lines,
                Money.of(entity.getTotalPrice()),
                toDomainStatus(entity.getStatus())
        );
    }

    private OrderLine toOrderLine(OrderLineEmbeddable line) {
        return OrderLine.of(
                ItemId.of(line.getItemId()),
                line.getName(),
                line.getQuantity(),
                Money.of(line.getPriceAtPurchase())
        );
    }

    public OrderStatusEnum toStatusEnum(OrderStatus status) {
        return switch (status) {
            case PENDING -> OrderStatusEnum.PENDING;
            case IN_PROGRESS -> OrderStatusEnum.IN_PROGRESS;
            case COMPLETED -> OrderStatusEnum.COMPLETED;
            case CANCELLED -> OrderStatusEnum.CANCELLED;
            case CANCELLED_ACKNOWLEDGED -> OrderStatusEnum.CANCELLED_ACKNOWLEDGED;
        };
    }

    public OrderStatus toDomainStatus(OrderStatusEnum status) {
        return switch (status) {
            case PENDING -> OrderStatus.PENDING;
            case IN_PROGRESS -> OrderStatus.IN_PROGRESS;
            case COMPLETED -> OrderStatus.COMPLETED;
            case CANCELLED -> OrderStatus.CANCELLED;
            case CANCELLED_ACKNOWLEDGED -> OrderStatus.CANCELLED_ACKNOWLEDGED;
        };
    }
}
