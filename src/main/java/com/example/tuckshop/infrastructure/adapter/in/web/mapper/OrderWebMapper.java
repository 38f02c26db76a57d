package com.example.tuckshop.infrastructure.adapter.in.web.mapper;

import com.example.tuckshop.application.dto.CreateOrderCommand;
import com.example.tuckshop.application.dto.CreateOrderCommand.OrderItemDto;
import com.example.tuckshop.application.dto.OrderQuery;
import com.example.tuckshop.application.dto.OrderResult;
import com.example.tuckshop.application.dto.StatusUpdateResult;
import com.example.tuckshop.application.dto.UpdateOrderStatusCommand;
import com.example.tuckshop.domain.model.Order;
import com.example.tuckshop.domain.model.OrderNumber;
import com.example.tuckshop.domain.model.OrderStatus;
import com.example.tuckshop.domain.model.StockError;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.CreateOrderRequest;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.CreateOrderResponse;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.OrderResponse;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.OrderResponse.OrderLineResponse;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.StockErrorResponse;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.UpdateOrderStatusRequest;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.UpdateOrderStatusResponse;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper between web DTOs and application DTOs.
 */
@Component
public class OrderWebMapper {

    public CreateOrderCommand toCommand(CreateOrderRequest request) {
        List<OrderItemDto> items = request.orderContents().stream()
                .map(item -> new OrderItemDto(item.itemId(), item.name(), item.quantity()))
                .toList();

        return new CreateOrderCommand(request.userId(), request.displayName(), items);
    }

    public UpdateOrderStatusCommand toCommand(UpdateOrderStatusRequest request) {
        return new UpdateOrderStatusCommand(
                OrderNumber.of(request.orderId()),
                OrderStatus.fromValue(request.status()));
    }

    public OrderQuery toQuery(String userId, String status) {
        return new OrderQuery(
                userId == null || userId.isBlank() ? null : userId,
                status == null || status.isBlank() ? null : OrderStatus.fromValue(status));
    }

    public CreateOrderResponse toResponse(OrderResult result) {
        if (result.outcome() == OrderResult.Outcome.CREATED) {
            return CreateOrderResponse.created(result.orderId(), result.documentId(), result.totalPrice(),
                    result.message());
        }
        List<StockErrorResponse> details = result.errors().stream()
                .map(this::toResponse)
                .toList();
        return CreateOrderResponse.failed(result.message(), details);
    }

    public UpdateOrderStatusResponse toResponse(StatusUpdateResult result) {
        if (result.success()) {
            return new UpdateOrderStatusResponse(true, result.orderId(), result.status().getValue(),
                    result.inventoryRestored(), result.message(), null, null);
        }
        return new UpdateOrderStatusResponse(false, result.orderId(), null, null, null,
                result.rejection().getValue(), result.message());
    }

    public OrderResponse toResponse(Order order) {
        List<OrderLineResponse> lines = order.getLines().stream()
                .map(line -> new OrderLineResponse(
                        line.getItemId().getValue(),
                        line.getName(),
                        line.getQuantity(),
                        line.getPriceAtPurchase().getAmount()))
                .toList();

        return new OrderResponse(
                order.getOrderNumber().getValue(),
                order.getOrderTime(),
                order.getUserId(),
                order.getDisplayName(),
                lines,
                order.getTotalPrice().getAmount(),
                order.getStatus().getValue(),
                order.getDocumentId());
    }

    private StockErrorResponse toResponse(StockError error) {
        return new StockErrorResponse(
                error.type().getValue(),
                error.itemName(),
                error.message(),
                error.requested(),
                error.available());
    }
}
