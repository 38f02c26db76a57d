package com.example.tuckshop.infrastructure.adapter.in.web;

import com.example.tuckshop.application.dto.CreateOrderCommand;
import com.example.tuckshop.application.dto.OrderResult;
import com.example.tuckshop.application.dto.StatusUpdateResult;
import com.example.tuckshop.application.port.in.CreateOrderUseCase;
import com.example.tuckshop.application.port.in.DeleteOrderUseCase;
import com.example.tuckshop.application.port.in.QueryOrdersUseCase;
import com.example.tuckshop.application.port.in.UpdateOrderStatusUseCase;
import com.example.tuckshop.domain.model.Caller;
import com.example.tuckshop.domain.model.OrderNumber;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.CreateOrderRequest;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.CreateOrderResponse;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.DeleteResponse;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.OrderResponse;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.UpdateOrderStatusRequest;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.UpdateOrderStatusResponse;
import com.example.tuckshop.infrastructure.adapter.in.web.mapper.OrderWebMapper;
import com.example.tuckshop.infrastructure.exception.IdempotencyConflictException;
import com.example.tuckshop.infrastructure.service.IdempotencyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * REST controller for orders.
 * Order creation supports idempotency via the X-Idempotency-Key header.
 */
@RestController
@RequestMapping("/api/orders")
@Tag(name = "Orders", description = "Placing, tracking and cancelling tuck shop orders")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);
    private static final int MAX_IDEMPOTENCY_KEY_LENGTH = 64;

    private final CreateOrderUseCase createOrderUseCase;
    private final UpdateOrderStatusUseCase updateOrderStatusUseCase;
    private final QueryOrdersUseCase queryOrdersUseCase;
    private final DeleteOrderUseCase deleteOrderUseCase;
    private final CallerIdentityResolver callerResolver;
    private final OrderWebMapper mapper;
    private final IdempotencyService idempotencyService;

    public OrderController(
            CreateOrderUseCase createOrderUseCase,
            UpdateOrderStatusUseCase updateOrderStatusUseCase,
            QueryOrdersUseCase queryOrdersUseCase,
            DeleteOrderUseCase deleteOrderUseCase,
            CallerIdentityResolver callerResolver,
            OrderWebMapper mapper,
            IdempotencyService idempotencyService) {
        this.createOrderUseCase = createOrderUseCase;
        this.updateOrderStatusUseCase = updateOrderStatusUseCase;
        this.queryOrdersUseCase = queryOrdersUseCase;
        this.deleteOrderUseCase = deleteOrderUseCase;
        this.callerResolver = callerResolver;
        this.mapper = mapper;
        this.idempotencyService = idempotencyService;
    }

    @Operation(
            summary = "Place an order",
            description = """
                    Deducts stock for every line in one step and records a pending order.
                    Prices and the total come from the inventory; client prices are ignored.

                    If any line cannot be served, nothing is deducted and every problem is listed.

                    **Idempotency**: send X-Idempotency-Key to make retries safe.
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "201",
                    description = "Order placed",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = CreateOrderResponse.class),
                            examples = @ExampleObject(value = """
                                    {
                                      "success": true,
                                      "orderId": 42,
                                      "documentId": "550e8400-e29b-41d4-a716-446655440000",
                                      "totalPrice": 7.50,
                                      "message": "Order created successfully"
                                    }
                                    """)
                    )
            ),
            @ApiResponse(responseCode = "200", description = "Idempotent replay of an earlier result"),
            @ApiResponse(
                    responseCode = "400",
                    description = "Stock problems or invalid request",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            examples = @ExampleObject(value = """
                                    {
                                      "success": false,
                                      "error": "Only 2 \\"Chips\\" available, but you requested 3.",
                                      "details": [
                                        {
                                          "type": "insufficient_stock",
                                          "itemName": "Chips",
                                          "message": "Only 2 \\"Chips\\" available, but you requested 3.",
                                          "requested": 3,
                                          "available": 2
                                        }
                                      ]
                                    }
                                    """)
                    )
            ),
            @ApiResponse(responseCode = "401", description = "Missing caller identity"),
            @ApiResponse(responseCode = "403", description = "Order placed on behalf of another user"),
            @ApiResponse(responseCode = "409", description = "Same idempotency key still in progress"),
            @ApiResponse(responseCode = "503", description = "Inventory could not be processed, safe to retry")
    })
    @PostMapping
    public CompletableFuture<ResponseEntity<CreateOrderResponse>> createOrder(
            @RequestHeader(value = CallerIdentityResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = CallerIdentityResolver.USER_ROLE_HEADER, required = false) String role,
            @Parameter(description = "Idempotency key for safe retries", example = "a1b2c3d4")
            @RequestHeader(value = "X-Idempotency-Key", required = false) String idempotencyKey,
            @Valid @RequestBody CreateOrderRequest request) {

        Caller caller = callerResolver.resolve(userId, role);
        CreateOrderCommand command = mapper.toCommand(request);
        String key = idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey.trim();

        log.info("Received order request from {} with {} lines, idempotencyKey: {}",
                caller.uid(), command.items().size(), key);

        if (key != null) {
            if (key.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
                throw new IllegalArgumentException("X-Idempotency-Key must be at most "
                        + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
            }
            Optional<OrderResult> existing = idempotencyService.getExistingResult(key, caller.uid());
            if (existing.isPresent()) {
                log.info("Returning cached result for idempotency key: {}", key);
                return CompletableFuture.completedFuture(ResponseEntity.ok(mapper.toResponse(existing.get())));
            }
            if (idempotencyService.isInProgress(key) || !idempotencyService.markInProgress(key, caller.uid())) {
                log.warn("Request already in progress for idempotency key: {}", key);
                throw new IdempotencyConflictException(key);
            }
        }

        return createOrderUseCase.createOrder(caller, command)
                .whenComplete((result, throwable) -> {
                    if (key != null) {
                        recordOutcome(key, result, throwable);
                    }
                })
                .thenApply(result -> {
                    CreateOrderResponse response = mapper.toResponse(result);
                    return switch (result.outcome()) {
                        case CREATED -> ResponseEntity.status(HttpStatus.CREATED).body(response);
                        case REJECTED -> ResponseEntity.badRequest().body(response);
                        case FAILED -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
                    };
                });
    }

    @Operation(
            summary = "Change an order's status",
            description = """
                    Customers may cancel their own pending orders. Staff move orders through
                    in-progress and completed, cancel pending or in-progress orders and
                    acknowledge cancellations. Cancelling returns the order's stock exactly once.
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status changed, or order already cancelled"),
            @ApiResponse(responseCode = "403", description = "Role may not make this change"),
            @ApiResponse(responseCode = "404", description = "Order not found"),
            @ApiResponse(responseCode = "409", description = "Transition not allowed from the current status"),
            @ApiResponse(responseCode = "503", description = "Order could not be updated, safe to retry")
    })
    @PutMapping
    public CompletableFuture<ResponseEntity<UpdateOrderStatusResponse>> updateStatus(
            @RequestHeader(value = CallerIdentityResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = CallerIdentityResolver.USER_ROLE_HEADER, required = false) String role,
            @Valid @RequestBody UpdateOrderStatusRequest request) {

        Caller caller = callerResolver.resolve(userId, role);
        log.info("Status change of order #{} to {} requested by {} ({})",
                request.orderId(), request.status(), caller.uid(), caller.role().getValue());

        return updateOrderStatusUseCase.updateStatus(caller, mapper.toCommand(request))
                .thenApply(result -> ResponseEntity.status(statusOf(result)).body(mapper.toResponse(result)));
    }

    @Operation(summary = "Get an order", description = "Customers can only read their own orders")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order found"),
            @ApiResponse(responseCode = "403", description = "Order belongs to another user"),
            @ApiResponse(responseCode = "404", description = "Order not found")
    })
    @GetMapping("/{orderId}")
    public CompletableFuture<ResponseEntity<OrderResponse>> getOrder(
            @RequestHeader(value = CallerIdentityResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = CallerIdentityResolver.USER_ROLE_HEADER, required = false) String role,
            @Parameter(description = "Order number (OrderID)", required = true)
            @PathVariable long orderId) {

        Caller caller = callerResolver.resolve(userId, role);
        return queryOrdersUseCase.getOrder(caller, OrderNumber.of(orderId))
                .thenApply(order -> ResponseEntity.ok(mapper.toResponse(order)));
    }

    @Operation(summary = "List orders", description = "Newest first. Customers only see their own orders.")
    @GetMapping
    public CompletableFuture<ResponseEntity<List<OrderResponse>>> listOrders(
            @RequestHeader(value = CallerIdentityResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = CallerIdentityResolver.USER_ROLE_HEADER, required = false) String role,
            @Parameter(description = "Only orders of this user") @RequestParam(name = "userId", required = false) String userFilter,
            @Parameter(description = "Only orders in this status") @RequestParam(required = false) String status) {

        Caller caller = callerResolver.resolve(userId, role);
        return queryOrdersUseCase.listOrders(caller, mapper.toQuery(userFilter, status))
                .thenApply(orders -> ResponseEntity.ok(orders.stream().map(mapper::toResponse).toList()));
    }

    @Operation(summary = "Delete an order", description = "Staff only. Stock is not touched.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order deleted"),
            @ApiResponse(responseCode = "403", description = "Caller is not staff"),
            @ApiResponse(responseCode = "404", description = "Order not found")
    })
    @DeleteMapping("/{orderId}")
    public CompletableFuture<ResponseEntity<DeleteResponse>> deleteOrder(
            @RequestHeader(value = CallerIdentityResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = CallerIdentityResolver.USER_ROLE_HEADER, required = false) String role,
            @PathVariable long orderId) {

        Caller caller = callerResolver.resolve(userId, role);
        return deleteOrderUseCase.deleteOrder(caller, OrderNumber.of(orderId))
                .thenApply(ignored -> ResponseEntity.ok(DeleteResponse.of(String.valueOf(orderId))));
    }

    /**
     * Stores or frees the idempotency key. A bookkeeping failure is logged and never
     * replaces the order result the client is waiting for.
     */
    private void recordOutcome(String key, OrderResult result, Throwable throwable) {
        try {
            if (throwable != null || result.outcome() == OrderResult.Outcome.FAILED) {
                idempotencyService.release(key);
            } else {
                idempotencyService.saveResult(key, result);
            }
        } catch (RuntimeException e) {
            log.error("Failed to record idempotency outcome for key {}", key, e);
        }
    }

    private static HttpStatus statusOf(StatusUpdateResult result) {
        if (result.success()) {
            return HttpStatus.OK;
        }
        return switch (result.rejection()) {
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_TRANSITION -> HttpStatus.CONFLICT;
            case PROCESSING_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
