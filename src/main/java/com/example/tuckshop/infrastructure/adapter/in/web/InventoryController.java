package com.example.tuckshop.infrastructure.adapter.in.web;

import com.example.tuckshop.application.port.in.ManageInventoryUseCase;
import com.example.tuckshop.domain.model.Caller;
import com.example.tuckshop.domain.model.ItemId;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.DeleteResponse;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.InventoryItemRequest;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.InventoryItemResponse;
import com.example.tuckshop.infrastructure.adapter.in.web.dto.UpdateInventoryItemRequest;
import com.example.tuckshop.infrastructure.adapter.in.web.mapper.InventoryWebMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Staff-only stock management.
 */
@RestController
@RequestMapping("/api/inventory")
@Tag(name = "Inventory", description = "Stock-keeping records, staff only")
public class InventoryController {

    private static final Logger log = LoggerFactory.getLogger(InventoryController.class);

    private final ManageInventoryUseCase manageInventoryUseCase;
    private final CallerIdentityResolver callerResolver;
    private final InventoryWebMapper mapper;

    public InventoryController(
            ManageInventoryUseCase manageInventoryUseCase,
            CallerIdentityResolver callerResolver,
            InventoryWebMapper mapper) {
        this.manageInventoryUseCase = manageInventoryUseCase;
        this.callerResolver = callerResolver;
        this.mapper = mapper;
    }

    @Operation(summary = "List inventory items", description = "Sorted by name")
    @GetMapping
    public CompletableFuture<ResponseEntity<List<InventoryItemResponse>>> listItems(
            @RequestHeader(value = CallerIdentityResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = CallerIdentityResolver.USER_ROLE_HEADER, required = false) String role) {

        Caller caller = callerResolver.resolve(userId, role);
        return manageInventoryUseCase.listItems(caller)
                .thenApply(items -> ResponseEntity.ok(items.stream().map(mapper::toResponse).toList()));
    }

    @Operation(summary = "Get an inventory item")
    @GetMapping("/{itemId}")
    public CompletableFuture<ResponseEntity<InventoryItemResponse>> getItem(
            @RequestHeader(value = CallerIdentityResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = CallerIdentityResolver.USER_ROLE_HEADER, required = false) String role,
            @PathVariable String itemId) {

        Caller caller = callerResolver.resolve(userId, role);
        return manageInventoryUseCase.getItem(caller, ItemId.of(itemId))
                .thenApply(item -> ResponseEntity.ok(mapper.toResponse(item)));
    }

    @Operation(
            summary = "Add an inventory item",
            description = "Description defaults to empty, cost price to 0 and the minimum stock threshold to 10."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Item created"),
            @ApiResponse(responseCode = "400", description = "Missing or negative fields"),
            @ApiResponse(responseCode = "403", description = "Caller is not staff")
    })
    @PostMapping
    public CompletableFuture<ResponseEntity<InventoryItemResponse>> addItem(
            @RequestHeader(value = CallerIdentityResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = CallerIdentityResolver.USER_ROLE_HEADER, required = false) String role,
            @Valid @RequestBody InventoryItemRequest request) {

        Caller caller = callerResolver.resolve(userId, role);
        log.debug("Add inventory item '{}' requested by {}", request.name(), caller.uid());
        return manageInventoryUseCase.addItem(caller, mapper.toCommand(request))
                .thenApply(item -> ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(item)));
    }

    @Operation(
            summary = "Update an inventory item",
            description = "Partial update. Changing quantity or threshold recomputes the stock status."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Item updated"),
            @ApiResponse(responseCode = "404", description = "Item not found"),
            @ApiResponse(responseCode = "409", description = "Item was changed concurrently")
    })
    @PutMapping("/{itemId}")
    public CompletableFuture<ResponseEntity<InventoryItemResponse>> updateItem(
            @RequestHeader(value = CallerIdentityResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = CallerIdentityResolver.USER_ROLE_HEADER, required = false) String role,
            @PathVariable String itemId,
            @RequestBody UpdateInventoryItemRequest request) {

        Caller caller = callerResolver.resolve(userId, role);
        return manageInventoryUseCase.updateItem(caller, ItemId.of(itemId), mapper.toCommand(request))
                .thenApply(item -> ResponseEntity.ok(mapper.toResponse(item)));
    }

    @Operation(summary = "Delete an inventory item")
    @DeleteMapping("/{itemId}")
    public CompletableFuture<ResponseEntity<DeleteResponse>> deleteItem(
            @RequestHeader(value = CallerIdentityResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = CallerIdentityResolver.USER_ROLE_HEADER, required = false) String role,
            @PathVariable String itemId) {

        Caller caller = callerResolver.resolve(userId, role);
        return manageInventoryUseCase.deleteItem(caller, ItemId.of(itemId))
                .thenApply(ignored -> ResponseEntity.ok(DeleteResponse.of(itemId)));
    }
}
