package com.example.tuckshop.integration;

import com.example.tuckshop.infrastructure.adapter.in.web.dto.CreateOrderResponse;
import com.example.tuckshop.infrastructure.persistence.entity.InventoryItemEntity;
import com.example.tuckshop.infrastructure.persistence.entity.OrderEntity;
import com.example.tuckshop.infrastructure.persistence.entity.OrderStatusEnum;
import com.example.tuckshop.support.WireMockTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end order placement and cancellation over HTTP.
 */
@DisplayName("Order Flow Integration Tests")
class OrderFlowIntegrationTest extends WireMockTestSupport {

    @Autowired
    private WebTestClient webTestClient;

    private long placeOrder(String userId, String contents) {
        CreateOrderResponse response = webTestClient.post()
                .uri("/api/orders")
                .header("X-User-Id", userId)
                .header("X-User-Role", "customer")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(orderBody(userId, contents))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(CreateOrderResponse.class)
                .returnResult()
                .getResponseBody();
        assertThat(response).isNotNull();
        return response.orderId();
    }

    private WebTestClient.ResponseSpec changeStatus(String uid, String role, long orderId, String status) {
        return webTestClient.put()
                .uri("/api/orders")
                .header("X-User-Id", uid)
                .header("X-User-Role", role)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        { "OrderID": %d, "status": "%s" }
                        """.formatted(orderId, status))
                .exchange();
    }

    private static String orderBody(String userId, String contents) {
        return """
                {
                    "userId": "%s",
                    "displayName": "Sam",
                    "OrderContents": [%s]
                }
                """.formatted(userId, contents);
    }

    @Nested
    @DisplayName("Placing orders")
    class PlacingOrders {

        @Test
        @DisplayName("should_deduct_stock_and_price_order_from_inventory")
        void should_deduct_stock_and_price_order_from_inventory() {
            // Given: A has 5 in stock with threshold 10, so it is already low-stock
            givenInventoryItem("A", "Apple Juice", "2.50", 5, 10);

            // When: the client claims a price of 0.01, which must be ignored
            webTestClient.post()
                    .uri("/api/orders")
                    .header("X-User-Id", "u1")
                    .header("X-User-Role", "customer")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("""
                            {
                                "userId": "u1",
                                "displayName": "Sam",
                                "TotalPrice": 0.01,
                                "OrderContents": [
                                    { "itemId": "A", "name": "Apple Juice", "quantity": 3, "price": 0.01 }
                                ]
                            }
                            """)
                    .exchange()
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true)
                    .jsonPath("$.orderId").isNotEmpty()
                    .jsonPath("$.documentId").isNotEmpty()
                    .jsonPath("$.totalPrice").isEqualTo(7.5);

            // Then
            InventoryItemEntity row = inventoryRow("A");
            assertThat(row.getQuantity()).isEqualTo(2);
            assertThat(row.getStatus()).isEqualTo("low-stock");
            assertThat(row.getUpdatedBy()).isEqualTo("u1");

            OrderEntity order = orderRepository.findAll().get(0);
            assertThat(order.getTotalPrice()).isEqualByComparingTo(new BigDecimal("7.50"));
            assertThat(order.getStatus()).isEqualTo(OrderStatusEnum.PENDING);
            assertThat(order.getLines()).singleElement()
                    .satisfies(line -> assertThat(line.getPriceAtPurchase()).isEqualByComparingTo("2.50"));
        }

        @Test
        @DisplayName("should_reject_order_exceeding_stock_without_touching_inventory")
        void should_reject_order_exceeding_stock_without_touching_inventory() {
            // Given
            givenInventoryItem("B", "Biscuits", "1.00", 2);

            // When
            webTestClient.post()
                    .uri("/api/orders")
                    .header("X-User-Id", "u1")
                    .header("X-User-Role", "customer")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(orderBody("u1", """
                            { "itemId": "B", "name": "Biscuits", "quantity": 5 }
                            """))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false)
                    .jsonPath("$.error").isEqualTo("Only 2 \"Biscuits\" available, but you requested 5.")
                    .jsonPath("$.details[0].type").isEqualTo("insufficient_stock")
                    .jsonPath("$.details[0].requested").isEqualTo(5)
                    .jsonPath("$.details[0].available").isEqualTo(2);

            // Then
            assertThat(inventoryRow("B").getQuantity()).isEqualTo(2);
            assertThat(orderRepository.count()).isZero();
        }

        @Test
        @DisplayName("should_leave_every_item_untouched_when_one_line_fails")
        void should_leave_every_item_untouched_when_one_line_fails() {
            // Given
            givenInventoryItem("A", "Apple Juice", "2.50", 5);
            givenInventoryItem("B", "Biscuits", "1.00", 0);

            // When
            webTestClient.post()
                    .uri("/api/orders")
                    .header("X-User-Id", "u1")
                    .header("X-User-Role", "customer")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(orderBody("u1", """
                            { "itemId": "A", "name": "Apple Juice", "quantity": 1 },
                            { "itemId": "B", "name": "Biscuits", "quantity": 1 },
                            { "itemId": "GONE", "name": "Gum", "quantity": 1 }
                            """))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.details.length()").isEqualTo(2)
                    .jsonPath("$.error").isEqualTo("\"Biscuits\" is out of stock. "
                            + "The following item(s) are no longer available: \"Gum\".");

            // Then
            assertThat(inventoryRow("A").getQuantity()).isEqualTo(5);
            assertThat(orderRepository.count()).isZero();
        }

        @Test
        @DisplayName("should_forbid_placing_an_order_for_another_user")
        void should_forbid_placing_an_order_for_another_user() {
            // Given
            givenInventoryItem("A", "Apple Juice", "2.50", 5);

            // When & Then
            webTestClient.post()
                    .uri("/api/orders")
                    .header("X-User-Id", "intruder")
                    .header("X-User-Role", "customer")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(orderBody("u1", """
                            { "itemId": "A", "quantity": 1 }
                            """))
                    .exchange()
                    .expectStatus().isForbidden();

            assertThat(inventoryRow("A").getQuantity()).isEqualTo(5);
        }

        @Test
        @DisplayName("should_require_caller_identity")
        void should_require_caller_identity() {
            webTestClient.post()
                    .uri("/api/orders")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(orderBody("u1", """
                            { "itemId": "A", "quantity": 1 }
                            """))
                    .exchange()
                    .expectStatus().isUnauthorized()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("UNAUTHORIZED");
        }

        @Test
        @DisplayName("should_reject_empty_order_contents")
        void should_reject_empty_order_contents() {
            webTestClient.post()
                    .uri("/api/orders")
                    .header("X-User-Id", "u1")
                    .header("X-User-Role", "customer")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(orderBody("u1", ""))
                    .exchange()
                    .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("should_assign_increasing_order_ids")
        void should_assign_increasing_order_ids() {
            // Given
            givenInventoryItem("A", "Apple Juice", "2.50", 10);

            // When
            long first = placeOrder("u1", """
                    { "itemId": "A", "quantity": 1 }
                    """);
            long second = placeOrder("u1", """
                    { "itemId": "A", "quantity": 1 }
                    """);

            // Then
            assertThat(second).isGreaterThan(first);
        }
    }

    @Nested
    @DisplayName("Cancelling orders")
    class CancellingOrders {

        @Test
        @DisplayName("should_restore_every_line_when_customer_cancels_pending_order")
        void should_restore_every_line_when_customer_cancels_pending_order() {
            // Given
            givenInventoryItem("A", "Apple Juice", "2.50", 20, 10);
            givenInventoryItem("B", "Biscuits", "1.00", 12, 10);
            long orderId = placeOrder("u1", """
                    { "itemId": "A", "quantity": 3 },
                    { "itemId": "B", "quantity": 2 }
                    """);
            assertThat(inventoryRow("A").getQuantity()).isEqualTo(17);
            assertThat(inventoryRow("B").getStatus()).isEqualTo("low-stock");

            // When
            changeStatus("u1", "customer", orderId, "cancelled")
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true)
                    .jsonPath("$.status").isEqualTo("cancelled")
                    .jsonPath("$.inventoryRestored").isEqualTo(true);

            // Then
            assertThat(inventoryRow("A").getQuantity()).isEqualTo(20);
            assertThat(inventoryRow("B").getQuantity()).isEqualTo(12);
            assertThat(inventoryRow("B").getStatus()).isEqualTo("in-stock");
            assertThat(orderRepository.findByOrderNumber(orderId)).get()
                    .extracting(OrderEntity::getStatus)
                    .isEqualTo(OrderStatusEnum.CANCELLED);
        }

        @Test
        @DisplayName("should_restore_only_once_when_cancelled_twice")
        void should_restore_only_once_when_cancelled_twice() {
            // Given
            givenInventoryItem("A", "Apple Juice", "2.50", 5);
            long orderId = placeOrder("u1", """
                    { "itemId": "A", "quantity": 2 }
                    """);
            changeStatus("admin", "owner", orderId, "cancelled").expectStatus().isOk();

            // When
            changeStatus("admin", "owner", orderId, "cancelled")
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Order is already cancelled");

            // Then
            assertThat(inventoryRow("A").getQuantity()).isEqualTo(5);
        }

        @Test
        @DisplayName("should_restore_stock_when_staff_cancels_in_progress_order")
        void should_restore_stock_when_staff_cancels_in_progress_order() {
            // Given
            givenInventoryItem("A", "Apple Juice", "2.50", 5);
            long orderId = placeOrder("u1", """
                    { "itemId": "A", "quantity": 4 }
                    """);
            changeStatus("emp", "employee", orderId, "in-progress").expectStatus().isOk();
            assertThat(inventoryRow("A").getStatus()).isEqualTo("low-stock");

            // When
            changeStatus("emp", "employee", orderId, "cancelled")
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("cancelled");

            // Then
            assertThat(inventoryRow("A").getQuantity()).isEqualTo(5);
            assertThat(outboxRepository.findByOrderReference(String.valueOf(orderId)))
                    .anySatisfy(event -> {
                        assertThat(event.getNotificationType()).isEqualTo("order-cancelled");
                        assertThat(event.getRecipient()).isEqualTo("u1");
                    });
        }

        @Test
        @DisplayName("should_not_restore_stock_when_cancellation_is_acknowledged")
        void should_not_restore_stock_when_cancellation_is_acknowledged() {
            // Given
            givenInventoryItem("A", "Apple Juice", "2.50", 5);
            long orderId = placeOrder("u1", """
                    { "itemId": "A", "quantity": 1 }
                    """);
            changeStatus("u1", "customer", orderId, "cancelled").expectStatus().isOk();

            // When
            changeStatus("emp", "employee", orderId, "cancelled-acknowledged")
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("cancelled-acknowledged");

            // Then
            assertThat(inventoryRow("A").getQuantity()).isEqualTo(5);
        }

        @Test
        @DisplayName("should_skip_deleted_items_and_still_cancel")
        void should_skip_deleted_items_and_still_cancel() {
            // Given
            givenInventoryItem("A", "Apple Juice", "2.50", 5);
            givenInventoryItem("B", "Biscuits", "1.00", 5);
            long orderId = placeOrder("u1", """
                    { "itemId": "A", "quantity": 1 },
                    { "itemId": "B", "quantity": 1 }
                    """);
            inventoryRepository.deleteById("B");

            // When
            changeStatus("u1", "customer", orderId, "cancelled")
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.inventoryRestored").isEqualTo(true);

            // Then
            assertThat(inventoryRow("A").getQuantity()).isEqualTo(5);
            assertThat(inventoryRepository.existsById("B")).isFalse();
        }
    }

    @Nested
    @DisplayName("Authorization boundary")
    class AuthorizationBoundary {

        @Test
        @DisplayName("should_forbid_customer_cancelling_someone_elses_order")
        void should_forbid_customer_cancelling_someone_elses_order() {
            // Given
            givenInventoryItem("A", "Apple Juice", "2.50", 5);
            long orderId = placeOrder("u1", """
                    { "itemId": "A", "quantity": 1 }
                    """);

            // When & Then
            changeStatus("u2", "customer", orderId, "cancelled")
                    .expectStatus().isForbidden()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("forbidden")
                    .jsonPath("$.reason").isEqualTo("Forbidden: Cannot modify other users' orders");

            assertThat(inventoryRow("A").getQuantity()).isEqualTo(4);
        }

        @Test
        @DisplayName("should_forbid_customer_completing_an_order")
        void should_forbid_customer_completing_an_order() {
            // Given
            givenInventoryItem("A", "Apple Juice", "2.50", 5);
            long orderId = placeOrder("u1", """
                    { "itemId": "A", "quantity": 1 }
                    """);

            // When & Then
            changeStatus("u1", "customer", orderId, "completed")
                    .expectStatus().isForbidden();
        }

        @Test
        @DisplayName("should_forbid_customer_cancelling_order_in_progress")
        void should_forbid_customer_cancelling_order_in_progress() {
            // Given
            givenInventoryItem("A", "Apple Juice", "2.50", 5);
            long orderId = placeOrder("u1", """
                    { "itemId": "A", "quantity": 1 }
                    """);
            changeStatus("emp", "employee", orderId, "in-progress").expectStatus().isOk();

            // When & Then
            changeStatus("u1", "customer", orderId, "cancelled")
                    .expectStatus().isForbidden()
                    .expectBody()
                    .jsonPath("$.reason").isEqualTo("Forbidden: Only pending orders can be cancelled");
            assertThat(inventoryRow("A").getQuantity()).isEqualTo(4);
        }

        @Test
        @DisplayName("should_reject_staff_transition_out_of_completed")
        void should_reject_staff_transition_out_of_completed() {
            // Given
            givenInventoryItem("A", "Apple Juice", "2.50", 5);
            long orderId = placeOrder("u1", """
                    { "itemId": "A", "quantity": 1 }
                    """);
            changeStatus("emp", "employee", orderId, "in-progress").expectStatus().isOk();
            changeStatus("emp", "employee", orderId, "completed").expectStatus().isOk();

            // When & Then
            changeStatus("emp", "owner", orderId, "cancelled")
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("invalid-transition");
            assertThat(inventoryRow("A").getQuantity()).isEqualTo(4);
        }

        @Test
        @DisplayName("should_report_not_found_for_unknown_order")
        void should_report_not_found_for_unknown_order() {
            changeStatus("emp", "employee", 999_999, "cancelled")
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("not-found");
        }
    }

    @Nested
    @DisplayName("Queries and deletion")
    class QueriesAndDeletion {

        @Test
        @DisplayName("should_show_order_to_owner_and_staff_only")
        void should_show_order_to_owner_and_staff_only() {
            // Given
            givenInventoryItem("A", "Apple Juice", "2.50", 5);
            long orderId = placeOrder("u1", """
                    { "itemId": "A", "quantity": 2 }
                    """);

            // When & Then
            webTestClient.get().uri("/api/orders/{id}", orderId)
                    .header("X-User-Id", "u1")
                    .header("X-User-Role", "customer")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.OrderID").isEqualTo(orderId)
                    .jsonPath("$.status").isEqualTo("pending")
                    .jsonPath("$.TotalPrice").isEqualTo(5.0)
                    .jsonPath("$.OrderContents[0].name").isEqualTo("Apple Juice");

            webTestClient.get().uri("/api/orders/{id}", orderId)
                    .header("X-User-Id", "u2")
                    .header("X-User-Role", "customer")
                    .exchange()
                    .expectStatus().isForbidden();

            webTestClient.get().uri("/api/orders/{id}", orderId)
                    .header("X-User-Id", "emp")
                    .header("X-User-Role", "employee")
                    .exchange()
                    .expectStatus().isOk();
        }

        @Test
        @DisplayName("should_list_customer_orders_newest_first")
        void should_list_customer_orders_newest_first() {
            // Given
            givenInventoryItem("A", "Apple Juice", "2.50", 10);
            long older = placeOrder("u1", """
                    { "itemId": "A", "quantity": 1 }
                    """);
            long newer = placeOrder("u1", """
                    { "itemId": "A", "quantity": 1 }
                    """);
            placeOrder("u2", """
                    { "itemId": "A", "quantity": 1 }
                    """);

            // When & Then
            webTestClient.get().uri("/api/orders")
                    .header("X-User-Id", "u1")
                    .header("X-User-Role", "customer")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.length()").isEqualTo(2)
                    .jsonPath("$[0].OrderID").isEqualTo(newer)
                    .jsonPath("$[1].OrderID").isEqualTo(older);

            webTestClient.get().uri("/api/orders?status=pending")
                    .header("X-User-Id", "emp")
                    .header("X-User-Role", "employee")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.length()").isEqualTo(3);
        }

        @Test
        @DisplayName("should_let_only_staff_delete_orders")
        void should_let_only_staff_delete_orders() {
            // Given
            givenInventoryItem("A", "Apple Juice", "2.50", 5);
            long orderId = placeOrder("u1", """
                    { "itemId": "A", "quantity": 1 }
                    """);

            // When & Then
            webTestClient.delete().uri("/api/orders/{id}", orderId)
                    .header("X-User-Id", "u1")
                    .header("X-User-Role", "customer")
                    .exchange()
                    .expectStatus().isForbidden();

            webTestClient.delete().uri("/api/orders/{id}", orderId)
                    .header("X-User-Id", "boss")
                    .header("X-User-Role", "owner")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true);

            webTestClient.delete().uri("/api/orders/{id}", orderId)
                    .header("X-User-Id", "boss")
                    .header("X-User-Role", "owner")
                    .exchange()
                    .expectStatus().isNotFound();

            // Deleting an order does not give stock back
            assertThat(inventoryRow("A").getQuantity()).isEqualTo(4);
        }
    }
}
