package com.example.tuckshop.integration;

import com.example.tuckshop.infrastructure.adapter.in.web.dto.CreateOrderResponse;
import com.example.tuckshop.infrastructure.persistence.entity.IdempotencyStatus;
import com.example.tuckshop.infrastructure.service.IdempotencyService;
import com.example.tuckshop.support.WireMockTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;

/**
 * Retrying an order with the same X-Idempotency-Key must not deduct stock twice.
 */
@DisplayName("Idempotency Integration Tests")
class IdempotencyIntegrationTest extends WireMockTestSupport {

    private static final String ORDER_BODY = """
            {
                "userId": "u1",
                "OrderContents": [ { "itemId": "BAR", "name": "Choc Bar", "quantity": 2 } ]
            }
            """;

    @Autowired
    private WebTestClient webTestClient;

    @SpyBean
    private IdempotencyService idempotencyService;

    private WebTestClient.ResponseSpec postOrder(String userId, String key) {
        WebTestClient.RequestBodySpec spec = webTestClient.post()
                .uri("/api/orders")
                .header("X-User-Id", userId)
                .header("X-User-Role", "customer")
                .contentType(MediaType.APPLICATION_JSON);
        if (key != null) {
            spec = spec.header("X-Idempotency-Key", key);
        }
        return spec.bodyValue(ORDER_BODY).exchange();
    }

    @Test
    @DisplayName("should_replay_result_for_repeated_key")
    void should_replay_result_for_repeated_key() {
        // Given
        givenInventoryItem("BAR", "Choc Bar", "1.25", 10);
        CreateOrderResponse first = postOrder("u1", "key-001")
                .expectStatus().isCreated()
                .expectBody(CreateOrderResponse.class)
                .returnResult()
                .getResponseBody();
        assertThat(first).isNotNull();

        // When
        CreateOrderResponse replay = postOrder("u1", "key-001")
                .expectStatus().isOk()
                .expectBody(CreateOrderResponse.class)
                .returnResult()
                .getResponseBody();

        // Then
        assertThat(replay).isNotNull();
        assertThat(replay.success()).isTrue();
        assertThat(replay.orderId()).isEqualTo(first.orderId());
        assertThat(replay.documentId()).isEqualTo(first.documentId());
        assertThat(inventoryRow("BAR").getQuantity()).isEqualTo(8);
        assertThat(orderRepository.count()).isEqualTo(1);
        assertThat(idempotencyRepository.findById("key-001")).get()
                .satisfies(record -> {
                    assertThat(record.getStatus()).isEqualTo(IdempotencyStatus.COMPLETED);
                    assertThat(record.getOrderNumber()).isEqualTo(first.orderId());
                });
    }

    @Test
    @DisplayName("should_treat_different_keys_as_different_orders")
    void should_treat_different_keys_as_different_orders() {
        // Given
        givenInventoryItem("BAR", "Choc Bar", "1.25", 10);

        // When
        postOrder("u1", "key-a").expectStatus().isCreated();
        postOrder("u1", "key-b").expectStatus().isCreated();
        postOrder("u1", null).expectStatus().isCreated();

        // Then
        assertThat(inventoryRow("BAR").getQuantity()).isEqualTo(4);
        assertThat(orderRepository.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("should_replay_stock_rejection_without_deducting")
    void should_replay_stock_rejection_without_deducting() {
        // Given
        givenInventoryItem("BAR", "Choc Bar", "1.25", 1);
        postOrder("u1", "key-short").expectStatus().isBadRequest();

        // When: stock arrives but the client retries the old request
        inventoryRepository.findById("BAR").ifPresent(row -> {
            row.setQuantity(10);
            row.setStatus("low-stock");
            inventoryRepository.saveAndFlush(row);
        });

        // Then
        postOrder("u1", "key-short")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false);
        assertThat(inventoryRow("BAR").getQuantity()).isEqualTo(10);
        assertThat(orderRepository.count()).isZero();
    }

    @Test
    @DisplayName("should_not_replay_another_users_result")
    void should_not_replay_another_users_result() {
        // Given
        givenInventoryItem("BAR", "Choc Bar", "1.25", 10);
        postOrder("u1", "shared-key").expectStatus().isCreated();

        // When & Then: the key is taken, so u2 cannot reuse it
        webTestClient.post()
                .uri("/api/orders")
                .header("X-User-Id", "u2")
                .header("X-User-Role", "customer")
                .header("X-Idempotency-Key", "shared-key")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {
                            "userId": "u2",
                            "OrderContents": [ { "itemId": "BAR", "quantity": 1 } ]
                        }
                        """)
                .exchange()
                .expectStatus().isEqualTo(409);

        assertThat(inventoryRow("BAR").getQuantity()).isEqualTo(8);
    }

    @Test
    @DisplayName("should_reject_overlong_key")
    void should_reject_overlong_key() {
        // Given
        givenInventoryItem("BAR", "Choc Bar", "1.25", 10);

        // When & Then
        postOrder("u1", "k".repeat(65)).expectStatus().isBadRequest();
        assertThat(inventoryRow("BAR").getQuantity()).isEqualTo(10);
    }

    @Test
    @DisplayName("should_return_created_order_when_result_cannot_be_recorded")
    void should_return_created_order_when_result_cannot_be_recorded() {
        // Given
        givenInventoryItem("BAR", "Choc Bar", "1.25", 10);
        doThrow(new DataAccessResourceFailureException("db down"))
                .when(idempotencyService).saveResult(eq("key-unrecorded"), any());

        // When
        CreateOrderResponse response = postOrder("u1", "key-unrecorded")
                .expectStatus().isCreated()
                .expectBody(CreateOrderResponse.class)
                .returnResult()
                .getResponseBody();

        // Then
        assertThat(response).isNotNull();
        assertThat(response.success()).isTrue();
        assertThat(response.orderId()).isNotNull();
        assertThat(inventoryRow("BAR").getQuantity()).isEqualTo(8);
        assertThat(orderRepository.count()).isEqualTo(1);
    }
}
