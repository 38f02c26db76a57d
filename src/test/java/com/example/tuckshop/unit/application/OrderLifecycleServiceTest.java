package com.example.tuckshop.unit.application;

import com.example.tuckshop.application.dto.StatusUpdateResult;
import com.example.tuckshop.application.dto.StatusUpdateResult.Rejection;
import com.example.tuckshop.application.dto.UpdateOrderStatusCommand;
import com.example.tuckshop.application.port.out.NotificationPort;
import com.example.tuckshop.application.port.out.NotificationPort.Notification;
import com.example.tuckshop.application.port.out.OrderStorePort;
import com.example.tuckshop.application.port.out.StockLedgerPort;
import com.example.tuckshop.application.port.out.StockLedgerPort.RestorationResult;
import com.example.tuckshop.application.service.OrderLifecycleService;
import com.example.tuckshop.domain.exception.OrderNotFoundException;
import com.example.tuckshop.domain.exception.StaffOnlyException;
import com.example.tuckshop.domain.model.*;
import com.example.tuckshop.domain.service.OrderTransitionPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.OngoingStubbing;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Order Lifecycle Service Tests")
class OrderLifecycleServiceTest {

    private static final OrderNumber NUMBER = OrderNumber.of(5);

    @Mock
    private OrderStorePort orderStorePort;

    @Mock
    private StockLedgerPort stockLedgerPort;

    @Mock
    private NotificationPort notificationPort;

    private OrderLifecycleService service;

    @BeforeEach
    void setUp() {
        service = new OrderLifecycleService(orderStorePort, stockLedgerPort, notificationPort,
                new OrderTransitionPolicy());
    }

    private static Order orderIn(OrderStatus status) {
        return Order.reconstitute("doc-5", NUMBER, Instant.EPOCH, "u1", "Sam",
                List.of(OrderLine.of(ItemId.of("A"), "Apple Juice", 3, Money.of("2.50")),
                        OrderLine.of(ItemId.of("B"), "Biscuits", 1, Money.of("1.00"))),
                Money.of("8.50"), status);
    }

    private void givenStored(Order... versions) {
        OngoingStubbing<CompletableFuture<Optional<Order>>> stubbing = when(orderStorePort.findByNumber(NUMBER));
        for (Order version : versions) {
            stubbing = stubbing.thenReturn(CompletableFuture.completedFuture(Optional.of(version)));
        }
    }

    private static UpdateOrderStatusCommand to(OrderStatus status) {
        return new UpdateOrderStatusCommand(NUMBER, status);
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("should_report_missing_order")
        void should_report_missing_order() {
            // Given
            when(orderStorePort.findByNumber(NUMBER)).thenReturn(CompletableFuture.completedFuture(Optional.empty()));

            // When
            StatusUpdateResult result = service.updateStatus(Caller.employee("e1"), to(OrderStatus.CANCELLED)).join();

            // Then
            assertThat(result.success()).isFalse();
            assertThat(result.rejection()).isEqualTo(Rejection.NOT_FOUND);
        }

        @Test
        @DisplayName("should_forbid_customer_on_foreign_order")
        void should_forbid_customer_on_foreign_order() {
            // Given
            givenStored(orderIn(OrderStatus.PENDING));

            // When
            StatusUpdateResult result = service.updateStatus(Caller.customer("u2"), to(OrderStatus.CANCELLED)).join();

            // Then
            assertThat(result.rejection()).isEqualTo(Rejection.FORBIDDEN);
            assertThat(result.message()).isEqualTo("Forbidden: Cannot modify other users' orders");
            verify(orderStorePort, never()).compareAndSetStatus(any(), any(), any());
            verifyNoInteractions(stockLedgerPort);
        }

        @Test
        @DisplayName("should_explain_customer_status_restrictions")
        void should_explain_customer_status_restrictions() {
            // Given
            givenStored(orderIn(OrderStatus.PENDING));

            // When
            StatusUpdateResult result = service.updateStatus(Caller.customer("u1"), to(OrderStatus.COMPLETED)).join();

            // Then
            assertThat(result.message()).isEqualTo("Forbidden: Customers can only cancel orders");
        }

        @Test
        @DisplayName("should_reject_invalid_staff_transition")
        void should_reject_invalid_staff_transition() {
            // Given
            givenStored(orderIn(OrderStatus.COMPLETED));

            // When
            StatusUpdateResult result = service.updateStatus(Caller.owner("o1"), to(OrderStatus.CANCELLED)).join();

            // Then
            assertThat(result.rejection()).isEqualTo(Rejection.INVALID_TRANSITION);
            assertThat(result.message()).isEqualTo("Cannot change order status from completed to cancelled");
        }

        @Test
        @DisplayName("should_succeed_without_side_effects_when_already_cancelled")
        void should_succeed_without_side_effects_when_already_cancelled() {
            // Given
            givenStored(orderIn(OrderStatus.CANCELLED_ACKNOWLEDGED));

            // When
            StatusUpdateResult result = service.updateStatus(Caller.employee("e1"), to(OrderStatus.CANCELLED)).join();

            // Then
            assertThat(result.success()).isTrue();
            assertThat(result.status()).isEqualTo(OrderStatus.CANCELLED_ACKNOWLEDGED);
            assertThat(result.inventoryRestored()).isNull();
            verify(orderStorePort, never()).compareAndSetStatus(any(), any(), any());
            verifyNoInteractions(stockLedgerPort, notificationPort);
        }
    }

    @Nested
    @DisplayName("Applied transitions")
    class AppliedTransitions {

        @Test
        @DisplayName("should_restore_every_line_when_customer_cancels")
        void should_restore_every_line_when_customer_cancels() {
            // Given
            givenStored(orderIn(OrderStatus.PENDING));
            when(orderStorePort.compareAndSetStatus(NUMBER, OrderStatus.PENDING, OrderStatus.CANCELLED))
                    .thenReturn(CompletableFuture.completedFuture(true));
            when(stockLedgerPort.restore(anyList(), eq("u1")))
                    .thenReturn(CompletableFuture.completedFuture(RestorationResult.success(List.of())));

            // When
            StatusUpdateResult result = service.updateStatus(Caller.customer("u1"), to(OrderStatus.CANCELLED)).join();

            // Then
            assertThat(result.success()).isTrue();
            assertThat(result.status()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(result.inventoryRestored()).isTrue();
            verify(stockLedgerPort).restore(List.of(
                    new RequestedItem(ItemId.of("A"), "Apple Juice", 3),
                    new RequestedItem(ItemId.of("B"), "Biscuits", 1)), "u1");
            verifyNoInteractions(notificationPort);
        }

        @Test
        @DisplayName("should_notify_owner_when_staff_cancels")
        void should_notify_owner_when_staff_cancels() {
            // Given
            givenStored(orderIn(OrderStatus.IN_PROGRESS));
            when(orderStorePort.compareAndSetStatus(NUMBER, OrderStatus.IN_PROGRESS, OrderStatus.CANCELLED))
                    .thenReturn(CompletableFuture.completedFuture(true));
            when(stockLedgerPort.restore(anyList(), eq("e1")))
                    .thenReturn(CompletableFuture.completedFuture(RestorationResult.success(List.of())));

            // When
            service.updateStatus(Caller.employee("e1"), to(OrderStatus.CANCELLED)).join();

            // Then
            ArgumentCaptor<Notification> notification = ArgumentCaptor.forClass(Notification.class);
            verify(notificationPort).publish(notification.capture());
            assertThat(notification.getValue().userId()).isEqualTo("u1");
            assertThat(notification.getValue().type()).isEqualTo(NotificationPort.ORDER_CANCELLED);
        }

        @Test
        @DisplayName("should_keep_cancellation_when_restore_fails")
        void should_keep_cancellation_when_restore_fails() {
            // Given
            givenStored(orderIn(OrderStatus.PENDING));
            when(orderStorePort.compareAndSetStatus(NUMBER, OrderStatus.PENDING, OrderStatus.CANCELLED))
                    .thenReturn(CompletableFuture.completedFuture(true));
            when(stockLedgerPort.restore(anyList(), eq("u1")))
                    .thenReturn(CompletableFuture.completedFuture(RestorationResult.failure("store unavailable")));

            // When
            StatusUpdateResult result = service.updateStatus(Caller.customer("u1"), to(OrderStatus.CANCELLED)).join();

            // Then
            assertThat(result.success()).isTrue();
            assertThat(result.inventoryRestored()).isFalse();
            assertThat(result.message()).isEqualTo("Order status updated, but inventory could not be restored");
        }

        @Test
        @DisplayName("should_keep_cancellation_when_restore_future_fails")
        void should_keep_cancellation_when_restore_future_fails() {
            // Given
            givenStored(orderIn(OrderStatus.PENDING));
            when(orderStorePort.compareAndSetStatus(NUMBER, OrderStatus.PENDING, OrderStatus.CANCELLED))
                    .thenReturn(CompletableFuture.completedFuture(true));
            when(stockLedgerPort.restore(anyList(), eq("u1")))
                    .thenReturn(CompletableFuture.failedFuture(new DataAccessResourceFailureException("db down")));

            // When
            StatusUpdateResult result = service.updateStatus(Caller.customer("u1"), to(OrderStatus.CANCELLED)).join();

            // Then
            assertThat(result.success()).isTrue();
            assertThat(result.status()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(result.inventoryRestored()).isFalse();
        }

        @Test
        @DisplayName("should_keep_staff_cancellation_when_notification_cannot_be_queued")
        void should_keep_staff_cancellation_when_notification_cannot_be_queued() {
            // Given
            givenStored(orderIn(OrderStatus.IN_PROGRESS));
            when(orderStorePort.compareAndSetStatus(NUMBER, OrderStatus.IN_PROGRESS, OrderStatus.CANCELLED))
                    .thenReturn(CompletableFuture.completedFuture(true));
            when(stockLedgerPort.restore(anyList(), eq("e1")))
                    .thenReturn(CompletableFuture.completedFuture(RestorationResult.success(List.of())));
            doThrow(new CannotCreateTransactionException("pool exhausted"))
                    .when(notificationPort).publish(any());

            // When
            StatusUpdateResult result = service.updateStatus(Caller.employee("e1"), to(OrderStatus.CANCELLED)).join();

            // Then
            assertThat(result.success()).isTrue();
            assertThat(result.inventoryRestored()).isTrue();
            verify(stockLedgerPort, times(1)).restore(anyList(), eq("e1"));
        }

        @Test
        @DisplayName("should_not_touch_stock_for_non_cancelling_transition")
        void should_not_touch_stock_for_non_cancelling_transition() {
            // Given
            givenStored(orderIn(OrderStatus.PENDING));
            when(orderStorePort.compareAndSetStatus(NUMBER, OrderStatus.PENDING, OrderStatus.IN_PROGRESS))
                    .thenReturn(CompletableFuture.completedFuture(true));

            // When
            StatusUpdateResult result = service.updateStatus(Caller.employee("e1"), to(OrderStatus.IN_PROGRESS)).join();

            // Then
            assertThat(result.status()).isEqualTo(OrderStatus.IN_PROGRESS);
            assertThat(result.inventoryRestored()).isNull();
            verifyNoInteractions(stockLedgerPort, notificationPort);
        }
    }

    @Nested
    @DisplayName("Lost claims")
    class LostClaims {

        @Test
        @DisplayName("should_not_restore_again_when_another_request_cancelled_first")
        void should_not_restore_again_when_another_request_cancelled_first() {
            // Given: the first read sees pending, the re-read sees the winner's cancellation
            givenStored(orderIn(OrderStatus.PENDING), orderIn(OrderStatus.CANCELLED));
            when(orderStorePort.compareAndSetStatus(NUMBER, OrderStatus.PENDING, OrderStatus.CANCELLED))
                    .thenReturn(CompletableFuture.completedFuture(false));

            // When
            StatusUpdateResult result = service.updateStatus(Caller.employee("e1"), to(OrderStatus.CANCELLED)).join();

            // Then
            assertThat(result.success()).isTrue();
            assertThat(result.message()).isEqualTo("Order is already cancelled");
            verify(orderStorePort, times(2)).findByNumber(NUMBER);
            verifyNoInteractions(stockLedgerPort);
        }

        @Test
        @DisplayName("should_judge_customer_again_after_staff_started_order")
        void should_judge_customer_again_after_staff_started_order() {
            // Given
            givenStored(orderIn(OrderStatus.PENDING), orderIn(OrderStatus.IN_PROGRESS));
            when(orderStorePort.compareAndSetStatus(NUMBER, OrderStatus.PENDING, OrderStatus.CANCELLED))
                    .thenReturn(CompletableFuture.completedFuture(false));

            // When
            StatusUpdateResult result = service.updateStatus(Caller.customer("u1"), to(OrderStatus.CANCELLED)).join();

            // Then
            assertThat(result.rejection()).isEqualTo(Rejection.FORBIDDEN);
            assertThat(result.message()).isEqualTo("Forbidden: Only pending orders can be cancelled");
            verifyNoInteractions(stockLedgerPort);
        }

        @Test
        @DisplayName("should_give_up_when_order_keeps_changing")
        void should_give_up_when_order_keeps_changing() {
            // Given
            when(orderStorePort.findByNumber(NUMBER))
                    .thenAnswer(invocation -> CompletableFuture.completedFuture(
                            Optional.of(orderIn(OrderStatus.PENDING))));
            when(orderStorePort.compareAndSetStatus(NUMBER, OrderStatus.PENDING, OrderStatus.IN_PROGRESS))
                    .thenReturn(CompletableFuture.completedFuture(false));

            // When
            StatusUpdateResult result = service.updateStatus(Caller.employee("e1"), to(OrderStatus.IN_PROGRESS)).join();

            // Then
            assertThat(result.success()).isFalse();
            assertThat(result.rejection()).isEqualTo(Rejection.PROCESSING_ERROR);
            verify(orderStorePort, times(4)).compareAndSetStatus(NUMBER, OrderStatus.PENDING, OrderStatus.IN_PROGRESS);
        }
    }

    @Nested
    @DisplayName("Store failures")
    class StoreFailures {

        @Test
        @DisplayName("should_report_processing_error_when_order_cannot_be_read")
        void should_report_processing_error_when_order_cannot_be_read() {
            // Given
            when(orderStorePort.findByNumber(NUMBER))
                    .thenReturn(CompletableFuture.failedFuture(new DataAccessResourceFailureException("db down")));

            // When
            StatusUpdateResult result = service.updateStatus(Caller.employee("e1"), to(OrderStatus.CANCELLED)).join();

            // Then
            assertThat(result.success()).isFalse();
            assertThat(result.rejection()).isEqualTo(Rejection.PROCESSING_ERROR);
            assertThat(result.orderId()).isEqualTo(5L);
            verifyNoInteractions(stockLedgerPort, notificationPort);
        }

        @Test
        @DisplayName("should_report_processing_error_when_claim_write_fails")
        void should_report_processing_error_when_claim_write_fails() {
            // Given
            givenStored(orderIn(OrderStatus.PENDING));
            when(orderStorePort.compareAndSetStatus(NUMBER, OrderStatus.PENDING, OrderStatus.CANCELLED))
                    .thenReturn(CompletableFuture.failedFuture(new CannotCreateTransactionException("pool exhausted")));

            // When
            StatusUpdateResult result = service.updateStatus(Caller.customer("u1"), to(OrderStatus.CANCELLED)).join();

            // Then
            assertThat(result.rejection()).isEqualTo(Rejection.PROCESSING_ERROR);
            verifyNoInteractions(stockLedgerPort, notificationPort);
        }
    }

    @Nested
    @DisplayName("Deletion")
    class Deletion {

        @Test
        @DisplayName("should_refuse_customer_deletion")
        void should_refuse_customer_deletion() {
            // When
            CompletableFuture<Void> future = service.deleteOrder(Caller.customer("u1"), NUMBER);

            // Then
            assertThatThrownBy(future::join).hasCauseInstanceOf(StaffOnlyException.class);
            verifyNoInteractions(orderStorePort);
        }

        @Test
        @DisplayName("should_report_missing_order_on_delete")
        void should_report_missing_order_on_delete() {
            // Given
            when(orderStorePort.delete(NUMBER)).thenReturn(CompletableFuture.completedFuture(false));

            // When
            CompletableFuture<Void> future = service.deleteOrder(Caller.owner("o1"), NUMBER);

            // Then
            assertThatThrownBy(future::join).hasCauseInstanceOf(OrderNotFoundException.class);
            verifyNoInteractions(stockLedgerPort);
        }
    }
}
