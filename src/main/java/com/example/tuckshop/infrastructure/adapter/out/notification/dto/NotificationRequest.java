package com.example.tuckshop.infrastructure.adapter.out.notification.dto;

import com.example.tuckshop.application.port.out.NotificationPort.Notification;

/**
 * Body sent to the notification service. Also the stored outbox payload.
 */
public record NotificationRequest(
        String userId,
        String type,
        String message,
        String orderReference
) {
    public static NotificationRequest from(Notification notification) {
        return new NotificationRequest(notification.userId(), notification.type(),
                notification.message(), notification.orderReference());
    }
}
