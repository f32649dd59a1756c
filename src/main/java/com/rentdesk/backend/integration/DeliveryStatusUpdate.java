package com.rentdesk.backend.integration;

import com.rentdesk.backend.enums.NotificationStatus;

/**
 * Delivery receipt for a message the provider accepted earlier.
 *
 * @param messageId provider message id, as stored on the notification log
 * @param error     provider error text, only set for {@link NotificationStatus#FAILED}
 */
public record DeliveryStatusUpdate(String messageId, NotificationStatus status, String error) {
}
