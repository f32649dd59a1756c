package com.rentdesk.backend.services;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.rentdesk.backend.entities.Notification;
import com.rentdesk.backend.entities.Property;
import com.rentdesk.backend.entities.RentPayment;
import com.rentdesk.backend.entities.Tenant;
import com.rentdesk.backend.entities.Unit;
import com.rentdesk.backend.enums.NotificationStatus;
import com.rentdesk.backend.exceptions.NotificationDeliveryException;
import com.rentdesk.backend.integration.DeliveryStatusUpdate;
import com.rentdesk.backend.integration.NotificationContext;
import com.rentdesk.backend.integration.NotificationDispatcher;
import com.rentdesk.backend.repositories.NotificationRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends rent messages through the configured dispatcher and keeps a log of every attempt.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationDispatcher notificationDispatcher;
    private final NotificationRepository notificationRepository;
    private final Clock clock;

    /**
     * @return the SENT log entry; its id is {@code null} when the message went out but the entry could
     *         not be stored
     * @throws NotificationDeliveryException after logging a FAILED entry
     */
    public Notification sendRentNotification(RentPayment payment, NotificationContext context) {
        Tenant tenant = payment.getTenant();
        Unit unit = payment.getUnit();
        Property property = unit.getProperty();

        String messageId;
        try {
            messageId = notificationDispatcher.notify(tenant, payment, unit, property.fullAddress(), context);
        } catch (NotificationDeliveryException e) {
            recordFailure(payment, context, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            recordFailure(payment, context, e.getMessage());
            throw new NotificationDeliveryException("Notification failed for payment " + payment.getId(), e);
        }

        Notification sent = entry(payment, context, NotificationStatus.SENT)
                .messageId(messageId)
                .sentAt(LocalDateTime.now(clock))
                .build();
        try {
            sent = notificationRepository.save(sent);
        } catch (DataAccessException e) {
            // the provider already accepted the message
            log.error("[Notification] {} delivered as {} but not logged for payment={}",
                    context.type(), messageId, payment.getId(), e);
        }
        log.info("[Notification] {} sent for payment={} tenant={}", context.type(), payment.getId(), tenant.getId());
        return sent;
    }

    /**
     * Moves the log entry of a provider message to the receipt's status.
     *
     * @return {@code false} when no entry carries the message id or the receipt would move it backwards
     */
    @Transactional
    public boolean applyDeliveryStatus(DeliveryStatusUpdate update) {
        Notification notification = notificationRepository
                .findFirstByMessageIdOrderByCreatedAtDesc(update.messageId())
                .orElse(null);
        if (notification == null) {
            log.debug("[Notification] no log entry for message {}", update.messageId());
            return false;
        }
        if (!notification.getStatus().canAdvanceTo(update.status())) {
            log.debug("[Notification] ignoring {} receipt for message {} already {}",
                    update.status(), update.messageId(), notification.getStatus());
            return false;
        }

        notification.setStatus(update.status());
        if (update.status() == NotificationStatus.FAILED) {
            notification.setErrorMessage(truncate(update.error()));
        }
        notificationRepository.save(notification);
        log.info("[Notification] message {} of payment={} is now {}",
                update.messageId(), notification.getPaymentId(), update.status());
        return true;
    }

    private void recordFailure(RentPayment payment, NotificationContext context, String error) {
        log.warn("[Notification] {} failed for payment={}: {}", context.type(), payment.getId(), error);
        try {
            notificationRepository.save(entry(payment, context, NotificationStatus.FAILED)
                    .errorMessage(truncate(error))
                    .build());
        } catch (DataAccessException e) {
            log.error("[Notification] could not log failed notification for payment={}", payment.getId(), e);
        }
    }

    private Notification.NotificationBuilder entry(RentPayment payment, NotificationContext context, NotificationStatus status) {
        return Notification.builder()
                .tenantId(payment.getTenant().getId())
                .paymentId(payment.getId())
                .type(context.type())
                .channel(notificationDispatcher.channel())
                .status(status);
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() > 1000 ? error.substring(0, 1000) : error;
    }
}
