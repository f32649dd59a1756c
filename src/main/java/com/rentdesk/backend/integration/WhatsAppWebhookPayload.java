package com.rentdesk.backend.integration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.rentdesk.backend.enums.NotificationStatus;

/**
 * Body of a WhatsApp Cloud API webhook call. Only the message status receipts are read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhatsAppWebhookPayload(String object, List<Entry> entry) {

    public static final String BUSINESS_ACCOUNT = "whatsapp_business_account";

    public boolean isBusinessAccount() {
        return BUSINESS_ACCOUNT.equals(object);
    }

    /**
     * Receipts in payload order. Statuses without a local counterpart are left out.
     */
    public List<DeliveryStatusUpdate> statusUpdates() {
        List<DeliveryStatusUpdate> updates = new ArrayList<>();
        if (entry == null) {
            return updates;
        }
        for (Entry e : entry) {
            if (e == null || e.changes() == null) {
                continue;
            }
            for (Change change : e.changes()) {
                if (change == null || change.value() == null || change.value().statuses() == null) {
                    continue;
                }
                for (Status status : change.value().statuses()) {
                    NotificationStatus mapped = toNotificationStatus(status.status());
                    if (status.id() == null || mapped == null) {
                        continue;
                    }
                    updates.add(new DeliveryStatusUpdate(status.id(), mapped,
                            mapped == NotificationStatus.FAILED ? status.firstError() : null));
                }
            }
        }
        return updates;
    }

    static NotificationStatus toNotificationStatus(String providerStatus) {
        if (providerStatus == null) {
            return null;
        }
        return switch (providerStatus.toLowerCase(Locale.ROOT)) {
            case "sent" -> NotificationStatus.SENT;
            case "delivered" -> NotificationStatus.DELIVERED;
            case "read" -> NotificationStatus.READ;
            case "failed" -> NotificationStatus.FAILED;
            default -> null;
        };
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(String id, List<Change> changes) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Change(String field, Value value) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Value(List<Status> statuses) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(String id, String status, List<ProviderError> errors) {

        String firstError() {
            if (errors == null || errors.isEmpty() || errors.get(0) == null) {
                return "Delivery failed";
            }
            ProviderError error = errors.get(0);
            String text = error.message() != null ? error.message() : error.title();
            if (text == null) {
                text = "Delivery failed";
            }
            return error.code() != null ? error.code() + ": " + text : text;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProviderError(Integer code, String title, String message) {}
}
