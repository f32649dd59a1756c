package com.rentdesk.backend.integration;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.rentdesk.backend.config.WhatsAppProperties;
import com.rentdesk.backend.entities.RentPayment;
import com.rentdesk.backend.entities.Tenant;
import com.rentdesk.backend.entities.Unit;
import com.rentdesk.backend.enums.NotificationChannel;
import com.rentdesk.backend.enums.NotificationType;
import com.rentdesk.backend.exceptions.NotificationDeliveryException;

import lombok.extern.slf4j.Slf4j;

/**
 * Sends rent template messages through the WhatsApp Cloud API.
 */
@Slf4j
@Component
public class WhatsAppNotificationDispatcher implements NotificationDispatcher {

    private static final DateTimeFormatter DUE_DATE_FORMAT = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.CANADA);

    private final RestClient restClient;
    private final WhatsAppProperties properties;

    public WhatsAppNotificationDispatcher(RestClient.Builder restClientBuilder, WhatsAppProperties properties) {
        this.properties = properties;
        this.restClient = restClientBuilder
                .baseUrl(properties.apiBaseUrl())
                .build();
    }

    @Override
    public String notify(Tenant tenant, RentPayment payment, Unit unit, String propertyAddress, NotificationContext context) {
        if (!properties.enabled() || !properties.isConfigured()) {
            throw new NotificationDeliveryException("WhatsApp is not enabled or not configured");
        }
        if (tenant.getPhone() == null || tenant.getPhone().isBlank()) {
            throw new NotificationDeliveryException("Tenant " + tenant.getId() + " has no phone number");
        }

        String unitAddress = unit.getUnitNumber() + ", " + propertyAddress;
        String link = payment.getPaymentLink() != null ? payment.getPaymentLink() : "";

        List<String> parameters;
        String template;
        if (context.type() == NotificationType.RENT_LATE) {
            template = properties.rentLateTemplate();
            parameters = List.of(
                    tenant.fullName(),
                    String.valueOf(context.daysLate()),
                    formatAmount(payment.getAmount()),
                    unitAddress,
                    link
            );
        } else {
            template = properties.rentDueTemplate();
            parameters = List.of(
                    tenant.fullName(),
                    payment.getDueDate().format(DUE_DATE_FORMAT),
                    formatAmount(payment.getAmount()),
                    unitAddress,
                    link
            );
        }

        Map<String, Object> body = Map.of(
                "messaging_product", "whatsapp",
                "to", tenant.getPhone(),
                "type", "template",
                "template", Map.of(
                        "name", template,
                        "language", Map.of("code", properties.languageCode()),
                        "components", List.of(Map.of(
                                "type", "body",
                                "parameters", parameters.stream()
                                        .map(text -> Map.of("type", "text", "text", text))
                                        .toList()
                        ))
                )
        );

        try {
            SendMessageResponse response = restClient.post()
                    .uri("/{phoneNumberId}/messages", properties.phoneNumberId())
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("Authorization", "Bearer " + properties.accessToken())
                    .body(body)
                    .retrieve()
                    .body(SendMessageResponse.class);

            if (response == null || response.messages() == null || response.messages().isEmpty()) {
                throw new NotificationDeliveryException("WhatsApp accepted the request but returned no message id");
            }
            String messageId = response.messages().get(0).id();
            log.debug("WhatsApp {} message sent to tenant {}: {}", context.type(), tenant.getId(), messageId);
            return messageId;
        } catch (RestClientException e) {
            throw new NotificationDeliveryException("WhatsApp send failed: " + e.getMessage(), e);
        }
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.WHATSAPP;
    }

    private static String formatAmount(BigDecimal amount) {
        return NumberFormat.getCurrencyInstance(Locale.CANADA).format(amount);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SendMessageResponse(List<MessageId> messages) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessageId(String id) {
    }
}
