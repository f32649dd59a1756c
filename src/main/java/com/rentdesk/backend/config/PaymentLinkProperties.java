package com.rentdesk.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rentdesk.payment-link")
public record PaymentLinkProperties(
        boolean enabled,
        String baseUrl
) {
    public PaymentLinkProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "https://interac.mock/request";
        }
    }
}
