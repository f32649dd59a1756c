package com.rentdesk.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * WhatsApp Cloud API settings used by the rent notification dispatcher.
 */
@ConfigurationProperties(prefix = "rentdesk.whatsapp")
public record WhatsAppProperties(
        boolean enabled,
        boolean requireConfigOnStartup,
        String apiBaseUrl,
        String phoneNumberId,
        String accessToken,
        String languageCode,
        String rentDueTemplate,
        String rentLateTemplate,
        String verifyToken
) {
    public WhatsAppProperties {
        if (apiBaseUrl == null || apiBaseUrl.isBlank()) {
            apiBaseUrl = "https://graph.facebook.com/v19.0";
        }
        if (languageCode == null || languageCode.isBlank()) {
            languageCode = "en";
        }
        if (rentDueTemplate == null || rentDueTemplate.isBlank()) {
            rentDueTemplate = "rent_due";
        }
        if (rentLateTemplate == null || rentLateTemplate.isBlank()) {
            rentLateTemplate = "rent_late";
        }
    }

    public boolean hasVerifyToken() {
        return verifyToken != null && !verifyToken.isBlank();
    }

    public boolean isConfigured() {
        return phoneNumberId != null && !phoneNumberId.isBlank()
                && accessToken != null && !accessToken.isBlank();
    }
}
