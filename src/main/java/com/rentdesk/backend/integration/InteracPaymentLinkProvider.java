package com.rentdesk.backend.integration;

import java.math.BigDecimal;
import java.time.Clock;

import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import com.rentdesk.backend.config.PaymentLinkProperties;
import com.rentdesk.backend.exceptions.PaymentLinkException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds an Interac e-Transfer money request link. No call is made to Interac: the link carries the
 * request parameters and a {@code rent-<epochMillis>} reference.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InteracPaymentLinkProvider implements PaymentLinkProvider {

    private final PaymentLinkProperties properties;
    private final Clock clock;

    @Override
    public String generateLink(String email, String name, BigDecimal amount, String memo) {
        if (!properties.enabled()) {
            throw new PaymentLinkException("Payment links are disabled (rentdesk.payment-link.enabled=false)");
        }
        if (email == null || email.isBlank()) {
            throw new PaymentLinkException("Tenant has no email address for an Interac request");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new PaymentLinkException("Interac request amount must be positive, got " + amount);
        }

        log.debug("Generating Interac request link for {} for ${}", email, amount);

        try {
            return UriComponentsBuilder.fromHttpUrl(properties.baseUrl())
                    .queryParam("email", email)
                    .queryParam("name", name)
                    .queryParam("amount", amount.toPlainString())
                    .queryParam("message", memo)
                    .queryParam("reference", "rent-" + clock.millis())
                    .encode()
                    .toUriString();
        } catch (IllegalArgumentException e) {
            throw new PaymentLinkException("Invalid Interac base URL: " + properties.baseUrl(), e);
        }
    }
}
