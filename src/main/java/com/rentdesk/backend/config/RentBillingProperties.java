package com.rentdesk.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Billing rules of the portfolio.
 *
 * @param zoneId               zone the landlord's calendar day is evaluated in
 * @param firstTierNoticeDays  days late from which an N4 notice may be served
 * @param secondTierNoticeDays days late from which an L1 application may be filed
 * @param paymentMemoTemplate  memo attached to payment requests, {@code %s} is the unit number
 */
@ConfigurationProperties(prefix = "rentdesk.billing")
public record RentBillingProperties(
        String zoneId,
        Integer firstTierNoticeDays,
        Integer secondTierNoticeDays,
        String paymentMemoTemplate
) {
    public RentBillingProperties {
        if (zoneId == null || zoneId.isBlank()) {
            zoneId = "America/Toronto";
        }
        if (firstTierNoticeDays == null) {
            firstTierNoticeDays = 14;
        }
        if (secondTierNoticeDays == null) {
            secondTierNoticeDays = 15;
        }
        if (paymentMemoTemplate == null || paymentMemoTemplate.isBlank()) {
            paymentMemoTemplate = "Rent payment for unit %s";
        }
    }

    public static RentBillingProperties defaults() {
        return new RentBillingProperties(null, null, null, null);
    }
}
