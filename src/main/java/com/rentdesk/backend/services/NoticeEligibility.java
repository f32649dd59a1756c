package com.rentdesk.backend.services;

import com.rentdesk.backend.config.RentBillingProperties;

/**
 * Legal notice tiers a late obligation qualifies for. Derived from days late each time, never stored.
 */
public record NoticeEligibility(long daysLate, boolean firstTier, boolean secondTier) {

    public static NoticeEligibility evaluate(long daysLate, RentBillingProperties properties) {
        return new NoticeEligibility(
                daysLate,
                daysLate >= properties.firstTierNoticeDays(),
                daysLate >= properties.secondTierNoticeDays()
        );
    }

    /**
     * Reminders stop once a first-tier notice may be served.
     */
    public boolean inReminderWindow() {
        return !firstTier;
    }
}
