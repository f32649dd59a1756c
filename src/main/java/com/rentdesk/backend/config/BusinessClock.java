package com.rentdesk.backend.config;

import java.time.LocalDate;

/**
 * Source of the landlord's current calendar date. Billing and lateness are always evaluated against
 * this date, never against the JVM default zone.
 */
@FunctionalInterface
public interface BusinessClock {

    LocalDate today();
}
