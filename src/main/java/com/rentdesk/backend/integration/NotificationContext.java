package com.rentdesk.backend.integration;

import com.rentdesk.backend.enums.NotificationType;

/**
 * What a rent message is about.
 *
 * @param daysLate whole days past the due date, 0 for a due-date message
 */
public record NotificationContext(NotificationType type, long daysLate) {

    public static NotificationContext rentDue() {
        return new NotificationContext(NotificationType.RENT_DUE, 0);
    }

    public static NotificationContext rentLate(long daysLate) {
        return new NotificationContext(NotificationType.RENT_LATE, daysLate);
    }
}
