package com.rentdesk.backend.enums;

public enum NotificationStatus {
    SENT,
    DELIVERED,
    READ,
    FAILED;

    /**
     * Provider receipts can arrive out of order; a receipt only moves the log entry forward.
     */
    public boolean canAdvanceTo(NotificationStatus next) {
        if (next == null || next == this || this == FAILED) {
            return false;
        }
        if (next == FAILED) {
            return this != READ;
        }
        return next.ordinal() > ordinal();
    }
}
