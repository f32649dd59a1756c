package com.rentdesk.backend.enums;

public enum NotificationType {
    RENT_DUE,
    RENT_LATE
}
