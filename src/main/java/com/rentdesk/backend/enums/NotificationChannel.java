package com.rentdesk.backend.enums;

public enum NotificationChannel {
    WHATSAPP,
    EMAIL
}
