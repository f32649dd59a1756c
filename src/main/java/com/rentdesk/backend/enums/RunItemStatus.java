package com.rentdesk.backend.enums;

public enum RunItemStatus {
    CREATED,
    SKIPPED,
    TRANSITIONED,
    NOTIFIED,
    FAILED
}
