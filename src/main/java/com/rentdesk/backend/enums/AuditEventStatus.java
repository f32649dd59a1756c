package com.rentdesk.backend.enums;

public enum AuditEventStatus {
    SUCCESS,
    FAILURE
}
