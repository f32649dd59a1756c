package com.rentdesk.backend.exceptions;

import java.util.UUID;

/**
 * Raised when a tenant does not end up with exactly one primary unit binding after a reconciliation.
 * The tenant is placed on a reconciliation hold until an operator resolves it.
 */
public class BindingConsistencyException extends BusinessException {

    private final UUID tenantId;
    private final int primaryCount;

    public BindingConsistencyException(UUID tenantId, int primaryCount) {
        super("Tenant " + tenantId + " has " + primaryCount + " primary unit bindings, expected exactly 1");
        this.tenantId = tenantId;
        this.primaryCount = primaryCount;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public int getPrimaryCount() {
        return primaryCount;
    }
}
