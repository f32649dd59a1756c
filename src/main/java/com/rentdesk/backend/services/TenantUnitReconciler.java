package com.rentdesk.backend.services;

import java.util.UUID;

import org.springframework.stereotype.Service;

import com.rentdesk.backend.audit.Auditable;
import com.rentdesk.backend.config.BusinessClock;
import com.rentdesk.backend.entities.TenantUnit;
import com.rentdesk.backend.exceptions.BindingConsistencyException;

import lombok.RequiredArgsConstructor;

/**
 * Moves a tenant's primary unit binding. A reconciliation that leaves the tenant without exactly one
 * primary binding is rolled back and the tenant is put on hold until an operator resolves it.
 */
@Service
@RequiredArgsConstructor
public class TenantUnitReconciler {

    private final PrimaryBindingWriter primaryBindingWriter;
    private final ReconciliationHoldService reconciliationHoldService;
    private final BusinessClock businessClock;

    @Auditable(action = "PRIMARY_UNIT_ASSIGNED", entityType = "TenantUnit")
    public TenantUnit assignPrimaryBinding(UUID tenantId, UUID unitId, RentTermsPatch terms) {
        try {
            return primaryBindingWriter.assign(tenantId, unitId, terms, businessClock.today());
        } catch (BindingConsistencyException e) {
            // placed after the rollback released the tenant lock
            reconciliationHoldService.placeHold(e.getTenantId(), e.getMessage());
            throw e;
        }
    }

    @Auditable(action = "RECONCILIATION_HOLD_RESOLVED", entityType = "TenantUnit")
    public TenantUnit resolveConsistencyHold(UUID tenantId, UUID unitId) {
        return primaryBindingWriter.resolveHold(tenantId, unitId);
    }
}
