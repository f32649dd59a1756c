package com.rentdesk.backend.services;

import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.rentdesk.backend.repositories.TenantRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationHoldService {

    private final TenantRepository tenantRepository;

    /**
     * Commits independently of the caller, so the hold survives the rollback of the failed reconciliation.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void placeHold(UUID tenantId, String reason) {
        tenantRepository.findById(tenantId).ifPresentOrElse(tenant -> {
            tenant.setReconciliationHold(true);
            tenant.setReconciliationHoldReason(reason);
            tenantRepository.save(tenant);
            log.error("[Reconciler] tenant={} placed on reconciliation hold: {}", tenantId, reason);
        }, () -> log.warn("[Reconciler] cannot place hold, tenant={} not found", tenantId));
    }
}
