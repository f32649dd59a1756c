package com.rentdesk.backend.services;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.rentdesk.backend.calendar.RentCalendar;
import com.rentdesk.backend.entities.Tenant;
import com.rentdesk.backend.entities.TenantUnit;
import com.rentdesk.backend.entities.Unit;
import com.rentdesk.backend.exceptions.BadRequestException;
import com.rentdesk.backend.exceptions.BindingConsistencyException;
import com.rentdesk.backend.exceptions.ConflictException;
import com.rentdesk.backend.exceptions.ResourceNotFoundException;
import com.rentdesk.backend.repositories.TenantRepository;
import com.rentdesk.backend.repositories.UnitRepository;
import com.rentdesk.backend.store.TenantUnitStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Transactional binding mutations behind {@link TenantUnitReconciler}. Each call holds the tenant row
 * lock for its whole transaction and rolls back when the tenant does not end with exactly one primary.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PrimaryBindingWriter {

    private final TenantRepository tenantRepository;
    private final UnitRepository unitRepository;
    private final TenantUnitStore tenantUnitStore;

    @Transactional
    public TenantUnit assign(UUID tenantId, UUID unitId, RentTermsPatch terms, LocalDate today) {
        validateTerms(terms);

        Tenant tenant = lockTenant(tenantId);
        if (tenant.isReconciliationHold()) {
            throw new ConflictException("Tenant " + tenantId + " is on reconciliation hold: "
                    + tenant.getReconciliationHoldReason());
        }
        Unit unit = unitRepository.findWithPropertyById(unitId)
                .orElseThrow(() -> new ResourceNotFoundException("Unit not found: " + unitId));

        List<TenantUnit> primaries = tenantUnitStore.listPrimaryBindingsForTenant(tenantId);
        if (primaries.size() > 1) {
            throw new BindingConsistencyException(tenantId, primaries.size());
        }
        Optional<TenantUnit> currentPrimary = primaries.stream().findFirst();
        Optional<TenantUnit> target = tenantUnitStore.findBinding(tenantId, unitId);

        if (target.isEmpty() && tenantUnitStore.listBindings(tenantId).isEmpty()
                && (!terms.rentAmount().isSet() || !terms.rentDueDay().isSet())) {
            throw new BadRequestException("rentAmount and rentDueDay are required for a tenant's first unit");
        }

        TenantUnit result;
        if (target.isPresent() && target.get().isPrimary()) {
            TenantUnit binding = target.get();
            binding.setRentAmount(terms.rentAmount().applyTo(binding.getRentAmount()));
            binding.setRentDueDay(terms.rentDueDay().applyTo(binding.getRentDueDay()));
            applyLeaseDates(binding, terms);
            result = tenantUnitStore.upsertBinding(binding);
            log.info("[Reconciler] updated primary binding tenant={} unit={}", tenantId, unitId);
        } else {
            TenantUnit demoted = currentPrimary.orElse(null);
            if (demoted != null) {
                demoted.setPrimary(false);
                if (demoted.getLeaseEndDate() == null) {
                    demoted.setLeaseEndDate(today);
                }
                tenantUnitStore.upsertBinding(demoted);
            }

            TenantUnit binding = target.orElseGet(() -> newBinding(tenant, unit, today));
            TenantUnit inheritFrom = demoted != null ? demoted : binding;
            binding.setRentAmount(terms.rentAmount().applyTo(inheritFrom.getRentAmount()));
            binding.setRentDueDay(terms.rentDueDay().applyTo(inheritFrom.getRentDueDay()));
            applyLeaseDates(binding, terms);
            binding.setPrimary(true);
            result = tenantUnitStore.upsertBinding(binding);

            log.info("[Reconciler] primary binding of tenant={} moved from unit={} to unit={}",
                    tenantId, demoted != null ? demoted.getUnit().getId() : null, unitId);
        }

        verifySinglePrimary(tenantId);
        return result;
    }

    /**
     * Keeps {@code unitId} as the only primary binding and lifts the reconciliation hold.
     */
    @Transactional
    public TenantUnit resolveHold(UUID tenantId, UUID unitId) {
        Tenant tenant = lockTenant(tenantId);
        if (!tenant.isReconciliationHold()) {
            throw new ConflictException("Tenant " + tenantId + " is not on reconciliation hold");
        }
        TenantUnit keep = tenantUnitStore.findBinding(tenantId, unitId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Binding not found for tenant " + tenantId + " and unit " + unitId));

        for (TenantUnit primary : tenantUnitStore.listPrimaryBindingsForTenant(tenantId)) {
            if (!primary.getId().equals(keep.getId())) {
                primary.setPrimary(false);
                tenantUnitStore.upsertBinding(primary);
            }
        }
        keep.setPrimary(true);
        TenantUnit result = tenantUnitStore.upsertBinding(keep);

        verifySinglePrimary(tenantId);

        tenant.setReconciliationHold(false);
        tenant.setReconciliationHoldReason(null);
        tenantRepository.save(tenant);
        log.info("[Reconciler] reconciliation hold lifted for tenant={} keeping unit={}", tenantId, unitId);
        return result;
    }

    private Tenant lockTenant(UUID tenantId) {
        return tenantRepository.findByIdForUpdate(tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Tenant not found: " + tenantId));
    }

    private void verifySinglePrimary(UUID tenantId) {
        int count = tenantUnitStore.listPrimaryBindingsForTenant(tenantId).size();
        if (count != 1) {
            throw new BindingConsistencyException(tenantId, count);
        }
    }

    private TenantUnit newBinding(Tenant tenant, Unit unit, LocalDate today) {
        TenantUnit binding = new TenantUnit();
        binding.setTenant(tenant);
        binding.setUnit(unit);
        binding.setLeaseStartDate(today);
        return binding;
    }

    private void applyLeaseDates(TenantUnit binding, RentTermsPatch terms) {
        if (terms.leaseStartDate() != null) {
            binding.setLeaseStartDate(terms.leaseStartDate());
        }
        if (terms.leaseEndDate() != null) {
            binding.setLeaseEndDate(terms.leaseEndDate());
        }
    }

    private void validateTerms(RentTermsPatch terms) {
        if (terms.rentAmount().isSet() && terms.rentAmount().value().compareTo(BigDecimal.ZERO) < 0) {
            throw new BadRequestException("rentAmount must not be negative");
        }
        if (terms.rentDueDay().isSet() && !RentCalendar.isValidDueDay(terms.rentDueDay().value())) {
            throw new BadRequestException("rentDueDay must be between 1 and 31");
        }
        if (terms.leaseStartDate() != null && terms.leaseEndDate() != null
                && terms.leaseEndDate().isBefore(terms.leaseStartDate())) {
            throw new BadRequestException("leaseEndDate must not be before leaseStartDate");
        }
    }
}
