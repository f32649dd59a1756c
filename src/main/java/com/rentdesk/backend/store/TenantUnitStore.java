package com.rentdesk.backend.store;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.rentdesk.backend.entities.TenantUnit;
import com.rentdesk.backend.exceptions.BindingConsistencyException;
import com.rentdesk.backend.repositories.TenantUnitRepository;
import com.rentdesk.backend.calendar.RentCalendar;

import lombok.RequiredArgsConstructor;

/**
 * Binding store: tenant-to-unit bindings and their rent terms.
 */
@Component
@RequiredArgsConstructor
public class TenantUnitStore {

    private final TenantUnitRepository tenantUnitRepository;

    /**
     * @throws BindingConsistencyException if the tenant has more than one primary binding
     */
    @Transactional(readOnly = true)
    public Optional<TenantUnit> findPrimaryBinding(UUID tenantId) {
        List<TenantUnit> primaries = tenantUnitRepository.findByTenantIdAndPrimaryTrue(tenantId);
        if (primaries.size() > 1) {
            throw new BindingConsistencyException(tenantId, primaries.size());
        }
        return primaries.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public List<TenantUnit> listPrimaryBindingsForTenant(UUID tenantId) {
        return tenantUnitRepository.findByTenantIdAndPrimaryTrue(tenantId);
    }

    @Transactional(readOnly = true)
    public Optional<TenantUnit> findBinding(UUID tenantId, UUID unitId) {
        return tenantUnitRepository.findByTenantIdAndUnitId(tenantId, unitId);
    }

    @Transactional(readOnly = true)
    public List<TenantUnit> listBindings(UUID tenantId) {
        return tenantUnitRepository.findByTenantIdOrderByCreatedAtAsc(tenantId);
    }

    @Transactional
    public TenantUnit upsertBinding(TenantUnit binding) {
        return tenantUnitRepository.saveAndFlush(binding);
    }

    /**
     * Primary bindings whose rent falls due on {@code date}, including due days the month does not have
     * when {@code date} is the last day of the month.
     */
    @Transactional(readOnly = true)
    public List<TenantUnit> listBindingsDueOn(LocalDate date) {
        return tenantUnitRepository.findByPrimaryTrueAndRentDueDayIn(RentCalendar.dueDaysFallingOn(date));
    }

    @Transactional(readOnly = true)
    public List<TenantUnit> listPrimaryBindings() {
        return tenantUnitRepository.findByPrimaryTrue();
    }
}
