package com.rentdesk.backend.repositories;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import com.rentdesk.backend.entities.TenantUnit;

public interface TenantUnitRepository extends JpaRepository<TenantUnit, UUID> {

    @EntityGraph(attributePaths = {"tenant", "unit", "unit.property"})
    List<TenantUnit> findByTenantIdAndPrimaryTrue(UUID tenantId);

    @EntityGraph(attributePaths = {"tenant", "unit", "unit.property"})
    Optional<TenantUnit> findByTenantIdAndUnitId(UUID tenantId, UUID unitId);

    @EntityGraph(attributePaths = {"tenant", "unit", "unit.property"})
    List<TenantUnit> findByTenantIdOrderByCreatedAtAsc(UUID tenantId);

    @EntityGraph(attributePaths = {"tenant", "unit", "unit.property"})
    List<TenantUnit> findByPrimaryTrueAndRentDueDayIn(Collection<Integer> rentDueDays);

    @EntityGraph(attributePaths = {"tenant", "unit", "unit.property"})
    List<TenantUnit> findByPrimaryTrue();
}
