package com.rentdesk.backend.repositories;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.rentdesk.backend.entities.RentPayment;
import com.rentdesk.backend.enums.RentPaymentStatus;

import jakarta.persistence.LockModeType;

public interface RentPaymentRepository extends JpaRepository<RentPayment, UUID> {

    @EntityGraph(attributePaths = {"tenant", "unit", "unit.property"})
    Optional<RentPayment> findFirstByTenantIdAndUnitIdAndDueDateBetweenOrderByDueDateAsc(
            UUID tenantId,
            UUID unitId,
            LocalDate periodStart,
            LocalDate periodEnd
    );

    @EntityGraph(attributePaths = {"tenant", "unit", "unit.property"})
    List<RentPayment> findByStatusOrderByDueDateAsc(RentPaymentStatus status);

    @EntityGraph(attributePaths = {"tenant", "unit", "unit.property"})
    List<RentPayment> findByStatusInOrderByDueDateAsc(Collection<RentPaymentStatus> statuses);

    @EntityGraph(attributePaths = {"tenant", "unit", "unit.property"})
    List<RentPayment> findByTenantIdOrderByDueDateDesc(UUID tenantId);

    @EntityGraph(attributePaths = {"tenant", "unit", "unit.property"})
    List<RentPayment> findAllByOrderByDueDateDesc();

    @EntityGraph(attributePaths = {"tenant", "unit", "unit.property"})
    Optional<RentPayment> findWithDetailsById(UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM RentPayment p WHERE p.id = :id")
    Optional<RentPayment> findByIdForUpdate(@Param("id") UUID id);
}
