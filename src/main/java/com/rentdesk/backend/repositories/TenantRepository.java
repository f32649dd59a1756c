package com.rentdesk.backend.repositories;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.rentdesk.backend.entities.Tenant;

import jakarta.persistence.LockModeType;

public interface TenantRepository extends JpaRepository<Tenant, UUID> {

    /**
     * Row lock used to serialize binding changes of one tenant.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Tenant t WHERE t.id = :id")
    Optional<Tenant> findByIdForUpdate(@Param("id") UUID id);
}
