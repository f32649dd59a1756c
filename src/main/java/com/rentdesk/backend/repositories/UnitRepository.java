package com.rentdesk.backend.repositories;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import com.rentdesk.backend.entities.Unit;

public interface UnitRepository extends JpaRepository<Unit, UUID> {

    @EntityGraph(attributePaths = {"property"})
    Optional<Unit> findWithPropertyById(UUID id);

    @EntityGraph(attributePaths = {"property"})
    List<Unit> findByPropertyIdOrderByUnitNumberAsc(UUID propertyId);
}
