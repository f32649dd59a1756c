package com.rentdesk.backend.repositories;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.rentdesk.backend.entities.AuditEvent;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {
}
