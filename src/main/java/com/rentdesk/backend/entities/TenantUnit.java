package com.rentdesk.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

/**
 * Binding between a tenant and a unit, carrying the rent terms. Only the primary binding of a tenant
 * is billed.
 */
@Entity
@Table(
        name = "tenant_units",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_tenant_unit", columnNames = {"tenant_id", "unit_id"})
        },
        indexes = {
                @Index(name = "idx_tenant_unit_due_day", columnList = "rent_due_day")
        }
)
@Getter
@Setter
public class TenantUnit {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "tenant_id", nullable = false)
    private Tenant tenant;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "unit_id", nullable = false)
    private Unit unit;

    @Column(name = "rent_amount", precision = 19, scale = 2)
    private BigDecimal rentAmount;

    @Column(name = "rent_due_day")
    private Integer rentDueDay;

    @Column(name = "is_primary", nullable = false)
    private boolean primary;

    @Column(name = "lease_start_date")
    private LocalDate leaseStartDate;

    @Column(name = "lease_end_date")
    private LocalDate leaseEndDate;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Rent amount and due day are both present, so the binding can be billed.
     */
    public boolean hasRentTerms() {
        return rentAmount != null && rentDueDay != null;
    }
}
