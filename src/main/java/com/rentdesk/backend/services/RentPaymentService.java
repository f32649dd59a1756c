package com.rentdesk.backend.services;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.rentdesk.backend.calendar.RentCalendar;
import com.rentdesk.backend.audit.Auditable;
import com.rentdesk.backend.config.BusinessClock;
import com.rentdesk.backend.dto.rent.NotificationResponseDTO;
import com.rentdesk.backend.dto.rent.OverdueRentDTO;
import com.rentdesk.backend.dto.rent.RecordPaymentRequestDTO;
import com.rentdesk.backend.dto.rent.RentPaymentRequestDTO;
import com.rentdesk.backend.dto.rent.RentPaymentResponseDTO;
import com.rentdesk.backend.dto.rent.RentStatusReportDTO;
import com.rentdesk.backend.entities.RentPayment;
import com.rentdesk.backend.entities.Tenant;
import com.rentdesk.backend.entities.TenantUnit;
import com.rentdesk.backend.entities.Unit;
import com.rentdesk.backend.enums.RentPaymentStatus;
import com.rentdesk.backend.exceptions.BadRequestException;
import com.rentdesk.backend.exceptions.ConflictException;
import com.rentdesk.backend.exceptions.ResourceNotFoundException;
import com.rentdesk.backend.mappers.RentPaymentMapper;
import com.rentdesk.backend.mappers.TenantMapper;
import com.rentdesk.backend.repositories.NotificationRepository;
import com.rentdesk.backend.repositories.RentPaymentRepository;
import com.rentdesk.backend.repositories.TenantRepository;
import com.rentdesk.backend.repositories.UnitRepository;
import com.rentdesk.backend.store.RentPaymentStore;
import com.rentdesk.backend.store.TenantUnitStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class RentPaymentService {

    private static final EnumSet<RentPaymentStatus> OPEN = EnumSet.of(RentPaymentStatus.PENDING, RentPaymentStatus.LATE);

    private final RentPaymentRepository rentPaymentRepository;
    private final TenantRepository tenantRepository;
    private final UnitRepository unitRepository;
    private final NotificationRepository notificationRepository;
    private final RentPaymentStore rentPaymentStore;
    private final TenantUnitStore tenantUnitStore;
    private final BusinessClock businessClock;

    @Transactional(readOnly = true)
    public List<RentPaymentResponseDTO> findAll() {
        return rentPaymentRepository.findAllByOrderByDueDateDesc().stream()
                .map(RentPaymentMapper::toResponseDTO)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<RentPaymentResponseDTO> findOpen() {
        return rentPaymentRepository.findByStatusInOrderByDueDateAsc(OPEN).stream()
                .map(RentPaymentMapper::toResponseDTO)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<RentPaymentResponseDTO> findByTenant(UUID tenantId) {
        if (!tenantRepository.existsById(tenantId)) {
            throw new ResourceNotFoundException("Tenant not found: " + tenantId);
        }
        return rentPaymentRepository.findByTenantIdOrderByDueDateDesc(tenantId).stream()
                .map(RentPaymentMapper::toResponseDTO)
                .toList();
    }

    @Transactional(readOnly = true)
    public RentPaymentResponseDTO findById(UUID id) {
        return RentPaymentMapper.toResponseDTO(load(id));
    }

    /**
     * Message log of an obligation, newest first.
     */
    @Transactional(readOnly = true)
    public List<NotificationResponseDTO> findNotifications(UUID id) {
        if (!rentPaymentRepository.existsById(id)) {
            throw new ResourceNotFoundException("Rent payment not found: " + id);
        }
        return notificationRepository.findByPaymentIdOrderByCreatedAtDesc(id).stream()
                .map(RentPaymentMapper::toNotificationDTO)
                .toList();
    }

    /**
     * Manual obligation, for example a month billed outside the daily run. Settlement statuses are recorded
     * through {@link #recordPayment}.
     */
    @Auditable(action = "RENT_PAYMENT_CREATED", entityType = "RentPayment")
    public RentPaymentResponseDTO create(RentPaymentRequestDTO request) {
        if (request.getStatus() != null && request.getStatus().isSettlement()) {
            throw new BadRequestException("New obligations must be PENDING or LATE");
        }
        Tenant tenant = tenantRepository.findById(request.getTenantId())
                .orElseThrow(() -> new ResourceNotFoundException("Tenant not found: " + request.getTenantId()));
        Unit unit = unitRepository.findWithPropertyById(request.getUnitId())
                .orElseThrow(() -> new ResourceNotFoundException("Unit not found: " + request.getUnitId()));

        LocalDate dueDate = request.getDueDate();
        if (rentPaymentStore.findObligation(tenant.getId(), unit.getId(),
                RentCalendar.periodStart(dueDate), RentCalendar.periodEnd(dueDate)).isPresent()) {
            throw new ConflictException("An obligation already exists for this tenant, unit and month");
        }

        try {
            RentPayment saved = rentPaymentStore.insertObligation(RentPaymentMapper.toEntity(request, tenant, unit));
            log.info("[RentPayment] manual obligation {} created for tenant={}", saved.getId(), tenant.getId());
            return RentPaymentMapper.toResponseDTO(saved);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("An obligation already exists for this tenant, unit and month");
        }
    }

    @Auditable(action = "RENT_PAYMENT_RECORDED", entityType = "RentPayment")
    public RentPaymentResponseDTO recordPayment(UUID id, RecordPaymentRequestDTO request) {
        if (request.getStatus() == null || !request.getStatus().isSettlement()) {
            throw new BadRequestException("status must be PAID or PARTIAL");
        }
        LocalDate paymentDate = request.getPaymentDate() != null ? request.getPaymentDate() : businessClock.today();

        RentPayment updated = rentPaymentStore
                .updateObligationStatus(id, request.getStatus(), paymentDate, request.getPaymentMethod())
                .orElseThrow(() -> new ConflictException("Rent payment " + id + " is already paid"));
        log.info("[RentPayment] payment {} recorded as {}", id, updated.getStatus());
        return findById(updated.getId());
    }

    /**
     * Primary bindings whose rent was due this month on or before {@code today} without an obligation,
     * and the obligations currently LATE.
     */
    @Transactional(readOnly = true)
    public RentStatusReportDTO checkRentStatus(LocalDate today) {
        List<OverdueRentDTO> notPaid = new ArrayList<>();
        for (TenantUnit binding : tenantUnitStore.listPrimaryBindings()) {
            if (!binding.hasRentTerms()) {
                continue;
            }
            LocalDate dueDate = RentCalendar.dueDateInMonthOf(today, binding.getRentDueDay());
            if (dueDate.isAfter(today)) {
                continue;
            }
            boolean billed = rentPaymentStore.findObligation(binding.getTenant().getId(), binding.getUnit().getId(),
                    RentCalendar.periodStart(dueDate), RentCalendar.periodEnd(dueDate)).isPresent();
            if (!billed) {
                notPaid.add(TenantMapper.toOverdueDTO(binding, dueDate, RentCalendar.daysLate(dueDate, today)));
            }
        }

        List<RentPaymentResponseDTO> late = rentPaymentStore.listObligationsByStatus(RentPaymentStatus.LATE).stream()
                .map(RentPaymentMapper::toResponseDTO)
                .toList();
        return new RentStatusReportDTO(today, notPaid, late);
    }

    private RentPayment load(UUID id) {
        return rentPaymentRepository.findWithDetailsById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Rent payment not found: " + id));
    }
}
