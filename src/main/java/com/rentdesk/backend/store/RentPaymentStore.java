package com.rentdesk.backend.store;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.rentdesk.backend.entities.RentPayment;
import com.rentdesk.backend.enums.RentPaymentStatus;
import com.rentdesk.backend.exceptions.ResourceNotFoundException;
import com.rentdesk.backend.repositories.RentPaymentRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Payment store: rent obligations. Every write runs in its own transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RentPaymentStore {

    private final RentPaymentRepository rentPaymentRepository;

    @Transactional(readOnly = true)
    public Optional<RentPayment> findObligation(UUID tenantId, UUID unitId, LocalDate periodStart, LocalDate periodEnd) {
        return rentPaymentRepository.findFirstByTenantIdAndUnitIdAndDueDateBetweenOrderByDueDateAsc(
                tenantId, unitId, periodStart, periodEnd);
    }

    /**
     * Inserts and flushes, so a concurrent insert for the same period fails here with a
     * {@link org.springframework.dao.DataIntegrityViolationException}.
     */
    @Transactional
    public RentPayment insertObligation(RentPayment obligation) {
        return rentPaymentRepository.saveAndFlush(obligation);
    }

    @Transactional(readOnly = true)
    public List<RentPayment> listObligationsByStatus(RentPaymentStatus status) {
        return rentPaymentRepository.findByStatusOrderByDueDateAsc(status);
    }

    @Transactional
    public Optional<RentPayment> updateObligationStatus(UUID id, RentPaymentStatus status, LocalDate paymentDate) {
        return updateObligationStatus(id, status, paymentDate, null);
    }

    /**
     * Applies a status change under a row lock. Returns empty when the current status does not allow the
     * change (for example LATE back to PENDING, or an obligation paid in the meantime), leaving the row as is.
     */
    @Transactional
    public Optional<RentPayment> updateObligationStatus(
            UUID id,
            RentPaymentStatus status,
            LocalDate paymentDate,
            String paymentMethod
    ) {
        RentPayment payment = rentPaymentRepository.findByIdForUpdate(id)
                .orElseThrow(() -> new ResourceNotFoundException("Rent payment not found: " + id));

        if (!payment.getStatus().canTransitionTo(status)) {
            log.debug("[RentPaymentStore] ignored transition {} -> {} for payment {}", payment.getStatus(), status, id);
            return Optional.empty();
        }

        payment.setStatus(status);
        if (paymentDate != null) {
            payment.setPaymentDate(paymentDate);
        }
        if (paymentMethod != null) {
            payment.setPaymentMethod(paymentMethod);
        }
        return Optional.of(rentPaymentRepository.save(payment));
    }

    @Transactional
    public void markReminderSent(UUID id, LocalDateTime sentAt) {
        rentPaymentRepository.findById(id).ifPresent(payment -> {
            payment.setLastReminderAt(sentAt);
            rentPaymentRepository.save(payment);
        });
    }
}
