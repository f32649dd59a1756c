package com.rentdesk.backend.services;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import com.rentdesk.backend.calendar.RentCalendar;
import com.rentdesk.backend.config.RentBillingProperties;
import com.rentdesk.backend.dto.cron.RentRunItemDTO;
import com.rentdesk.backend.dto.cron.RentRunResultDTO;
import com.rentdesk.backend.entities.Notification;
import com.rentdesk.backend.entities.RentPayment;
import com.rentdesk.backend.entities.TenantUnit;
import com.rentdesk.backend.enums.RentPaymentStatus;
import com.rentdesk.backend.enums.RunItemStatus;
import com.rentdesk.backend.exceptions.NotificationDeliveryException;
import com.rentdesk.backend.integration.NotificationContext;
import com.rentdesk.backend.integration.PaymentLinkProvider;
import com.rentdesk.backend.mappers.RentPaymentMapper;
import com.rentdesk.backend.store.RentPaymentStore;
import com.rentdesk.backend.store.TenantUnitStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates the monthly rent obligations of primary bindings. Runs are idempotent: a binding that already
 * has an obligation for the month is skipped, so overlapping or repeated runs never bill twice.
 *
 * <p>There is no transaction around a run. Each binding is handled on its own and a failure is reported
 * in the run result without stopping the others.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RentBillingService {

    private final TenantUnitStore tenantUnitStore;
    private final RentPaymentStore rentPaymentStore;
    private final PaymentLinkProvider paymentLinkProvider;
    private final NotificationService notificationService;
    private final RentBillingProperties billingProperties;
    private final Clock clock;

    /**
     * Bills every primary binding whose rent falls due on {@code date}.
     */
    public RentRunResultDTO generateDueRent(LocalDate date) {
        List<TenantUnit> due = tenantUnitStore.listBindingsDueOn(date);
        log.info("[RentBilling] generating rent due on {}: {} bindings", date, due.size());

        List<RentRunItemDTO> results = new ArrayList<>();
        for (TenantUnit binding : due) {
            results.add(bill(binding, date));
        }

        RentRunResultDTO result = RentRunResultDTO.of("due-rent", date, results);
        logSummary(result);
        return result;
    }

    /**
     * Bills primary bindings whose due date already passed this month without an obligation, for example
     * after a missed run or a binding created after its due day. Such obligations start LATE.
     */
    public RentRunResultDTO catchUpMissedRent(LocalDate date) {
        List<RentRunItemDTO> results = new ArrayList<>();
        for (TenantUnit binding : tenantUnitStore.listPrimaryBindings()) {
            if (!binding.hasRentTerms()) {
                results.add(missingTerms(binding));
                continue;
            }
            LocalDate dueDate = RentCalendar.dueDateInMonthOf(date, binding.getRentDueDay());
            if (dueDate.isBefore(date)) {
                results.add(bill(binding, date));
            }
        }

        RentRunResultDTO result = RentRunResultDTO.of("catch-up", date, results);
        logSummary(result);
        return result;
    }

    /**
     * Due-date run followed by the catch-up sweep, as triggered once a day.
     */
    public RentRunResultDTO runDailyBilling(LocalDate date) {
        List<RentRunItemDTO> results = new ArrayList<>(generateDueRent(date).results());
        results.addAll(catchUpMissedRent(date).results());
        return RentRunResultDTO.of("due-rent", date, results);
    }

    private RentRunItemDTO bill(TenantUnit binding, LocalDate date) {
        if (!binding.hasRentTerms()) {
            return missingTerms(binding);
        }
        try {
            LocalDate dueDate = RentCalendar.dueDateInMonthOf(date, binding.getRentDueDay());
            Optional<RentPayment> existing = rentPaymentStore.findObligation(
                    binding.getTenant().getId(),
                    binding.getUnit().getId(),
                    RentCalendar.periodStart(dueDate),
                    RentCalendar.periodEnd(dueDate)
            );
            if (existing.isPresent()) {
                return skipped(binding, dueDate, existing.get(), "Obligation already exists for this month");
            }

            long daysLate = RentCalendar.daysLate(dueDate, date);
            RentPaymentStatus status = dueDate.isBefore(date) ? RentPaymentStatus.LATE : RentPaymentStatus.PENDING;

            RentPayment obligation = RentPayment.builder()
                    .tenant(binding.getTenant())
                    .unit(binding.getUnit())
                    .amount(binding.getRentAmount())
                    .dueDate(dueDate)
                    .billingPeriod(RentCalendar.periodStart(dueDate))
                    .status(status)
                    .paymentLink(requestPaymentLink(binding))
                    .build();

            RentPayment saved;
            try {
                saved = rentPaymentStore.insertObligation(obligation);
            } catch (DataIntegrityViolationException e) {
                log.info("[RentBilling] obligation for tenant={} unit={} created concurrently",
                        binding.getTenant().getId(), binding.getUnit().getId());
                return skipped(binding, dueDate, null, "Obligation already exists for this month");
            }

            return notifyCreated(saved, status, daysLate, date);
        } catch (RuntimeException e) {
            log.error("[RentBilling] billing failed for tenant={} unit={}",
                    binding.getTenant().getId(), binding.getUnit().getId(), e);
            return RentPaymentMapper.runItem(binding, RunItemStatus.FAILED)
                    .error(e.getMessage())
                    .build();
        }
    }

    private RentRunItemDTO notifyCreated(RentPayment saved, RentPaymentStatus status, long daysLate, LocalDate date) {
        RentRunItemDTO.RentRunItemDTOBuilder item = RentPaymentMapper.runItem(saved, RunItemStatus.CREATED)
                .daysLate(status == RentPaymentStatus.LATE ? daysLate : null);

        NotificationContext context = status == RentPaymentStatus.LATE
                ? NotificationContext.rentLate(daysLate)
                : NotificationContext.rentDue();
        Notification notification;
        try {
            notification = notificationService.sendRentNotification(saved, context);
        } catch (NotificationDeliveryException e) {
            return item.status(RunItemStatus.FAILED).error(e.getMessage()).build();
        }
        item.notificationId(RentPaymentMapper.notificationId(notification));

        if (status == RentPaymentStatus.LATE) {
            // counts as today's late reminder
            try {
                rentPaymentStore.markReminderSent(saved.getId(), LocalDateTime.of(date, LocalTime.now(clock)));
            } catch (DataAccessException e) {
                log.error("[RentBilling] late notice sent but not stamped on payment={}", saved.getId(), e);
            }
        }
        return item.build();
    }

    private String requestPaymentLink(TenantUnit binding) {
        try {
            return paymentLinkProvider.generateLink(
                    binding.getTenant().getEmail(),
                    binding.getTenant().getFirstName(),
                    binding.getRentAmount(),
                    String.format(billingProperties.paymentMemoTemplate(), binding.getUnit().getUnitNumber())
            );
        } catch (RuntimeException e) {
            log.warn("[RentBilling] no payment link for tenant={}: {}", binding.getTenant().getId(), e.getMessage());
            return null;
        }
    }

    private RentRunItemDTO skipped(TenantUnit binding, LocalDate dueDate, RentPayment existing, String reason) {
        RentRunItemDTO.RentRunItemDTOBuilder item = existing != null
                ? RentPaymentMapper.runItem(existing, RunItemStatus.SKIPPED)
                : RentPaymentMapper.runItem(binding, RunItemStatus.SKIPPED).dueDate(dueDate);
        return item.error(reason).build();
    }

    private RentRunItemDTO missingTerms(TenantUnit binding) {
        log.warn("[RentBilling] primary binding {} has no rent amount or due day, not billed", binding.getId());
        return RentPaymentMapper.runItem(binding, RunItemStatus.FAILED)
                .error("Primary binding has no rent amount or due day")
                .build();
    }

    private void logSummary(RentRunResultDTO result) {
        log.info("[RentBilling] {} run for {}: processed={} created={} skipped={} failed={}",
                result.run(), result.date(), result.processed(), result.created(), result.skipped(), result.failed());
    }
}
