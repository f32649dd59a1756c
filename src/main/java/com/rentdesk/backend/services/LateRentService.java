package com.rentdesk.backend.services;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.rentdesk.backend.calendar.RentCalendar;
import com.rentdesk.backend.config.RentBillingProperties;
import com.rentdesk.backend.dto.cron.LateRunResultDTO;
import com.rentdesk.backend.dto.cron.LegalNoticeEligibilityDTO;
import com.rentdesk.backend.dto.cron.LegalNoticeReportDTO;
import com.rentdesk.backend.dto.cron.RentRunItemDTO;
import com.rentdesk.backend.entities.Notification;
import com.rentdesk.backend.entities.RentPayment;
import com.rentdesk.backend.enums.LegalNoticeTier;
import com.rentdesk.backend.enums.RentPaymentStatus;
import com.rentdesk.backend.enums.RunItemStatus;
import com.rentdesk.backend.exceptions.NotificationDeliveryException;
import com.rentdesk.backend.integration.NotificationContext;
import com.rentdesk.backend.mappers.RentPaymentMapper;
import com.rentdesk.backend.store.RentPaymentStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves overdue obligations to LATE, reminds tenants, and reports which late obligations qualify for
 * an N4 notice or an L1 application.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LateRentService {

    private final RentPaymentStore rentPaymentStore;
    private final NotificationService notificationService;
    private final RentBillingProperties billingProperties;
    private final Clock clock;

    public List<RentRunItemDTO> markOverduePaymentsLate(LocalDate today) {
        List<RentRunItemDTO> results = new ArrayList<>();
        for (RentPayment payment : rentPaymentStore.listObligationsByStatus(RentPaymentStatus.PENDING)) {
            if (!payment.getDueDate().isBefore(today)) {
                continue;
            }
            long daysLate = RentCalendar.daysLate(payment.getDueDate(), today);
            try {
                Optional<RentPayment> updated =
                        rentPaymentStore.updateObligationStatus(payment.getId(), RentPaymentStatus.LATE, null);
                results.add(RentPaymentMapper.runItem(payment, updated.isPresent() ? RunItemStatus.TRANSITIONED : RunItemStatus.SKIPPED)
                        .paymentStatus(updated.map(RentPayment::getStatus).orElse(null))
                        .daysLate(daysLate)
                        .build());
            } catch (RuntimeException e) {
                log.error("[LateRent] could not mark payment={} late", payment.getId(), e);
                results.add(RentPaymentMapper.runItem(payment, RunItemStatus.FAILED)
                        .daysLate(daysLate)
                        .error(e.getMessage())
                        .build());
            }
        }
        log.info("[LateRent] {} obligations marked late on {}",
                results.stream().filter(r -> r.getStatus() == RunItemStatus.TRANSITIONED).count(), today);
        return results;
    }

    /**
     * Reminds tenants of LATE obligations that are not yet notice-eligible, at most once per obligation
     * per day.
     */
    public List<RentRunItemDTO> sendLateReminders(LocalDate today) {
        List<RentRunItemDTO> results = new ArrayList<>();
        for (RentPayment payment : rentPaymentStore.listObligationsByStatus(RentPaymentStatus.LATE)) {
            long daysLate = RentCalendar.daysLate(payment.getDueDate(), today);
            if (!NoticeEligibility.evaluate(daysLate, billingProperties).inReminderWindow()) {
                continue;
            }
            if (remindedOn(payment, today)) {
                results.add(RentPaymentMapper.runItem(payment, RunItemStatus.SKIPPED)
                        .daysLate(daysLate)
                        .error("Reminder already sent today")
                        .build());
                continue;
            }

            Notification notification;
            try {
                notification = notificationService.sendRentNotification(payment, NotificationContext.rentLate(daysLate));
            } catch (NotificationDeliveryException e) {
                results.add(RentPaymentMapper.runItem(payment, RunItemStatus.FAILED)
                        .daysLate(daysLate)
                        .error(e.getMessage())
                        .build());
                continue;
            } catch (RuntimeException e) {
                log.error("[LateRent] reminder failed for payment={}", payment.getId(), e);
                results.add(RentPaymentMapper.runItem(payment, RunItemStatus.FAILED)
                        .daysLate(daysLate)
                        .error(e.getMessage())
                        .build());
                continue;
            }

            recordReminder(payment, today);
            results.add(RentPaymentMapper.runItem(payment, RunItemStatus.NOTIFIED)
                    .daysLate(daysLate)
                    .notificationId(RentPaymentMapper.notificationId(notification))
                    .build());
        }
        log.info("[LateRent] late reminders on {}: {} sent",
                today, results.stream().filter(r -> r.getStatus() == RunItemStatus.NOTIFIED).count());
        return results;
    }

    public LegalNoticeReportDTO findNoticeEligibility(LocalDate today) {
        List<LegalNoticeEligibilityDTO> firstTier = new ArrayList<>();
        List<LegalNoticeEligibilityDTO> secondTier = new ArrayList<>();
        for (RentPayment payment : rentPaymentStore.listObligationsByStatus(RentPaymentStatus.LATE)) {
            NoticeEligibility eligibility =
                    NoticeEligibility.evaluate(RentCalendar.daysLate(payment.getDueDate(), today), billingProperties);
            if (eligibility.firstTier()) {
                firstTier.add(RentPaymentMapper.toEligibilityDTO(payment, LegalNoticeTier.N4, eligibility.daysLate()));
            }
            if (eligibility.secondTier()) {
                secondTier.add(RentPaymentMapper.toEligibilityDTO(payment, LegalNoticeTier.L1, eligibility.daysLate()));
            }
        }
        return new LegalNoticeReportDTO(today, firstTier, secondTier);
    }

    public List<LegalNoticeEligibilityDTO> findNoticeEligibility(LegalNoticeTier tier, LocalDate today) {
        LegalNoticeReportDTO report = findNoticeEligibility(today);
        return tier == LegalNoticeTier.N4 ? report.firstTier() : report.secondTier();
    }

    public LateRunResultDTO runLateCycle(LocalDate today) {
        List<RentRunItemDTO> transitioned = markOverduePaymentsLate(today);
        List<RentRunItemDTO> reminders = sendLateReminders(today);
        LegalNoticeReportDTO notices = findNoticeEligibility(today);
        return new LateRunResultDTO(
                today,
                transitioned,
                reminders,
                notices.firstTier().size(),
                notices.secondTier().size()
        );
    }

    private void recordReminder(RentPayment payment, LocalDate today) {
        try {
            rentPaymentStore.markReminderSent(payment.getId(), LocalDateTime.of(today, LocalTime.now(clock)));
        } catch (DataAccessException e) {
            log.error("[LateRent] reminder sent but not stamped on payment={}", payment.getId(), e);
        }
    }

    private boolean remindedOn(RentPayment payment, LocalDate day) {
        return payment.getLastReminderAt() != null && payment.getLastReminderAt().toLocalDate().equals(day);
    }
}
