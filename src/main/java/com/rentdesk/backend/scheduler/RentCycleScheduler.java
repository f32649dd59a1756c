package com.rentdesk.backend.scheduler;

import com.rentdesk.backend.config.BusinessClock;
import com.rentdesk.backend.dto.cron.LateRunResultDTO;
import com.rentdesk.backend.dto.cron.RentRunResultDTO;
import com.rentdesk.backend.services.LateRentService;
import com.rentdesk.backend.services.RentBillingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * In-process trigger for the daily rent runs, for deployments without an external cron calling
 * {@code /api/cron}. Off by default.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "rentdesk.scheduler", name = "enabled", havingValue = "true")
public class RentCycleScheduler {

    private final RentBillingService rentBillingService;
    private final LateRentService lateRentService;
    private final BusinessClock businessClock;

    @Scheduled(cron = "${rentdesk.scheduler.due-rent-cron:0 0 7 * * *}", zone = "${rentdesk.billing.zone-id:America/Toronto}")
    public void runDueRent() {
        LocalDate today = businessClock.today();
        try {
            RentRunResultDTO result = rentBillingService.runDailyBilling(today);
            log.info("[Scheduler] due-rent {} finished: created={} failed={}", today, result.created(), result.failed());
        } catch (RuntimeException e) {
            log.error("[Scheduler] due-rent run for {} aborted", today, e);
        }
    }

    @Scheduled(cron = "${rentdesk.scheduler.late-rent-cron:0 0 9 * * *}", zone = "${rentdesk.billing.zone-id:America/Toronto}")
    public void runLateRent() {
        LocalDate today = businessClock.today();
        try {
            LateRunResultDTO result = lateRentService.runLateCycle(today);
            log.info("[Scheduler] late-rent {} finished: transitioned={} reminders={} n4={} l1={}",
                    today, result.transitioned().size(), result.reminders().size(),
                    result.firstTierEligible(), result.secondTierEligible());
        } catch (RuntimeException e) {
            log.error("[Scheduler] late-rent run for {} aborted", today, e);
        }
    }
}
