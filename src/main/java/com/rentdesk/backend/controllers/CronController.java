package com.rentdesk.backend.controllers;

import com.rentdesk.backend.config.BusinessClock;
import com.rentdesk.backend.dto.ApiResponse;
import com.rentdesk.backend.dto.cron.LateRunResultDTO;
import com.rentdesk.backend.dto.cron.LegalNoticeEligibilityDTO;
import com.rentdesk.backend.dto.cron.RentRunResultDTO;
import com.rentdesk.backend.dto.rent.RentStatusReportDTO;
import com.rentdesk.backend.enums.LegalNoticeTier;
import com.rentdesk.backend.services.LateRentService;
import com.rentdesk.backend.services.RentBillingService;
import com.rentdesk.backend.calendar.RentCalendar;
import com.rentdesk.backend.services.RentPaymentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * Scheduler trigger. External cron services call these endpoints once a day; {@code day} replays a given
 * day of the current month.
 */
@RestController
@RequestMapping("/api/cron")
@RequiredArgsConstructor
public class CronController {

    private final RentBillingService rentBillingService;
    private final LateRentService lateRentService;
    private final RentPaymentService rentPaymentService;
    private final BusinessClock businessClock;

    @PostMapping("/due-rent")
    public ResponseEntity<ApiResponse<RentRunResultDTO>> dueRent(@RequestParam(required = false) Integer day) {
        RentRunResultDTO result = rentBillingService.runDailyBilling(resolveDate(day));
        return ResponseEntity.ok(ApiResponse.success(result, "Processed " + result.processed() + " bindings"));
    }

    @PostMapping("/late-rent")
    public ResponseEntity<ApiResponse<LateRunResultDTO>> lateRent(@RequestParam(required = false) Integer day) {
        LateRunResultDTO result = lateRentService.runLateCycle(resolveDate(day));
        return ResponseEntity.ok(ApiResponse.success(result, "Late rent cycle completed"));
    }

    @GetMapping("/form-n4")
    public ResponseEntity<ApiResponse<List<LegalNoticeEligibilityDTO>>> formN4(@RequestParam(required = false) Integer day) {
        List<LegalNoticeEligibilityDTO> eligible = lateRentService.findNoticeEligibility(LegalNoticeTier.N4, resolveDate(day));
        return ResponseEntity.ok(ApiResponse.success(eligible, eligible.size() + " tenants eligible for N4"));
    }

    @GetMapping("/form-l1")
    public ResponseEntity<ApiResponse<List<LegalNoticeEligibilityDTO>>> formL1(@RequestParam(required = false) Integer day) {
        List<LegalNoticeEligibilityDTO> eligible = lateRentService.findNoticeEligibility(LegalNoticeTier.L1, resolveDate(day));
        return ResponseEntity.ok(ApiResponse.success(eligible, eligible.size() + " tenants eligible for L1"));
    }

    @GetMapping("/rent-status")
    public ResponseEntity<ApiResponse<RentStatusReportDTO>> rentStatus(@RequestParam(required = false) Integer day) {
        RentStatusReportDTO report = rentPaymentService.checkRentStatus(resolveDate(day));
        return ResponseEntity.ok(ApiResponse.success(report, "Rent status"));
    }

    private LocalDate resolveDate(Integer day) {
        return RentCalendar.withDayOverride(businessClock.today(), day);
    }
}
