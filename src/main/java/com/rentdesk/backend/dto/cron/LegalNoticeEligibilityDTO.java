package com.rentdesk.backend.dto.cron;

import com.rentdesk.backend.enums.LegalNoticeTier;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A late obligation that qualifies for a legal notice form.
 */
public record LegalNoticeEligibilityDTO(
        LegalNoticeTier tier,
        String paymentId,
        String tenantId,
        String tenantName,
        String unitId,
        String unitNumber,
        BigDecimal amount,
        LocalDate dueDate,
        long daysLate
) {
}
