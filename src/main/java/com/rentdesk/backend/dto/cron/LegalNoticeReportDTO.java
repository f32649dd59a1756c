package com.rentdesk.backend.dto.cron;

import java.time.LocalDate;
import java.util.List;

public record LegalNoticeReportDTO(
        LocalDate date,
        List<LegalNoticeEligibilityDTO> firstTier,
        List<LegalNoticeEligibilityDTO> secondTier
) {
}
