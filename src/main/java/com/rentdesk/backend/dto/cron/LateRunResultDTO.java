package com.rentdesk.backend.dto.cron;

import java.time.LocalDate;
import java.util.List;

public record LateRunResultDTO(
        LocalDate date,
        List<RentRunItemDTO> transitioned,
        List<RentRunItemDTO> reminders,
        int firstTierEligible,
        int secondTierEligible
) {
}
