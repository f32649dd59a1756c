package com.rentdesk.backend.dto.cron;

import com.rentdesk.backend.enums.RunItemStatus;

import java.time.LocalDate;
import java.util.List;

public record RentRunResultDTO(
        String run,
        LocalDate date,
        int processed,
        long created,
        long skipped,
        long failed,
        List<RentRunItemDTO> results
) {

    public static RentRunResultDTO of(String run, LocalDate date, List<RentRunItemDTO> results) {
        return new RentRunResultDTO(
                run,
                date,
                results.size(),
                count(results, RunItemStatus.CREATED),
                count(results, RunItemStatus.SKIPPED),
                count(results, RunItemStatus.FAILED),
                List.copyOf(results)
        );
    }

    private static long count(List<RentRunItemDTO> results, RunItemStatus status) {
        return results.stream().filter(r -> r.getStatus() == status).count();
    }
}
