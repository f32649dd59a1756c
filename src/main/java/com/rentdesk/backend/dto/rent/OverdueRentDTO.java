package com.rentdesk.backend.dto.rent;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A primary binding whose rent for the current month is due but has no obligation yet.
 */
public record OverdueRentDTO(
        String tenantId,
        String tenantName,
        String unitId,
        String unitNumber,
        String propertyName,
        BigDecimal rentAmount,
        LocalDate dueDate,
        long daysPastDue
) {
}
