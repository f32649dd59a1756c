package com.rentdesk.backend.services;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Rent terms sent with a primary-unit assignment. Lease dates are plain values: {@code null} keeps the
 * stored date.
 */
public record RentTermsPatch(
        FieldPatch<BigDecimal> rentAmount,
        FieldPatch<Integer> rentDueDay,
        LocalDate leaseStartDate,
        LocalDate leaseEndDate
) {
    public RentTermsPatch {
        if (rentAmount == null) {
            rentAmount = FieldPatch.omitted();
        }
        if (rentDueDay == null) {
            rentDueDay = FieldPatch.omitted();
        }
    }

    public static RentTermsPatch of(FieldPatch<BigDecimal> rentAmount, FieldPatch<Integer> rentDueDay) {
        return new RentTermsPatch(rentAmount, rentDueDay, null, null);
    }

    public static RentTermsPatch unchanged() {
        return new RentTermsPatch(null, null, null, null);
    }
}
