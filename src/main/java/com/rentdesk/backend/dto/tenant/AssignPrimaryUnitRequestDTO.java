package com.rentdesk.backend.dto.tenant;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Body of a primary-unit assignment.
 *
 * <p>Rent fields are three-state: a missing property leaves the stored value unchanged (the field
 * stays {@code null}), an explicit JSON {@code null} clears it ({@code Optional.empty()}), and a value
 * sets it.
 */
@Data
public class AssignPrimaryUnitRequestDTO {

    @NotNull(message = "unitId is required")
    private UUID unitId;

    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    private Optional<BigDecimal> rentAmount;

    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    private Optional<Integer> rentDueDay;

    private LocalDate leaseStartDate;

    private LocalDate leaseEndDate;
}
