package com.rentdesk.backend.dto.rent;

import com.rentdesk.backend.enums.RentPaymentStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Manual creation of a rent obligation. Normally obligations come from the daily billing run.
 */
@Data
public class RentPaymentRequestDTO {

    @NotNull(message = "tenantId is required")
    private UUID tenantId;

    @NotNull(message = "unitId is required")
    private UUID unitId;

    @NotNull(message = "amount is required")
    @DecimalMin(value = "0.01", message = "amount must be greater than zero")
    private BigDecimal amount;

    @NotNull(message = "dueDate is required")
    private LocalDate dueDate;

    private RentPaymentStatus status;

    private String paymentMethod;

    private String paymentLink;
}
