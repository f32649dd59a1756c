package com.rentdesk.backend.dto.rent;

import com.rentdesk.backend.enums.RentPaymentStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;

@Data
public class RecordPaymentRequestDTO {

    /**
     * PAID or PARTIAL.
     */
    @NotNull(message = "status is required")
    private RentPaymentStatus status;

    /**
     * Defaults to today.
     */
    private LocalDate paymentDate;

    private String paymentMethod;
}
