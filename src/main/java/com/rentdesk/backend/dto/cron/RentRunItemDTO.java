package com.rentdesk.backend.dto.cron;

import com.rentdesk.backend.enums.RentPaymentStatus;
import com.rentdesk.backend.enums.RunItemStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Outcome of one binding or obligation in a rent run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RentRunItemDTO {

    private RunItemStatus status;

    private String tenantId;
    private String tenantName;
    private String unitId;
    private String unitNumber;

    private String paymentId;
    private RentPaymentStatus paymentStatus;
    private BigDecimal amount;
    private LocalDate dueDate;
    private Long daysLate;

    private String notificationId;
    private String error;
}
