package com.rentdesk.backend.dto.rent;

import com.rentdesk.backend.enums.RentPaymentStatus;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
public class RentPaymentResponseDTO {

    private String id;
    private String tenantId;
    private String tenantName;
    private String unitId;
    private String unitNumber;

    private BigDecimal amount;
    private LocalDate dueDate;
    private LocalDate paymentDate;
    private RentPaymentStatus status;
    private String paymentMethod;
    private String paymentLink;

    private LocalDateTime lastReminderAt;
    private LocalDateTime createdAt;
}
