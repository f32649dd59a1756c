package com.rentdesk.backend.dto.tenant;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class TenantUnitResponseDTO {

    private String id;
    private String tenantId;
    private String unitId;
    private String unitNumber;
    private String propertyId;
    private String propertyName;

    private BigDecimal rentAmount;
    private Integer rentDueDay;
    private boolean primary;

    private LocalDate leaseStartDate;
    private LocalDate leaseEndDate;
}
