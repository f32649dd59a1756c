package com.rentdesk.backend.dto.tenant;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
public class TenantResponseDTO {

    private String id;
    private String firstName;
    private String lastName;
    private String email;
    private String phone;

    private boolean reconciliationHold;
    private String reconciliationHoldReason;

    private TenantUnitResponseDTO primaryUnit;
    private List<TenantUnitResponseDTO> units;

    private LocalDateTime createdAt;
}
