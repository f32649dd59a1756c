package com.rentdesk.backend.dto.tenant;

import jakarta.validation.constraints.NotBlank;

public record UnitRequestDTO(
        @NotBlank(message = "unitNumber is required") String unitNumber
) {
}
