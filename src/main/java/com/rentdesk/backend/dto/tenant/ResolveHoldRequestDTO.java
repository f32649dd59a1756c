package com.rentdesk.backend.dto.tenant;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * Names the binding that stays primary when a reconciliation hold is lifted.
 */
public record ResolveHoldRequestDTO(
        @NotNull(message = "unitId is required") UUID unitId
) {
}
