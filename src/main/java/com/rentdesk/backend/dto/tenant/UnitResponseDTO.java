package com.rentdesk.backend.dto.tenant;

public record UnitResponseDTO(
        String id,
        String unitNumber,
        String propertyId,
        String propertyName
) {
}
