package com.rentdesk.backend.controllers;

import com.rentdesk.backend.dto.ApiResponse;
import com.rentdesk.backend.dto.tenant.PropertyRequestDTO;
import com.rentdesk.backend.dto.tenant.PropertyResponseDTO;
import com.rentdesk.backend.dto.tenant.UnitRequestDTO;
import com.rentdesk.backend.dto.tenant.UnitResponseDTO;
import com.rentdesk.backend.services.PropertyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/properties")
@RequiredArgsConstructor
public class PropertyController {

    private final PropertyService propertyService;

    @PostMapping
    public ResponseEntity<ApiResponse<PropertyResponseDTO>> create(@Valid @RequestBody PropertyRequestDTO dto) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(propertyService.create(dto), "Property created"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<PropertyResponseDTO>>> findAll() {
        return ResponseEntity.ok(ApiResponse.success(propertyService.findAll(), "Properties"));
    }

    @PostMapping("/{propertyId}/units")
    public ResponseEntity<ApiResponse<UnitResponseDTO>> addUnit(
            @PathVariable UUID propertyId,
            @Valid @RequestBody UnitRequestDTO dto
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(propertyService.addUnit(propertyId, dto), "Unit created"));
    }

    @GetMapping("/{propertyId}/units")
    public ResponseEntity<ApiResponse<List<UnitResponseDTO>>> findUnits(@PathVariable UUID propertyId) {
        return ResponseEntity.ok(ApiResponse.success(propertyService.findUnits(propertyId), "Units"));
    }
}
