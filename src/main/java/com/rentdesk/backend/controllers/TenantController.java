package com.rentdesk.backend.controllers;

import com.rentdesk.backend.dto.ApiResponse;
import com.rentdesk.backend.dto.tenant.AssignPrimaryUnitRequestDTO;
import com.rentdesk.backend.dto.tenant.ResolveHoldRequestDTO;
import com.rentdesk.backend.dto.tenant.TenantRequestDTO;
import com.rentdesk.backend.dto.tenant.TenantResponseDTO;
import com.rentdesk.backend.dto.tenant.TenantUnitResponseDTO;
import com.rentdesk.backend.dto.tenant.TenantUpdateRequestDTO;
import com.rentdesk.backend.entities.TenantUnit;
import com.rentdesk.backend.mappers.TenantMapper;
import com.rentdesk.backend.services.FieldPatch;
import com.rentdesk.backend.services.RentTermsPatch;
import com.rentdesk.backend.services.TenantService;
import com.rentdesk.backend.services.TenantUnitReconciler;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/tenants")
@RequiredArgsConstructor
public class TenantController {

    private final TenantService tenantService;
    private final TenantUnitReconciler tenantUnitReconciler;

    @PostMapping
    public ResponseEntity<ApiResponse<TenantResponseDTO>> create(@Valid @RequestBody TenantRequestDTO dto) {
        TenantResponseDTO created = tenantService.create(dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Tenant created"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<TenantResponseDTO>>> findAll() {
        return ResponseEntity.ok(ApiResponse.success(tenantService.findAll(), "Tenants"));
    }

    @GetMapping("/{tenantId}")
    public ResponseEntity<ApiResponse<TenantResponseDTO>> findById(@PathVariable UUID tenantId) {
        return ResponseEntity.ok(ApiResponse.success(tenantService.findById(tenantId), "Tenant found"));
    }

    @PatchMapping("/{tenantId}")
    public ResponseEntity<ApiResponse<TenantResponseDTO>> update(
            @PathVariable UUID tenantId,
            @Valid @RequestBody TenantUpdateRequestDTO dto
    ) {
        return ResponseEntity.ok(ApiResponse.success(tenantService.update(tenantId, dto), "Tenant updated"));
    }

    @PutMapping("/{tenantId}/primary-unit")
    public ResponseEntity<ApiResponse<TenantUnitResponseDTO>> assignPrimaryUnit(
            @PathVariable UUID tenantId,
            @Valid @RequestBody AssignPrimaryUnitRequestDTO dto
    ) {
        RentTermsPatch terms = new RentTermsPatch(
                FieldPatch.fromRequest(dto.getRentAmount()),
                FieldPatch.fromRequest(dto.getRentDueDay()),
                dto.getLeaseStartDate(),
                dto.getLeaseEndDate()
        );
        TenantUnit binding = tenantUnitReconciler.assignPrimaryBinding(tenantId, dto.getUnitId(), terms);
        return ResponseEntity.ok(ApiResponse.success(TenantMapper.toBindingDTO(binding), "Primary unit assigned"));
    }

    @PostMapping("/{tenantId}/primary-unit/resolve")
    public ResponseEntity<ApiResponse<TenantUnitResponseDTO>> resolveHold(
            @PathVariable UUID tenantId,
            @Valid @RequestBody ResolveHoldRequestDTO dto
    ) {
        TenantUnit binding = tenantUnitReconciler.resolveConsistencyHold(tenantId, dto.unitId());
        return ResponseEntity.ok(ApiResponse.success(TenantMapper.toBindingDTO(binding), "Reconciliation hold resolved"));
    }
}
