package com.rentdesk.backend.controllers;

import com.rentdesk.backend.dto.ApiResponse;
import com.rentdesk.backend.dto.rent.NotificationResponseDTO;
import com.rentdesk.backend.dto.rent.RecordPaymentRequestDTO;
import com.rentdesk.backend.dto.rent.RentPaymentRequestDTO;
import com.rentdesk.backend.dto.rent.RentPaymentResponseDTO;
import com.rentdesk.backend.services.RentPaymentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/rent")
@RequiredArgsConstructor
public class RentPaymentController {

    private final RentPaymentService rentPaymentService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<RentPaymentResponseDTO>>> findAll() {
        return ResponseEntity.ok(ApiResponse.success(rentPaymentService.findAll(), "Rent payments"));
    }

    @GetMapping("/open")
    public ResponseEntity<ApiResponse<List<RentPaymentResponseDTO>>> findOpen() {
        return ResponseEntity.ok(ApiResponse.success(rentPaymentService.findOpen(), "Open rent payments"));
    }

    @GetMapping("/tenant/{tenantId}")
    public ResponseEntity<ApiResponse<List<RentPaymentResponseDTO>>> findByTenant(@PathVariable UUID tenantId) {
        return ResponseEntity.ok(ApiResponse.success(rentPaymentService.findByTenant(tenantId), "Rent payments of tenant"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<RentPaymentResponseDTO>> findById(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(rentPaymentService.findById(id), "Rent payment found"));
    }

    @GetMapping("/{id}/notifications")
    public ResponseEntity<ApiResponse<List<NotificationResponseDTO>>> findNotifications(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(rentPaymentService.findNotifications(id), "Notifications of rent payment"));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<RentPaymentResponseDTO>> create(@Valid @RequestBody RentPaymentRequestDTO dto) {
        RentPaymentResponseDTO created = rentPaymentService.create(dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Rent payment created"));
    }

    @PostMapping("/{id}/payments")
    public ResponseEntity<ApiResponse<RentPaymentResponseDTO>> recordPayment(
            @PathVariable UUID id,
            @Valid @RequestBody RecordPaymentRequestDTO dto
    ) {
        RentPaymentResponseDTO updated = rentPaymentService.recordPayment(id, dto);
        return ResponseEntity.ok(ApiResponse.success(updated, "Payment recorded"));
    }
}
