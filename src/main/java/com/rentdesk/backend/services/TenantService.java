package com.rentdesk.backend.services;

import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.rentdesk.backend.dto.tenant.TenantRequestDTO;
import com.rentdesk.backend.dto.tenant.TenantResponseDTO;
import com.rentdesk.backend.dto.tenant.TenantUpdateRequestDTO;
import com.rentdesk.backend.entities.Tenant;
import com.rentdesk.backend.mappers.TenantMapper;
import com.rentdesk.backend.repositories.TenantRepository;
import com.rentdesk.backend.store.TenantUnitStore;
import com.rentdesk.backend.exceptions.BadRequestException;
import com.rentdesk.backend.exceptions.ResourceNotFoundException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class TenantService {

    private final TenantRepository tenantRepository;
    private final TenantUnitStore tenantUnitStore;

    @Transactional
    public TenantResponseDTO create(TenantRequestDTO request) {
        Tenant saved = tenantRepository.save(TenantMapper.toEntity(request));
        return TenantMapper.toResponseDTO(saved, List.of());
    }

    @Transactional
    public TenantResponseDTO update(UUID id, TenantUpdateRequestDTO request) {
        Tenant tenant = load(id);

        if (request.getFirstName() != null) {
            tenant.setFirstName(requireText(request.getFirstName(), "firstName"));
        }
        if (request.getLastName() != null) {
            tenant.setLastName(requireText(request.getLastName(), "lastName"));
        }
        if (request.getPhone() != null) {
            tenant.setPhone(requireText(request.getPhone(), "phone"));
        }
        if (request.getEmail() != null) {
            tenant.setEmail(request.getEmail().isBlank() ? null : request.getEmail().trim());
        }

        Tenant saved = tenantRepository.save(tenant);
        log.info("[Tenant] tenant {} updated", id);
        return TenantMapper.toResponseDTO(saved, tenantUnitStore.listBindings(id));
    }

    @Transactional(readOnly = true)
    public TenantResponseDTO findById(UUID id) {
        Tenant tenant = load(id);
        return TenantMapper.toResponseDTO(tenant, tenantUnitStore.listBindings(id));
    }

    @Transactional(readOnly = true)
    public List<TenantResponseDTO> findAll() {
        return tenantRepository.findAll().stream()
                .map(tenant -> TenantMapper.toResponseDTO(tenant, tenantUnitStore.listBindings(tenant.getId())))
                .toList();
    }

    private Tenant load(UUID id) {
        return tenantRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Tenant not found: " + id));
    }

    private static String requireText(String value, String field) {
        if (value.isBlank()) {
            throw new BadRequestException(field + " must not be blank");
        }
        return value.trim();
    }
}
