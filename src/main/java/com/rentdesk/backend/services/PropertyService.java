package com.rentdesk.backend.services;

import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.rentdesk.backend.dto.tenant.PropertyRequestDTO;
import com.rentdesk.backend.dto.tenant.PropertyResponseDTO;
import com.rentdesk.backend.dto.tenant.UnitRequestDTO;
import com.rentdesk.backend.dto.tenant.UnitResponseDTO;
import com.rentdesk.backend.entities.Property;
import com.rentdesk.backend.entities.Unit;
import com.rentdesk.backend.exceptions.ResourceNotFoundException;
import com.rentdesk.backend.mappers.TenantMapper;
import com.rentdesk.backend.repositories.PropertyRepository;
import com.rentdesk.backend.repositories.UnitRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class PropertyService {

    private final PropertyRepository propertyRepository;
    private final UnitRepository unitRepository;

    @Transactional
    public PropertyResponseDTO create(PropertyRequestDTO request) {
        return TenantMapper.toPropertyDTO(propertyRepository.save(TenantMapper.toEntity(request)));
    }

    @Transactional(readOnly = true)
    public List<PropertyResponseDTO> findAll() {
        return propertyRepository.findAll().stream()
                .map(TenantMapper::toPropertyDTO)
                .toList();
    }

    @Transactional
    public UnitResponseDTO addUnit(UUID propertyId, UnitRequestDTO request) {
        Property property = loadProperty(propertyId);
        Unit unit = new Unit();
        unit.setProperty(property);
        unit.setUnitNumber(request.unitNumber().trim());
        return TenantMapper.toUnitDTO(unitRepository.save(unit));
    }

    @Transactional(readOnly = true)
    public List<UnitResponseDTO> findUnits(UUID propertyId) {
        loadProperty(propertyId);
        return unitRepository.findByPropertyIdOrderByUnitNumberAsc(propertyId).stream()
                .map(TenantMapper::toUnitDTO)
                .toList();
    }

    private Property loadProperty(UUID id) {
        return propertyRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Property not found: " + id));
    }
}
