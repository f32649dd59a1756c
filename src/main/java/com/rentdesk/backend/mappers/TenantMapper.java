package com.rentdesk.backend.mappers;

import static com.rentdesk.backend.mappers.MappingSupport.idOf;
import static com.rentdesk.backend.mappers.MappingSupport.required;

import java.time.LocalDate;
import java.util.List;

import com.rentdesk.backend.dto.rent.OverdueRentDTO;
import com.rentdesk.backend.dto.tenant.PropertyRequestDTO;
import com.rentdesk.backend.dto.tenant.PropertyResponseDTO;
import com.rentdesk.backend.dto.tenant.TenantRequestDTO;
import com.rentdesk.backend.dto.tenant.TenantResponseDTO;
import com.rentdesk.backend.dto.tenant.TenantUnitResponseDTO;
import com.rentdesk.backend.dto.tenant.UnitResponseDTO;
import com.rentdesk.backend.entities.Property;
import com.rentdesk.backend.entities.Tenant;
import com.rentdesk.backend.entities.TenantUnit;
import com.rentdesk.backend.entities.Unit;

public class TenantMapper {

    private TenantMapper() {}

    public static Tenant toEntity(TenantRequestDTO dto) {
        Tenant tenant = new Tenant();
        tenant.setFirstName(dto.getFirstName().trim());
        tenant.setLastName(dto.getLastName().trim());
        tenant.setEmail(dto.getEmail() != null && !dto.getEmail().isBlank() ? dto.getEmail().trim() : null);
        tenant.setPhone(dto.getPhone().trim());
        return tenant;
    }

    public static TenantResponseDTO toResponseDTO(Tenant tenant, List<TenantUnit> bindings) {
        TenantResponseDTO dto = new TenantResponseDTO();
        dto.setId(idOf(tenant.getId(), "Tenant"));
        dto.setFirstName(required(tenant.getFirstName(), "Tenant", "firstName"));
        dto.setLastName(required(tenant.getLastName(), "Tenant", "lastName"));
        dto.setEmail(tenant.getEmail());
        dto.setPhone(tenant.getPhone());
        dto.setReconciliationHold(tenant.isReconciliationHold());
        dto.setReconciliationHoldReason(tenant.getReconciliationHoldReason());
        dto.setCreatedAt(tenant.getCreatedAt());

        List<TenantUnitResponseDTO> units = bindings.stream().map(TenantMapper::toBindingDTO).toList();
        dto.setUnits(units);
        dto.setPrimaryUnit(units.stream().filter(TenantUnitResponseDTO::isPrimary).findFirst().orElse(null));
        return dto;
    }

    public static TenantUnitResponseDTO toBindingDTO(TenantUnit binding) {
        Tenant tenant = required(binding.getTenant(), "TenantUnit", "tenant");
        Unit unit = required(binding.getUnit(), "TenantUnit", "unit");
        Property property = required(unit.getProperty(), "Unit", "property");

        TenantUnitResponseDTO dto = new TenantUnitResponseDTO();
        dto.setId(idOf(binding.getId(), "TenantUnit"));
        dto.setTenantId(idOf(tenant.getId(), "Tenant"));
        dto.setUnitId(idOf(unit.getId(), "Unit"));
        dto.setUnitNumber(unit.getUnitNumber());
        dto.setPropertyId(idOf(property.getId(), "Property"));
        dto.setPropertyName(property.getName());
        dto.setRentAmount(binding.getRentAmount());
        dto.setRentDueDay(binding.getRentDueDay());
        dto.setPrimary(binding.isPrimary());
        dto.setLeaseStartDate(binding.getLeaseStartDate());
        dto.setLeaseEndDate(binding.getLeaseEndDate());
        return dto;
    }

    public static OverdueRentDTO toOverdueDTO(TenantUnit binding, LocalDate dueDate, long daysPastDue) {
        Tenant tenant = required(binding.getTenant(), "TenantUnit", "tenant");
        Unit unit = required(binding.getUnit(), "TenantUnit", "unit");
        Property property = required(unit.getProperty(), "Unit", "property");
        return new OverdueRentDTO(
                idOf(tenant.getId(), "Tenant"),
                tenant.fullName(),
                idOf(unit.getId(), "Unit"),
                unit.getUnitNumber(),
                property.getName(),
                required(binding.getRentAmount(), "TenantUnit", "rentAmount"),
                dueDate,
                daysPastDue
        );
    }

    public static Property toEntity(PropertyRequestDTO dto) {
        Property property = new Property();
        property.setName(dto.getName().trim());
        property.setAddress(dto.getAddress().trim());
        property.setCity(dto.getCity().trim());
        property.setProvince(dto.getProvince().trim());
        property.setPostalCode(dto.getPostalCode().trim());
        return property;
    }

    public static PropertyResponseDTO toPropertyDTO(Property property) {
        PropertyResponseDTO dto = new PropertyResponseDTO();
        dto.setId(idOf(property.getId(), "Property"));
        dto.setName(property.getName());
        dto.setAddress(property.getAddress());
        dto.setCity(property.getCity());
        dto.setProvince(property.getProvince());
        dto.setPostalCode(property.getPostalCode());
        return dto;
    }

    public static UnitResponseDTO toUnitDTO(Unit unit) {
        Property property = required(unit.getProperty(), "Unit", "property");
        return new UnitResponseDTO(
                idOf(unit.getId(), "Unit"),
                required(unit.getUnitNumber(), "Unit", "unitNumber"),
                idOf(property.getId(), "Property"),
                property.getName()
        );
    }
}
