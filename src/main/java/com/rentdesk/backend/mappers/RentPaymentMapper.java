package com.rentdesk.backend.mappers;

import static com.rentdesk.backend.mappers.MappingSupport.idOf;
import static com.rentdesk.backend.mappers.MappingSupport.required;

import com.rentdesk.backend.calendar.RentCalendar;
import com.rentdesk.backend.dto.cron.LegalNoticeEligibilityDTO;
import com.rentdesk.backend.dto.cron.RentRunItemDTO;
import com.rentdesk.backend.dto.rent.NotificationResponseDTO;
import com.rentdesk.backend.dto.rent.RentPaymentRequestDTO;
import com.rentdesk.backend.dto.rent.RentPaymentResponseDTO;
import com.rentdesk.backend.entities.Notification;
import com.rentdesk.backend.entities.RentPayment;
import com.rentdesk.backend.entities.Tenant;
import com.rentdesk.backend.entities.TenantUnit;
import com.rentdesk.backend.entities.Unit;
import com.rentdesk.backend.enums.LegalNoticeTier;
import com.rentdesk.backend.enums.RentPaymentStatus;
import com.rentdesk.backend.enums.RunItemStatus;

public class RentPaymentMapper {

    private static final String ENTITY = "RentPayment";

    private RentPaymentMapper() {}

    public static RentPayment toEntity(RentPaymentRequestDTO dto, Tenant tenant, Unit unit) {
        return RentPayment.builder()
                .tenant(tenant)
                .unit(unit)
                .amount(dto.getAmount())
                .dueDate(dto.getDueDate())
                .billingPeriod(RentCalendar.periodStart(dto.getDueDate()))
                .status(dto.getStatus() != null ? dto.getStatus() : RentPaymentStatus.PENDING)
                .paymentMethod(dto.getPaymentMethod())
                .paymentLink(dto.getPaymentLink())
                .build();
    }

    public static RentPaymentResponseDTO toResponseDTO(RentPayment entity) {
        Tenant tenant = required(entity.getTenant(), ENTITY, "tenant");
        Unit unit = required(entity.getUnit(), ENTITY, "unit");

        RentPaymentResponseDTO dto = new RentPaymentResponseDTO();
        dto.setId(idOf(entity.getId(), ENTITY));
        dto.setTenantId(idOf(tenant.getId(), "Tenant"));
        dto.setTenantName(tenant.fullName());
        dto.setUnitId(idOf(unit.getId(), "Unit"));
        dto.setUnitNumber(unit.getUnitNumber());
        dto.setAmount(required(entity.getAmount(), ENTITY, "amount"));
        dto.setDueDate(required(entity.getDueDate(), ENTITY, "dueDate"));
        dto.setPaymentDate(entity.getPaymentDate());
        dto.setStatus(required(entity.getStatus(), ENTITY, "status"));
        dto.setPaymentMethod(entity.getPaymentMethod());
        dto.setPaymentLink(entity.getPaymentLink());
        dto.setLastReminderAt(entity.getLastReminderAt());
        dto.setCreatedAt(entity.getCreatedAt());
        return dto;
    }

    public static LegalNoticeEligibilityDTO toEligibilityDTO(RentPayment entity, LegalNoticeTier tier, long daysLate) {
        Tenant tenant = required(entity.getTenant(), ENTITY, "tenant");
        Unit unit = required(entity.getUnit(), ENTITY, "unit");
        return new LegalNoticeEligibilityDTO(
                tier,
                idOf(entity.getId(), ENTITY),
                idOf(tenant.getId(), "Tenant"),
                tenant.fullName(),
                idOf(unit.getId(), "Unit"),
                unit.getUnitNumber(),
                required(entity.getAmount(), ENTITY, "amount"),
                required(entity.getDueDate(), ENTITY, "dueDate"),
                daysLate
        );
    }

    /**
     * Run item for an obligation, with the status and error left for the caller.
     */
    public static RentRunItemDTO.RentRunItemDTOBuilder runItem(RentPayment entity, RunItemStatus status) {
        Tenant tenant = required(entity.getTenant(), ENTITY, "tenant");
        Unit unit = required(entity.getUnit(), ENTITY, "unit");
        return RentRunItemDTO.builder()
                .status(status)
                .tenantId(idOf(tenant.getId(), "Tenant"))
                .tenantName(tenant.fullName())
                .unitId(idOf(unit.getId(), "Unit"))
                .unitNumber(unit.getUnitNumber())
                .paymentId(MappingSupport.nullableId(entity.getId()))
                .paymentStatus(entity.getStatus())
                .amount(entity.getAmount())
                .dueDate(entity.getDueDate());
    }

    /**
     * Run item for a binding that has no obligation yet.
     */
    public static RentRunItemDTO.RentRunItemDTOBuilder runItem(TenantUnit binding, RunItemStatus status) {
        Tenant tenant = required(binding.getTenant(), "TenantUnit", "tenant");
        Unit unit = required(binding.getUnit(), "TenantUnit", "unit");
        return RentRunItemDTO.builder()
                .status(status)
                .tenantId(idOf(tenant.getId(), "Tenant"))
                .tenantName(tenant.fullName())
                .unitId(idOf(unit.getId(), "Unit"))
                .unitNumber(unit.getUnitNumber())
                .amount(binding.getRentAmount());
    }

    public static String notificationId(Notification notification) {
        return notification == null ? null : MappingSupport.nullableId(notification.getId());
    }

    public static NotificationResponseDTO toNotificationDTO(Notification entity) {
        NotificationResponseDTO dto = new NotificationResponseDTO();
        dto.setId(idOf(entity.getId(), "Notification"));
        dto.setPaymentId(MappingSupport.nullableId(entity.getPaymentId()));
        dto.setType(required(entity.getType(), "Notification", "type"));
        dto.setChannel(entity.getChannel());
        dto.setStatus(required(entity.getStatus(), "Notification", "status"));
        dto.setMessageId(entity.getMessageId());
        dto.setErrorMessage(entity.getErrorMessage());
        dto.setSentAt(entity.getSentAt());
        dto.setCreatedAt(entity.getCreatedAt());
        return dto;
    }
}
