package com.rentdesk.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.rentdesk.backend.TestFixtures;
import com.rentdesk.backend.config.BusinessClock;
import com.rentdesk.backend.dto.rent.NotificationResponseDTO;
import com.rentdesk.backend.dto.rent.RecordPaymentRequestDTO;
import com.rentdesk.backend.dto.rent.RentPaymentRequestDTO;
import com.rentdesk.backend.dto.rent.RentPaymentResponseDTO;
import com.rentdesk.backend.dto.rent.RentStatusReportDTO;
import com.rentdesk.backend.entities.Notification;
import com.rentdesk.backend.entities.RentPayment;
import com.rentdesk.backend.entities.TenantUnit;
import com.rentdesk.backend.enums.NotificationChannel;
import com.rentdesk.backend.enums.NotificationStatus;
import com.rentdesk.backend.enums.NotificationType;
import com.rentdesk.backend.enums.RentPaymentStatus;
import com.rentdesk.backend.exceptions.BadRequestException;
import com.rentdesk.backend.exceptions.ConflictException;
import com.rentdesk.backend.exceptions.ResourceNotFoundException;
import com.rentdesk.backend.repositories.NotificationRepository;
import com.rentdesk.backend.repositories.RentPaymentRepository;
import com.rentdesk.backend.repositories.TenantRepository;
import com.rentdesk.backend.repositories.UnitRepository;
import com.rentdesk.backend.store.RentPaymentStore;
import com.rentdesk.backend.store.TenantUnitStore;

@ExtendWith(MockitoExtension.class)
class RentPaymentServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);

    @Mock
    private RentPaymentRepository rentPaymentRepository;

    @Mock
    private TenantRepository tenantRepository;

    @Mock
    private UnitRepository unitRepository;

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private RentPaymentStore rentPaymentStore;

    @Mock
    private TenantUnitStore tenantUnitStore;

    @Mock
    private BusinessClock businessClock;

    @InjectMocks
    private RentPaymentService service;

    private TenantUnit binding;

    @BeforeEach
    void setUp() {
        binding = TestFixtures.binding(TestFixtures.tenant("Jane", "Doe"),
                TestFixtures.unit(TestFixtures.property(), "101"), "1500.00", 1, true);
    }

    @Test
    void recordPayment_defaultsPaymentDateToToday() {
        RentPayment late = TestFixtures.payment(binding, LocalDate.of(2025, 3, 1), RentPaymentStatus.LATE);
        RecordPaymentRequestDTO request = new RecordPaymentRequestDTO();
        request.setStatus(RentPaymentStatus.PAID);
        request.setPaymentMethod("interac");
        when(businessClock.today()).thenReturn(TODAY);
        when(rentPaymentStore.updateObligationStatus(late.getId(), RentPaymentStatus.PAID, TODAY, "interac"))
                .thenAnswer(inv -> {
                    late.setStatus(RentPaymentStatus.PAID);
                    late.setPaymentDate(TODAY);
                    return Optional.of(late);
                });
        when(rentPaymentRepository.findWithDetailsById(late.getId())).thenReturn(Optional.of(late));

        RentPaymentResponseDTO response = service.recordPayment(late.getId(), request);

        assertEquals(RentPaymentStatus.PAID, response.getStatus());
        assertEquals(TODAY, response.getPaymentDate());
    }

    @Test
    void recordPayment_nonSettlementStatus_rejected() {
        RecordPaymentRequestDTO request = new RecordPaymentRequestDTO();
        request.setStatus(RentPaymentStatus.PENDING);

        assertThrows(BadRequestException.class,
                () -> service.recordPayment(UUID.randomUUID(), request));
        verifyNoInteractions(rentPaymentStore);
    }

    @Test
    void recordPayment_alreadyPaid_throwsConflict() {
        RentPayment paid = TestFixtures.payment(binding, LocalDate.of(2025, 3, 1), RentPaymentStatus.PAID);
        RecordPaymentRequestDTO request = new RecordPaymentRequestDTO();
        request.setStatus(RentPaymentStatus.PARTIAL);
        request.setPaymentDate(LocalDate.of(2025, 3, 5));
        when(rentPaymentStore.updateObligationStatus(paid.getId(), RentPaymentStatus.PARTIAL, LocalDate.of(2025, 3, 5), null))
                .thenReturn(Optional.empty());

        assertThrows(ConflictException.class, () -> service.recordPayment(paid.getId(), request));
    }

    @Test
    void create_existingObligationForMonth_throwsConflict() {
        RentPaymentRequestDTO request = new RentPaymentRequestDTO();
        request.setTenantId(binding.getTenant().getId());
        request.setUnitId(binding.getUnit().getId());
        request.setAmount(new BigDecimal("1500.00"));
        request.setDueDate(LocalDate.of(2025, 3, 1));
        when(tenantRepository.findById(binding.getTenant().getId())).thenReturn(Optional.of(binding.getTenant()));
        when(unitRepository.findWithPropertyById(binding.getUnit().getId())).thenReturn(Optional.of(binding.getUnit()));
        when(rentPaymentStore.findObligation(binding.getTenant().getId(), binding.getUnit().getId(),
                LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 31)))
                .thenReturn(Optional.of(TestFixtures.payment(binding, LocalDate.of(2025, 3, 1), RentPaymentStatus.PENDING)));

        assertThrows(ConflictException.class, () -> service.create(request));
        verify(rentPaymentStore, never()).insertObligation(any());
    }

    @Test
    void create_settlementStatus_rejected() {
        RentPaymentRequestDTO request = new RentPaymentRequestDTO();
        request.setStatus(RentPaymentStatus.PAID);

        assertThrows(BadRequestException.class, () -> service.create(request));
    }

    @Test
    void checkRentStatus_listsUnbilledDueBindingsAndLateObligations() {
        TenantUnit notDueYet = TestFixtures.binding(TestFixtures.tenant("John", "Roe"),
                TestFixtures.unit(TestFixtures.property(), "7"), "900.00", 20, true);
        RentPayment late = TestFixtures.payment(binding, LocalDate.of(2025, 2, 1), RentPaymentStatus.LATE);
        when(tenantUnitStore.listPrimaryBindings()).thenReturn(List.of(binding, notDueYet));
        when(rentPaymentStore.findObligation(binding.getTenant().getId(), binding.getUnit().getId(),
                LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 31))).thenReturn(Optional.empty());
        when(rentPaymentStore.listObligationsByStatus(RentPaymentStatus.LATE)).thenReturn(List.of(late));

        RentStatusReportDTO report = service.checkRentStatus(TODAY);

        assertEquals(1, report.notPaid().size());
        assertEquals(9, report.notPaid().get(0).daysPastDue());
        assertEquals("Maple Court", report.notPaid().get(0).propertyName());
        assertEquals(1, report.late().size());
    }

    @Test
    void findNotifications_returnsLogOfPayment() {
        UUID paymentId = UUID.randomUUID();
        Notification read = Notification.builder()
                .id(UUID.randomUUID())
                .tenantId(UUID.randomUUID())
                .paymentId(paymentId)
                .type(NotificationType.RENT_LATE)
                .channel(NotificationChannel.WHATSAPP)
                .status(NotificationStatus.READ)
                .messageId("wamid.42")
                .build();
        when(rentPaymentRepository.existsById(paymentId)).thenReturn(true);
        when(notificationRepository.findByPaymentIdOrderByCreatedAtDesc(paymentId)).thenReturn(List.of(read));

        List<NotificationResponseDTO> notifications = service.findNotifications(paymentId);

        assertEquals(1, notifications.size());
        assertEquals(NotificationStatus.READ, notifications.get(0).getStatus());
        assertEquals(paymentId.toString(), notifications.get(0).getPaymentId());
        assertEquals("wamid.42", notifications.get(0).getMessageId());
    }

    @Test
    void findNotifications_unknownPayment_notFound() {
        UUID paymentId = UUID.randomUUID();
        when(rentPaymentRepository.existsById(paymentId)).thenReturn(false);

        assertThrows(ResourceNotFoundException.class, () -> service.findNotifications(paymentId));
        verifyNoInteractions(notificationRepository);
    }
}
