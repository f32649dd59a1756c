package com.rentdesk.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import com.rentdesk.backend.TestFixtures;
import com.rentdesk.backend.config.RentBillingProperties;
import com.rentdesk.backend.dto.cron.RentRunItemDTO;
import com.rentdesk.backend.dto.cron.RentRunResultDTO;
import com.rentdesk.backend.entities.Notification;
import com.rentdesk.backend.entities.Property;
import com.rentdesk.backend.entities.RentPayment;
import com.rentdesk.backend.entities.TenantUnit;
import com.rentdesk.backend.enums.NotificationType;
import com.rentdesk.backend.enums.RentPaymentStatus;
import com.rentdesk.backend.enums.RunItemStatus;
import com.rentdesk.backend.exceptions.NotificationDeliveryException;
import com.rentdesk.backend.exceptions.PaymentLinkException;
import com.rentdesk.backend.integration.NotificationContext;
import com.rentdesk.backend.integration.PaymentLinkProvider;
import com.rentdesk.backend.store.RentPaymentStore;
import com.rentdesk.backend.store.TenantUnitStore;

@ExtendWith(MockitoExtension.class)
class RentBillingServiceTest {

    private static final ZoneId TORONTO = ZoneId.of("America/Toronto");

    @Mock
    private TenantUnitStore tenantUnitStore;

    @Mock
    private RentPaymentStore rentPaymentStore;

    @Mock
    private PaymentLinkProvider paymentLinkProvider;

    @Mock
    private NotificationService notificationService;

    private RentBillingService service;

    private TenantUnit binding;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(LocalDate.of(2025, 3, 1).atTime(7, 0).atZone(TORONTO).toInstant(), TORONTO);
        service = new RentBillingService(
                tenantUnitStore,
                rentPaymentStore,
                paymentLinkProvider,
                notificationService,
                RentBillingProperties.defaults(),
                clock
        );
        Property property = TestFixtures.property();
        binding = TestFixtures.binding(
                TestFixtures.tenant("Jane", "Doe"), TestFixtures.unit(property, "101"), "1500.00", 1, true);
    }

    private void stubInsertAssignsId() {
        when(rentPaymentStore.insertObligation(any(RentPayment.class))).thenAnswer(inv -> {
            RentPayment p = inv.getArgument(0);
            p.setId(UUID.randomUUID());
            return p;
        });
    }

    private Notification sentNotification() {
        Notification notification = new Notification();
        notification.setId(UUID.randomUUID());
        return notification;
    }

    @Test
    void generateDueRent_createsPendingObligationWithLinkAndSendsDueMessage() {
        LocalDate march1 = LocalDate.of(2025, 3, 1);
        when(tenantUnitStore.listBindingsDueOn(march1)).thenReturn(List.of(binding));
        when(rentPaymentStore.findObligation(any(), any(), eq(LocalDate.of(2025, 3, 1)), eq(LocalDate.of(2025, 3, 31))))
                .thenReturn(Optional.empty());
        when(paymentLinkProvider.generateLink("jane@example.com", "Jane", new BigDecimal("1500.00"), "Rent payment for unit 101"))
                .thenReturn("https://interac.mock/request?reference=rent-1");
        stubInsertAssignsId();
        Notification notification = sentNotification();
        when(notificationService.sendRentNotification(any(RentPayment.class), eq(NotificationContext.rentDue())))
                .thenReturn(notification);

        RentRunResultDTO result = service.generateDueRent(march1);

        ArgumentCaptor<RentPayment> captor = ArgumentCaptor.forClass(RentPayment.class);
        verify(rentPaymentStore).insertObligation(captor.capture());
        RentPayment created = captor.getValue();
        assertEquals(RentPaymentStatus.PENDING, created.getStatus());
        assertEquals(march1, created.getDueDate());
        assertEquals(LocalDate.of(2025, 3, 1), created.getBillingPeriod());
        assertEquals(new BigDecimal("1500.00"), created.getAmount());
        assertEquals("https://interac.mock/request?reference=rent-1", created.getPaymentLink());

        assertEquals(1, result.created());
        RentRunItemDTO item = result.results().get(0);
        assertEquals(RunItemStatus.CREATED, item.getStatus());
        assertEquals(created.getId().toString(), item.getPaymentId());
        assertEquals(notification.getId().toString(), item.getNotificationId());
        verify(rentPaymentStore, never()).markReminderSent(any(), any());
    }

    @Test
    void generateDueRent_existingObligation_isSkipped() {
        LocalDate march1 = LocalDate.of(2025, 3, 1);
        RentPayment existing = TestFixtures.payment(binding, march1, RentPaymentStatus.PENDING);
        when(tenantUnitStore.listBindingsDueOn(march1)).thenReturn(List.of(binding));
        when(rentPaymentStore.findObligation(any(), any(), any(), any())).thenReturn(Optional.of(existing));

        RentRunResultDTO result = service.generateDueRent(march1);

        assertEquals(1, result.skipped());
        assertEquals(existing.getId().toString(), result.results().get(0).getPaymentId());
        verify(rentPaymentStore, never()).insertObligation(any());
        verify(notificationService, never()).sendRentNotification(any(), any());
    }

    @Test
    void generateDueRent_dueDay31OnLastDayOfFebruary_dueOnTheTwentyEighth() {
        binding.setRentDueDay(31);
        LocalDate feb28 = LocalDate.of(2025, 2, 28);
        when(tenantUnitStore.listBindingsDueOn(feb28)).thenReturn(List.of(binding));
        when(rentPaymentStore.findObligation(any(), any(), eq(LocalDate.of(2025, 2, 1)), eq(feb28)))
                .thenReturn(Optional.empty());
        stubInsertAssignsId();
        when(notificationService.sendRentNotification(any(), any())).thenReturn(sentNotification());

        service.generateDueRent(feb28);

        ArgumentCaptor<RentPayment> captor = ArgumentCaptor.forClass(RentPayment.class);
        verify(rentPaymentStore).insertObligation(captor.capture());
        assertEquals(feb28, captor.getValue().getDueDate());
        assertEquals(RentPaymentStatus.PENDING, captor.getValue().getStatus());
    }

    @Test
    void generateDueRent_linkFailure_createsObligationWithoutLink() {
        LocalDate march1 = LocalDate.of(2025, 3, 1);
        when(tenantUnitStore.listBindingsDueOn(march1)).thenReturn(List.of(binding));
        when(rentPaymentStore.findObligation(any(), any(), any(), any())).thenReturn(Optional.empty());
        when(paymentLinkProvider.generateLink(anyString(), anyString(), any(), anyString()))
                .thenThrow(new PaymentLinkException("disabled"));
        stubInsertAssignsId();
        when(notificationService.sendRentNotification(any(), any())).thenReturn(sentNotification());

        RentRunResultDTO result = service.generateDueRent(march1);

        ArgumentCaptor<RentPayment> captor = ArgumentCaptor.forClass(RentPayment.class);
        verify(rentPaymentStore).insertObligation(captor.capture());
        assertNull(captor.getValue().getPaymentLink());
        assertEquals(1, result.created());
    }

    @Test
    void generateDueRent_notificationFailure_keepsObligationAndReportsFailedItem() {
        LocalDate march1 = LocalDate.of(2025, 3, 1);
        when(tenantUnitStore.listBindingsDueOn(march1)).thenReturn(List.of(binding));
        when(rentPaymentStore.findObligation(any(), any(), any(), any())).thenReturn(Optional.empty());
        stubInsertAssignsId();
        when(notificationService.sendRentNotification(any(), any()))
                .thenThrow(new NotificationDeliveryException("WhatsApp down"));

        RentRunResultDTO result = service.generateDueRent(march1);

        RentRunItemDTO item = result.results().get(0);
        assertEquals(RunItemStatus.FAILED, item.getStatus());
        assertNotNull(item.getPaymentId());
        assertEquals("WhatsApp down", item.getError());
        verify(rentPaymentStore).insertObligation(any());
    }

    @Test
    void generateDueRent_concurrentInsert_reportedAsSkipped() {
        LocalDate march1 = LocalDate.of(2025, 3, 1);
        when(tenantUnitStore.listBindingsDueOn(march1)).thenReturn(List.of(binding));
        when(rentPaymentStore.findObligation(any(), any(), any(), any())).thenReturn(Optional.empty());
        when(rentPaymentStore.insertObligation(any())).thenThrow(new DataIntegrityViolationException("uk_rent_payment_period"));

        RentRunResultDTO result = service.generateDueRent(march1);

        assertEquals(1, result.skipped());
        assertEquals(0, result.failed());
        verify(notificationService, never()).sendRentNotification(any(), any());
    }

    @Test
    void generateDueRent_bindingWithoutTerms_failsWithoutBilling() {
        binding.setRentAmount(null);
        LocalDate march1 = LocalDate.of(2025, 3, 1);
        when(tenantUnitStore.listBindingsDueOn(march1)).thenReturn(List.of(binding));

        RentRunResultDTO result = service.generateDueRent(march1);

        assertEquals(1, result.failed());
        verify(rentPaymentStore, never()).insertObligation(any());
    }

    @Test
    void generateDueRent_failureOnOneBinding_doesNotStopOthers() {
        Property property = TestFixtures.property();
        TenantUnit other = TestFixtures.binding(
                TestFixtures.tenant("John", "Roe"), TestFixtures.unit(property, "102"), "1200.00", 1, true);
        LocalDate march1 = LocalDate.of(2025, 3, 1);
        when(tenantUnitStore.listBindingsDueOn(march1)).thenReturn(List.of(binding, other));
        when(rentPaymentStore.findObligation(eq(binding.getTenant().getId()), any(), any(), any()))
                .thenThrow(new IllegalStateException("connection reset"));
        when(rentPaymentStore.findObligation(eq(other.getTenant().getId()), any(), any(), any()))
                .thenReturn(Optional.empty());
        stubInsertAssignsId();
        when(notificationService.sendRentNotification(any(), any())).thenReturn(sentNotification());

        RentRunResultDTO result = service.generateDueRent(march1);

        assertEquals(2, result.processed());
        assertEquals(1, result.failed());
        assertEquals(1, result.created());
    }

    @Test
    void catchUpMissedRent_createsLateObligationAndCountsReminder() {
        LocalDate march16 = LocalDate.of(2025, 3, 16);
        TenantUnit notYetDue = TestFixtures.binding(
                TestFixtures.tenant("John", "Roe"), TestFixtures.unit(TestFixtures.property(), "7"), "900.00", 20, true);
        when(tenantUnitStore.listPrimaryBindings()).thenReturn(List.of(binding, notYetDue));
        when(rentPaymentStore.findObligation(any(), any(), any(), any())).thenReturn(Optional.empty());
        stubInsertAssignsId();
        when(notificationService.sendRentNotification(any(), eq(NotificationContext.rentLate(15))))
                .thenReturn(sentNotification());

        RentRunResultDTO result = service.catchUpMissedRent(march16);

        ArgumentCaptor<RentPayment> captor = ArgumentCaptor.forClass(RentPayment.class);
        verify(rentPaymentStore).insertObligation(captor.capture());
        assertEquals(RentPaymentStatus.LATE, captor.getValue().getStatus());
        assertEquals(LocalDate.of(2025, 3, 1), captor.getValue().getDueDate());

        assertEquals(1, result.processed());
        assertEquals(15L, result.results().get(0).getDaysLate());

        ArgumentCaptor<NotificationContext> context = ArgumentCaptor.forClass(NotificationContext.class);
        verify(notificationService).sendRentNotification(any(), context.capture());
        assertEquals(NotificationType.RENT_LATE, context.getValue().type());
        verify(rentPaymentStore).markReminderSent(eq(captor.getValue().getId()), any(LocalDateTime.class));
    }

    @Test
    void catchUpMissedRent_stampFailsAfterDelivery_stillReportedCreated() {
        when(tenantUnitStore.listPrimaryBindings()).thenReturn(List.of(binding));
        when(rentPaymentStore.findObligation(any(), any(), any(), any())).thenReturn(Optional.empty());
        stubInsertAssignsId();
        when(notificationService.sendRentNotification(any(), any())).thenReturn(sentNotification());
        doThrow(new DataAccessResourceFailureException("lock timeout"))
                .when(rentPaymentStore).markReminderSent(any(), any(LocalDateTime.class));

        RentRunResultDTO result = service.catchUpMissedRent(LocalDate.of(2025, 3, 10));

        assertEquals(1, result.created());
        assertEquals(0, result.failed());
        assertNotNull(result.results().get(0).getNotificationId());
    }
}
