package com.rentdesk.backend.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.rentdesk.backend.TestFixtures;
import com.rentdesk.backend.entities.RentPayment;
import com.rentdesk.backend.entities.TenantUnit;
import com.rentdesk.backend.enums.RentPaymentStatus;
import com.rentdesk.backend.exceptions.ResourceNotFoundException;
import com.rentdesk.backend.repositories.RentPaymentRepository;

@ExtendWith(MockitoExtension.class)
class RentPaymentStoreTest {

    @Mock
    private RentPaymentRepository rentPaymentRepository;

    @InjectMocks
    private RentPaymentStore store;

    private RentPayment payment(RentPaymentStatus status) {
        TenantUnit binding = TestFixtures.binding(TestFixtures.tenant("Jane", "Doe"),
                TestFixtures.unit(TestFixtures.property(), "101"), "1500.00", 1, true);
        return TestFixtures.payment(binding, LocalDate.of(2025, 1, 1), status);
    }

    @Test
    void updateObligationStatus_pendingToLate_saved() {
        RentPayment pending = payment(RentPaymentStatus.PENDING);
        when(rentPaymentRepository.findByIdForUpdate(pending.getId())).thenReturn(Optional.of(pending));
        when(rentPaymentRepository.save(pending)).thenReturn(pending);

        Optional<RentPayment> result = store.updateObligationStatus(pending.getId(), RentPaymentStatus.LATE, null);

        assertTrue(result.isPresent());
        assertEquals(RentPaymentStatus.LATE, pending.getStatus());
    }

    @Test
    void updateObligationStatus_paidObligation_leftUntouched() {
        RentPayment paid = payment(RentPaymentStatus.PAID);
        when(rentPaymentRepository.findByIdForUpdate(paid.getId())).thenReturn(Optional.of(paid));

        Optional<RentPayment> result = store.updateObligationStatus(paid.getId(), RentPaymentStatus.LATE, null);

        assertTrue(result.isEmpty());
        assertEquals(RentPaymentStatus.PAID, paid.getStatus());
        verify(rentPaymentRepository, never()).save(any());
    }

    @Test
    void updateObligationStatus_recordsPaymentDateAndMethod() {
        RentPayment late = payment(RentPaymentStatus.LATE);
        when(rentPaymentRepository.findByIdForUpdate(late.getId())).thenReturn(Optional.of(late));
        when(rentPaymentRepository.save(late)).thenReturn(late);

        store.updateObligationStatus(late.getId(), RentPaymentStatus.PAID, LocalDate.of(2025, 1, 20), "interac");

        assertEquals(RentPaymentStatus.PAID, late.getStatus());
        assertEquals(LocalDate.of(2025, 1, 20), late.getPaymentDate());
        assertEquals("interac", late.getPaymentMethod());
    }

    @Test
    void updateObligationStatus_unknownId_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(rentPaymentRepository.findByIdForUpdate(id)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class,
                () -> store.updateObligationStatus(id, RentPaymentStatus.LATE, null));
    }
}
