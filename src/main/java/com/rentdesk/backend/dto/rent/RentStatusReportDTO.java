package com.rentdesk.backend.dto.rent;

import java.time.LocalDate;
import java.util.List;

public record RentStatusReportDTO(
        LocalDate date,
        List<OverdueRentDTO> notPaid,
        List<RentPaymentResponseDTO> late
) {
}
