package com.rentdesk.backend.controllers;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import com.rentdesk.backend.config.BusinessClock;
import com.rentdesk.backend.dto.cron.LateRunResultDTO;
import com.rentdesk.backend.dto.cron.LegalNoticeEligibilityDTO;
import com.rentdesk.backend.dto.cron.RentRunItemDTO;
import com.rentdesk.backend.dto.cron.RentRunResultDTO;
import com.rentdesk.backend.enums.LegalNoticeTier;
import com.rentdesk.backend.enums.RunItemStatus;
import com.rentdesk.backend.services.LateRentService;
import com.rentdesk.backend.services.RentBillingService;

@SpringBootTest(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "spring.datasource.url=jdbc:h2:mem:rentdesk_cron;DB_CLOSE_DELAY=-1;MODE=PostgreSQL",
        "spring.datasource.driverClassName=org.h2.Driver",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.jpa.database-platform=org.hibernate.dialect.H2Dialect",
        "rentdesk.whatsapp.enabled=false"
})
@AutoConfigureMockMvc
class CronControllerTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 2, 10);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RentBillingService rentBillingService;

    @MockBean
    private LateRentService lateRentService;

    @MockBean
    private BusinessClock businessClock;

    @BeforeEach
    void setUp() {
        when(businessClock.today()).thenReturn(TODAY);
    }

    @Test
    void dueRent_withoutDay_runsForToday() throws Exception {
        RentRunItemDTO item = RentRunItemDTO.builder().status(RunItemStatus.CREATED).tenantName("Jane Doe").build();
        when(rentBillingService.runDailyBilling(TODAY)).thenReturn(RentRunResultDTO.of("due-rent", TODAY, List.of(item)));

        mockMvc.perform(post("/api/cron/due-rent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.date").value("2025-02-10"))
                .andExpect(jsonPath("$.data.created").value(1))
                .andExpect(jsonPath("$.data.results[0].tenantName").value("Jane Doe"));
    }

    @Test
    void dueRent_dayPastMonthEnd_clampsToLastDay() throws Exception {
        LocalDate feb28 = LocalDate.of(2025, 2, 28);
        when(rentBillingService.runDailyBilling(feb28)).thenReturn(RentRunResultDTO.of("due-rent", feb28, List.of()));

        mockMvc.perform(post("/api/cron/due-rent").param("day", "31"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.processed").value(0));

        verify(rentBillingService).runDailyBilling(feb28);
    }

    @Test
    void dueRent_dayOutOfRange_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/cron/due-rent").param("day", "32"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verifyNoInteractions(rentBillingService);
    }

    @Test
    void dueRent_nonNumericDay_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/cron/due-rent").param("day", "first"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void lateRent_reportsNoticeCounts() throws Exception {
        LocalDate feb16 = LocalDate.of(2025, 2, 16);
        when(lateRentService.runLateCycle(feb16)).thenReturn(new LateRunResultDTO(feb16, List.of(), List.of(), 1, 1));

        mockMvc.perform(post("/api/cron/late-rent").param("day", "16"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.firstTierEligible").value(1))
                .andExpect(jsonPath("$.data.secondTierEligible").value(1));
    }

    @Test
    void formN4_listsEligibleTenants() throws Exception {
        LegalNoticeEligibilityDTO eligible = new LegalNoticeEligibilityDTO(LegalNoticeTier.N4, "p-1", "t-1",
                "Jane Doe", "u-1", "101", new BigDecimal("1500.00"), LocalDate.of(2025, 1, 25), 16);
        when(lateRentService.findNoticeEligibility(LegalNoticeTier.N4, TODAY)).thenReturn(List.of(eligible));

        mockMvc.perform(get("/api/cron/form-n4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("1 tenants eligible for N4"))
                .andExpect(jsonPath("$.data[0].tier").value("N4"))
                .andExpect(jsonPath("$.data[0].daysLate").value(16));
    }
}
