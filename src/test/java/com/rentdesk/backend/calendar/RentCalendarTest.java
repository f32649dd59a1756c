package com.rentdesk.backend.calendar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.rentdesk.backend.exceptions.BadRequestException;

class RentCalendarTest {

    @Test
    void dueDateInMonthOf_clampsDayBeyondMonthLength() {
        assertEquals(LocalDate.of(2025, 2, 28), RentCalendar.dueDateInMonthOf(LocalDate.of(2025, 2, 10), 31));
        assertEquals(LocalDate.of(2024, 2, 29), RentCalendar.dueDateInMonthOf(LocalDate.of(2024, 2, 10), 30));
        assertEquals(LocalDate.of(2025, 4, 30), RentCalendar.dueDateInMonthOf(LocalDate.of(2025, 4, 1), 31));
        assertEquals(LocalDate.of(2025, 3, 5), RentCalendar.dueDateInMonthOf(LocalDate.of(2025, 3, 20), 5));
    }

    @Test
    void dueDaysFallingOn_lastDayOfFebruary_includesMissingDays() {
        assertEquals(Set.of(28, 29, 30, 31), RentCalendar.dueDaysFallingOn(LocalDate.of(2025, 2, 28)));
        assertEquals(Set.of(29, 30, 31), RentCalendar.dueDaysFallingOn(LocalDate.of(2024, 2, 29)));
    }

    @Test
    void dueDaysFallingOn_regularDay_onlyThatDay() {
        assertEquals(Set.of(27), RentCalendar.dueDaysFallingOn(LocalDate.of(2025, 2, 27)));
        assertEquals(Set.of(31), RentCalendar.dueDaysFallingOn(LocalDate.of(2025, 1, 31)));
        assertEquals(Set.of(30, 31), RentCalendar.dueDaysFallingOn(LocalDate.of(2025, 4, 30)));
    }

    @Test
    void daysLate_neverNegative() {
        LocalDate due = LocalDate.of(2025, 1, 1);
        assertEquals(0, RentCalendar.daysLate(due, LocalDate.of(2024, 12, 30)));
        assertEquals(0, RentCalendar.daysLate(due, due));
        assertEquals(14, RentCalendar.daysLate(due, LocalDate.of(2025, 1, 15)));
        assertEquals(15, RentCalendar.daysLate(due, LocalDate.of(2025, 1, 16)));
    }

    @Test
    void periodBounds_coverCalendarMonth() {
        LocalDate date = LocalDate.of(2025, 2, 14);
        assertEquals(LocalDate.of(2025, 2, 1), RentCalendar.periodStart(date));
        assertEquals(LocalDate.of(2025, 2, 28), RentCalendar.periodEnd(date));
    }

    @Test
    void withDayOverride_replacesDayAndClamps() {
        LocalDate today = LocalDate.of(2025, 2, 10);
        assertEquals(today, RentCalendar.withDayOverride(today, null));
        assertEquals(LocalDate.of(2025, 2, 1), RentCalendar.withDayOverride(today, 1));
        assertEquals(LocalDate.of(2025, 2, 28), RentCalendar.withDayOverride(today, 31));
    }

    @Test
    void withDayOverride_outOfRange_throwsBadRequest() {
        LocalDate today = LocalDate.of(2025, 2, 10);
        assertThrows(BadRequestException.class, () -> RentCalendar.withDayOverride(today, 0));
        assertThrows(BadRequestException.class, () -> RentCalendar.withDayOverride(today, 32));
    }

    @Test
    void isValidDueDay_rejectsNullAndOutOfRange() {
        assertTrue(RentCalendar.isValidDueDay(1));
        assertTrue(RentCalendar.isValidDueDay(31));
        assertFalse(RentCalendar.isValidDueDay(null));
        assertFalse(RentCalendar.isValidDueDay(0));
        assertFalse(RentCalendar.isValidDueDay(32));
    }
}
