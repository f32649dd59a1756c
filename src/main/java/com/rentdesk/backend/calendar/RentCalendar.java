package com.rentdesk.backend.calendar;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashSet;
import java.util.Set;

import com.rentdesk.backend.exceptions.BadRequestException;

/**
 * Calendar arithmetic for monthly rent: due-day clamping, billing periods and days late.
 */
public final class RentCalendar {

    public static final int MIN_DUE_DAY = 1;
    public static final int MAX_DUE_DAY = 31;

    private RentCalendar() {
    }

    /**
     * Due date of the month containing {@code date} for a binding due on {@code rentDueDay}. Days beyond the
     * month length fall on the last day of the month (31 in February gives the 28th or 29th).
     */
    public static LocalDate dueDateInMonthOf(LocalDate date, int rentDueDay) {
        requireValidDueDay(rentDueDay);
        YearMonth month = YearMonth.from(date);
        return month.atDay(Math.min(rentDueDay, month.lengthOfMonth()));
    }

    /**
     * Due days that fall on {@code date}: the day itself and, on the last day of a short month, every day
     * up to 31 that the month does not have.
     */
    public static Set<Integer> dueDaysFallingOn(LocalDate date) {
        Set<Integer> days = new LinkedHashSet<>();
        int day = date.getDayOfMonth();
        days.add(day);
        if (day == date.lengthOfMonth()) {
            for (int d = day + 1; d <= MAX_DUE_DAY; d++) {
                days.add(d);
            }
        }
        return days;
    }

    public static LocalDate periodStart(LocalDate date) {
        return date.withDayOfMonth(1);
    }

    public static LocalDate periodEnd(LocalDate date) {
        return YearMonth.from(date).atEndOfMonth();
    }

    /**
     * Whole days elapsed from {@code dueDate} to {@code today}, never negative.
     */
    public static long daysLate(LocalDate dueDate, LocalDate today) {
        return Math.max(0, ChronoUnit.DAYS.between(dueDate, today));
    }

    /**
     * Replaces the day of {@code today} with {@code dayOverride}, clamped to the month length.
     * Used by the scheduler trigger to replay a given day of the current month.
     */
    public static LocalDate withDayOverride(LocalDate today, Integer dayOverride) {
        if (dayOverride == null) {
            return today;
        }
        if (dayOverride < MIN_DUE_DAY || dayOverride > MAX_DUE_DAY) {
            throw new BadRequestException("day must be between 1 and 31");
        }
        return dueDateInMonthOf(today, dayOverride);
    }

    public static boolean isValidDueDay(Integer rentDueDay) {
        return rentDueDay != null && rentDueDay >= MIN_DUE_DAY && rentDueDay <= MAX_DUE_DAY;
    }

    private static void requireValidDueDay(int rentDueDay) {
        if (!isValidDueDay(rentDueDay)) {
            throw new BadRequestException("rentDueDay must be between 1 and 31, got " + rentDueDay);
        }
    }
}
