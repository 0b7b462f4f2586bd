package com.al.clinicalsummary.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

import static org.junit.jupiter.api.Assertions.*;

public class DateTimeUtilTest {

    @Test
    public void testParseIsoDate_PlainDate() {
        assertEquals(LocalDate.of(2025, 1, 5), DateTimeUtil.parseIsoDate("2025-01-05"));
    }

    @Test
    public void testParseIsoDate_DateTimeKeepsCalendarDate() {
        assertEquals(LocalDate.of(2025, 1, 5), DateTimeUtil.parseIsoDate("2025-01-05T23:30:00"));
        assertEquals(LocalDate.of(2025, 1, 5), DateTimeUtil.parseIsoDate("2025-01-05T23:30:00-05:00"));
        assertEquals(LocalDate.of(2025, 1, 5), DateTimeUtil.parseIsoDate("2025-01-05T10:30Z"));
    }

    @Test
    public void testParseIsoDate_Invalid() {
        assertThrows(DateTimeParseException.class, () -> DateTimeUtil.parseIsoDate("not-a-date"));
        assertThrows(DateTimeParseException.class, () -> DateTimeUtil.parseIsoDate("01/05/2025"));
        assertThrows(DateTimeParseException.class, () -> DateTimeUtil.parseIsoDate("2025-02-30"));
        assertThrows(DateTimeParseException.class, () -> DateTimeUtil.parseIsoDate(""));
        assertThrows(DateTimeParseException.class, () -> DateTimeUtil.parseIsoDate(null));
    }

    @Test
    public void testLengthOfStayDays() {
        assertEquals(4, DateTimeUtil.lengthOfStayDays("2025-01-01", "2025-01-05"));
        assertEquals(0, DateTimeUtil.lengthOfStayDays("2025-01-05", "2025-01-05"));
        assertEquals(2, DateTimeUtil.lengthOfStayDays("2024-02-28", "2024-03-01"));
        assertEquals(1, DateTimeUtil.lengthOfStayDays("2024-12-31T22:00:00", "2025-01-01T01:00:00"));
    }

    @Test
    public void testLengthOfStayDays_NeverNegative() {
        assertEquals(0, DateTimeUtil.lengthOfStayDays("2025-01-05", "2025-01-01"));
    }
}
