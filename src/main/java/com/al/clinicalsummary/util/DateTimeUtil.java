package com.al.clinicalsummary.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;

/**
 * Parsing of the ISO-8601 dates found in extracted timing data.
 *
 * <p>
 * Accepted forms:
 * <ul>
 * <li>2025-01-05 - plain date</li>
 * <li>2025-01-05T10:30:00 - local date-time</li>
 * <li>2025-01-05T10:30:00Z, 2025-01-05T10:30:00-05:00 - date-time with offset</li>
 * </ul>
 * Only the calendar date as written is kept; no zone conversion happens.
 */
public final class DateTimeUtil {

    // yyyy-MM-dd, optionally followed by Thh:mm[:ss[.fff]] and an offset or Z
    private static final DateTimeFormatter ISO_DATE_OPTIONAL_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private DateTimeUtil() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Parse an ISO date or date-time string to its calendar date.
     *
     * @throws DateTimeParseException if the value is blank or in none of the accepted forms
     */
    public static LocalDate parseIsoDate(String value) {
        if (value == null || value.isBlank()) {
            throw new DateTimeParseException("Date is missing", value == null ? "" : value, 0);
        }
        return LocalDate.from(ISO_DATE_OPTIONAL_TIME.parse(value.trim()));
    }

    /**
     * Whole days from admission to discharge, never negative.
     *
     * @throws DateTimeParseException if either date cannot be parsed
     */
    public static int lengthOfStayDays(String admissionDate, String dischargeDate) {
        LocalDate admitted = parseIsoDate(admissionDate);
        LocalDate discharged = parseIsoDate(dischargeDate);
        long days = ChronoUnit.DAYS.between(admitted, discharged);
        return (int) Math.max(0, days);
    }
}
