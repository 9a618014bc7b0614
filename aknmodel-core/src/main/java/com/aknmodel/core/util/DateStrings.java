package com.aknmodel.core.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Conversions between {@link LocalDate} values and the {@code YYYY-MM-DD} strings
 * Akoma Ntoso stores in {@code date} attributes.
 */
public final class DateStrings {

    private DateStrings() {
        // Utility class
    }

    /**
     * Formats a date as {@code YYYY-MM-DD}.
     *
     * @param date date to format, may be null
     * @return formatted date, or an empty string for null
     */
    public static String format(LocalDate date) {
        if (date == null) {
            return "";
        }
        return String.format("%04d-%02d-%02d", date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /**
     * Parses an ISO-8601 date or date-time string into a date.
     *
     * <p>Accepts {@code 2010-01-01}, {@code 2010-01-01+02:00} and full date-times such as
     * {@code 2010-01-01T10:00:00Z}; the time part is discarded.
     *
     * @param value ISO-8601 string, may be null
     * @return parsed date, or null if the value is null or blank
     * @throws IllegalArgumentException if the value is not an ISO-8601 date
     */
    public static LocalDate parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }

        String trimmed = value.trim();
        try {
            if (trimmed.indexOf('T') > 0) {
                return LocalDate.parse(trimmed, DateTimeFormatter.ISO_DATE_TIME);
            }
            return LocalDate.parse(trimmed, DateTimeFormatter.ISO_DATE);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid ISO-8601 date: " + value, e);
        }
    }
}
