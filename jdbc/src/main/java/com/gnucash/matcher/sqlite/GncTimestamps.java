package com.gnucash.matcher.sqlite;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Reads the calendar date out of the timestamp text GnuCash writes to its SQL tables. Current
 * versions write {@code 2024-01-05 10:59:00}; older ones wrote {@code 20240105105900}.
 */
public final class GncTimestamps {

    private static final DateTimeFormatter COMPACT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private GncTimestamps() {}

    public static LocalDate toLocalDate(String timestamp) {
        if (timestamp == null) {
            return null;
        }
        String text = timestamp.trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            if (text.length() >= 10 && text.charAt(4) == '-') {
                return LocalDate.parse(text.substring(0, 10));
            }
            if (text.length() >= 8) {
                return LocalDate.parse(text.substring(0, 8), COMPACT);
            }
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid GnuCash timestamp: " + timestamp, ex);
        }
        throw new IllegalArgumentException("Invalid GnuCash timestamp: " + timestamp);
    }
}
