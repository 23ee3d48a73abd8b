package com.agronet.marketplace.service;

import com.agronet.marketplace.exception.ValidationException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;

/**
 * Strict YYYY-MM-DD parsing. Rejects impossible calendar dates such as 2026-02-30.
 *
 * @author Agronet Marketplace Team
 */
public final class DateRules {

    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private DateRules() {
    }

    /**
     * Parse a date, returning null for a null or blank value.
     *
     * @param field Request field name, used in the error message
     * @param value Raw value
     * @return Parsed date or null
     * @throws ValidationException if the value is not a real YYYY-MM-DD date
     */
    public static LocalDate parseOptional(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return parse(field, value);
    }

    public static LocalDate parse(String field, String value) {
        if (value == null || !ISO_DATE.matcher(value.trim()).matches()) {
            throw new ValidationException(field, field + " must be in YYYY-MM-DD format");
        }
        try {
            return LocalDate.parse(value.trim(), FORMAT);
        } catch (DateTimeParseException e) {
            throw new ValidationException(field, field + " is not a valid calendar date: " + value);
        }
    }
}
