package com.di.epistream.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Lenient date parsing for source files. Returns empty instead of throwing so callers can
 * turn a miss into their own error type.
 */
public final class DateParsing {

    private static final List<String> KNOWN_PATTERNS = Arrays.asList(
            "yyyy-MM-dd",   // ISO standard
            "dd/MM/yyyy",   // UK / EU
            "MM-dd-yyyy",   // US
            "yyyy/MM/dd",
            "dd-MM-yyyy",
            "MM/dd/yyyy",   // US alternate
            "dd.MM.yyyy",   // Central Europe
            "yyyy.MM.dd",
            "yyyyMMdd"
    );

    private static final List<DateTimeFormatter> FORMATTERS = KNOWN_PATTERNS.stream()
            .map(DateTimeFormatter::ofPattern)
            .toList();

    private DateParsing() {
    }

    /**
     * Tries ISO timestamps first (the date part, in UTC), then every known date pattern in order.
     * Ambiguous day/month strings resolve to the first pattern that accepts them.
     */
    public static Optional<LocalDate> parseDate(String input) {
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }
        String value = input.trim();
        if (value.length() > 10 && value.charAt(10) == 'T') {
            try {
                return Optional.of(OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDate());
            } catch (DateTimeParseException e) {
                try {
                    return Optional.of(Instant.parse(value).atZone(ZoneOffset.UTC).toLocalDate());
                } catch (DateTimeParseException ignored) {
                    value = value.substring(0, 10);
                }
            }
        } else if (value.length() > 10 && value.charAt(10) == ' ') {
            value = value.substring(0, 10);
        }
        for (DateTimeFormatter formatter : FORMATTERS) {
            try {
                return Optional.of(LocalDate.parse(value, formatter));
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        return Optional.empty();
    }

    /** UTC calendar date of an epoch-millisecond timestamp. */
    public static LocalDate fromEpochMillis(long epochMillis) {
        return Instant.ofEpochMilli(epochMillis).atZone(ZoneOffset.UTC).toLocalDate();
    }

    public static List<String> supportedPatterns() {
        return KNOWN_PATTERNS;
    }
}
