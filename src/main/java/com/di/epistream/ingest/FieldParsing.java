package com.di.epistream.ingest;

import com.di.epistream.util.DateParsing;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Parsing helpers shared by the source adapters. Blank and "null" values read as absent.
 */
public final class FieldParsing {

    private FieldParsing() {
    }

    public static Long count(RawRecord raw, String key) {
        String value = raw.get(key);
        if (isAbsent(value)) {
            return null;
        }
        String cleaned = value.trim().replace(",", "").replace("_", "");
        try {
            return new BigDecimal(cleaned).stripTrailingZeros().longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new SchemaException(raw.getSourceId(), raw.getOrigin(),
                    "Unparseable number '" + value + "' in field " + key);
        }
    }

    /** First present count among the candidate keys. */
    public static Long firstCount(RawRecord raw, String... keys) {
        for (String key : keys) {
            if (!isAbsent(raw.get(key))) {
                return count(raw, key);
            }
        }
        return null;
    }

    public static LocalDate date(RawRecord raw, String key) {
        String value = raw.get(key);
        if (isAbsent(value)) {
            return null;
        }
        Optional<LocalDate> parsed = DateParsing.parseDate(value);
        return parsed.orElseThrow(() -> new SchemaException(raw.getSourceId(), raw.getOrigin(),
                "Unrecognized date '" + value + "' in field " + key
                        + ". Supported patterns are: " + String.join(", ", DateParsing.supportedPatterns())));
    }

    public static String text(RawRecord raw, String... keys) {
        for (String key : keys) {
            String value = raw.get(key);
            if (!isAbsent(value)) {
                return value.trim();
            }
        }
        return null;
    }

    static boolean isAbsent(String value) {
        return value == null || value.isBlank() || "null".equalsIgnoreCase(value.trim())
                || "nan".equalsIgnoreCase(value.trim());
    }
}
