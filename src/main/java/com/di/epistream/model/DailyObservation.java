package com.di.epistream.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One source's report for one country and day, mapped onto the canonical schema.
 * Key: (countryCode, date, source).
 */
@Value
@Builder
public class DailyObservation {
    String countryCode;
    LocalDate date;
    String source;
    CaseCounts counts;
    Instant extractedAt;
}
