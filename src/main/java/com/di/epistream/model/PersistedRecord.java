package com.di.epistream.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Durable row of {@code covid_cases}. Primary key (countryCode, date).
 */
@Value
@Builder(toBuilder = true)
public class PersistedRecord {
    String countryCode;
    LocalDate date;
    CaseCounts counts;
    DerivedMetrics metrics;
    Set<QualityFlag> qualityFlags;
    double reconciliationConfidence;
    /** Comma-joined contributing sources. */
    String source;
    String dataHash;
    Instant createdAt;
    Instant updatedAt;

    public static PersistedRecord of(EnrichedFact fact, String dataHash, Instant now) {
        Set<QualityFlag> flags = fact.getQualityFlags().isEmpty()
                ? EnumSet.noneOf(QualityFlag.class)
                : EnumSet.copyOf(fact.getQualityFlags());
        return PersistedRecord.builder()
                .countryCode(fact.getCountryCode())
                .date(fact.getDate())
                .counts(fact.getCounts())
                .metrics(fact.getMetrics())
                .qualityFlags(Collections.unmodifiableSet(flags))
                .reconciliationConfidence(fact.getReconciliationConfidence())
                .source(String.join(",", fact.getContributingSources()))
                .dataHash(dataHash)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
