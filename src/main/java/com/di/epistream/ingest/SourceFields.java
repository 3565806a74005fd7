package com.di.epistream.ingest;

import com.di.epistream.model.CaseCounts;

import java.time.LocalDate;

/**
 * Values an adapter pulled out of a raw record, before country resolution.
 *
 * @param countryCode ISO code as reported (alpha-3 or alpha-2), may be null
 * @param countryName country label as reported, may be null
 * @param date        report date, may be null (rejected by the normalizer)
 * @param counts      mapped counts, never null
 */
public record SourceFields(String countryCode, String countryName, LocalDate date, CaseCounts counts) {
}
