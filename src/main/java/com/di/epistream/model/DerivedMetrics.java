package com.di.epistream.model;

import lombok.Builder;
import lombok.Value;

/**
 * Fields computed from the reconciled series. Null means "undefined" (no population,
 * zero denominator, no data in the window), never zero.
 */
@Value
@Builder
public class DerivedMetrics {

    public static final DerivedMetrics EMPTY = DerivedMetrics.builder().build();

    Double casesPerMillion;
    Double deathsPerMillion;
    /** Percent. */
    Double caseFatalityRate;
    Double newCases7dayAvg;
    Double newDeaths7dayAvg;
    Double newCases14dayAvg;
    /** Week-over-week percent change of {@link #newCases7dayAvg}. */
    Double growthRate;
    /** Day-over-day percent change of new_cases. */
    Double newCasesPctChange;
}
