package com.di.epistream.quality;

import java.time.LocalDate;

/**
 * Daily deltas of one earlier day, as used by the spike check. Either value may be null.
 */
public record HistoryPoint(LocalDate date, Long newCases, Long newDeaths) {
}
