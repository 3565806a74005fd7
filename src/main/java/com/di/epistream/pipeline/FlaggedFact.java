package com.di.epistream.pipeline;

import com.di.epistream.model.QualityFlag;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * A fact listed for review in the run summary.
 */
public record FlaggedFact(String countryCode, LocalDate date, Set<QualityFlag> flags, List<String> issues) {
}
