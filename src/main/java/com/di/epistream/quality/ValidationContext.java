package com.di.epistream.quality;

import com.di.epistream.model.CaseCounts;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * What the validator may know about a country's earlier days.
 */
@Value
@Builder
public class ValidationContext {

    public static final ValidationContext EMPTY = ValidationContext.builder().build();

    /** Counts of the nearest earlier day (this run's previous fact, else the persisted row). */
    CaseCounts priorCounts;
    LocalDate priorDate;
    /** Earlier days, any order; the validator applies its own window. */
    @Singular("historyPoint")
    List<HistoryPoint> history;

    public static ValidationContext ofPrior(LocalDate priorDate, CaseCounts priorCounts) {
        return ValidationContext.builder().priorDate(priorDate).priorCounts(priorCounts).build();
    }
}
