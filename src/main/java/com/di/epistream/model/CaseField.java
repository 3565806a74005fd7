package com.di.epistream.model;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Named accessors over {@link CaseCounts}, used wherever the pipeline treats the counts
 * uniformly (field-by-field reconciliation, canonical hashing, JDBC column binding).
 */
public enum CaseField {

    TOTAL_CASES("total_cases", true, CaseCounts::getTotalCases, CaseCounts.CaseCountsBuilder::totalCases),
    NEW_CASES("new_cases", false, CaseCounts::getNewCases, CaseCounts.CaseCountsBuilder::newCases),
    TOTAL_DEATHS("total_deaths", true, CaseCounts::getTotalDeaths, CaseCounts.CaseCountsBuilder::totalDeaths),
    NEW_DEATHS("new_deaths", false, CaseCounts::getNewDeaths, CaseCounts.CaseCountsBuilder::newDeaths),
    TOTAL_RECOVERED("total_recovered", true, CaseCounts::getTotalRecovered, CaseCounts.CaseCountsBuilder::totalRecovered),
    NEW_RECOVERED("new_recovered", false, CaseCounts::getNewRecovered, CaseCounts.CaseCountsBuilder::newRecovered),
    ACTIVE_CASES("active_cases", false, CaseCounts::getActiveCases, CaseCounts.CaseCountsBuilder::activeCases),
    CRITICAL_CASES("critical_cases", false, CaseCounts::getCriticalCases, CaseCounts.CaseCountsBuilder::criticalCases);

    /** Daily deltas; a negative value here is reported as {@link QualityFlag#NEGATIVE_DELTA}. */
    public static final Set<CaseField> DELTAS = EnumSet.of(NEW_CASES, NEW_DEATHS, NEW_RECOVERED);

    private final String column;
    private final boolean cumulative;
    private final Function<CaseCounts, Long> reader;
    private final BiConsumer<CaseCounts.CaseCountsBuilder, Long> writer;

    CaseField(String column, boolean cumulative,
              Function<CaseCounts, Long> reader,
              BiConsumer<CaseCounts.CaseCountsBuilder, Long> writer) {
        this.column = column;
        this.cumulative = cumulative;
        this.reader = reader;
        this.writer = writer;
    }

    public String column() {
        return column;
    }

    /** Running totals that must never decrease from one day to the next. */
    public boolean isCumulative() {
        return cumulative;
    }

    public Long read(CaseCounts counts) {
        return counts == null ? null : reader.apply(counts);
    }

    public void write(CaseCounts.CaseCountsBuilder builder, Long value) {
        writer.accept(builder, value);
    }
}
