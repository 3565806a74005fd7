package com.di.epistream.pipeline;

import com.di.epistream.change.ChangeDecision;
import com.di.epistream.change.ChangeDetector;
import com.di.epistream.config.EpiStreamProperties;
import com.di.epistream.enrich.CountrySeries;
import com.di.epistream.enrich.MetricsCalculator;
import com.di.epistream.load.CaseStore;
import com.di.epistream.model.CaseCounts;
import com.di.epistream.model.Country;
import com.di.epistream.model.EnrichedFact;
import com.di.epistream.model.PersistedRecord;
import com.di.epistream.model.ReconciledFact;
import com.di.epistream.model.ValidatedFact;
import com.di.epistream.quality.HistoryPoint;
import com.di.epistream.quality.ValidationContext;
import com.di.epistream.quality.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Validates, enriches and diffs one country's reconciled facts in date order against the
 * persisted history of that country.
 */
@Slf4j
@Component
public class CountryTransformer {

    private final Validator validator;
    private final MetricsCalculator metricsCalculator;
    private final ChangeDetector changeDetector;
    private final CaseStore caseStore;
    private final Clock clock;
    private final int historyDays;
    private final int anomalyWindowDays;

    public CountryTransformer(Validator validator, MetricsCalculator metricsCalculator, ChangeDetector changeDetector,
                              CaseStore caseStore, Clock clock, EpiStreamProperties properties) {
        this.validator = validator;
        this.metricsCalculator = metricsCalculator;
        this.changeDetector = changeDetector;
        this.caseStore = caseStore;
        this.clock = clock;
        this.historyDays = properties.getEnrich().getHistoryDays();
        this.anomalyWindowDays = properties.getQuality().getAnomalyWindowDays();
    }

    /**
     * Stored rows after a changed day read it through the 14-day average and growth rate, the
     * spike window and the previous-day checks, so they are recomputed up to this many days on.
     */
    static final int DEPENDENT_DAYS = 14;

    /**
     * @param facts       reconciled facts of a single country, any order
     * @param country     reference row, may be null when population is unknown
     * @param fullReload  return every recomputed row, not only changed ones
     */
    public CountryBatch transform(String countryCode, List<ReconciledFact> facts, Country country, boolean fullReload) {
        List<ReconciledFact> ordered = facts.stream()
                .sorted(Comparator.comparing(ReconciledFact::getDate))
                .toList();
        CountryBatch.CountryBatchBuilder batch = CountryBatch.builder().countryCode(countryCode);
        if (ordered.isEmpty()) {
            return batch.build();
        }
        LocalDate first = ordered.get(0).getDate();
        LocalDate last = ordered.get(ordered.size() - 1).getDate();
        LocalDate horizon = last.plusDays(Math.max(DEPENDENT_DAYS, anomalyWindowDays));

        NavigableMap<LocalDate, PersistedRecord> stored = new TreeMap<>();
        NavigableMap<LocalDate, CaseCounts> series = new TreeMap<>();
        for (PersistedRecord row : caseStore.findHistory(countryCode, first.minusDays(historyDays), horizon)) {
            stored.put(row.getDate(), row);
            series.put(row.getDate(), row.getCounts());
        }

        List<ValidatedFact> accepted = new ArrayList<>();
        Set<LocalDate> inputDates = new HashSet<>();
        int rejected = 0;
        for (ReconciledFact fact : ordered) {
            inputDates.add(fact.getDate());
            ValidatedFact validated = validator.validate(fact, contextFor(fact.getDate(), series));
            if (validated.isFlagged()) {
                batch.flaggedFact(new FlaggedFact(countryCode, fact.getDate(), validated.getQualityFlags(), validated.getIssues()));
            }
            if (validated.isRejected()) {
                rejected++;
                log.warn("[VALIDATE] Rejected {} {} | {}", countryCode, fact.getDate(), validated.getIssues());
                continue;
            }
            series.put(fact.getDate(), fact.getCounts());
            accepted.add(validated);
        }

        CountrySeries countrySeries = new CountrySeries(countryCode, series);
        Instant now = clock.instant();
        int unchanged = 0;
        LocalDate earliestChange = null;
        for (ValidatedFact validated : accepted) {
            EnrichedFact enriched = metricsCalculator.enrich(validated, countrySeries, country);
            ChangeDecision decision = changeDetector.diff(enriched, storedHash(stored, validated.getDate()));
            if (decision.requiresWrite() && earliestChange == null) {
                earliestChange = validated.getDate();
            }
            if (fullReload || decision.requiresWrite()) {
                batch.changedRecord(PersistedRecord.of(enriched, decision.newHash(), now));
            } else {
                unchanged++;
            }
        }
        if (earliestChange != null) {
            recomputeDependents(countryCode, batch, stored.subMap(earliestChange, false, horizon, true), inputDates,
                    series, countrySeries, country, now);
        }
        return batch.unchanged(unchanged).rejected(rejected).build();
    }

    /**
     * Re-validates and re-enriches stored rows that follow a changed day and are not part of
     * this run's input. Rows whose hash moved are added to the batch.
     */
    private void recomputeDependents(String countryCode, CountryBatch.CountryBatchBuilder batch,
                                     NavigableMap<LocalDate, PersistedRecord> dependents,
                                     Set<LocalDate> inputDates, NavigableMap<LocalDate, CaseCounts> series,
                                     CountrySeries countrySeries, Country country, Instant now) {
        int recomputed = 0;
        for (PersistedRecord row : dependents.values()) {
            if (inputDates.contains(row.getDate())) {
                continue;
            }
            ValidatedFact validated = validator.validate(restore(row), contextFor(row.getDate(), series));
            if (validated.isRejected()) {
                log.warn("[VALIDATE] Stored row {} {} no longer passes validation and is kept as stored | {}",
                        row.getCountryCode(), row.getDate(), validated.getIssues());
                continue;
            }
            EnrichedFact enriched = metricsCalculator.enrich(validated, countrySeries, country);
            ChangeDecision decision = changeDetector.diff(enriched, row.getDataHash());
            if (!decision.requiresWrite()) {
                continue;
            }
            if (validated.isFlagged()) {
                batch.flaggedFact(new FlaggedFact(row.getCountryCode(), row.getDate(), validated.getQualityFlags(), validated.getIssues()));
            }
            batch.changedRecord(PersistedRecord.of(enriched, decision.newHash(), now));
            recomputed++;
        }
        if (recomputed > 0) {
            log.info("[TRANSFORM] {} | recomputed {} stored row(s) after a corrected day", countryCode, recomputed);
        }
    }

    static ReconciledFact restore(PersistedRecord row) {
        List<String> sources = row.getSource() == null || row.getSource().isBlank()
                ? List.of()
                : Arrays.stream(row.getSource().split(",")).map(String::trim).sorted().toList();
        return ReconciledFact.builder()
                .countryCode(row.getCountryCode())
                .date(row.getDate())
                .counts(row.getCounts())
                .contributingSources(sources)
                .reconciliationConfidence(row.getReconciliationConfidence())
                .build();
    }

    private static String storedHash(NavigableMap<LocalDate, PersistedRecord> stored, LocalDate date) {
        PersistedRecord row = stored.get(date);
        return row != null ? row.getDataHash() : null;
    }

    private ValidationContext contextFor(LocalDate date, NavigableMap<LocalDate, CaseCounts> series) {
        ValidationContext.ValidationContextBuilder context = ValidationContext.builder();
        Map.Entry<LocalDate, CaseCounts> prior = series.lowerEntry(date);
        if (prior != null) {
            context.priorDate(prior.getKey()).priorCounts(prior.getValue());
        }
        series.subMap(date.minusDays(anomalyWindowDays), true, date, false).forEach((day, counts) ->
                context.historyPoint(new HistoryPoint(day, counts.getNewCases(), counts.getNewDeaths())));
        return context.build();
    }
}
