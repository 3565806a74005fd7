package com.di.epistream.quality;

import com.di.epistream.config.EpiStreamProperties;
import com.di.epistream.model.CaseCounts;
import com.di.epistream.model.CaseField;
import com.di.epistream.model.QualityFlag;
import com.di.epistream.model.ReconciledFact;
import com.di.epistream.model.ValidatedFact;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Annotates reconciled facts with quality flags. Checks run in a fixed order and flags
 * accumulate; apart from {@link QualityFlag#REJECTED} nothing here keeps a fact from loading.
 */
@Component
public class Validator {

    private final EpiStreamProperties.Quality config;
    private final Clock clock;

    public Validator(EpiStreamProperties properties, Clock clock) {
        this.config = properties.getQuality();
        this.clock = clock;
    }

    public ValidatedFact validate(ReconciledFact fact, ReconciledFact priorFact) {
        ValidationContext context = priorFact == null
                ? ValidationContext.EMPTY
                : ValidationContext.ofPrior(priorFact.getDate(), priorFact.getCounts());
        return validate(fact, context);
    }

    public ValidatedFact validate(ReconciledFact fact, ValidationContext context) {
        Set<QualityFlag> flags = EnumSet.noneOf(QualityFlag.class);
        List<String> issues = new ArrayList<>();

        if (checkStructure(fact, flags, issues)) {
            return new ValidatedFact(fact, flags, issues);
        }
        CaseCounts counts = fact.getCounts() != null ? fact.getCounts() : CaseCounts.EMPTY;
        checkNonNegative(counts, flags, issues);
        checkActiveConsistency(counts, flags, issues);
        checkMonotonic(counts, context, flags, issues);
        checkSpike(fact.getDate(), counts, context, flags, issues);
        if (fact.getReconciliationConfidence() < config.getLowConfidenceThreshold()) {
            flags.add(QualityFlag.LOW_CONFIDENCE);
            issues.add(String.format("reconciliation confidence %.2f below %.2f",
                    fact.getReconciliationConfidence(), config.getLowConfidenceThreshold()));
        }
        return new ValidatedFact(fact, flags, issues);
    }

    /** @return true when the fact is rejected and no further check applies */
    private boolean checkStructure(ReconciledFact fact, Set<QualityFlag> flags, List<String> issues) {
        if (fact.getCountryCode() == null || fact.getCountryCode().isBlank()) {
            issues.add("missing country code");
        }
        if (fact.getDate() == null) {
            issues.add("missing date");
        } else if (fact.getDate().isAfter(LocalDate.now(clock))) {
            issues.add("date " + fact.getDate() + " is in the future");
        }
        if (issues.isEmpty()) {
            return false;
        }
        flags.add(QualityFlag.REJECTED);
        return true;
    }

    private void checkNonNegative(CaseCounts counts, Set<QualityFlag> flags, List<String> issues) {
        for (CaseField field : CaseField.values()) {
            Long value = field.read(counts);
            if (value != null && value < 0) {
                flags.add(QualityFlag.NEGATIVE_VALUE);
                if (CaseField.DELTAS.contains(field)) {
                    flags.add(QualityFlag.NEGATIVE_DELTA);
                }
                issues.add(field.column() + " is negative (" + value + ")");
            }
        }
    }

    private void checkActiveConsistency(CaseCounts counts, Set<QualityFlag> flags, List<String> issues) {
        Long active = counts.getActiveCases();
        Long total = counts.getTotalCases();
        Long deaths = counts.getTotalDeaths();
        Long recovered = counts.getTotalRecovered();
        if (active == null || total == null || deaths == null || recovered == null) {
            return;
        }
        long expected = total - deaths - recovered;
        double tolerance = Math.max(config.getConsistencyTolerancePct() / 100.0 * total, config.getConsistencyToleranceMin());
        if (Math.abs(active - expected) > tolerance) {
            flags.add(QualityFlag.INCONSISTENT_ACTIVE);
            issues.add(String.format("active_cases %d differs from total - deaths - recovered = %d by more than %.1f",
                    active, expected, tolerance));
        }
    }

    private void checkMonotonic(CaseCounts counts, ValidationContext context, Set<QualityFlag> flags, List<String> issues) {
        CaseCounts prior = context.getPriorCounts();
        if (prior == null) {
            return;
        }
        for (CaseField field : CaseField.values()) {
            if (!field.isCumulative()) continue;
            Long now = field.read(counts);
            Long before = field.read(prior);
            if (now != null && before != null && now < before) {
                flags.add(QualityFlag.CUMULATIVE_DECREASE);
                issues.add(String.format("%s decreased from %d (%s) to %d",
                        field.column(), before, context.getPriorDate(), now));
            }
        }
    }

    private void checkSpike(LocalDate date, CaseCounts counts, ValidationContext context,
                            Set<QualityFlag> flags, List<String> issues) {
        LocalDate from = date.minusDays(config.getAnomalyWindowDays());
        List<HistoryPoint> window = context.getHistory().stream()
                .filter(p -> p.date() != null && !p.date().isBefore(from) && p.date().isBefore(date))
                .toList();
        spike("new_cases", counts.getNewCases(), window, HistoryPoint::newCases, config.getAnomalyCasesFloor(), flags, issues);
        spike("new_deaths", counts.getNewDeaths(), window, HistoryPoint::newDeaths, config.getAnomalyDeathsFloor(), flags, issues);
    }

    private void spike(String column, Long value, List<HistoryPoint> window, Function<HistoryPoint, Long> metric,
                       long floor, Set<QualityFlag> flags, List<String> issues) {
        if (value == null) {
            return;
        }
        double[] points = window.stream()
                .map(metric)
                .filter(v -> v != null)
                .mapToDouble(Long::doubleValue)
                .toArray();
        if (points.length < config.getAnomalyMinHistory()) {
            return;
        }
        double mean = 0;
        for (double p : points) mean += p;
        mean /= points.length;
        double variance = 0;
        for (double p : points) variance += (p - mean) * (p - mean);
        double std = Math.sqrt(variance / points.length);
        double threshold = Math.max(config.getAnomalyStdMultiplier() * std, floor);
        if (value - mean > threshold) {
            flags.add(QualityFlag.ANOMALOUS_SPIKE);
            issues.add(String.format("%s %d exceeds trailing mean %.1f by more than %.1f", column, value, mean, threshold));
        }
    }
}
