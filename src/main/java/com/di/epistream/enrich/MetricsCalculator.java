package com.di.epistream.enrich;

import com.di.epistream.model.CaseCounts;
import com.di.epistream.model.Country;
import com.di.epistream.model.DerivedMetrics;
import com.di.epistream.model.EnrichedFact;
import com.di.epistream.model.ValidatedFact;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Map;
import java.util.function.Function;

/**
 * Derives per-capita, fatality, rolling-average and growth metrics for one fact from its
 * country's reconciled series. Rolling averages cover calendar windows and average only the
 * days actually present, so a missing day never counts as zero.
 */
@Component
public class MetricsCalculator {

    static final int SCALE = 4;

    public EnrichedFact enrich(ValidatedFact fact, CountrySeries series, Country country) {
        if (fact.isRejected()) {
            throw new IllegalArgumentException("Rejected fact " + fact.getCountryCode() + " " + fact.getDate() + " cannot be enriched");
        }
        CaseCounts counts = fact.getCounts();
        LocalDate date = fact.getDate();
        Long population = country != null ? country.getPopulation() : null;

        Double avg7 = rollingAverage(series, date, 7, CaseCounts::getNewCases);
        Double avg7WeekBefore = rollingAverage(series, date.minusDays(7), 7, CaseCounts::getNewCases);

        DerivedMetrics metrics = DerivedMetrics.builder()
                .casesPerMillion(round(perMillion(counts.getTotalCases(), population)))
                .deathsPerMillion(round(perMillion(counts.getTotalDeaths(), population)))
                .caseFatalityRate(round(caseFatalityRate(counts)))
                .newCases7dayAvg(round(avg7))
                .newDeaths7dayAvg(round(rollingAverage(series, date, 7, CaseCounts::getNewDeaths)))
                .newCases14dayAvg(round(rollingAverage(series, date, 14, CaseCounts::getNewCases)))
                .growthRate(round(percentChange(avg7WeekBefore, avg7)))
                .newCasesPctChange(round(dayOverDay(series, date, counts.getNewCases())))
                .build();
        return new EnrichedFact(fact, metrics);
    }

    static Double perMillion(Long value, Long population) {
        if (value == null || population == null || population == 0) {
            return null;
        }
        return value * 1_000_000.0 / population;
    }

    static Double caseFatalityRate(CaseCounts counts) {
        Long cases = counts.getTotalCases();
        Long deaths = counts.getTotalDeaths();
        if (cases == null || deaths == null || cases <= 0) {
            return null;
        }
        return deaths * 100.0 / cases;
    }

    /**
     * Mean of the present values within [date - (days - 1), date]; null when none is present.
     */
    static Double rollingAverage(CountrySeries series, LocalDate date, int days, Function<CaseCounts, Long> metric) {
        long sum = 0;
        int present = 0;
        for (CaseCounts c : series.range(date.minusDays(days - 1L), date).values()) {
            Long v = metric.apply(c);
            if (v != null) {
                sum += v;
                present++;
            }
        }
        return present == 0 ? null : (double) sum / present;
    }

    private static Double dayOverDay(CountrySeries series, LocalDate date, Long current) {
        if (current == null) {
            return null;
        }
        Map.Entry<LocalDate, CaseCounts> previous = series.before(date);
        while (previous != null && previous.getValue().getNewCases() == null) {
            previous = series.before(previous.getKey());
        }
        if (previous == null) {
            return null;
        }
        return percentChange(previous.getValue().getNewCases().doubleValue(), current.doubleValue());
    }

    static Double percentChange(Double before, Double after) {
        if (before == null || after == null || before == 0.0) {
            return null;
        }
        return (after - before) / before * 100.0;
    }

    static Double round(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return null;
        }
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
