package com.di.epistream.enrich;

import com.di.epistream.model.CaseCounts;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Reconciled daily counts of one country keyed by date. Missing dates are gaps, never zeros.
 */
public final class CountrySeries {

    private final String countryCode;
    private final NavigableMap<LocalDate, CaseCounts> byDate;

    public CountrySeries(String countryCode, Map<LocalDate, CaseCounts> byDate) {
        this.countryCode = countryCode;
        this.byDate = Collections.unmodifiableNavigableMap(new TreeMap<>(byDate));
    }

    public String getCountryCode() {
        return countryCode;
    }

    public NavigableMap<LocalDate, CaseCounts> getByDate() {
        return byDate;
    }

    public CaseCounts get(LocalDate date) {
        return byDate.get(date);
    }

    /** Inclusive range [from, to]. */
    public NavigableMap<LocalDate, CaseCounts> range(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            return Collections.emptyNavigableMap();
        }
        return byDate.subMap(from, true, to, true);
    }

    /** Nearest earlier day, or null. */
    public Map.Entry<LocalDate, CaseCounts> before(LocalDate date) {
        return byDate.lowerEntry(date);
    }

    public int size() {
        return byDate.size();
    }
}
