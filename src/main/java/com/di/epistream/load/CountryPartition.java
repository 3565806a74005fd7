package com.di.epistream.load;

import com.di.epistream.model.PersistedRecord;
import lombok.Value;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * All rows of one country for one run: the unit of work and of transactional isolation.
 * Rows are sorted by date.
 */
@Value
public class CountryPartition {

    String countryCode;
    List<PersistedRecord> rows;
    /** Rewrite rows even when the stored hash is identical (full reload). */
    boolean forceRewrite;

    public CountryPartition(String countryCode, List<PersistedRecord> rows, boolean forceRewrite) {
        this.countryCode = countryCode;
        this.rows = rows.stream()
                .sorted(Comparator.comparing(PersistedRecord::getDate))
                .toList();
        this.forceRewrite = forceRewrite;
    }

    public LocalDate getFromDate() {
        return rows.isEmpty() ? null : rows.get(0).getDate();
    }

    public LocalDate getToDate() {
        return rows.isEmpty() ? null : rows.get(rows.size() - 1).getDate();
    }

    public int size() {
        return rows.size();
    }
}
