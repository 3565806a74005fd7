package com.di.epistream.load;

import com.di.epistream.model.PersistedRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Case store held in memory. A partition is applied to a staged copy of its country's rows
 * and published only when every row succeeded, which gives the same all-or-nothing outcome
 * as the JDBC transaction. Enforces the table's not-null constraints.
 */
@Component
@ConditionalOnProperty(name = "epistream.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryCaseStore implements CaseStore {

    private final Map<String, NavigableMap<LocalDate, PersistedRecord>> rows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCaseStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Map<LocalDate, String> findHashes(String countryCode, LocalDate from, LocalDate to) {
        Map<LocalDate, String> hashes = new LinkedHashMap<>();
        slice(countryCode, from, to).forEach((date, row) -> hashes.put(date, row.getDataHash()));
        return hashes;
    }

    @Override
    public List<PersistedRecord> findHistory(String countryCode, LocalDate from, LocalDate to) {
        return new ArrayList<>(slice(countryCode, from, to).values());
    }

    @Override
    public PartitionResult writePartition(CountryPartition partition) {
        int[] counts = new int[3];
        rows.compute(partition.getCountryCode(), (code, current) -> {
            NavigableMap<LocalDate, PersistedRecord> staged = current == null ? new TreeMap<>() : new TreeMap<>(current);
            Instant now = clock.instant();
            for (PersistedRecord row : partition.getRows()) {
                checkConstraints(partition.getCountryCode(), row);
                PersistedRecord existing = staged.get(row.getDate());
                if (existing == null) {
                    staged.put(row.getDate(), row.toBuilder().createdAt(now).updatedAt(now).build());
                    counts[0]++;
                } else if (partition.isForceRewrite() || !existing.getDataHash().equals(row.getDataHash())) {
                    staged.put(row.getDate(), row.toBuilder().createdAt(existing.getCreatedAt()).updatedAt(now).build());
                    counts[1]++;
                } else {
                    counts[2]++;
                }
            }
            return staged;
        });
        return new PartitionResult(counts[0], counts[1], counts[2]);
    }

    @Override
    public long count() {
        return rows.values().stream().mapToLong(Map::size).sum();
    }

    private NavigableMap<LocalDate, PersistedRecord> slice(String countryCode, LocalDate from, LocalDate to) {
        NavigableMap<LocalDate, PersistedRecord> country = rows.get(countryCode);
        if (country == null || from.isAfter(to)) {
            return new TreeMap<>();
        }
        return new TreeMap<>(country.subMap(from, true, to, true));
    }

    private static void checkConstraints(String partitionCountry, PersistedRecord row) {
        if (row.getCountryCode() == null || row.getDate() == null || row.getDataHash() == null) {
            throw new DataIntegrityViolationException("null value violates not-null constraint on covid_cases for "
                    + row.getCountryCode() + " " + row.getDate());
        }
        if (!partitionCountry.equals(row.getCountryCode())) {
            throw new DataIntegrityViolationException("row " + row.getCountryCode() + " " + row.getDate()
                    + " does not belong to partition " + partitionCountry);
        }
    }
}
