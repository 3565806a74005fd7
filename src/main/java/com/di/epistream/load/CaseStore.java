package com.di.epistream.load;

import com.di.epistream.model.PersistedRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Storage for {@code covid_cases} rows. Implementations: in-memory (default) or JDBC.
 */
public interface CaseStore {

    /** Stored data hashes of one country within [from, to]. */
    Map<LocalDate, String> findHashes(String countryCode, LocalDate from, LocalDate to);

    /** Stored rows of one country within [from, to], sorted by date. */
    List<PersistedRecord> findHistory(String countryCode, LocalDate from, LocalDate to);

    /**
     * Writes one partition atomically: insert when absent, update when the hash differs
     * (or always, for a forced rewrite), skip otherwise. On any failure nothing of the
     * partition is kept and the exception propagates.
     */
    PartitionResult writePartition(CountryPartition partition);

    long count();
}
