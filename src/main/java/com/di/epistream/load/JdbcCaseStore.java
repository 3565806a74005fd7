package com.di.epistream.load;

import com.di.epistream.model.CaseCounts;
import com.di.epistream.model.CaseField;
import com.di.epistream.model.DerivedMetrics;
import com.di.epistream.model.PersistedRecord;
import com.di.epistream.model.QualityFlag;
import com.di.epistream.sql.SqlQueriesProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Date;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JDBC implementation of {@link CaseStore} over {@code covid_cases}. Each partition is written
 * inside one {@link TransactionTemplate} transaction; any exception rolls the whole country back.
 * <p>Rows go through {@code INSERT ... ON CONFLICT DO UPDATE}, so a key written by a concurrent
 * run between the hash lookup and the batch becomes an update (or a no-op when its hash already
 * matches) instead of a duplicate-key failure. Driver batches that report
 * {@link Statement#SUCCESS_NO_INFO} are counted from the hash lookup.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "epistream.store.type", havingValue = "jdbc")
public class JdbcCaseStore implements CaseStore {

    private static final RowMapper<PersistedRecord> ROW_MAPPER = (rs, rowNum) -> {
        CaseCounts.CaseCountsBuilder counts = CaseCounts.builder();
        for (CaseField field : CaseField.values()) {
            field.write(counts, rs.getObject(field.column(), Long.class));
        }
        return PersistedRecord.builder()
                .countryCode(rs.getString("country_code"))
                .date(rs.getDate("date").toLocalDate())
                .counts(counts.build())
                .metrics(DerivedMetrics.builder()
                        .casesPerMillion(rs.getObject("cases_per_million", Double.class))
                        .deathsPerMillion(rs.getObject("deaths_per_million", Double.class))
                        .caseFatalityRate(rs.getObject("case_fatality_rate", Double.class))
                        .newCases7dayAvg(rs.getObject("new_cases_7day_avg", Double.class))
                        .newDeaths7dayAvg(rs.getObject("new_deaths_7day_avg", Double.class))
                        .newCases14dayAvg(rs.getObject("new_cases_14day_avg", Double.class))
                        .growthRate(rs.getObject("growth_rate", Double.class))
                        .newCasesPctChange(rs.getObject("new_cases_pct_change", Double.class))
                        .build())
                .qualityFlags(parseFlags(rs.getString("quality_flags")))
                .reconciliationConfidence(rs.getDouble("reconciliation_confidence"))
                .source(rs.getString("source"))
                .dataHash(rs.getString("data_hash"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    };

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final SqlQueriesProperties sql;
    private final Clock clock;

    public JdbcCaseStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                         SqlQueriesProperties sql, Clock clock) {
        this.jdbc = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.sql = sql;
        this.clock = clock;
    }

    @Override
    public Map<LocalDate, String> findHashes(String countryCode, LocalDate from, LocalDate to) {
        Map<LocalDate, String> hashes = new LinkedHashMap<>();
        jdbc.query(sql.getCases().getFindHashesInRange(), rs -> {
            hashes.put(rs.getDate("date").toLocalDate(), rs.getString("data_hash"));
        }, countryCode, Date.valueOf(from), Date.valueOf(to));
        return hashes;
    }

    @Override
    public List<PersistedRecord> findHistory(String countryCode, LocalDate from, LocalDate to) {
        return jdbc.query(sql.getCases().getFindHistoryInRange(), ROW_MAPPER,
                countryCode, Date.valueOf(from), Date.valueOf(to));
    }

    @Override
    public PartitionResult writePartition(CountryPartition partition) {
        if (partition.size() == 0) {
            return new PartitionResult(0, 0, 0);
        }
        return transactionTemplate.execute(status -> {
            Map<LocalDate, String> existing = findHashes(partition.getCountryCode(), partition.getFromDate(), partition.getToDate());
            Timestamp now = Timestamp.from(clock.instant());
            List<PersistedRecord> pending = new ArrayList<>();
            List<Object[]> args = new ArrayList<>();
            int unchanged = 0;
            for (PersistedRecord row : partition.getRows()) {
                String storedHash = existing.get(row.getDate());
                if (storedHash != null && !partition.isForceRewrite() && storedHash.equals(row.getDataHash())) {
                    unchanged++;
                    continue;
                }
                pending.add(row);
                args.add(upsertArgs(row, now));
            }
            if (pending.isEmpty()) {
                return new PartitionResult(0, 0, unchanged);
            }
            String upsert = partition.isForceRewrite() ? sql.getCases().getRewrite() : sql.getCases().getUpsert();
            int[] affected = jdbc.batchUpdate(upsert, args);
            int inserted = 0;
            int updated = 0;
            for (int i = 0; i < pending.size(); i++) {
                int count = affected != null && i < affected.length ? affected[i] : Statement.SUCCESS_NO_INFO;
                if (count == 0) {
                    // a concurrent writer stored the same content first
                    unchanged++;
                } else if (existing.containsKey(pending.get(i).getDate())) {
                    updated++;
                } else {
                    inserted++;
                }
            }
            log.debug("[LOAD] {} committed | inserted={} | updated={} | unchanged={}",
                    partition.getCountryCode(), inserted, updated, unchanged);
            return new PartitionResult(inserted, updated, unchanged);
        });
    }

    @Override
    public long count() {
        Long n = jdbc.queryForObject(sql.getCases().getCount(), Long.class);
        return n == null ? 0 : n;
    }

    /**
     * Column order: country_code, date, counts..., metrics..., quality_flags, confidence, source,
     * data_hash, created_at, updated_at. created_at is only used when the row is new.
     */
    private static Object[] upsertArgs(PersistedRecord row, Timestamp now) {
        List<Object> args = new ArrayList<>();
        args.add(row.getCountryCode());
        args.add(Date.valueOf(row.getDate()));
        args.addAll(valueArgs(row));
        args.add(row.getDataHash());
        args.add(now);
        args.add(now);
        return args.toArray();
    }

    private static List<Object> valueArgs(PersistedRecord row) {
        List<Object> args = new ArrayList<>();
        for (CaseField field : CaseField.values()) {
            args.add(field.read(row.getCounts()));
        }
        DerivedMetrics m = row.getMetrics() != null ? row.getMetrics() : DerivedMetrics.EMPTY;
        args.add(m.getCasesPerMillion());
        args.add(m.getDeathsPerMillion());
        args.add(m.getCaseFatalityRate());
        args.add(m.getNewCases7dayAvg());
        args.add(m.getNewDeaths7dayAvg());
        args.add(m.getNewCases14dayAvg());
        args.add(m.getGrowthRate());
        args.add(m.getNewCasesPctChange());
        args.add(formatFlags(row.getQualityFlags()));
        args.add(row.getReconciliationConfidence());
        args.add(row.getSource());
        return args;
    }

    static String formatFlags(Set<QualityFlag> flags) {
        if (flags == null || flags.isEmpty()) return null;
        return flags.stream().map(QualityFlag::name).sorted().collect(Collectors.joining(","));
    }

    static Set<QualityFlag> parseFlags(String value) {
        Set<QualityFlag> flags = EnumSet.noneOf(QualityFlag.class);
        if (value == null || value.isBlank()) return flags;
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(s -> flags.add(QualityFlag.valueOf(s)));
        return flags;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
