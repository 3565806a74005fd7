package com.di.epistream.reconcile;

import com.di.epistream.sql.SqlQueriesProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;

/**
 * JDBC implementation of {@link ReliabilityStore} over {@code source_reliability}; one row per
 * (version, country, source).
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "epistream.store.type", havingValue = "jdbc")
public class JdbcReliabilityStore implements ReliabilityStore {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final Clock clock;

    public JdbcReliabilityStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, Clock clock) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.clock = clock;
    }

    @Override
    public ReliabilityState loadLatest() {
        Long version = jdbc.queryForObject(sql.getReliability().getFindLatestVersion(), Long.class);
        if (version == null) {
            return ReliabilityState.initial();
        }
        Map<SourceKey, ReliabilityScore> scores = new TreeMap<>();
        jdbc.query(sql.getReliability().getFindByVersion(), rs -> {
            scores.put(new SourceKey(rs.getString("country_code"), rs.getString("source_id")),
                    new ReliabilityScore(rs.getDouble("agreements"), rs.getDouble("comparisons")));
        }, version);
        log.info("[RECONCILE] Loaded reliability state version {} ({} entries)", version, scores.size());
        return new ReliabilityState(version, scores);
    }

    @Override
    public void save(ReliabilityState state) {
        if (state == null || state.getScores().isEmpty()) return;
        Timestamp now = Timestamp.from(clock.instant());
        jdbc.batchUpdate(sql.getReliability().getInsert(), state.getScores().entrySet().stream()
                .map(e -> new Object[]{
                        state.getVersion(),
                        e.getKey().countryCode(),
                        e.getKey().sourceId(),
                        e.getValue().getAgreements(),
                        e.getValue().getComparisons(),
                        now})
                .toList());
    }
}
