package com.di.epistream.pipeline;

import com.di.epistream.sql.SqlQueriesProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Component
@ConditionalOnProperty(name = "epistream.store.type", havingValue = "jdbc")
public class JdbcRunStore implements RunStore {

    private static final RowMapper<RunRecord> RUN_ROW_MAPPER = (rs, rowNum) -> RunRecord.builder()
            .runId(rs.getString("run_id"))
            .mode(rs.getString("mode"))
            .outcome(rs.getString("outcome"))
            .inserted(rs.getInt("inserted"))
            .updated(rs.getInt("updated"))
            .unchanged(rs.getInt("unchanged"))
            .rejected(rs.getInt("rejected"))
            .failed(rs.getInt("failed"))
            .flagged(rs.getInt("flagged"))
            .reliabilityVersion(rs.getLong("reliability_version"))
            .startedAt(toInstant(rs.getTimestamp("started_at")))
            .finishedAt(toInstant(rs.getTimestamp("finished_at")))
            .message(rs.getString("message"))
            .build();

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcRunStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    @Override
    public void save(RunRecord run) {
        if (run == null || run.getRunId() == null) return;
        jdbc.update(sql.getRuns().getInsert(),
                run.getRunId(),
                run.getMode(),
                run.getOutcome(),
                run.getInserted(),
                run.getUpdated(),
                run.getUnchanged(),
                run.getRejected(),
                run.getFailed(),
                run.getFlagged(),
                run.getReliabilityVersion(),
                toTimestamp(run.getStartedAt()),
                toTimestamp(run.getFinishedAt()),
                run.getMessage());
    }

    @Override
    public List<RunRecord> findRecent(int limit) {
        return jdbc.query(sql.getRuns().getFindRecent(), RUN_ROW_MAPPER, Math.max(1, limit));
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }
}
