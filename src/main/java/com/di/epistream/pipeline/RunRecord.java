package com.di.epistream.pipeline;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One row of {@code pipeline_runs}.
 */
@Value
@Builder
public class RunRecord {
    String runId;
    String mode;
    String outcome;
    int inserted;
    int updated;
    int unchanged;
    int rejected;
    int failed;
    int flagged;
    long reliabilityVersion;
    Instant startedAt;
    Instant finishedAt;
    String message;

    public static RunRecord from(RunSummary summary) {
        return RunRecord.builder()
                .runId(summary.getRunId())
                .mode(summary.getMode() != null ? summary.getMode().name() : null)
                .outcome(summary.getOutcome() != null ? summary.getOutcome().name() : null)
                .inserted(summary.getInserted())
                .updated(summary.getUpdated())
                .unchanged(summary.getUnchanged())
                .rejected(summary.getRejected())
                .failed(summary.getFailed())
                .flagged(summary.getFlaggedFacts().size())
                .reliabilityVersion(summary.getReliabilityVersion())
                .startedAt(summary.getStartedAt())
                .finishedAt(summary.getFinishedAt())
                .message(summary.getMessage())
                .build();
    }
}
