package com.di.epistream.pipeline;

import com.di.epistream.load.LoadReport;
import com.di.epistream.load.PartitionFailure;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Everything a run did, as logged at the end and stored in {@code pipeline_runs}.
 */
@Value
@Builder(toBuilder = true)
public class RunSummary {
    String runId;
    RunMode mode;
    RunOutcome outcome;
    Instant startedAt;
    Instant finishedAt;

    int rawRecords;
    int observations;
    int schemaErrors;
    int unknownCountries;
    int learnedAliases;
    int facts;
    int ambiguities;
    /** Facts flagged REJECTED by the validator. */
    int rejectedFacts;
    /** Facts whose hash matched the stored one and were never sent to the loader. */
    int unchangedDetected;
    long reliabilityVersion;

    @Builder.Default
    LoadReport load = LoadReport.EMPTY;
    @Singular
    List<PartitionFailure> transformFailures;
    @Singular
    List<FlaggedFact> flaggedFacts;
    String message;

    public int getInserted() {
        return load.getInserted();
    }

    public int getUpdated() {
        return load.getUpdated();
    }

    public int getUnchanged() {
        return unchangedDetected + load.getUnchanged();
    }

    /** Raw records dropped during normalization plus facts rejected by validation. */
    public int getRejected() {
        return schemaErrors + unknownCountries + rejectedFacts;
    }

    public int getFailed() {
        return load.getFailed() + transformFailures.stream().mapToInt(PartitionFailure::rows).sum();
    }

    public int exitCode() {
        return outcome == null ? RunOutcome.FAILED.exitCode() : outcome.exitCode();
    }
}
