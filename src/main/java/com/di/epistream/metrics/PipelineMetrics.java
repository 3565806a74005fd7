package com.di.epistream.metrics;

import com.di.epistream.load.PartitionFailure;
import com.di.epistream.pipeline.RunSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for pipeline runs: row outcomes, failed partitions by error category,
 * run duration by outcome and reliability state version.
 */
@Slf4j
@Component
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter insertedCounter;
    private final Counter updatedCounter;
    private final Counter unchangedCounter;
    private final Counter rejectedCounter;
    private final Counter failedCounter;
    private final DistributionSummary flaggedFacts;
    private final DistributionSummary ambiguities;
    private final AtomicLong reliabilityVersion;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.insertedCounter = rows("inserted");
        this.updatedCounter = rows("updated");
        this.unchangedCounter = rows("unchanged");
        this.rejectedCounter = rows("rejected");
        this.failedCounter = rows("failed");

        this.flaggedFacts = DistributionSummary.builder("epistream.run.flagged")
                .description("Facts carrying at least one quality flag per run")
                .register(meterRegistry);
        this.ambiguities = DistributionSummary.builder("epistream.run.ambiguities")
                .description("Fields resolved by source priority per run")
                .register(meterRegistry);
        this.reliabilityVersion = meterRegistry.gauge("epistream.reliability.version", new AtomicLong());
    }

    private Counter rows(String outcome) {
        return Counter.builder("epistream.rows")
                .description("Rows by outcome")
                .baseUnit("rows")
                .tag("outcome", outcome)
                .register(meterRegistry);
    }

    public void recordRun(RunSummary summary) {
        insertedCounter.increment(summary.getInserted());
        updatedCounter.increment(summary.getUpdated());
        unchangedCounter.increment(summary.getUnchanged());
        rejectedCounter.increment(summary.getRejected());
        failedCounter.increment(summary.getFailed());
        flaggedFacts.record(summary.getFlaggedFacts().size());
        ambiguities.record(summary.getAmbiguities());

        for (PartitionFailure failure : summary.getLoad().getFailures()) {
            recordPartitionFailure("load", failure);
        }
        for (PartitionFailure failure : summary.getTransformFailures()) {
            recordPartitionFailure("transform", failure);
        }
        if (summary.getStartedAt() != null && summary.getFinishedAt() != null) {
            Timer.builder("epistream.run.duration")
                    .description("Wall time of a pipeline run")
                    .tag("outcome", String.valueOf(summary.getOutcome()))
                    .register(meterRegistry)
                    .record(Duration.between(summary.getStartedAt(), summary.getFinishedAt()));
        }
        if (summary.getReliabilityVersion() > 0) {
            reliabilityVersion.set(summary.getReliabilityVersion());
        }
        log.debug("Recorded run metrics: run={}, outcome={}", summary.getRunId(), summary.getOutcome());
    }

    private void recordPartitionFailure(String stage, PartitionFailure failure) {
        Counter.builder("epistream.partitions.failed")
                .description("Country partitions rolled back or not transformed")
                .tag("stage", stage)
                .tag("category", String.valueOf(failure.category()))
                .register(meterRegistry)
                .increment();
    }
}
