package com.di.epistream.load;

import com.di.epistream.config.EpiStreamProperties;
import com.di.epistream.exception.ErrorCategory;
import com.di.epistream.model.PersistedRecord;
import com.di.epistream.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes changed rows into the case store, one transaction per country.
 * <p>Partitions run concurrently on a fixed pool of {@code epistream.load.workers} threads.
 * A failing partition is rolled back and reported; its siblings carry on. Once the
 * {@link CancellationFlag} is raised or the load timeout passes, partitions that have not
 * started are skipped while committed ones stay durable. Running partitions are interrupted
 * and given {@code epistream.load.shutdown-grace-seconds} to finish; one still running after
 * that is reported as failed although its transaction may yet commit.
 */
@Slf4j
@Component
public class IncrementalLoader {

    private final CaseStore store;
    private final int workers;
    private final Duration timeout;
    private final Duration shutdownGrace;

    @Autowired
    public IncrementalLoader(CaseStore store, EpiStreamProperties properties) {
        this(store, properties.getLoad().getWorkers(),
                Duration.ofMinutes(properties.getLoad().getTimeoutMinutes()),
                Duration.ofSeconds(properties.getLoad().getShutdownGraceSeconds()));
    }

    IncrementalLoader(CaseStore store, int workers, Duration timeout, Duration shutdownGrace) {
        this.store = store;
        this.workers = workers;
        this.timeout = timeout;
        this.shutdownGrace = shutdownGrace;
    }

    public LoadReport load(List<PersistedRecord> changedRecords) {
        return load(changedRecords, false, new CancellationFlag());
    }

    public LoadReport load(List<PersistedRecord> changedRecords, boolean forceRewrite, CancellationFlag cancellation) {
        List<CountryPartition> partitions = partition(changedRecords, forceRewrite);
        if (partitions.isEmpty()) {
            log.info("[LOAD] Nothing to load");
            return LoadReport.EMPTY;
        }
        long start = System.currentTimeMillis();
        log.info("[LOAD] Loading {} row(s) in {} country partition(s) | workers={} | forceRewrite={}",
                changedRecords.size(), partitions.size(), workers, forceRewrite);

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, partitions.size()), workerThreads());
        Map<CountryPartition, Outcome> outcomes = new LinkedHashMap<>();
        Map<CountryPartition, AtomicBoolean> started = new LinkedHashMap<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        try {
            for (CountryPartition partition : partitions) {
                AtomicBoolean began = new AtomicBoolean(false);
                started.put(partition, began);
                CompletableFuture<Void> future = CompletableFuture
                        .supplyAsync(MdcPropagation.wrapSupplier(() -> runPartition(partition, cancellation, began)), pool)
                        .exceptionally(ex -> Outcome.failed(new PartitionLoadException(partition, unwrap(ex))))
                        .thenAccept(outcome -> {
                            synchronized (outcomes) {
                                outcomes.put(partition, outcome);
                            }
                        });
                futures.add(future);
            }
            awaitAll(futures, cancellation);
        } finally {
            pool.shutdownNow();
            awaitInFlight(pool);
        }

        LoadReport.LoadReportBuilder report = LoadReport.builder().partitions(partitions.size());
        int inserted = 0, updated = 0, unchanged = 0, failed = 0;
        synchronized (outcomes) {
            for (CountryPartition partition : partitions) {
                Outcome outcome = outcomes.get(partition);
                if (outcome == null) {
                    // still running or queued when the grace period ended
                    if (started.get(partition).get()) {
                        outcome = Outcome.failed(new PartitionLoadException(partition,
                                new TimeoutException("load did not finish within " + timeout
                                        + " and was still running after " + shutdownGrace + "; its transaction may still commit")));
                    } else {
                        outcome = Outcome.skipped();
                    }
                }
                if (outcome.result() != null) {
                    inserted += outcome.result().inserted();
                    updated += outcome.result().updated();
                    unchanged += outcome.result().unchanged();
                } else if (outcome.failure() != null) {
                    failed += partition.size();
                    report.failure(outcome.failure().toFailure());
                } else {
                    report.skippedCountry(partition.getCountryCode());
                }
            }
        }
        LoadReport result = report
                .inserted(inserted)
                .updated(updated)
                .unchanged(unchanged)
                .failed(failed)
                .durationMs(System.currentTimeMillis() - start)
                .build();
        log.info("[LOAD] Done in {} ms | inserted={} | updated={} | unchanged={} | failedRows={} | failedPartitions={} | skipped={}",
                result.getDurationMs(), inserted, updated, unchanged, failed, result.getFailures().size(), result.getSkipped().size());
        return result;
    }

    static List<CountryPartition> partition(List<PersistedRecord> records, boolean forceRewrite) {
        Map<String, List<PersistedRecord>> byCountry = new TreeMap<>();
        for (PersistedRecord record : records) {
            byCountry.computeIfAbsent(record.getCountryCode(), k -> new ArrayList<>()).add(record);
        }
        List<CountryPartition> partitions = new ArrayList<>(byCountry.size());
        byCountry.forEach((country, rows) -> partitions.add(new CountryPartition(country, rows, forceRewrite)));
        return partitions;
    }

    private Outcome runPartition(CountryPartition partition, CancellationFlag cancellation, AtomicBoolean began) {
        if (cancellation.isCancelled()) {
            log.info("[LOAD] Skipping {} (run cancelled)", partition.getCountryCode());
            return Outcome.skipped();
        }
        began.set(true);
        MDC.put("country", partition.getCountryCode());
        try {
            PartitionResult result = store.writePartition(partition);
            log.debug("[LOAD] Partition {} [{}..{}] committed {} row(s)",
                    partition.getCountryCode(), partition.getFromDate(), partition.getToDate(), partition.size());
            return Outcome.succeeded(result);
        } catch (RuntimeException e) {
            PartitionLoadException failure = new PartitionLoadException(partition, e);
            ErrorCategory category = failure.getCategory();
            log.error("[LOAD] Partition {} [{}..{}] rolled back | rows={} | category={} | {}",
                    partition.getCountryCode(), partition.getFromDate(), partition.getToDate(),
                    partition.size(), category, failure.getMessage(), e);
            return Outcome.failed(failure);
        } finally {
            MDC.remove("country");
        }
    }

    private void awaitAll(List<CompletableFuture<Void>> futures, CancellationFlag cancellation) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancellation.cancel();
            log.error("[LOAD] Load timed out after {}; remaining partitions are skipped", timeout);
        } catch (InterruptedException e) {
            cancellation.cancel();
            Thread.currentThread().interrupt();
            log.error("[LOAD] Interrupted while waiting for partitions; remaining partitions are skipped");
        } catch (ExecutionException e) {
            // partition failures are captured as outcomes, so the combined future only fails on a defect here
            throw new IllegalStateException("Unexpected partition future failure", e.getCause());
        }
    }

    private void awaitInFlight(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[LOAD] Partitions still running {} after interruption; they are reported as failed but may still commit",
                        shutdownGrace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[LOAD] Interrupted while waiting for running partitions to stop");
        }
    }

    private static Throwable unwrap(Throwable ex) {
        if (ex instanceof java.util.concurrent.CompletionException && ex.getCause() != null) {
            return ex.getCause();
        }
        return ex;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "load-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Outcome(PartitionResult result, PartitionLoadException failure) {
        static Outcome succeeded(PartitionResult result) {
            return new Outcome(result, null);
        }

        static Outcome failed(PartitionLoadException failure) {
            return new Outcome(null, failure);
        }

        static Outcome skipped() {
            return new Outcome(null, null);
        }
    }
}
