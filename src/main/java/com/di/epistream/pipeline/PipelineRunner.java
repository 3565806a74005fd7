package com.di.epistream.pipeline;

import com.di.epistream.config.EpiStreamProperties;
import com.di.epistream.exception.ErrorCategory;
import com.di.epistream.exception.PipelineException;
import com.di.epistream.ingest.CsvUploadReader;
import com.di.epistream.ingest.JsonSnapshotReader;
import com.di.epistream.ingest.NormalizationResult;
import com.di.epistream.ingest.Normalizer;
import com.di.epistream.ingest.RawRecord;
import com.di.epistream.load.CancellationFlag;
import com.di.epistream.load.IncrementalLoader;
import com.di.epistream.load.LoadReport;
import com.di.epistream.load.PartitionFailure;
import com.di.epistream.metrics.PipelineMetrics;
import com.di.epistream.model.PersistedRecord;
import com.di.epistream.model.ReconciledFact;
import com.di.epistream.reconcile.ReconciliationOutcome;
import com.di.epistream.reconcile.Reconciler;
import com.di.epistream.reconcile.ReliabilityState;
import com.di.epistream.reconcile.ReliabilityStore;
import com.di.epistream.registry.CountryRegistry;
import com.di.epistream.registry.CountryResolver;
import com.di.epistream.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs the whole pipeline once: ingest, normalize, reconcile, then per country validate,
 * enrich and diff, and finally load the changed rows.
 * <p>Only infrastructure failures before any partition starts (reference data, store
 * unreachable) fail the run. Bad records, ambiguous fields, quality flags and failed
 * partitions are counted in the {@link RunSummary}.
 */
@Slf4j
@Service
public class PipelineRunner {

    private final EpiStreamProperties properties;
    private final JsonSnapshotReader snapshotReader;
    private final CsvUploadReader csvReader;
    private final CountryResolver countryResolver;
    private final Normalizer normalizer;
    private final Reconciler reconciler;
    private final ReliabilityStore reliabilityStore;
    private final CountryTransformer transformer;
    private final IncrementalLoader loader;
    private final RunStore runStore;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private volatile CancellationFlag currentRun;

    public PipelineRunner(EpiStreamProperties properties,
                          JsonSnapshotReader snapshotReader,
                          CsvUploadReader csvReader,
                          CountryResolver countryResolver,
                          Normalizer normalizer,
                          Reconciler reconciler,
                          ReliabilityStore reliabilityStore,
                          CountryTransformer transformer,
                          IncrementalLoader loader,
                          RunStore runStore,
                          PipelineMetrics metrics,
                          Clock clock) {
        this.properties = properties;
        this.snapshotReader = snapshotReader;
        this.csvReader = csvReader;
        this.countryResolver = countryResolver;
        this.normalizer = normalizer;
        this.reconciler = reconciler;
        this.reliabilityStore = reliabilityStore;
        this.transformer = transformer;
        this.loader = loader;
        this.runStore = runStore;
        this.metrics = metrics;
        this.clock = clock;
    }

    /** Stops partitions of the current run that have not started yet. */
    public void cancel() {
        CancellationFlag flag = currentRun;
        if (flag != null) {
            log.warn("[PIPELINE] Cancellation requested");
            flag.cancel();
        }
    }

    public RunSummary run(RunRequest request) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put("runId", runId);
        CancellationFlag cancellation = new CancellationFlag();
        currentRun = cancellation;
        RunSummary.RunSummaryBuilder summary = RunSummary.builder()
                .runId(runId)
                .mode(request.mode())
                .startedAt(clock.instant());
        try {
            log.info("[PIPELINE] Run {} started | mode={} | csv={}", runId, request.mode(), request.csvUpload());
            execute(request, cancellation, summary);
        } catch (PipelineException e) {
            log.error("[PIPELINE] Run {} failed before loading: {}", runId, e.getMessage(), e);
            summary.outcome(RunOutcome.FAILED).message(e.getMessage());
        } catch (RuntimeException e) {
            log.error("[PIPELINE] Run {} aborted by an unexpected error", runId, e);
            summary.outcome(RunOutcome.FAILED).message(e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            currentRun = null;
        }
        RunSummary result = summary.finishedAt(clock.instant()).build();
        record(result);
        metrics.recordRun(result);
        logSummary(result);
        MDC.remove("runId");
        return result;
    }

    private void execute(RunRequest request, CancellationFlag cancellation, RunSummary.RunSummaryBuilder summary) {
        CountryRegistry registry = countryResolver.refresh();
        ReliabilityState state = loadReliability();

        List<RawRecord> raw = readInput(request);
        NormalizationResult normalized = normalizer.normalizeAll(raw);
        ReconciliationOutcome reconciled = reconciler.reconcile(normalized.getObservations(), state);
        summary.rawRecords(raw.size())
                .observations(normalized.getObservations().size())
                .schemaErrors(normalized.getSchemaErrors())
                .unknownCountries(normalized.getUnknownCountries())
                .learnedAliases(normalized.getLearnedAliases().size())
                .facts(reconciled.getFacts().size())
                .ambiguities(reconciled.getAmbiguities().size());

        List<CountryBatch> batches = transformAll(reconciled.getFacts(), registry, request.fullReload());
        List<PersistedRecord> toWrite = new ArrayList<>();
        int unchanged = 0;
        int rejected = 0;
        for (CountryBatch batch : batches) {
            if (batch.getFailure() != null) {
                summary.transformFailure(batch.getFailure());
                continue;
            }
            toWrite.addAll(batch.getChangedRecords());
            unchanged += batch.getUnchanged();
            rejected += batch.getRejected();
            summary.flaggedFacts(batch.getFlaggedFacts());
        }
        summary.unchangedDetected(unchanged).rejectedFacts(rejected);
        log.info("[CHANGE] {} row(s) to write | {} unchanged | {} rejected", toWrite.size(), unchanged, rejected);

        LoadReport report = loader.load(toWrite, request.fullReload(), cancellation);
        summary.load(report);

        boolean stateSaved = saveReliability(reconciled.getNextState());
        summary.reliabilityVersion(reconciled.getNextState().getVersion());

        long transformFailures = batches.stream().filter(b -> b.getFailure() != null).count();
        if (nothingPersisted(report, transformFailures)) {
            summary.outcome(RunOutcome.FAILED)
                    .message("no country partition was persisted: " + report.getFailures().size() + " failed to load, "
                            + report.getSkipped().size() + " skipped, " + transformFailures + " failed to transform");
            return;
        }
        boolean partial = report.hasFailures() || transformFailures > 0 || !stateSaved;
        summary.outcome(partial ? RunOutcome.PARTIAL_FAILURE : RunOutcome.SUCCESS);
        if (!stateSaved) {
            summary.message("reliability state version " + reconciled.getNextState().getVersion() + " was not saved");
        }
    }

    /** True when there was country work to do and every partition of it failed or was skipped. */
    static boolean nothingPersisted(LoadReport report, long transformFailures) {
        int attempted = report.getPartitions() + (int) transformFailures;
        int committed = report.getPartitions() - report.getFailures().size() - report.getSkipped().size();
        return attempted > 0 && committed <= 0;
    }

    private ReliabilityState loadReliability() {
        try {
            return reliabilityStore.loadLatest();
        } catch (DataAccessException e) {
            throw new PipelineException("Reliability store unreachable", e);
        }
    }

    private boolean saveReliability(ReliabilityState next) {
        try {
            reliabilityStore.save(next);
            return true;
        } catch (DataAccessException e) {
            log.error("[RECONCILE] Could not save reliability state version {}: {}", next.getVersion(), e.getMessage(), e);
            return false;
        }
    }

    private List<RawRecord> readInput(RunRequest request) {
        if (request.csvUpload() != null) {
            return csvReader.read(request.csvUpload());
        }
        List<RawRecord> records = new ArrayList<>();
        for (EpiStreamProperties.SourceLocation source : properties.getPipeline().getSources()) {
            Path path = Paths.get(source.getPath());
            records.addAll(snapshotReader.read(source.getId(), path));
        }
        if (properties.getPipeline().getSources().isEmpty()) {
            log.warn("[INGEST] No sources configured (epistream.pipeline.sources) and no CSV upload given");
        }
        return records;
    }

    private List<CountryBatch> transformAll(List<ReconciledFact> facts, CountryRegistry registry,
                                            boolean fullReload) {
        Map<String, List<ReconciledFact>> byCountry = new TreeMap<>();
        for (ReconciledFact fact : facts) {
            byCountry.computeIfAbsent(fact.getCountryCode(), k -> new ArrayList<>()).add(fact);
        }
        if (byCountry.isEmpty()) {
            return List.of();
        }
        int threads = Math.min(properties.getLoad().getWorkers(), byCountry.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<CompletableFuture<CountryBatch>> futures = new ArrayList<>();
            byCountry.forEach((country, countryFacts) -> futures.add(CompletableFuture
                    .supplyAsync(MdcPropagation.wrapSupplier(() ->
                            transformer.transform(country, countryFacts, registry.find(country).orElse(null), fullReload)), pool)
                    .exceptionally(ex -> failedBatch(country, countryFacts, ex))));
            List<CountryBatch> batches = new ArrayList<>(futures.size());
            for (CompletableFuture<CountryBatch> future : futures) {
                batches.add(future.join());
            }
            return batches;
        } finally {
            pool.shutdown();
        }
    }

    private CountryBatch failedBatch(String country, List<ReconciledFact> facts, Throwable ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        ErrorCategory category = ErrorCategory.categorize(cause);
        log.error("[TRANSFORM] {} failed ({} fact(s)) | category={} | {}", country, facts.size(), category, cause.getMessage(), cause);
        return CountryBatch.builder()
                .countryCode(country)
                .failure(new PartitionFailure(country,
                        facts.stream().map(ReconciledFact::getDate).min(Comparator.naturalOrder()).orElse(null),
                        facts.stream().map(ReconciledFact::getDate).max(Comparator.naturalOrder()).orElse(null),
                        facts.size(), category, String.valueOf(cause.getMessage())))
                .build();
    }

    private void record(RunSummary summary) {
        try {
            runStore.save(RunRecord.from(summary));
        } catch (DataAccessException e) {
            log.error("[PIPELINE] Could not record run {}: {}", summary.getRunId(), e.getMessage());
        }
    }

    private void logSummary(RunSummary s) {
        log.info("[SUMMARY] run={} mode={} outcome={} | raw={} observations={} facts={} | inserted={} updated={} unchanged={} rejected={} failed={} | ambiguities={} flagged={} | reliabilityVersion={}",
                s.getRunId(), s.getMode(), s.getOutcome(), s.getRawRecords(), s.getObservations(), s.getFacts(),
                s.getInserted(), s.getUpdated(), s.getUnchanged(), s.getRejected(), s.getFailed(),
                s.getAmbiguities(), s.getFlaggedFacts().size(), s.getReliabilityVersion());
        s.getFlaggedFacts().forEach(f ->
                log.info("[SUMMARY] flagged {} {} {} {}", f.countryCode(), f.date(), f.flags(), f.issues()));
        s.getLoad().getFailures().forEach(f ->
                log.warn("[SUMMARY] failed partition {} [{}..{}] rows={} category={} | {}",
                        f.countryCode(), f.fromDate(), f.toDate(), f.rows(), f.category(), f.message()));
        s.getTransformFailures().forEach(f ->
                log.warn("[SUMMARY] failed transformation {} rows={} category={} | {}",
                        f.countryCode(), f.rows(), f.category(), f.message()));
        if (!s.getLoad().getSkipped().isEmpty()) {
            log.warn("[SUMMARY] skipped partitions: {}", s.getLoad().getSkipped());
        }
    }
}
