package com.di.epistream.load;

import com.di.epistream.TestFixtures;
import com.di.epistream.config.EpiStreamProperties;
import com.di.epistream.exception.ErrorCategory;
import com.di.epistream.model.DerivedMetrics;
import com.di.epistream.model.PersistedRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IncrementalLoader Tests")
class IncrementalLoaderTest {

    private static final LocalDate DAY = LocalDate.of(2021, 3, 20);

    private EpiStreamProperties properties;
    private InMemoryCaseStore store;
    private IncrementalLoader loader;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        store = new InMemoryCaseStore(TestFixtures.CLOCK);
        loader = new IncrementalLoader(store, properties);
    }

    static PersistedRecord row(String country, LocalDate date, String hash) {
        return PersistedRecord.builder()
                .countryCode(country)
                .date(date)
                .counts(TestFixtures.totals(100, 10))
                .metrics(DerivedMetrics.EMPTY)
                .qualityFlags(Set.of())
                .reconciliationConfidence(1.0)
                .source("disease.sh")
                .dataHash(hash)
                .build();
    }

    // ============================================
    // Partitioning
    // ============================================

    @Test
    @DisplayName("Should group rows by country with dates sorted")
    void testPartition() {
        List<CountryPartition> partitions = IncrementalLoader.partition(List.of(
                row("FRA", DAY, "a"),
                row("DEU", DAY.plusDays(1), "b"),
                row("DEU", DAY, "c")), false);

        assertEquals(2, partitions.size());
        CountryPartition germany = partitions.get(0);
        assertEquals("DEU", germany.getCountryCode());
        assertEquals(DAY, germany.getFromDate());
        assertEquals(DAY.plusDays(1), germany.getToDate());
        assertEquals(2, germany.size());
        assertFalse(germany.isForceRewrite());
    }

    @Test
    @DisplayName("Should return the empty report when nothing changed")
    void testLoad_Empty() {
        assertSame(LoadReport.EMPTY, loader.load(List.of()));
    }

    // ============================================
    // Writes
    // ============================================

    @Test
    @DisplayName("Should insert new rows, update changed ones and count identical ones")
    void testLoad_InsertUpdateUnchanged() {
        loader.load(List.of(row("DEU", DAY, "h1"), row("DEU", DAY.plusDays(1), "h2")));

        LoadReport report = loader.load(List.of(
                row("DEU", DAY, "h1"),
                row("DEU", DAY.plusDays(1), "h2-changed"),
                row("DEU", DAY.plusDays(2), "h3")));

        assertEquals(1, report.getInserted());
        assertEquals(1, report.getUpdated());
        assertEquals(1, report.getUnchanged());
        assertFalse(report.hasFailures());
        assertEquals(3, store.count());
        assertEquals(Map.of(DAY, "h1", DAY.plusDays(1), "h2-changed", DAY.plusDays(2), "h3"),
                store.findHashes("DEU", DAY, DAY.plusDays(5)));
    }

    @Test
    @DisplayName("Should rewrite identical rows on a forced reload and keep creation time")
    void testLoad_ForceRewrite() {
        loader.load(List.of(row("DEU", DAY, "h1")));
        PersistedRecord before = store.findHistory("DEU", DAY, DAY).get(0);

        LoadReport report = loader.load(List.of(row("DEU", DAY, "h1")), true, new CancellationFlag());

        assertEquals(1, report.getUpdated());
        assertEquals(0, report.getUnchanged());
        assertEquals(before.getCreatedAt(), store.findHistory("DEU", DAY, DAY).get(0).getCreatedAt());
    }

    @Test
    @DisplayName("Should roll back only the failing country partition")
    void testLoad_PartitionIsolation() {
        LoadReport report = loader.load(List.of(
                row("DEU", DAY, "d1"),
                row("FRA", DAY, "f1"),
                row("FRA", DAY.plusDays(1), null),
                row("ITA", DAY, "i1")));

        assertEquals(2, report.getInserted());
        assertEquals(2, report.getFailed());
        assertEquals(1, report.getFailures().size());
        PartitionFailure failure = report.getFailures().get(0);
        assertEquals("FRA", failure.countryCode());
        assertEquals(DAY, failure.fromDate());
        assertEquals(DAY.plusDays(1), failure.toDate());
        assertEquals(ErrorCategory.CONSTRAINT_VIOLATION, failure.category());
        assertTrue(report.hasFailures());

        assertTrue(store.findHistory("FRA", DAY, DAY.plusDays(1)).isEmpty(), "FRA must be rolled back as a whole");
        assertEquals(1, store.findHistory("DEU", DAY, DAY).size());
        assertEquals(1, store.findHistory("ITA", DAY, DAY).size());
    }

    @Test
    @DisplayName("Should keep previously committed rows of a failing country untouched")
    void testLoad_FailureKeepsEarlierRows() {
        loader.load(List.of(row("FRA", DAY, "f1")));
        loader.load(List.of(row("FRA", DAY, "f1-changed"), row("FRA", DAY.plusDays(1), null)));
        assertEquals(Map.of(DAY, "f1"), store.findHashes("FRA", DAY, DAY.plusDays(1)));
    }

    // ============================================
    // Cancellation
    // ============================================

    @Test
    @DisplayName("Should skip every partition when cancelled before the start")
    void testLoad_CancelledBeforeStart() {
        CancellationFlag cancellation = new CancellationFlag();
        cancellation.cancel();

        LoadReport report = loader.load(List.of(row("DEU", DAY, "d1"), row("FRA", DAY, "f1")), false, cancellation);

        assertEquals(List.of("DEU", "FRA"), report.getSkipped());
        assertEquals(0, report.getInserted());
        assertEquals(0, store.count());
        assertTrue(report.hasFailures());
    }

    @Test
    @DisplayName("Should keep committed partitions and skip the rest after cancellation")
    void testLoad_CancelledMidway() {
        properties.getLoad().setWorkers(1);
        CancellationFlag cancellation = new CancellationFlag();
        List<String> written = new ArrayList<>();
        CaseStore cancellingStore = new InMemoryCaseStore(TestFixtures.CLOCK) {
            @Override
            public PartitionResult writePartition(CountryPartition partition) {
                PartitionResult result = super.writePartition(partition);
                written.add(partition.getCountryCode());
                cancellation.cancel();
                return result;
            }
        };
        IncrementalLoader sequential = new IncrementalLoader(cancellingStore, properties);

        LoadReport report = sequential.load(List.of(
                row("DEU", DAY, "d1"), row("FRA", DAY, "f1"), row("ITA", DAY, "i1")), false, cancellation);

        assertEquals(List.of("DEU"), written);
        assertEquals(1, report.getInserted());
        assertEquals(List.of("FRA", "ITA"), report.getSkipped());
        assertEquals(1, cancellingStore.count());
    }

    @Test
    @DisplayName("Should run partitions on named worker threads")
    void testLoad_WorkerThreads() {
        List<String> threads = new ArrayList<>();
        CaseStore recording = new InMemoryCaseStore(TestFixtures.CLOCK) {
            @Override
            public PartitionResult writePartition(CountryPartition partition) {
                synchronized (threads) {
                    threads.add(Thread.currentThread().getName());
                }
                return super.writePartition(partition);
            }
        };
        new IncrementalLoader(recording, properties).load(List.of(row("DEU", DAY, "d1"), row("FRA", DAY, "f1")));
        assertEquals(2, threads.size());
        assertTrue(threads.stream().allMatch(name -> name.startsWith("load-worker-")));
    }

    // ============================================
    // Timeout
    // ============================================

    private static void busyFor(Duration duration) {
        long deadline = System.nanoTime() + duration.toNanos();
        boolean interrupted = false;
        while (System.nanoTime() < deadline) {
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    @DisplayName("Should count a partition that commits within the grace period after a timeout")
    void testLoad_TimeoutCommitWithinGrace() {
        CaseStore slowGermany = new InMemoryCaseStore(TestFixtures.CLOCK) {
            @Override
            public PartitionResult writePartition(CountryPartition partition) {
                if ("DEU".equals(partition.getCountryCode())) {
                    busyFor(Duration.ofMillis(300));
                }
                return super.writePartition(partition);
            }
        };
        IncrementalLoader impatient = new IncrementalLoader(slowGermany, 2, Duration.ofMillis(50), Duration.ofSeconds(10));

        LoadReport report = impatient.load(List.of(row("DEU", DAY, "d1"), row("FRA", DAY, "f1")),
                false, new CancellationFlag());

        assertEquals(2, report.getInserted());
        assertTrue(report.getFailures().isEmpty());
        assertEquals(2, slowGermany.count());
    }

    @Test
    @DisplayName("Should report a partition still running after the grace period as possibly committing")
    void testLoad_TimeoutStillRunning() {
        CountDownLatch release = new CountDownLatch(1);
        CaseStore stuckGermany = new InMemoryCaseStore(TestFixtures.CLOCK) {
            @Override
            public PartitionResult writePartition(CountryPartition partition) {
                if ("DEU".equals(partition.getCountryCode())) {
                    while (release.getCount() > 0) {
                        busyFor(Duration.ofMillis(20));
                    }
                }
                return super.writePartition(partition);
            }
        };
        IncrementalLoader impatient = new IncrementalLoader(stuckGermany, 2, Duration.ofMillis(50), Duration.ofMillis(100));

        try {
            LoadReport report = impatient.load(List.of(row("DEU", DAY, "d1"), row("FRA", DAY, "f1")),
                    false, new CancellationFlag());

            assertEquals(1, report.getInserted());
            assertEquals(1, report.getFailures().size());
            PartitionFailure failure = report.getFailures().get(0);
            assertEquals("DEU", failure.countryCode());
            assertEquals(ErrorCategory.TIMEOUT_ERROR, failure.category());
            assertTrue(failure.message().contains("may still commit"));
        } finally {
            release.countDown();
        }
    }
}
