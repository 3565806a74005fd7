package com.di.epistream.reconcile;

import com.di.epistream.TestFixtures;
import com.di.epistream.model.CaseCounts;
import com.di.epistream.model.CaseField;
import com.di.epistream.model.DailyObservation;
import com.di.epistream.model.ReconciledFact;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Reconciler Tests")
class ReconcilerTest {

    private static final LocalDate DAY = LocalDate.of(2021, 3, 31);
    private static final Instant EXTRACTED = Instant.parse("2021-04-01T05:00:00Z");

    private final Reconciler reconciler = new Reconciler(TestFixtures.properties());

    private static DailyObservation observation(String country, String source, CaseCounts counts) {
        return DailyObservation.builder()
                .countryCode(country)
                .date(DAY)
                .source(source)
                .counts(counts)
                .extractedAt(EXTRACTED)
                .build();
    }

    private static CaseCounts cases(long total) {
        return CaseCounts.builder().totalCases(total).build();
    }

    private static ReliabilityState trusting(String country, String source) {
        return new ReliabilityState(3L, Map.of(new SourceKey(country, source), new ReliabilityScore(10.0, 10.0)));
    }

    // ============================================
    // Field selection
    // ============================================

    @Test
    @DisplayName("Should pass a single-source fact through with full confidence")
    void testReconcile_SingleSource() {
        ReconciliationOutcome outcome = reconciler.reconcile(
                List.of(observation("DEU", "csv", cases(500))), ReliabilityState.initial());

        ReconciledFact fact = outcome.getFacts().get(0);
        assertEquals(500L, fact.getCounts().getTotalCases());
        assertEquals(1.0, fact.getReconciliationConfidence());
        assertEquals(List.of("csv"), List.copyOf(fact.getContributingSources()));
        assertTrue(outcome.getAmbiguities().isEmpty());
        assertTrue(outcome.getNextState().getScores().isEmpty(), "single-source keys are not comparisons");
    }

    @Test
    @DisplayName("Should take the value of the more reliable source when sources disagree")
    void testReconcile_MoreReliableWins() {
        List<DailyObservation> observations = List.of(
                observation("DEU", "covid19api", cases(100)),
                observation("DEU", "disease.sh", cases(105)));

        ReconciliationOutcome outcome = reconciler.reconcile(observations, trusting("DEU", "covid19api"));

        ReconciledFact fact = outcome.getFacts().get(0);
        assertEquals(100L, fact.getCounts().getTotalCases());
        assertEquals(0.5, fact.getReconciliationConfidence());
        assertEquals(Set.of("covid19api", "disease.sh"), Set.copyOf(fact.getContributingSources()));
        assertTrue(outcome.getAmbiguities().isEmpty());
    }

    @Test
    @DisplayName("Should merge fields a single source reports alone")
    void testReconcile_FieldwiseMerge() {
        List<DailyObservation> observations = List.of(
                observation("DEU", "covid19api", CaseCounts.builder().totalCases(1000L).totalRecovered(700L).build()),
                observation("DEU", "disease.sh", CaseCounts.builder().totalCases(1001L).activeCases(250L).build()));

        ReconciledFact fact = reconciler.reconcile(observations, ReliabilityState.initial()).getFacts().get(0);

        assertEquals(1001L, fact.getCounts().getTotalCases());
        assertEquals(700L, fact.getCounts().getTotalRecovered());
        assertEquals(250L, fact.getCounts().getActiveCases());
        assertEquals(1.0, fact.getReconciliationConfidence(), "1000 and 1001 agree within tolerance");
    }

    @Test
    @DisplayName("Should record an ambiguity and fall back to source priority on tied scores")
    void testReconcile_TiedScoresAmbiguity() {
        List<DailyObservation> observations = List.of(
                observation("FRA", "csv", cases(100)),
                observation("FRA", "disease.sh", cases(150)));

        ReconciliationOutcome outcome = reconciler.reconcile(observations, ReliabilityState.initial());

        ReconciledFact fact = outcome.getFacts().get(0);
        assertEquals(150L, fact.getCounts().getTotalCases());
        assertEquals(Set.of(CaseField.TOTAL_CASES), Set.copyOf(fact.getAmbiguousFields()));
        assertEquals(1, outcome.getAmbiguities().size());
        ReconciliationAmbiguity ambiguity = outcome.getAmbiguities().get(0);
        assertEquals("disease.sh", ambiguity.chosenSource());
        assertEquals(List.of("disease.sh", "csv"), ambiguity.tiedSources());
        assertEquals(Map.of("csv", 100L, "disease.sh", 150L), ambiguity.candidates());
    }

    // ============================================
    // Reliability state
    // ============================================

    @Test
    @DisplayName("Should return a new state version without touching the input state")
    void testReconcile_StateIsImmutable() {
        ReliabilityState before = trusting("DEU", "covid19api");
        ReliabilityState copy = new ReliabilityState(before.getVersion(), before.getScores());

        ReconciliationOutcome outcome = reconciler.reconcile(List.of(
                observation("DEU", "covid19api", cases(100)),
                observation("DEU", "disease.sh", cases(105))), before);

        assertEquals(copy, before);
        ReliabilityState next = outcome.getNextState();
        assertEquals(4L, next.getVersion());
        ReliabilityScore trusted = next.get("DEU", "covid19api");
        assertEquals(10.5, trusted.getAgreements(), 1e-9);
        assertEquals(10.5, trusted.getComparisons(), 1e-9);
        ReliabilityScore dissenter = next.get("DEU", "disease.sh");
        assertEquals(0.0, dissenter.getAgreements(), 1e-9);
        assertEquals(1.0, dissenter.getComparisons(), 1e-9);
    }

    @Test
    @DisplayName("Should not decay scores of pairs absent from the run")
    void testReconcile_UntouchedPairsKept() {
        ReliabilityState before = trusting("ITA", "csv");
        ReliabilityState next = reconciler.reconcile(List.of(
                observation("DEU", "covid19api", cases(100)),
                observation("DEU", "disease.sh", cases(100))), before).getNextState();
        assertEquals(before.get("ITA", "csv"), next.get("ITA", "csv"));
    }

    @Test
    @DisplayName("Should give identical results for any input order")
    void testReconcile_OrderIndependent() {
        List<DailyObservation> observations = new ArrayList<>(List.of(
                observation("DEU", "covid19api", cases(100)),
                observation("DEU", "disease.sh", cases(105)),
                observation("FRA", "csv", cases(70)),
                observation("FRA", "disease.sh", cases(90)),
                observation("ITA", "csv", cases(10))));
        ReliabilityState state = trusting("DEU", "covid19api");

        ReconciliationOutcome first = reconciler.reconcile(observations, state);
        Collections.reverse(observations);
        ReconciliationOutcome second = reconciler.reconcile(observations, state);

        assertEquals(first.getFacts(), second.getFacts());
        assertEquals(first.getNextState(), second.getNextState());
        assertEquals(List.of("DEU", "FRA", "ITA"),
                first.getFacts().stream().map(ReconciledFact::getCountryCode).toList());
    }

    @Test
    @DisplayName("Should apply both percent and absolute tolerance")
    void testAgree() {
        assertTrue(reconciler.agree(1000, 1020));
        assertFalse(reconciler.agree(1000, 1021));
        assertTrue(reconciler.agree(0, 1));
        assertFalse(reconciler.agree(0, 2));
    }

    @Test
    @DisplayName("Should keep every saved version in the in-memory store")
    void testInMemoryStore_Versions() {
        InMemoryReliabilityStore store = new InMemoryReliabilityStore();
        assertEquals(ReliabilityState.initial(), store.loadLatest());
        ReliabilityState v1 = trusting("DEU", "csv");
        store.save(v1);
        store.save(new ReliabilityState(1L, Map.of()));
        assertEquals(v1, store.loadLatest());
    }
}
