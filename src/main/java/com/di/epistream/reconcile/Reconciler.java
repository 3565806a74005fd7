package com.di.epistream.reconcile;

import com.di.epistream.config.EpiStreamProperties;
import com.di.epistream.model.CaseCounts;
import com.di.epistream.model.CaseField;
import com.di.epistream.model.DailyObservation;
import com.di.epistream.model.ReconciledFact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Merges observations from several sources into one {@link ReconciledFact} per (country, date).
 * <p>For a field reported by several sources the value of the most reliable source for that
 * country wins; scores within {@value #SCORE_EPSILON} tie and fall back to the configured source
 * priority, then to source id. Reliability is read from the given state only and the updated
 * counters are returned as a new state version, so identical inputs give identical outputs.
 */
@Slf4j
@Component
public class Reconciler {

    static final double SCORE_EPSILON = 1e-9;

    private final double tolerancePct;
    private final long toleranceMin;
    private final double decay;
    private final List<String> sourcePriority;

    public Reconciler(EpiStreamProperties properties) {
        EpiStreamProperties.Reconcile config = properties.getReconcile();
        this.tolerancePct = config.getTolerancePct();
        this.toleranceMin = config.getToleranceMin();
        this.decay = config.getReliabilityDecay();
        this.sourcePriority = config.getSourcePriority().stream()
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    public ReconciliationOutcome reconcile(List<DailyObservation> observations, ReliabilityState state) {
        Map<FactKey, Map<String, DailyObservation>> groups = new TreeMap<>();
        for (DailyObservation o : observations) {
            groups.computeIfAbsent(new FactKey(o.getCountryCode(), o.getDate()), k -> new TreeMap<>())
                    .merge(o.getSource(), o, Reconciler::latest);
        }

        List<ReconciledFact> facts = new ArrayList<>(groups.size());
        List<ReconciliationAmbiguity> ambiguities = new ArrayList<>();
        Map<SourceKey, List<Boolean>> comparisons = new TreeMap<>();

        for (Map.Entry<FactKey, Map<String, DailyObservation>> group : groups.entrySet()) {
            FactKey key = group.getKey();
            Map<String, DailyObservation> bySource = group.getValue();
            if (bySource.size() == 1) {
                DailyObservation only = bySource.values().iterator().next();
                facts.add(ReconciledFact.builder()
                        .countryCode(key.countryCode())
                        .date(key.date())
                        .counts(only.getCounts() != null ? only.getCounts() : CaseCounts.EMPTY)
                        .contributingSource(only.getSource())
                        .reconciliationConfidence(1.0)
                        .build());
                continue;
            }
            facts.add(merge(key, bySource, state, ambiguities, comparisons));
        }

        ReliabilityState next = nextState(state, comparisons);
        if (!ambiguities.isEmpty()) {
            log.info("[RECONCILE] {} ambiguous field(s) resolved by source priority", ambiguities.size());
        }
        log.info("[RECONCILE] {} observation(s) -> {} fact(s) | multiSourceKeys={} | reliabilityVersion {} -> {}",
                observations.size(), facts.size(),
                groups.values().stream().filter(m -> m.size() > 1).count(),
                state.getVersion(), next.getVersion());
        return new ReconciliationOutcome(List.copyOf(facts), next, List.copyOf(ambiguities));
    }

    private ReconciledFact merge(FactKey key,
                                 Map<String, DailyObservation> bySource,
                                 ReliabilityState state,
                                 List<ReconciliationAmbiguity> ambiguities,
                                 Map<SourceKey, List<Boolean>> comparisons) {
        List<String> ranked = new ArrayList<>(bySource.keySet());
        ranked.sort(rankingFor(key.countryCode(), state));

        CaseCounts.CaseCountsBuilder merged = CaseCounts.builder();
        Set<String> disagreeing = new HashSet<>();
        ReconciledFact.ReconciledFactBuilder fact = ReconciledFact.builder()
                .countryCode(key.countryCode())
                .date(key.date());

        for (CaseField field : CaseField.values()) {
            List<String> reporters = ranked.stream()
                    .filter(source -> field.read(bySource.get(source).getCounts()) != null)
                    .toList();
            if (reporters.isEmpty()) {
                continue;
            }
            String chosenSource = reporters.get(0);
            long chosen = field.read(bySource.get(chosenSource).getCounts());
            field.write(merged, chosen);

            List<String> tiedDissenters = new ArrayList<>();
            double topScore = state.score(key.countryCode(), chosenSource);
            for (String source : reporters) {
                long value = field.read(bySource.get(source).getCounts());
                if (!agree(chosen, value)) {
                    disagreeing.add(source);
                    if (Math.abs(state.score(key.countryCode(), source) - topScore) <= SCORE_EPSILON) {
                        tiedDissenters.add(source);
                    }
                }
            }
            if (!tiedDissenters.isEmpty()) {
                List<String> tied = new ArrayList<>();
                tied.add(chosenSource);
                tied.addAll(tiedDissenters);
                Map<String, Long> candidates = new TreeMap<>();
                reporters.forEach(s -> candidates.put(s, field.read(bySource.get(s).getCounts())));
                ReconciliationAmbiguity ambiguity = new ReconciliationAmbiguity(
                        key.countryCode(), key.date(), field, candidates, List.copyOf(tied), chosenSource);
                ambiguities.add(ambiguity);
                fact.ambiguousField(field);
                log.warn("[RECONCILE] Ambiguous {} for {} {} | candidates={} | chosen={}",
                        field.column(), key.countryCode(), key.date(), candidates, chosenSource);
            }
        }

        int agreeing = 0;
        for (String source : bySource.keySet()) {
            boolean agreed = !disagreeing.contains(source);
            if (agreed) agreeing++;
            comparisons.computeIfAbsent(new SourceKey(key.countryCode(), source), k -> new ArrayList<>()).add(agreed);
        }

        return fact
                .counts(merged.build())
                .contributingSources(bySource.keySet())
                .reconciliationConfidence((double) agreeing / bySource.size())
                .build();
    }

    /** Highest score first; near-equal scores by configured priority, then source id. */
    private Comparator<String> rankingFor(String countryCode, ReliabilityState state) {
        return (a, b) -> {
            double sa = state.score(countryCode, a);
            double sb = state.score(countryCode, b);
            if (Math.abs(sa - sb) > SCORE_EPSILON) {
                return Double.compare(sb, sa);
            }
            int byPriority = Integer.compare(priorityOf(a), priorityOf(b));
            return byPriority != 0 ? byPriority : a.compareTo(b);
        };
    }

    private int priorityOf(String source) {
        int index = sourcePriority.indexOf(source.toLowerCase(Locale.ROOT));
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    boolean agree(long a, long b) {
        double tolerance = Math.max(tolerancePct / 100.0 * Math.max(Math.abs(a), Math.abs(b)), toleranceMin);
        return Math.abs(a - b) <= tolerance;
    }

    private ReliabilityState nextState(ReliabilityState state, Map<SourceKey, List<Boolean>> comparisons) {
        Map<SourceKey, ReliabilityScore> scores = new LinkedHashMap<>(state.getScores());
        comparisons.forEach((sourceKey, outcomes) -> {
            ReliabilityScore score = state.get(sourceKey.countryCode(), sourceKey.sourceId()).decay(decay);
            for (Boolean agreed : outcomes) {
                score = score.record(agreed);
            }
            scores.put(sourceKey, score);
        });
        return new ReliabilityState(state.getVersion() + 1, scores);
    }

    private static DailyObservation latest(DailyObservation a, DailyObservation b) {
        if (a.getExtractedAt() == null) return b;
        if (b.getExtractedAt() == null) return a;
        return b.getExtractedAt().isBefore(a.getExtractedAt()) ? a : b;
    }

    private record FactKey(String countryCode, LocalDate date) implements Comparable<FactKey> {
        @Override
        public int compareTo(FactKey other) {
            int c = countryCode.compareTo(other.countryCode);
            return c != 0 ? c : date.compareTo(other.date);
        }
    }
}
