package com.di.epistream.reconcile;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable, versioned snapshot of every (country, source) reliability score. The reconciler
 * reads one snapshot and returns the next; nothing holds it as mutable global state.
 */
public final class ReliabilityState {

    private static final ReliabilityState INITIAL = new ReliabilityState(0L, new TreeMap<>());

    private final long version;
    private final NavigableMap<SourceKey, ReliabilityScore> scores;

    public ReliabilityState(long version, Map<SourceKey, ReliabilityScore> scores) {
        this.version = version;
        this.scores = Collections.unmodifiableNavigableMap(new TreeMap<>(scores));
    }

    /** Version 0 with no history. */
    public static ReliabilityState initial() {
        return INITIAL;
    }

    public long getVersion() {
        return version;
    }

    public NavigableMap<SourceKey, ReliabilityScore> getScores() {
        return scores;
    }

    public ReliabilityScore get(String countryCode, String sourceId) {
        return scores.getOrDefault(new SourceKey(countryCode, sourceId), ReliabilityScore.UNSEEN);
    }

    public double score(String countryCode, String sourceId) {
        return get(countryCode, sourceId).score();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReliabilityState other)) return false;
        return version == other.version && scores.equals(other.scores);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, scores);
    }

    @Override
    public String toString() {
        return "ReliabilityState{version=" + version + ", entries=" + scores.size() + "}";
    }
}
