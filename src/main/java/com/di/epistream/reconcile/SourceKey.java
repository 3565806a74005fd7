package com.di.epistream.reconcile;

import java.util.Comparator;

/**
 * (country, source) pair a reliability score is tracked for.
 */
public record SourceKey(String countryCode, String sourceId) implements Comparable<SourceKey> {

    private static final Comparator<SourceKey> ORDER = Comparator
            .comparing(SourceKey::countryCode)
            .thenComparing(SourceKey::sourceId);

    @Override
    public int compareTo(SourceKey other) {
        return ORDER.compare(this, other);
    }
}
