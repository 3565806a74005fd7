package com.di.epistream.reconcile;

/**
 * Versioned persistence for {@link ReliabilityState}. Every saved version is kept, so a past
 * run can be replayed against the state it started from.
 */
public interface ReliabilityStore {

    /** Latest saved state, or {@link ReliabilityState#initial()} when nothing was saved yet. */
    ReliabilityState loadLatest();

    void save(ReliabilityState state);
}
