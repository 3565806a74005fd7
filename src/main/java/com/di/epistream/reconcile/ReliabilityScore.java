package com.di.epistream.reconcile;

import lombok.Value;

/**
 * Rolling agreement counters for one (country, source). Counters are fractional because
 * they decay by a constant factor every run.
 */
@Value
public class ReliabilityScore {

    public static final ReliabilityScore UNSEEN = new ReliabilityScore(0.0, 0.0);

    double agreements;
    double comparisons;

    /** Laplace-smoothed agreement rate: 0.5 for a source never compared. */
    public double score() {
        return (agreements + 1.0) / (comparisons + 2.0);
    }

    ReliabilityScore decay(double factor) {
        return new ReliabilityScore(agreements * factor, comparisons * factor);
    }

    ReliabilityScore record(boolean agreed) {
        return new ReliabilityScore(agreed ? agreements + 1.0 : agreements, comparisons + 1.0);
    }
}
