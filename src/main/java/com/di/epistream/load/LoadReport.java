package com.di.epistream.load;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class LoadReport {

    public static final LoadReport EMPTY = LoadReport.builder().build();

    int partitions;
    int inserted;
    int updated;
    int unchanged;
    /** Rows of failed partitions. */
    int failed;
    @Singular
    List<PartitionFailure> failures;
    /** Countries whose partition never started because the run was cancelled or timed out. */
    @Singular("skippedCountry")
    List<String> skipped;
    long durationMs;

    public boolean hasFailures() {
        return !failures.isEmpty() || !skipped.isEmpty();
    }
}
