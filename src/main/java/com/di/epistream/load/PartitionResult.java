package com.di.epistream.load;

/**
 * Row counts of one committed partition.
 */
public record PartitionResult(int inserted, int updated, int unchanged) {
}
