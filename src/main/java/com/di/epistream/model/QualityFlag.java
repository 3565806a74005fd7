package com.di.epistream.model;

/**
 * Annotations attached by the validator. Only {@link #REJECTED} keeps a fact out of storage;
 * every other flag is persisted next to the data it describes.
 */
public enum QualityFlag {
    NEGATIVE_VALUE,
    NEGATIVE_DELTA,
    INCONSISTENT_ACTIVE,
    CUMULATIVE_DECREASE,
    ANOMALOUS_SPIKE,
    LOW_CONFIDENCE,
    REJECTED
}
