package com.di.epistream.ingest;

/**
 * A single raw record could not be turned into an observation. Never fatal for the run:
 * the record is dropped, logged and counted.
 */
public abstract class NormalizationException extends RuntimeException {

    private final String sourceId;
    private final String origin;

    protected NormalizationException(String sourceId, String origin, String message) {
        super(message);
        this.sourceId = sourceId;
        this.origin = origin;
    }

    public String getSourceId() {
        return sourceId;
    }

    /** Where the record came from, e.g. {@code covid19api.json#12}. */
    public String getOrigin() {
        return origin;
    }
}
