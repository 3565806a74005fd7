package com.di.epistream.ingest;

/**
 * Unrecognised or malformed raw record: missing date, unparseable number, future date,
 * or a source with no registered adapter.
 */
public class SchemaException extends NormalizationException {

    public SchemaException(String sourceId, String origin, String message) {
        super(sourceId, origin, message);
    }
}
