package com.di.epistream.ingest;

/**
 * Maps one source's field layout onto the canonical schema.
 */
public interface SourceAdapter {

    /** Source id this adapter handles, e.g. "disease.sh". */
    String type();

    /**
     * @throws SchemaException when a field is present but unparseable
     */
    SourceFields extract(RawRecord raw);
}
