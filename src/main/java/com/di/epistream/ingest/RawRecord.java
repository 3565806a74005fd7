package com.di.epistream.ingest;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row as delivered by a source, before any mapping. Nested JSON objects are flattened
 * into dotted keys ({@code countryInfo.iso3}).
 */
@Value
public class RawRecord {
    String sourceId;
    /** File and row reference used in log lines, e.g. {@code disease_sh.json#17}. */
    String origin;
    Instant fetchedAt;
    /** Insertion-ordered, as read from the source. */
    Map<String, String> fields;

    public RawRecord(String sourceId, String origin, Instant fetchedAt, Map<String, String> fields) {
        this.sourceId = sourceId;
        this.origin = origin;
        this.fetchedAt = fetchedAt;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String get(String key) {
        return fields.get(key);
    }
}
