package com.di.epistream.model;

import lombok.Builder;
import lombok.Value;

/**
 * Reference row for one country, keyed by ISO 3166 alpha-3 code.
 */
@Value
@Builder(toBuilder = true)
public class Country {
    String countryCode;
    String name;
    String continent;
    /** Null when unknown; per-capita metrics are then left empty. */
    Long population;
    String alpha2;
}
