package com.di.epistream.registry;

import com.di.epistream.ingest.NormalizationException;

/**
 * No canonical country code could be assigned to a record. The label is kept so the
 * registry can be extended by hand.
 */
public class UnknownCountryException extends NormalizationException {

    private final String countryLabel;

    public UnknownCountryException(String sourceId, String origin, String countryLabel) {
        super(sourceId, origin, "No country matches '" + countryLabel + "'");
        this.countryLabel = countryLabel;
    }

    public String getCountryLabel() {
        return countryLabel;
    }
}
