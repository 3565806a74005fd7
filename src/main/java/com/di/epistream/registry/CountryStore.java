package com.di.epistream.registry;

import com.di.epistream.model.Country;

import java.util.List;
import java.util.Map;

/**
 * Persistence for the country reference table and the append-only alias table.
 * Implementations: in-memory (default) or JDBC ({@code epistream.store.type=jdbc}).
 */
public interface CountryStore {

    void upsertCountries(List<Country> countries);

    List<Country> findAllCountries();

    /** normalized alias -> country code. */
    Map<String, String> findAliases();

    /**
     * Adds an alias unless it is already known. Existing aliases are never changed.
     *
     * @return true when a new row was written
     */
    boolean appendAlias(String normalizedAlias, String countryCode);
}
