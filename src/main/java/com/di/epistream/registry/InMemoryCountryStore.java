package com.di.epistream.registry;

import com.di.epistream.model.Country;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "epistream.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryCountryStore implements CountryStore {

    private final Map<String, Country> countries = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();

    @Override
    public void upsertCountries(List<Country> list) {
        for (Country country : list) {
            countries.put(country.getCountryCode(), country);
        }
    }

    @Override
    public List<Country> findAllCountries() {
        return new ArrayList<>(new TreeMap<>(countries).values());
    }

    @Override
    public Map<String, String> findAliases() {
        return Map.copyOf(aliases);
    }

    @Override
    public boolean appendAlias(String normalizedAlias, String countryCode) {
        return aliases.putIfAbsent(normalizedAlias, countryCode) == null;
    }
}
