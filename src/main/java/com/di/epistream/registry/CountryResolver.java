package com.di.epistream.registry;

import com.di.epistream.config.EpiStreamProperties;
import com.di.epistream.exception.PipelineException;
import com.di.epistream.model.Country;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assigns canonical ISO alpha-3 codes to source labels.
 * <p>Resolution order: alpha-3 code, alpha-2 code, alias table (normalized name), fuzzy name
 * match. A fuzzy hit is appended to the alias table so the next run resolves it directly.
 * {@link #refresh()} must run once per pipeline run before any lookup.
 */
@Slf4j
@Component
public class CountryResolver {

    private final CountryStore store;
    private final CountryReferenceLoader referenceLoader;
    private final double fuzzyMinSimilarity;

    private volatile CountryRegistry registry;

    public CountryResolver(CountryStore store, CountryReferenceLoader referenceLoader, EpiStreamProperties properties) {
        this.store = store;
        this.referenceLoader = referenceLoader;
        this.fuzzyMinSimilarity = properties.getRegistry().getFuzzyMinSimilarity();
    }

    /**
     * Upserts the reference countries, appends any seed alias not yet stored and rebuilds the
     * lookup index from the store.
     *
     * @throws PipelineException when the reference data cannot be read or the store is unreachable
     */
    public CountryRegistry refresh() {
        List<Country> reference = referenceLoader.loadCountries();
        Map<String, String> seedAliases = referenceLoader.loadAliases();
        try {
            store.upsertCountries(reference);
            Map<String, String> stored = store.findAliases();
            int appended = 0;
            for (Map.Entry<String, String> seed : seedAliases.entrySet()) {
                if (!stored.containsKey(seed.getKey()) && store.appendAlias(seed.getKey(), seed.getValue())) {
                    appended++;
                }
            }
            Map<String, String> aliases = new HashMap<>(seedAliases);
            aliases.putAll(store.findAliases());
            this.registry = new CountryRegistry(store.findAllCountries(), aliases);
            log.info("[REGISTRY] Registry ready | countries={} | aliases={} | seedAliasesAppended={}",
                    registry.countries().size(), registry.aliasCount(), appended);
            return registry;
        } catch (DataAccessException e) {
            throw new PipelineException("Country store unreachable while refreshing the registry", e);
        }
    }

    public CountryRegistry registry() {
        CountryRegistry current = registry;
        if (current == null) {
            throw new IllegalStateException("CountryResolver.refresh() has not been called");
        }
        return current;
    }

    /**
     * @param code  code reported by the source (alpha-3 or alpha-2), may be null
     * @param label country name reported by the source, may be null
     * @return the match, or empty when no step identifies a country
     */
    public Optional<CountryMatch> resolve(String code, String label) {
        CountryRegistry index = registry();

        Optional<String> alpha3 = index.byAlpha3(code);
        if (alpha3.isPresent()) {
            return Optional.of(CountryMatch.of(alpha3.get(), CountryMatch.Method.ALPHA3));
        }
        Optional<String> alpha2 = index.byAlpha2(code);
        if (alpha2.isPresent()) {
            return Optional.of(CountryMatch.of(alpha2.get(), CountryMatch.Method.ALPHA2));
        }
        String normalized = NameNormalizer.normalize(label);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> alias = index.byAlias(normalized);
        if (alias.isPresent()) {
            return Optional.of(CountryMatch.of(alias.get(), CountryMatch.Method.ALIAS));
        }
        Optional<String> fuzzy = index.byFuzzyName(normalized, fuzzyMinSimilarity);
        if (fuzzy.isEmpty()) {
            return Optional.empty();
        }
        String countryCode = fuzzy.get();
        if (index.addAlias(normalized, countryCode)) {
            store.appendAlias(normalized, countryCode);
            log.info("[REGISTRY] Learned alias '{}' -> {}", normalized, countryCode);
            return Optional.of(new CountryMatch(countryCode, CountryMatch.Method.FUZZY, normalized));
        }
        return Optional.of(CountryMatch.of(countryCode, CountryMatch.Method.FUZZY));
    }
}
