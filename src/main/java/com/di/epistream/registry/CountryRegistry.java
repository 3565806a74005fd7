package com.di.epistream.registry;

import com.di.epistream.model.Country;
import com.di.epistream.util.StringSimilarity;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lookup index over the reference countries and known aliases. Country data is fixed for the
 * lifetime of an instance; aliases may be added concurrently.
 */
public class CountryRegistry {

    private final Map<String, Country> byCode;
    private final Map<String, String> byAlpha2;
    private final Map<String, String> aliases = new ConcurrentHashMap<>();

    public CountryRegistry(Collection<Country> countries, Map<String, String> knownAliases) {
        Map<String, Country> codes = new TreeMap<>();
        Map<String, String> alpha2 = new HashMap<>();
        for (Country c : countries) {
            codes.put(c.getCountryCode(), c);
            if (c.getAlpha2() != null) {
                alpha2.put(c.getAlpha2(), c.getCountryCode());
            }
            aliases.put(NameNormalizer.normalize(c.getName()), c.getCountryCode());
        }
        knownAliases.forEach((alias, code) -> {
            if (codes.containsKey(code)) {
                aliases.put(alias, code);
            }
        });
        this.byCode = Collections.unmodifiableMap(codes);
        this.byAlpha2 = Collections.unmodifiableMap(alpha2);
    }

    public Optional<Country> find(String countryCode) {
        return countryCode == null ? Optional.empty() : Optional.ofNullable(byCode.get(countryCode));
    }

    public Map<String, Country> countries() {
        return byCode;
    }

    public int aliasCount() {
        return aliases.size();
    }

    Optional<String> byAlpha3(String code) {
        if (code == null) return Optional.empty();
        String key = code.trim().toUpperCase(Locale.ROOT);
        return key.length() == 3 && byCode.containsKey(key) ? Optional.of(key) : Optional.empty();
    }

    Optional<String> byAlpha2(String code) {
        if (code == null) return Optional.empty();
        String key = code.trim().toUpperCase(Locale.ROOT);
        return key.length() == 2 ? Optional.ofNullable(byAlpha2.get(key)) : Optional.empty();
    }

    Optional<String> byAlias(String normalizedName) {
        return Optional.ofNullable(aliases.get(normalizedName));
    }

    /**
     * Best fuzzy candidate at or above {@code minSimilarity}. Empty when nothing qualifies or when
     * two different countries share the best score.
     */
    Optional<String> byFuzzyName(String normalizedName, double minSimilarity) {
        double best = -1.0;
        String bestCode = null;
        boolean tied = false;
        // sorted iteration keeps the outcome independent of map ordering
        for (Map.Entry<String, String> entry : new TreeMap<>(aliases).entrySet()) {
            double score = StringSimilarity.similarity(normalizedName, entry.getKey());
            if (score > best + 1e-9) {
                best = score;
                bestCode = entry.getValue();
                tied = false;
            } else if (Math.abs(score - best) <= 1e-9 && !entry.getValue().equals(bestCode)) {
                tied = true;
            }
        }
        if (bestCode == null || tied || best < minSimilarity) {
            return Optional.empty();
        }
        return Optional.of(bestCode);
    }

    /** @return true when the alias was not known before */
    boolean addAlias(String normalizedName, String countryCode) {
        return aliases.putIfAbsent(normalizedName, countryCode) == null;
    }
}
