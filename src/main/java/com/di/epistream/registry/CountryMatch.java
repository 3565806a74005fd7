package com.di.epistream.registry;

/**
 * Outcome of resolving one source label to a canonical country.
 *
 * @param countryCode  ISO alpha-3 code
 * @param method       which resolution step matched
 * @param learnedAlias normalized alias appended by a fuzzy match, otherwise null
 */
public record CountryMatch(String countryCode, Method method, String learnedAlias) {

    public enum Method { ALPHA3, ALPHA2, ALIAS, FUZZY }

    static CountryMatch of(String countryCode, Method method) {
        return new CountryMatch(countryCode, method, null);
    }
}
