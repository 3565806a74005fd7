package com.di.epistream.registry;

import com.di.epistream.TestFixtures;
import com.di.epistream.config.EpiStreamProperties;
import com.di.epistream.exception.PipelineException;
import com.di.epistream.model.Country;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("CountryResolver Tests")
class CountryResolverTest {

    private EpiStreamProperties properties;
    private InMemoryCountryStore store;
    private CountryResolver resolver;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        store = new InMemoryCountryStore();
        resolver = TestFixtures.resolver(properties, store);
    }

    @Test
    @DisplayName("Should upsert the reference countries into the store on refresh")
    void testRefresh_UpsertsCountries() {
        List<Country> countries = store.findAllCountries();
        assertTrue(countries.size() > 100);
        Country germany = resolver.registry().find("DEU").orElseThrow();
        assertEquals("Germany", germany.getName());
        assertEquals("DE", germany.getAlpha2());
        assertEquals(83783942L, germany.getPopulation());
        assertTrue(store.findAliases().containsKey("united states of america"), "seed aliases are appended");
    }

    @Test
    @DisplayName("Should resolve by alpha-3 code before anything else")
    void testResolve_Alpha3() {
        CountryMatch match = resolver.resolve("fra", "Some Other Name").orElseThrow();
        assertEquals("FRA", match.countryCode());
        assertEquals(CountryMatch.Method.ALPHA3, match.method());
    }

    @Test
    @DisplayName("Should resolve alpha-2 codes reported by covid19api")
    void testResolve_Alpha2() {
        CountryMatch match = resolver.resolve("GB", null).orElseThrow();
        assertEquals("GBR", match.countryCode());
        assertEquals(CountryMatch.Method.ALPHA2, match.method());
    }

    @Test
    @DisplayName("Should resolve names through the alias table")
    void testResolve_Alias() {
        assertEquals("KOR", resolver.resolve(null, "S. Korea").orElseThrow().countryCode());
        assertEquals("USA", resolver.resolve(null, "United States of America").orElseThrow().countryCode());
        assertEquals("CIV", resolver.resolve(null, "Cote d'Ivoire").orElseThrow().countryCode());
        assertEquals(CountryMatch.Method.ALIAS, resolver.resolve(null, "germany").orElseThrow().method());
    }

    @Test
    @DisplayName("Should resolve a misspelled name by fuzzy match and learn the alias")
    void testResolve_FuzzyLearnsAlias() {
        CountryMatch first = resolver.resolve(null, "Argentinia").orElseThrow();
        assertEquals("ARG", first.countryCode());
        assertEquals(CountryMatch.Method.FUZZY, first.method());
        assertEquals("argentinia", first.learnedAlias());
        assertEquals("ARG", store.findAliases().get("argentinia"));

        CountryMatch second = resolver.resolve(null, "Argentinia").orElseThrow();
        assertEquals(CountryMatch.Method.ALIAS, second.method());
        assertNull(second.learnedAlias());
    }

    @Test
    @DisplayName("Should keep learned aliases across refreshes")
    void testRefresh_KeepsLearnedAliases() {
        resolver.resolve(null, "Argentinia");
        resolver.refresh();
        assertEquals(CountryMatch.Method.ALIAS, resolver.resolve(null, "Argentinia").orElseThrow().method());
    }

    @Test
    @DisplayName("Should return empty for labels that match nothing")
    void testResolve_Unknown() {
        assertEquals(Optional.empty(), resolver.resolve(null, "Atlantis"));
        assertEquals(Optional.empty(), resolver.resolve("ZZ", null));
        assertEquals(Optional.empty(), resolver.resolve(null, "   "));
    }

    @Test
    @DisplayName("Should not fuzzy-match below the configured similarity")
    void testResolve_FuzzyThreshold() {
        properties.getRegistry().setFuzzyMinSimilarity(0.99);
        CountryResolver strict = TestFixtures.resolver(properties, new InMemoryCountryStore());
        assertTrue(strict.resolve(null, "Argentinia").isEmpty());
    }

    @Test
    @DisplayName("Should fail with PipelineException when the store is unreachable")
    void testRefresh_StoreUnreachable() {
        CountryStore broken = mock(CountryStore.class);
        doThrow(new DataAccessResourceFailureException("connection refused")).when(broken).upsertCountries(anyList());
        CountryResolver failing = new CountryResolver(broken,
                new CountryReferenceLoader(new DefaultResourceLoader(), properties), properties);
        assertThrows(PipelineException.class, failing::refresh);
    }

    @Test
    @DisplayName("Should fail with PipelineException when reference data is missing")
    void testRefresh_MissingReference() {
        properties.getRegistry().setCountriesResource("classpath:reference/missing.csv");
        CountryResolver failing = new CountryResolver(new InMemoryCountryStore(),
                new CountryReferenceLoader(new DefaultResourceLoader(), properties), properties);
        assertThrows(PipelineException.class, failing::refresh);
    }

    @Test
    @DisplayName("Should refuse lookups before the first refresh")
    void testResolve_BeforeRefresh() {
        CountryResolver fresh = new CountryResolver(new InMemoryCountryStore(),
                new CountryReferenceLoader(new DefaultResourceLoader(), properties), properties);
        assertThrows(IllegalStateException.class, () -> fresh.resolve("DEU", null));
    }

    @Test
    @DisplayName("Should skip fuzzy matches that tie between two countries")
    void testRegistry_FuzzyTie() {
        CountryRegistry registry = new CountryRegistry(List.of(
                Country.builder().countryCode("AAA").name("Abcd").build(),
                Country.builder().countryCode("BBB").name("Abce").build()), Map.of());
        assertTrue(registry.byFuzzyName("abcf", 0.5).isEmpty());
        assertEquals(Optional.of("AAA"), registry.byFuzzyName("abcd", 0.5));
    }
}
