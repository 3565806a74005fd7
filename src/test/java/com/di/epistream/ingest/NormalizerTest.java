package com.di.epistream.ingest;

import com.di.epistream.TestFixtures;
import com.di.epistream.model.DailyObservation;
import com.di.epistream.registry.InMemoryCountryStore;
import com.di.epistream.registry.UnknownCountryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Normalizer Tests")
class NormalizerTest {

    private static final Instant FETCHED = Instant.parse("2021-04-01T05:00:00Z");
    // 2021-03-31T12:00:00Z
    private static final String MARCH_31_MILLIS = "1617192000000";

    private InMemoryCountryStore countryStore;
    private Normalizer normalizer;

    @BeforeEach
    void setUp() {
        countryStore = new InMemoryCountryStore();
        normalizer = new Normalizer(TestFixtures.adapterRegistry(),
                TestFixtures.resolver(TestFixtures.properties(), countryStore), TestFixtures.CLOCK);
    }

    private static RawRecord raw(String source, String origin, Instant fetchedAt, String... keyValues) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put(keyValues[i], keyValues[i + 1]);
        }
        return new RawRecord(source, origin, fetchedAt, fields);
    }

    private static RawRecord diseaseSh(String country, String iso3, String cases) {
        return raw("disease.sh", "disease_sh.json#1", FETCHED,
                "country", country, "countryInfo.iso3", iso3, "updated", MARCH_31_MILLIS,
                "cases", cases, "todayCases", "120", "deaths", "30", "active", "400");
    }

    // ============================================
    // Single record
    // ============================================

    @Test
    @DisplayName("Should map a disease.sh record onto a daily observation")
    void testNormalize_DiseaseSh() {
        DailyObservation observation = normalizer.normalize(diseaseSh("Germany", "DEU", "1000"));
        assertEquals("DEU", observation.getCountryCode());
        assertEquals(LocalDate.of(2021, 3, 31), observation.getDate());
        assertEquals("disease.sh", observation.getSource());
        assertEquals(1000L, observation.getCounts().getTotalCases());
        assertEquals(120L, observation.getCounts().getNewCases());
        assertEquals(400L, observation.getCounts().getActiveCases());
        assertNull(observation.getCounts().getTotalRecovered());
        assertEquals(FETCHED, observation.getExtractedAt());
    }

    @Test
    @DisplayName("Should resolve covid19api alpha-2 codes to alpha-3")
    void testNormalize_Covid19Api() {
        RawRecord raw = raw("covid19api", "covid19api.json#4", FETCHED,
                "Country", "United Kingdom", "CountryCode", "GB", "Date", "2021-03-31T00:00:00Z",
                "TotalConfirmed", "4000", "NewConfirmed", "50");
        DailyObservation observation = normalizer.normalize(raw);
        assertEquals("GBR", observation.getCountryCode());
        assertEquals("covid19api", observation.getSource());
        assertEquals(4000L, observation.getCounts().getTotalCases());
        assertNull(observation.getCounts().getActiveCases());
    }

    @Test
    @DisplayName("Should reject records without an adapter")
    void testNormalize_UnknownSource() {
        assertThrows(SchemaException.class, () -> normalizer.normalize(raw("worldometers", "w.json#1", FETCHED)));
    }

    @Test
    @DisplayName("Should reject records without a date or dated after today")
    void testNormalize_BadDates() {
        RawRecord missing = raw("csv", "upload.csv#2", FETCHED, "country", "France", "total_cases", "10");
        RawRecord future = raw("csv", "upload.csv#3", FETCHED, "country", "France", "date", "2021-04-02", "total_cases", "10");
        assertThrows(SchemaException.class, () -> normalizer.normalize(missing));
        assertThrows(SchemaException.class, () -> normalizer.normalize(future));
    }

    @Test
    @DisplayName("Should raise UnknownCountryException carrying the label")
    void testNormalize_UnknownCountry() {
        UnknownCountryException e = assertThrows(UnknownCountryException.class,
                () -> normalizer.normalize(diseaseSh("Atlantis", null, "10")));
        assertEquals("Atlantis", e.getCountryLabel());
        assertEquals("disease.sh", e.getSourceId());
    }

    // ============================================
    // Batches
    // ============================================

    @Test
    @DisplayName("Should count rejects and keep going")
    void testNormalizeAll_CountsRejects() {
        NormalizationResult result = normalizer.normalizeAll(List.of(
                diseaseSh("Germany", "DEU", "1000"),
                diseaseSh("Atlantis", null, "10"),
                diseaseSh("France", "FRA", "12.5"),
                diseaseSh("France", "FRA", "900")));
        assertEquals(2, result.getObservations().size());
        assertEquals(1, result.getSchemaErrors());
        assertEquals(1, result.getUnknownCountries());
        assertEquals(2, result.rejectedCount());
        assertEquals(Set.of("Atlantis"), result.getUnknownLabels());
        assertEquals("DEU", result.getObservations().get(0).getCountryCode());
        assertEquals("FRA", result.getObservations().get(1).getCountryCode());
    }

    @Test
    @DisplayName("Should keep the latest extraction of a repeated country, date and source")
    void testNormalizeAll_Duplicates() {
        RawRecord early = raw("csv", "a.csv#2", FETCHED.minusSeconds(3600),
                "country", "Germany", "date", "2021-03-31", "total_cases", "100");
        RawRecord late = raw("csv", "b.csv#2", FETCHED,
                "country", "Germany", "date", "2021-03-31", "total_cases", "110");
        NormalizationResult result = normalizer.normalizeAll(List.of(late, early));
        assertEquals(1, result.getObservations().size());
        assertEquals(1, result.getDuplicatesDropped());
        assertEquals(110L, result.getObservations().get(0).getCounts().getTotalCases());
    }

    @Test
    @DisplayName("Should report aliases learned by fuzzy matching")
    void testNormalizeAll_LearnedAliases() {
        NormalizationResult result = normalizer.normalizeAll(List.of(
                diseaseSh("Argentinia", null, "10"),
                diseaseSh("Argentinia", null, "10")));
        assertEquals(List.of("argentinia"), result.getLearnedAliases());
        assertEquals("ARG", countryStore.findAliases().get("argentinia"));
    }
}
