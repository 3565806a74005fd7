package com.di.epistream.ingest;

import com.di.epistream.TestFixtures;
import com.di.epistream.ingest.adapter.Covid19ApiAdapter;
import com.di.epistream.ingest.adapter.DiseaseShAdapter;
import com.di.epistream.model.CaseCounts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The registry is initialized by hand here; Spring calls initialize() through @PostConstruct.
 */
@DisplayName("SourceAdapterRegistry Tests")
class SourceAdapterRegistryTest {

    @Test
    @DisplayName("Should return empty for unknown, null and blank source types")
    void testFind_Unknown() {
        SourceAdapterRegistry registry = TestFixtures.adapterRegistry();
        assertTrue(registry.find("worldometers").isEmpty());
        assertTrue(registry.find(null).isEmpty());
        assertTrue(registry.find("  ").isEmpty());
    }

    @Test
    @DisplayName("Should find adapters ignoring case and surrounding whitespace")
    void testFind_CaseInsensitive() {
        SourceAdapterRegistry registry = TestFixtures.adapterRegistry();
        assertInstanceOf(DiseaseShAdapter.class, registry.find(" Disease.SH ").orElseThrow());
        assertInstanceOf(Covid19ApiAdapter.class, registry.find("COVID19API").orElseThrow());
        assertEquals(Set.of("disease.sh", "covid19api", "csv"), registry.getRegisteredTypes());
    }

    @Test
    @DisplayName("Should return empty set when no adapters registered")
    void testGetRegisteredTypes_Empty() {
        SourceAdapterRegistry registry = TestFixtures.adapterRegistry(Collections.emptyList());
        assertTrue(registry.getRegisteredTypes().isEmpty());
    }

    @Test
    @DisplayName("Should fail when two adapters claim the same type")
    void testInitialize_Duplicate() {
        SourceAdapter shadow = new FixedTypeAdapter("DISEASE.sh");
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> TestFixtures.adapterRegistry(List.of(new DiseaseShAdapter(), shadow)));
        assertTrue(e.getMessage().contains("disease.sh"));
    }

    @Test
    @DisplayName("Should fail when an adapter reports a blank type")
    void testInitialize_BlankType() {
        assertThrows(IllegalStateException.class,
                () -> TestFixtures.adapterRegistry(List.of(new FixedTypeAdapter(" "))));
    }

    private record FixedTypeAdapter(String type) implements SourceAdapter {
        @Override
        public SourceFields extract(RawRecord raw) {
            return new SourceFields(null, null, null, CaseCounts.EMPTY);
        }
    }
}
