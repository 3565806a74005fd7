package com.di.epistream.registry;

import com.di.epistream.config.EpiStreamProperties;
import com.di.epistream.exception.PipelineException;
import com.di.epistream.model.Country;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the bundled country reference list and seed aliases.
 * <p>countries.csv: {@code country_code,alpha2,name,continent,population};
 * country-aliases.csv: {@code alias,country_code}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CountryReferenceLoader {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setCommentMarker('#')
            .build();

    private final ResourceLoader resourceLoader;
    private final EpiStreamProperties properties;

    public List<Country> loadCountries() {
        String location = properties.getRegistry().getCountriesResource();
        List<Country> countries = new ArrayList<>();
        for (CSVRecord row : read(location)) {
            String code = row.get("country_code").toUpperCase(Locale.ROOT);
            if (code.length() != 3) {
                throw new PipelineException("Invalid alpha-3 code '" + code + "' in " + location + " line " + row.getRecordNumber());
            }
            String population = row.get("population");
            String alpha2 = row.get("alpha2");
            countries.add(Country.builder()
                    .countryCode(code)
                    .alpha2(alpha2.isEmpty() ? null : alpha2.toUpperCase(Locale.ROOT))
                    .name(row.get("name"))
                    .continent(emptyToNull(row.get("continent")))
                    .population(population.isEmpty() ? null : Long.valueOf(population))
                    .build());
        }
        log.info("[REGISTRY] Loaded {} reference countries from {}", countries.size(), location);
        return countries;
    }

    /** Seed aliases keyed by normalized label. */
    public Map<String, String> loadAliases() {
        String location = properties.getRegistry().getAliasesResource();
        Map<String, String> aliases = new LinkedHashMap<>();
        for (CSVRecord row : read(location)) {
            aliases.put(NameNormalizer.normalize(row.get("alias")), row.get("country_code").toUpperCase(Locale.ROOT));
        }
        log.info("[REGISTRY] Loaded {} seed aliases from {}", aliases.size(), location);
        return aliases;
    }

    private List<CSVRecord> read(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new PipelineException("Reference resource not found: " + location);
        }
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            return parser.getRecords();
        } catch (IOException | IllegalArgumentException e) {
            throw new PipelineException("Failed to read reference resource " + location, e);
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
