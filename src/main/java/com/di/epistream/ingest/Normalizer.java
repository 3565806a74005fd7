package com.di.epistream.ingest;

import com.di.epistream.model.DailyObservation;
import com.di.epistream.registry.CountryMatch;
import com.di.epistream.registry.CountryResolver;
import com.di.epistream.registry.UnknownCountryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Maps raw source records onto {@link DailyObservation}s: adapter selection by source id,
 * country identity resolution and date checks. A bad record is logged and counted, never fatal.
 */
@Slf4j
@Component
public class Normalizer {

    private final SourceAdapterRegistry adapters;
    private final CountryResolver countryResolver;
    private final Clock clock;

    public Normalizer(SourceAdapterRegistry adapters, CountryResolver countryResolver, Clock clock) {
        this.adapters = adapters;
        this.countryResolver = countryResolver;
        this.clock = clock;
    }

    /**
     * @throws SchemaException          unknown source, unparseable field, missing or future date
     * @throws UnknownCountryException  no country matches the record
     */
    public DailyObservation normalize(RawRecord raw) {
        return map(raw).observation();
    }

    public NormalizationResult normalizeAll(List<RawRecord> records) {
        Map<String, DailyObservation> byKey = new LinkedHashMap<>();
        List<String> learned = new ArrayList<>();
        TreeSet<String> unknownLabels = new TreeSet<>();
        int schemaErrors = 0;
        int unknownCountries = 0;
        int duplicates = 0;

        for (RawRecord raw : records) {
            try {
                Mapped mapped = map(raw);
                DailyObservation observation = mapped.observation();
                if (mapped.match().learnedAlias() != null) {
                    learned.add(mapped.match().learnedAlias());
                }
                String key = observation.getCountryCode() + "|" + observation.getDate() + "|" + observation.getSource();
                DailyObservation previous = byKey.get(key);
                if (previous != null) {
                    duplicates++;
                    if (observation.getExtractedAt().isBefore(previous.getExtractedAt())) {
                        continue;
                    }
                }
                byKey.put(key, observation);
            } catch (UnknownCountryException e) {
                unknownCountries++;
                unknownLabels.add(e.getCountryLabel());
                log.warn("[NORMALIZE] Unknown country | source={} | row={} | label='{}'",
                        e.getSourceId(), e.getOrigin(), e.getCountryLabel());
            } catch (SchemaException e) {
                schemaErrors++;
                log.warn("[NORMALIZE] Schema error | source={} | row={} | {}", e.getSourceId(), e.getOrigin(), e.getMessage());
            }
        }

        List<DailyObservation> observations = new ArrayList<>(byKey.values());
        observations.sort(Comparator.comparing(DailyObservation::getCountryCode)
                .thenComparing(DailyObservation::getDate)
                .thenComparing(DailyObservation::getSource));
        log.info("[NORMALIZE] {} raw record(s) -> {} observation(s) | schemaErrors={} | unknownCountries={} | duplicates={} | learnedAliases={}",
                records.size(), observations.size(), schemaErrors, unknownCountries, duplicates, learned.size());
        return NormalizationResult.builder()
                .observations(observations)
                .schemaErrors(schemaErrors)
                .unknownCountries(unknownCountries)
                .unknownLabels(unknownLabels)
                .learnedAliases(learned)
                .duplicatesDropped(duplicates)
                .build();
    }

    private Mapped map(RawRecord raw) {
        SourceAdapter adapter = adapters.find(raw.getSourceId())
                .orElseThrow(() -> new SchemaException(raw.getSourceId(), raw.getOrigin(),
                        "No adapter registered for source '" + raw.getSourceId() + "'. Available: " + adapters.getRegisteredTypes()));
        SourceFields fields = adapter.extract(raw);

        if (fields.date() == null) {
            throw new SchemaException(raw.getSourceId(), raw.getOrigin(), "Missing report date");
        }
        LocalDate today = LocalDate.now(clock);
        if (fields.date().isAfter(today)) {
            throw new SchemaException(raw.getSourceId(), raw.getOrigin(),
                    "Report date " + fields.date() + " is after today (" + today + ")");
        }

        CountryMatch match = countryResolver.resolve(fields.countryCode(), fields.countryName())
                .orElseThrow(() -> new UnknownCountryException(raw.getSourceId(), raw.getOrigin(),
                        fields.countryName() != null ? fields.countryName() : String.valueOf(fields.countryCode())));
        DailyObservation observation = DailyObservation.builder()
                .countryCode(match.countryCode())
                .date(fields.date())
                .source(adapter.type())
                .counts(fields.counts())
                .extractedAt(raw.getFetchedAt() != null ? raw.getFetchedAt() : clock.instant())
                .build();
        return new Mapped(observation, match);
    }

    private record Mapped(DailyObservation observation, CountryMatch match) {
    }
}
