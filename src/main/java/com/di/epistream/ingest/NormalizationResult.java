package com.di.epistream.ingest;

import com.di.epistream.model.DailyObservation;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
@Builder
public class NormalizationResult {
    @Singular
    List<DailyObservation> observations;
    int schemaErrors;
    int unknownCountries;
    /** Labels that matched no country, sorted. */
    Set<String> unknownLabels;
    /** Aliases appended by fuzzy matching during this batch. */
    @Singular
    List<String> learnedAliases;
    /** Repeated (country, date, source) rows replaced by a later extraction. */
    int duplicatesDropped;

    public int rejectedCount() {
        return schemaErrors + unknownCountries;
    }
}
