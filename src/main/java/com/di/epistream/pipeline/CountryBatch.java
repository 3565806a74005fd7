package com.di.epistream.pipeline;

import com.di.epistream.load.PartitionFailure;
import com.di.epistream.model.PersistedRecord;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Output of transforming one country's reconciled facts: the rows to hand to the loader
 * and what was held back.
 */
@Value
@Builder
public class CountryBatch {
    String countryCode;
    @Singular
    List<PersistedRecord> changedRecords;
    int unchanged;
    int rejected;
    @Singular
    List<FlaggedFact> flaggedFacts;
    /** Set when the transformation itself failed; no record of the country is loaded then. */
    PartitionFailure failure;
}
