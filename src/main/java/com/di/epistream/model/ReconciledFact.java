package com.di.epistream.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * The single authoritative row for (countryCode, date) after cross-source merging.
 */
@Value
@Builder(toBuilder = true)
public class ReconciledFact {
    String countryCode;
    LocalDate date;
    CaseCounts counts;
    /** Sorted source ids that reported this key. */
    @Singular
    List<String> contributingSources;
    /** Share of contributing sources that agreed with every chosen value, in [0, 1]. */
    double reconciliationConfidence;
    /** Fields where sources disagreed and no reliability winner existed. */
    @Singular
    List<CaseField> ambiguousFields;
}
