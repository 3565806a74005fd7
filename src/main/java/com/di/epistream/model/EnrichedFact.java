package com.di.epistream.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

@Value
public class EnrichedFact {

    ValidatedFact validated;
    DerivedMetrics metrics;

    public String getCountryCode() {
        return validated.getCountryCode();
    }

    public LocalDate getDate() {
        return validated.getDate();
    }

    public CaseCounts getCounts() {
        return validated.getCounts();
    }

    public Set<QualityFlag> getQualityFlags() {
        return validated.getQualityFlags();
    }

    public List<String> getContributingSources() {
        return validated.getFact().getContributingSources();
    }

    public double getReconciliationConfidence() {
        return validated.getFact().getReconciliationConfidence();
    }
}
