package com.di.epistream.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Value
public class ValidatedFact {

    ReconciledFact fact;
    Set<QualityFlag> qualityFlags;
    List<String> issues;

    public ValidatedFact(ReconciledFact fact, Set<QualityFlag> qualityFlags, List<String> issues) {
        this.fact = fact;
        this.qualityFlags = qualityFlags.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(QualityFlag.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(qualityFlags));
        this.issues = List.copyOf(issues);
    }

    public String getCountryCode() {
        return fact.getCountryCode();
    }

    public LocalDate getDate() {
        return fact.getDate();
    }

    public CaseCounts getCounts() {
        return fact.getCounts();
    }

    public boolean hasFlag(QualityFlag flag) {
        return qualityFlags.contains(flag);
    }

    public boolean isRejected() {
        return qualityFlags.contains(QualityFlag.REJECTED);
    }

    /** True when the fact carries any flag at all. */
    public boolean isFlagged() {
        return !qualityFlags.isEmpty();
    }
}
