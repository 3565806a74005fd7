package com.di.epistream.model;

import lombok.Builder;
import lombok.Value;

/**
 * The eight raw daily counts carried for a country and date.
 * Every count is nullable; before validation a count may also be negative.
 */
@Value
@Builder(toBuilder = true)
public class CaseCounts {

    public static final CaseCounts EMPTY = CaseCounts.builder().build();

    Long totalCases;
    Long newCases;
    Long totalDeaths;
    Long newDeaths;
    Long totalRecovered;
    Long newRecovered;
    Long activeCases;
    Long criticalCases;

    public Long get(CaseField field) {
        return field.read(this);
    }

    public boolean isEmpty() {
        for (CaseField field : CaseField.values()) {
            if (field.read(this) != null) return false;
        }
        return true;
    }
}
