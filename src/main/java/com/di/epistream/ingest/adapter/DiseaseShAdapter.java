package com.di.epistream.ingest.adapter;

import com.di.epistream.ingest.FieldParsing;
import com.di.epistream.ingest.RawRecord;
import com.di.epistream.ingest.SourceAdapter;
import com.di.epistream.ingest.SourceFields;
import com.di.epistream.model.CaseCounts;
import com.di.epistream.util.DateParsing;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * disease.sh {@code /v3/covid-19/countries} snapshots. The report date is the UTC day of the
 * {@code updated} epoch-millisecond timestamp.
 */
@Component
public class DiseaseShAdapter implements SourceAdapter {

    @Override
    public String type() {
        return "disease.sh";
    }

    @Override
    public SourceFields extract(RawRecord raw) {
        Long updated = FieldParsing.count(raw, "updated");
        LocalDate date = updated == null ? null : DateParsing.fromEpochMillis(updated);
        CaseCounts counts = CaseCounts.builder()
                .totalCases(FieldParsing.count(raw, "cases"))
                .newCases(FieldParsing.count(raw, "todayCases"))
                .totalDeaths(FieldParsing.count(raw, "deaths"))
                .newDeaths(FieldParsing.count(raw, "todayDeaths"))
                .totalRecovered(FieldParsing.count(raw, "recovered"))
                .newRecovered(FieldParsing.count(raw, "todayRecovered"))
                .activeCases(FieldParsing.count(raw, "active"))
                .criticalCases(FieldParsing.count(raw, "critical"))
                .build();
        return new SourceFields(
                FieldParsing.text(raw, "countryInfo.iso3", "countryInfo.iso2"),
                FieldParsing.text(raw, "country"),
                date,
                counts);
    }
}
