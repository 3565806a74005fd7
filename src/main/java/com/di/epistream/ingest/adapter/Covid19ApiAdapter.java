package com.di.epistream.ingest.adapter;

import com.di.epistream.ingest.FieldParsing;
import com.di.epistream.ingest.RawRecord;
import com.di.epistream.ingest.SourceAdapter;
import com.di.epistream.ingest.SourceFields;
import com.di.epistream.model.CaseCounts;
import org.springframework.stereotype.Component;

/**
 * covid19api.com summary rows. Countries are reported by alpha-2 code; no active or critical counts.
 */
@Component
public class Covid19ApiAdapter implements SourceAdapter {

    @Override
    public String type() {
        return "covid19api";
    }

    @Override
    public SourceFields extract(RawRecord raw) {
        CaseCounts counts = CaseCounts.builder()
                .totalCases(FieldParsing.count(raw, "TotalConfirmed"))
                .newCases(FieldParsing.count(raw, "NewConfirmed"))
                .totalDeaths(FieldParsing.count(raw, "TotalDeaths"))
                .newDeaths(FieldParsing.count(raw, "NewDeaths"))
                .totalRecovered(FieldParsing.count(raw, "TotalRecovered"))
                .newRecovered(FieldParsing.count(raw, "NewRecovered"))
                .build();
        return new SourceFields(
                FieldParsing.text(raw, "CountryCode"),
                FieldParsing.text(raw, "Country"),
                FieldParsing.date(raw, "Date"),
                counts);
    }
}
