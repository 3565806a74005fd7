package com.di.epistream.ingest.adapter;

import com.di.epistream.ingest.CsvUploadReader;
import com.di.epistream.ingest.FieldParsing;
import com.di.epistream.ingest.RawRecord;
import com.di.epistream.ingest.SourceAdapter;
import com.di.epistream.ingest.SourceFields;
import com.di.epistream.model.CaseCounts;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Manually uploaded CSV files with loosely named, lower-cased headers.
 * The country column is {@code country}, else {@code location}, else the first header that
 * mentions a country, location, region or area. The date column is the first header containing "date".
 */
@Component
public class CsvUploadAdapter implements SourceAdapter {

    private static final List<String> COUNTRY_HINTS = List.of("country", "location", "region", "area");

    @Override
    public String type() {
        return CsvUploadReader.SOURCE_ID;
    }

    @Override
    public SourceFields extract(RawRecord raw) {
        CaseCounts counts = CaseCounts.builder()
                .totalCases(FieldParsing.firstCount(raw, "total_cases", "cases", "confirmed", "total_confirmed"))
                .newCases(FieldParsing.firstCount(raw, "new_cases", "new_confirmed", "today_cases"))
                .totalDeaths(FieldParsing.firstCount(raw, "total_deaths", "deaths"))
                .newDeaths(FieldParsing.firstCount(raw, "new_deaths", "today_deaths"))
                .totalRecovered(FieldParsing.firstCount(raw, "total_recovered", "recovered"))
                .newRecovered(FieldParsing.firstCount(raw, "new_recovered", "today_recovered"))
                .activeCases(FieldParsing.firstCount(raw, "active_cases", "active"))
                .criticalCases(FieldParsing.firstCount(raw, "critical_cases", "critical"))
                .build();
        String dateColumn = raw.getFields().keySet().stream()
                .filter(h -> h.contains("date"))
                .findFirst()
                .orElse(null);
        return new SourceFields(
                FieldParsing.text(raw, "iso_code", "country_code", "iso3", "iso2"),
                countryLabel(raw),
                dateColumn == null ? null : FieldParsing.date(raw, dateColumn),
                counts);
    }

    private static String countryLabel(RawRecord raw) {
        String direct = FieldParsing.text(raw, "country", "location");
        if (direct != null) {
            return direct;
        }
        for (String header : raw.getFields().keySet()) {
            if (header.endsWith("_code")) continue;
            for (String hint : COUNTRY_HINTS) {
                if (header.contains(hint)) {
                    return FieldParsing.text(raw, header);
                }
            }
        }
        return null;
    }
}
