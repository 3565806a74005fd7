package com.di.epistream.ingest;

import com.di.epistream.exception.PipelineException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a manually uploaded CSV file. Header names are lower-cased and trimmed; every row
 * becomes a {@link RawRecord} of source {@value #SOURCE_ID}.
 */
@Slf4j
@Component
public class CsvUploadReader {

    public static final String SOURCE_ID = "csv";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .setAllowMissingColumnNames(true)
            .build();

    private final Clock clock;

    public CsvUploadReader(Clock clock) {
        this.clock = clock;
    }

    public List<RawRecord> read(Path path) {
        Instant fetchedAt = clock.instant();
        String fileName = path.getFileName().toString();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            List<String> headers = parser.getHeaderNames().stream()
                    .map(h -> h.trim().toLowerCase(Locale.ROOT))
                    .toList();
            List<RawRecord> records = new ArrayList<>();
            for (CSVRecord row : parser) {
                Map<String, String> fields = new LinkedHashMap<>();
                for (int i = 0; i < headers.size() && i < row.size(); i++) {
                    String value = row.get(i);
                    if (!headers.get(i).isEmpty() && value != null && !value.isBlank()) {
                        fields.putIfAbsent(headers.get(i), value.trim());
                    }
                }
                // +1 for the header line
                records.add(new RawRecord(SOURCE_ID, fileName + "#" + (row.getRecordNumber() + 1), fetchedAt, fields));
            }
            log.info("[INGEST] Read {} CSV row(s) | file={} | headers={}", records.size(), path, headers);
            return records;
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            throw new PipelineException("Cannot read CSV upload " + path, e);
        }
    }
}
