package com.di.epistream.ingest;

import com.di.epistream.exception.PipelineException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a JSON array snapshot written by the extractor into {@link RawRecord}s.
 */
@Slf4j
@Component
public class JsonSnapshotReader {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonSnapshotReader(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @throws PipelineException when the file is missing, unreadable, or not a JSON array
     */
    public List<RawRecord> read(String sourceId, Path path) {
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new PipelineException("Cannot read snapshot " + path + " for source " + sourceId, e);
        }
        if (root == null || !root.isArray()) {
            throw new PipelineException("Snapshot " + path + " is not a JSON array");
        }
        Instant fetchedAt = fetchedAt(path);
        String fileName = path.getFileName().toString();
        List<RawRecord> records = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode element : root) {
            index++;
            Map<String, String> fields = new LinkedHashMap<>();
            if (element.isObject()) {
                flatten("", element, fields);
            }
            records.add(new RawRecord(sourceId, fileName + "#" + index, fetchedAt, fields));
        }
        log.info("[INGEST] Read {} raw record(s) | source={} | file={}", records.size(), sourceId, path);
        return records;
    }

    private Instant fetchedAt(Path path) {
        try {
            return Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            log.debug("[INGEST] No modification time for {}, using current time", path);
            return clock.instant();
        }
    }

    static void flatten(String prefix, JsonNode node, Map<String, String> out) {
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            JsonNode value = entry.getValue();
            if (value.isObject()) {
                flatten(key, value, out);
            } else if (value.isValueNode() && !value.isNull()) {
                out.put(key, value.asText());
            }
        }
    }
}
