package com.di.epistream.ingest;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Discovers every {@link SourceAdapter} bean and indexes it by its normalized type
 * (trimmed, lower case). Two adapters claiming the same type fail startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceAdapterRegistry {

    private final List<SourceAdapter> adapters;

    private Map<String, SourceAdapter> adaptersByType = Collections.emptyMap();

    @PostConstruct
    void initialize() {
        if (adapters == null || adapters.isEmpty()) {
            log.warn("No SourceAdapter beans found. Registry will be empty.");
            return;
        }
        Map<String, List<SourceAdapter>> grouped = adapters.stream()
                .peek(SourceAdapterRegistry::validateType)
                .collect(Collectors.groupingBy(adapter -> normalizeType(adapter.type())));

        String duplicates = grouped.entrySet().stream()
                .filter(entry -> entry.getValue().size() > 1)
                .map(entry -> String.format("'%s' -> [%s]", entry.getKey(), entry.getValue().stream()
                        .map(adapter -> adapter.getClass().getName())
                        .collect(Collectors.joining(", "))))
                .collect(Collectors.joining(" ; "));
        if (!duplicates.isEmpty()) {
            throw new IllegalStateException("Duplicate SourceAdapter type() values detected: " + duplicates);
        }

        adaptersByType = grouped.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, entry -> entry.getValue().get(0)));
        log.info("Registered {} source adapter(s): {}", adaptersByType.size(), adaptersByType.keySet());
    }

    /**
     * @param type source id from the raw record (case-insensitive)
     * @return the adapter, or empty when the source is unknown or blank
     */
    public Optional<SourceAdapter> find(String type) {
        if (type == null || type.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(adaptersByType.get(normalizeType(type)));
    }

    public Set<String> getRegisteredTypes() {
        return adaptersByType.keySet();
    }

    private static void validateType(SourceAdapter adapter) {
        String type = adapter.type();
        if (type == null || type.isBlank()) {
            throw new IllegalStateException(String.format(
                    "Adapter %s returned blank type(). Adapter type must be non-null and non-blank.",
                    adapter.getClass().getName()));
        }
    }

    static String normalizeType(String type) {
        return type == null ? null : type.trim().toLowerCase(Locale.ROOT);
    }
}
