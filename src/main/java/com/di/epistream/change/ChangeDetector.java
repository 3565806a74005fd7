package com.di.epistream.change;

import com.di.epistream.model.CaseField;
import com.di.epistream.model.DerivedMetrics;
import com.di.epistream.model.EnrichedFact;
import com.di.epistream.model.QualityFlag;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content hashing and diffing of enriched facts against the stored hash.
 * <p>The hash is SHA-256 over canonical JSON (keys sorted) of the key, every count, every
 * derived metric, the sorted quality flags, the reconciliation confidence (4 decimals) and the
 * sorted contributing sources. Timestamps are left out, so re-running on identical input
 * produces identical hashes.
 */
@Component
public class ChangeDetector {

    private static final int CONFIDENCE_SCALE = 4;

    private final ObjectMapper canonicalMapper;

    public ChangeDetector(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    public ChangeDecision diff(EnrichedFact fact, String previousHash) {
        String hash = hash(fact);
        if (previousHash == null) {
            return new ChangeDecision(ChangeType.NEW, hash, null);
        }
        return new ChangeDecision(previousHash.equals(hash) ? ChangeType.UNCHANGED : ChangeType.CHANGED, hash, previousHash);
    }

    public String hash(EnrichedFact fact) {
        try {
            byte[] canonical = canonicalMapper.writeValueAsBytes(canonicalForm(fact));
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize fact " + fact.getCountryCode() + " " + fact.getDate(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    Map<String, Object> canonicalForm(EnrichedFact fact) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("country_code", fact.getCountryCode());
        canonical.put("date", fact.getDate().toString());
        for (CaseField field : CaseField.values()) {
            canonical.put(field.column(), field.read(fact.getCounts()));
        }
        DerivedMetrics m = fact.getMetrics() != null ? fact.getMetrics() : DerivedMetrics.EMPTY;
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("cases_per_million", m.getCasesPerMillion());
        metrics.put("deaths_per_million", m.getDeathsPerMillion());
        metrics.put("case_fatality_rate", m.getCaseFatalityRate());
        metrics.put("new_cases_7day_avg", m.getNewCases7dayAvg());
        metrics.put("new_deaths_7day_avg", m.getNewDeaths7dayAvg());
        metrics.put("new_cases_14day_avg", m.getNewCases14dayAvg());
        metrics.put("growth_rate", m.getGrowthRate());
        metrics.put("new_cases_pct_change", m.getNewCasesPctChange());
        canonical.putAll(metrics);
        List<String> flags = fact.getQualityFlags().stream()
                .map(QualityFlag::name)
                .sorted()
                .toList();
        canonical.put("quality_flags", flags);
        canonical.put("reconciliation_confidence", BigDecimal.valueOf(fact.getReconciliationConfidence())
                .setScale(CONFIDENCE_SCALE, RoundingMode.HALF_UP).toPlainString());
        canonical.put("source", fact.getContributingSources().stream().sorted().toList());
        return canonical;
    }
}
