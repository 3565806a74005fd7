package com.di.epistream.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * All tunables of the pipeline (application.yml, prefix {@code epistream}).
 * Defaults for the quality and reconciliation thresholds are listed in application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "epistream")
public class EpiStreamProperties {

    @Valid
    private Pipeline pipeline = new Pipeline();
    @Valid
    private Quality quality = new Quality();
    @Valid
    private Reconcile reconcile = new Reconcile();
    @Valid
    private Registry registry = new Registry();
    @Valid
    private Enrich enrich = new Enrich();
    @Valid
    private Load load = new Load();
    @Valid
    private Store store = new Store();

    @Data
    public static class Pipeline {
        /** Run once at startup and exit with the run's status code. */
        private boolean runOnStartup = true;
        /** Raw JSON snapshots dropped by the extractor, read when no CSV upload is given. */
        private List<SourceLocation> sources = new ArrayList<>();
    }

    @Data
    public static class SourceLocation {
        /** Source id; must match a registered adapter type (disease.sh, covid19api, csv). */
        @NotBlank
        private String id;
        /** File system path of a JSON array snapshot. */
        @NotBlank
        private String path;
    }

    @Data
    public static class Quality {
        /** INCONSISTENT_ACTIVE tolerance as a percent of total_cases. */
        @DecimalMin("0.0")
        private double consistencyTolerancePct = 5.0;
        /** Absolute lower bound for the consistency tolerance. */
        @Min(0)
        private long consistencyToleranceMin = 10;
        @DecimalMin("0.0")
        private double anomalyStdMultiplier = 3.0;
        @Min(1)
        private int anomalyWindowDays = 14;
        /** Trailing points required before the spike check runs at all. */
        @Min(1)
        private int anomalyMinHistory = 3;
        @Min(0)
        private long anomalyCasesFloor = 100;
        @Min(0)
        private long anomalyDeathsFloor = 10;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double lowConfidenceThreshold = 0.5;
    }

    @Data
    public static class Reconcile {
        /** Two source values agree when within this percent of the larger one. */
        @DecimalMin("0.0")
        private double tolerancePct = 2.0;
        @Min(0)
        private long toleranceMin = 1;
        /** Multiplier applied to past agreement counters before each run's update. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double reliabilityDecay = 0.95;
        /** Tie-break order, most trusted first. */
        private List<String> sourcePriority = new ArrayList<>(List.of("disease.sh", "covid19api", "csv"));
    }

    @Data
    public static class Registry {
        private String countriesResource = "classpath:reference/countries.csv";
        private String aliasesResource = "classpath:reference/country-aliases.csv";
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double fuzzyMinSimilarity = 0.85;
    }

    @Data
    public static class Enrich {
        /** Days of persisted history read before the first date of a run. */
        @Min(14)
        private int historyDays = 21;
    }

    @Data
    public static class Load {
        @Min(1)
        private int workers = 4;
        @Min(1)
        private long timeoutMinutes = 30;
        /** How long interrupted partitions get to finish after the timeout or a cancellation. */
        @Min(0)
        private long shutdownGraceSeconds = 30;
    }

    @Data
    public static class Store {
        /** memory or jdbc. */
        private String type = "memory";
        private boolean initializeSchema = true;
        private String jdbcUrl;
        private String username;
        private String password;
        private String driverClassName = "org.postgresql.Driver";
        @Min(1)
        private int maximumPoolSize = 10;
        @Min(0)
        private int minimumIdle = 2;
        private long idleTimeoutMs = 600_000L;
        private long connectionTimeoutMs = 30_000L;
        private long maxLifetimeMs = 1_800_000L;
    }
}
