package com.openlearn.collector.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Collection pipeline settings bound from {@code collector.*}.
 *
 * Sources are declared in application.yml and loaded once into
 * {@link com.openlearn.collector.service.SourceRegistry} at startup.
 */
@ConfigurationProperties(prefix = "collector")
@Validated
@Data
public class CollectorProperties {

    @Valid
    private Scheduler scheduler = new Scheduler();
    @Valid
    private Retry retry = new Retry();
    private Fetch fetch = new Fetch();
    @Valid
    private RateLimit rateLimit = new RateLimit();
    @Valid
    private Enrichment enrichment = new Enrichment();
    private Cache cache = new Cache();
    @Valid
    private Alerts alerts = new Alerts();

    /**
     * Predefined collection sources
     */
    @Valid
    private List<SourceEntry> sources = new ArrayList<>();

    @Data
    public static class Scheduler {
        /**
         * Register triggers and run the recovery scan when the context starts
         */
        private boolean autoStart = true;

        /**
         * Upper bound of the random delay spreading each source's first run
         */
        private Duration initialDelayMax = Duration.ofSeconds(60);

        private Duration heartbeatInterval = Duration.ofSeconds(30);

        /**
         * Recovery warns when an interrupted RUNNING job has a heartbeat newer than this
         */
        private Duration staleAfter = Duration.ofMinutes(5);

        /**
         * How often a halted scheduler checks the job store
         */
        private Duration healthCheckInterval = Duration.ofSeconds(30);

        private int retentionDays = 30;

        @Min(1)
        private int alertOnFailureCount = 3;

        private int triggerPoolSize = 4;

        private Tier high = new Tier(4, 20);
        private Tier medium = new Tier(3, 20);
        private Tier low = new Tier(2, 20);
    }

    @Data
    public static class Tier {
        private int poolSize;
        private int queueCapacity;

        public Tier() {
        }

        public Tier(int poolSize, int queueCapacity) {
            this.poolSize = poolSize;
            this.queueCapacity = queueCapacity;
        }
    }

    @Data
    public static class Retry {
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(60);
        private Duration maxDelay = Duration.ofHours(1);
        private double jitterRatio = 0.1;

        /**
         * Requeue delay for capacity failures without an explicit retry-after
         */
        private Duration capacityDelay = Duration.ofSeconds(60);
    }

    @Data
    public static class Fetch {
        private Duration timeout = Duration.ofSeconds(60);
        private int poolSize = 8;
    }

    @Data
    public static class RateLimit {
        @Min(1)
        private int defaultPerMinute = 60;
        private Duration window = Duration.ofMinutes(1);

        /**
         * How long a collection waits for a permit before giving up as a capacity failure
         */
        private Duration acquireTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Enrichment {
        private boolean enabled = true;
        @Min(1)
        private int batchSize = 32;
        private Duration batchTimeout = Duration.ofSeconds(2);
        private int workerCount = 4;
        private Duration cacheTtl = Duration.ofHours(24);

        /**
         * Orchestrator wait for a submitted enrichment
         */
        private Duration awaitTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Cache {
        /**
         * redis | memory
         */
        private String backing = "redis";
        private int localMaxSize = 10_000;
    }

    @Data
    public static class Alerts {
        private Publish publish = new Publish();
        @Valid
        private List<AlertRule> rules = new ArrayList<>(defaultRules());

        private static List<AlertRule> defaultRules() {
            List<AlertRule> rules = new ArrayList<>();
            // umbrales de indicadores económicos
            rules.add(new AlertRule("variacion_mensual", "GT", 1.0, "inflation", "high"));
            rules.add(new AlertRule("tasa_desempleo", "GT", 15.0, "unemployment", "medium"));
            rules.add(new AlertRule("variacion_trimestral", "LT", -2.0, "gdp_contraction", "high"));
            return rules;
        }
    }

    @Data
    public static class Publish {
        private boolean enabled = false;
        private String topic = "openlearn.alerts";
    }

    /**
     * Threshold rule over a numeric field of an API item's {@code data}.
     */
    @Data
    public static class AlertRule {
        @NotBlank
        private String field;
        /**
         * GT | GTE | LT | LTE
         */
        private String operator = "GT";
        private double threshold;
        @NotBlank
        private String kind;
        private String severity = "medium";

        /**
         * Source keys the rule applies to; empty means every API source
         */
        private List<String> sources = new ArrayList<>();

        public AlertRule() {
        }

        public AlertRule(String field, String operator, double threshold, String kind, String severity) {
            this.field = field;
            this.operator = operator;
            this.threshold = threshold;
            this.kind = kind;
            this.severity = severity;
        }
    }

    @Data
    public static class SourceEntry {
        @NotBlank
        private String key;
        private String name;

        /**
         * api | scraper
         */
        private String kind = "api";

        /**
         * high | medium | low. Interval and max retries default from the tier.
         */
        private String priority = "low";

        private Duration interval;
        private Integer rateLimitPerMinute;
        private Integer maxRetries;
        private boolean enabled = true;
        private String category;
        @NotBlank
        private String url;

        /**
         * CSS selectors for scraper sources: link, title, content, max-articles
         */
        private Map<String, String> selectors = new HashMap<>();

        private Map<String, String> metadata = new HashMap<>();
    }
}
