package com.openlearn.collector.service.cache;

import java.time.Duration;
import java.util.Arrays;

/**
 * Cache namespaces with their default TTL and staleness tolerance.
 * A key's namespace is the segment before the first ':'.
 */
public enum CacheCategory {
    RECORDS("records", Duration.ofMinutes(5), Duration.ofMinutes(10)),
    ALERTS("alerts", Duration.ofMinutes(1), Duration.ofMinutes(5)),
    SOURCE_STATUS("source_status", Duration.ofSeconds(30), Duration.ofMinutes(1)),
    API_GOVERNMENT("api_gov", Duration.ofHours(6), Duration.ofHours(12)),
    API_NEWS("api_news", Duration.ofHours(1), Duration.ofHours(2)),
    ENRICHMENT("nlp", Duration.ofHours(24), Duration.ofDays(7)),
    GENERAL("general", Duration.ofHours(1), Duration.ofHours(24));

    public static final String VERSION = "v1";

    private final String namespace;
    private final Duration defaultTtl;
    private final Duration maxStaleness;

    CacheCategory(String namespace, Duration defaultTtl, Duration maxStaleness) {
        this.namespace = namespace;
        this.defaultTtl = defaultTtl;
        this.maxStaleness = maxStaleness;
    }

    public String getNamespace() {
        return namespace;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public Duration getMaxStaleness() {
        return maxStaleness;
    }

    /**
     * {@code <namespace>:v1:<part>:<part>...}
     */
    public String key(Object... parts) {
        StringBuilder sb = new StringBuilder(namespace).append(':').append(VERSION);
        for (Object part : parts) {
            sb.append(':').append(part);
        }
        return sb.toString();
    }

    /**
     * Glob matching every key of this namespace whose id starts with the given parts.
     */
    public String pattern(Object... parts) {
        return key(parts) + ":*";
    }

    /**
     * Requested TTL (or the default when null) bounded by the staleness tolerance.
     */
    public Duration effectiveTtl(Duration requested) {
        Duration ttl = requested == null || requested.isZero() || requested.isNegative() ? defaultTtl : requested;
        return ttl.compareTo(maxStaleness) > 0 ? maxStaleness : ttl;
    }

    public static CacheCategory forKey(String key) {
        int idx = key.indexOf(':');
        String ns = idx < 0 ? key : key.substring(0, idx);
        return Arrays.stream(values())
                .filter(c -> c.namespace.equals(ns))
                .findFirst()
                .orElse(GENERAL);
    }
}
