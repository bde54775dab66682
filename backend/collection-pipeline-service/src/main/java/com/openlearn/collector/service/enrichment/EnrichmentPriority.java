package com.openlearn.collector.service.enrichment;

/**
 * Queue priority of an enrichment request. Lower rank is dispatched first.
 */
public enum EnrichmentPriority {
    CRITICAL(0),
    HIGH(1),
    NORMAL(2),
    LOW(3);

    private final int rank;

    EnrichmentPriority(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }
}
