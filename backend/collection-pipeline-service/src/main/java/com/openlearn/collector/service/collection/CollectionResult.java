package com.openlearn.collector.service.collection;

/**
 * Outcome of one {@code collect} call.
 */
public record CollectionResult(
        int itemsFetched,
        int itemsStored,
        int itemsDuplicate,
        int errors,
        int alertsRaised,
        int enrichmentFailures
) {

    public static CollectionResult empty() {
        return new CollectionResult(0, 0, 0, 0, 0, 0);
    }
}
