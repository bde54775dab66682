package com.openlearn.collector.service.enrichment;

/**
 * Text waiting for enrichment. {@code sequence} keeps FIFO order within a priority.
 */
public record EnrichmentRequest(String textHash, String text, EnrichmentPriority priority, long sequence) {
}
