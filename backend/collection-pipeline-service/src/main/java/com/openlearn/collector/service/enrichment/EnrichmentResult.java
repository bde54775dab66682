package com.openlearn.collector.service.enrichment;

import java.util.List;
import java.util.Map;

/**
 * Model output for one text.
 *
 * @param entities       entity type (institutions, locations, ...) to matched terms
 * @param sentimentScore in [-1, 1]
 * @param sentimentLabel positive, negative or neutral
 * @param regionalTerms  regional vocabulary found in the text
 * @param summary        leading excerpt of the text
 */
public record EnrichmentResult(
        String textHash,
        Map<String, List<String>> entities,
        double sentimentScore,
        String sentimentLabel,
        List<String> regionalTerms,
        String summary
) {
}
