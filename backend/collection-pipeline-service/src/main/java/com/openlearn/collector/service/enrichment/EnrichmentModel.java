package com.openlearn.collector.service.enrichment;

import java.util.List;

/**
 * Text enrichment model invoked once per batch.
 */
public interface EnrichmentModel {

    /**
     * @return one result per request, in request order
     */
    List<EnrichmentResult> enrichBatch(List<EnrichmentRequest> requests);

    String name();
}
