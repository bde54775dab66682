package com.openlearn.collector.exception;

/**
 * 배치 단위 enrichment 실패. 해당 배치의 요청에만 전달됩니다.
 */
public class EnrichmentException extends CollectionException {

    public EnrichmentException(String message) {
        super("ENRICHMENT_ERROR", message);
    }

    public EnrichmentException(String message, Throwable cause) {
        super("ENRICHMENT_ERROR", message, null, cause);
    }
}
