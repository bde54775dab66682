package com.openlearn.collector.exception;

public class SourceNotFoundException extends CollectionException {

    public SourceNotFoundException(String sourceKey) {
        super("SOURCE_NOT_FOUND", "Source not found: " + sourceKey, sourceKey);
    }
}
