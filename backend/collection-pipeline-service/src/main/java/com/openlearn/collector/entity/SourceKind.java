package com.openlearn.collector.entity;

/**
 * 수집 소스 유형.
 * API는 구조화된 JSON 응답, SCRAPER는 HTML 문서를 반환합니다.
 */
public enum SourceKind {
    API,
    SCRAPER;

    public static SourceKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Source kind must not be blank");
        }
        return switch (value.trim().toLowerCase()) {
            case "api", "api_client", "api-client" -> API;
            case "scraper", "html", "web" -> SCRAPER;
            default -> throw new IllegalArgumentException("Unknown source kind: " + value);
        };
    }
}
