package com.openlearn.collector.service.collection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.openlearn.collector.exception.ItemValidationException;
import com.openlearn.collector.service.adapter.RawItem;
import com.openlearn.collector.util.HashUtils;
import org.springframework.stereotype.Component;

/**
 * 중복 제거용 콘텐츠 해시.
 *
 * 문서는 url/title/content, API 항목은 {@code data}의 정규화된 JSON (키 정렬)으로 계산합니다.
 * 수집 시각 같은 부수 필드는 포함하지 않습니다.
 */
@Component
public class ContentHasher {

    private final ObjectMapper canonicalMapper;

    public ContentHasher(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public String hash(RawItem item) {
        if (item.contentHash() != null && !item.contentHash().isBlank()) {
            return item.contentHash();
        }
        return switch (item.kind()) {
            case SCRAPER -> HashUtils.sha256Hex(
                    item.stringField("url"), item.stringField("title"), item.stringField("content"));
            case API -> HashUtils.sha256Hex(canonicalJson(item));
        };
    }

    private String canonicalJson(RawItem item) {
        Object data = item.payload().get("data");
        try {
            return canonicalMapper.writeValueAsString(data != null ? data : item.payload().get("source"));
        } catch (JsonProcessingException e) {
            throw new ItemValidationException("Item data is not serializable", item.sourceKey(), e);
        }
    }
}
