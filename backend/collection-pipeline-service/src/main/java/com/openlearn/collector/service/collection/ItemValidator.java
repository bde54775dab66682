package com.openlearn.collector.service.collection;

import com.openlearn.collector.exception.ItemValidationException;
import com.openlearn.collector.service.adapter.RawItem;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 항목 단위 검증. 실패는 오류 카운트로만 집계되고 수집 자체를 중단시키지 않습니다.
 */
@Component
public class ItemValidator {

    public void validate(RawItem item) {
        Map<String, Object> payload = item.payload();
        if (payload == null || payload.isEmpty()) {
            throw new ItemValidationException("Item has no payload", item.sourceKey());
        }
        switch (item.kind()) {
            case API -> {
                if (payload.get("source") == null && payload.get("data") == null) {
                    throw new ItemValidationException("API item requires 'source' or 'data'", item.sourceKey());
                }
            }
            case SCRAPER -> {
                if (isBlank(item.stringField("title"))) {
                    throw new ItemValidationException("Document has empty title", item.sourceKey());
                }
                if (isBlank(item.stringField("content"))) {
                    throw new ItemValidationException("Document has empty content", item.sourceKey());
                }
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
