package com.openlearn.collector.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.openlearn.collector.dto.RecordDTO;
import com.openlearn.collector.mapper.EntityMapper;
import com.openlearn.collector.repository.PersistedRecordRepository;
import com.openlearn.collector.service.cache.CacheCategory;
import com.openlearn.collector.service.cache.LayeredCacheManager;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 최근 수집 레코드 조회. 결과는 records 네임스페이스에 캐시되며 새 레코드가 저장되면 무효화됩니다.
 */
@Service
@RequiredArgsConstructor
public class RecordQueryService {

    public static final int MAX_LIMIT = 500;
    private static final String ALL_SOURCES = "all";
    private static final TypeReference<List<RecordDTO>> RECORD_LIST = new TypeReference<>() {};

    private final PersistedRecordRepository recordRepository;
    private final SourceRegistry sourceRegistry;
    private final LayeredCacheManager cacheManager;
    private final EntityMapper entityMapper;

    @Transactional(readOnly = true)
    public List<RecordDTO> recent(String sourceKey, int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ": " + limit);
        }
        if (sourceKey != null) {
            sourceRegistry.get(sourceKey);
        }
        String key = CacheCategory.RECORDS.key(sourceKey != null ? sourceKey : ALL_SOURCES, limit);
        return cacheManager.getOrSet(key, CacheCategory.RECORDS.getDefaultTtl(), RECORD_LIST,
                () -> load(sourceKey, limit));
    }

    private List<RecordDTO> load(String sourceKey, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        return (sourceKey != null
                ? recordRepository.findBySourceKeyOrderByCreatedAtDesc(sourceKey, page)
                : recordRepository.findAllByOrderByCreatedAtDesc(page))
                .stream()
                .map(entityMapper::toDTO)
                .toList();
    }
}
