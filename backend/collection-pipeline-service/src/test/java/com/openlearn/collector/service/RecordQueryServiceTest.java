package com.openlearn.collector.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.openlearn.collector.MutableClock;
import com.openlearn.collector.TestSources;
import com.openlearn.collector.dto.RecordDTO;
import com.openlearn.collector.entity.PersistedRecord;
import com.openlearn.collector.entity.SourceKind;
import com.openlearn.collector.entity.SourcePriority;
import com.openlearn.collector.exception.SourceNotFoundException;
import com.openlearn.collector.mapper.EntityMapper;
import com.openlearn.collector.repository.PersistedRecordRepository;
import com.openlearn.collector.service.cache.CacheCategory;
import com.openlearn.collector.service.cache.InMemoryCacheBackingStore;
import com.openlearn.collector.service.cache.LayeredCacheManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * RecordQueryService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class RecordQueryServiceTest {

    @Mock
    private PersistedRecordRepository recordRepository;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
    private LayeredCacheManager cache;
    private RecordQueryService service;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        cache = new LayeredCacheManager(Caffeine.newBuilder().maximumSize(100).build(),
                new InMemoryCacheBackingStore(clock), objectMapper, clock, new SimpleMeterRegistry());
        SourceRegistry registry = new SourceRegistry(List.of(TestSources.api("dane_ipc", SourcePriority.HIGH, 5)));
        service = new RecordQueryService(recordRepository, registry, cache, new EntityMapper(objectMapper));
    }

    private static PersistedRecord record(long id) {
        return PersistedRecord.builder()
                .id(id)
                .sourceKey("dane_ipc")
                .contentHash("h" + id)
                .kind(SourceKind.API)
                .derivedFieldsJson("{\"difficulty_score\":1.0}")
                .payloadJson("{\"data\":{\"valor\":1.5}}")
                .createdAt(LocalDateTime.of(2026, 3, 1, 11, 0))
                .build();
    }

    @Test
    @DisplayName("두 번째 조회는 캐시에서 응답한다")
    void cachesResult() {
        when(recordRepository.findBySourceKeyOrderByCreatedAtDesc("dane_ipc", PageRequest.of(0, 10)))
                .thenReturn(List.of(record(2), record(1)));

        List<RecordDTO> first = service.recent("dane_ipc", 10);
        List<RecordDTO> second = service.recent("dane_ipc", 10);

        assertThat(first).extracting(RecordDTO::id).containsExactly(2L, 1L);
        assertThat(second).isEqualTo(first);
        assertThat(second.get(0).derivedFields()).containsEntry("difficulty_score", 1.0);
        verify(recordRepository, times(1)).findBySourceKeyOrderByCreatedAtDesc("dane_ipc", PageRequest.of(0, 10));
    }

    @Test
    @DisplayName("무효화되거나 TTL 이 지나면 다시 조회한다")
    void reloadsAfterInvalidationOrExpiry() {
        when(recordRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, 50))).thenReturn(List.of(record(1)));

        service.recent(null, 50);
        cache.invalidatePattern(CacheCategory.RECORDS.pattern("all"));
        service.recent(null, 50);
        clock.advance(Duration.ofMinutes(6));
        service.recent(null, 50);

        verify(recordRepository, times(3)).findAllByOrderByCreatedAtDesc(PageRequest.of(0, 50));
    }

    @Test
    @DisplayName("limit 범위를 벗어나면 IllegalArgumentException")
    void rejectsInvalidLimit() {
        assertThatThrownBy(() -> service.recent(null, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.recent(null, RecordQueryService.MAX_LIMIT + 1))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(recordRepository);
    }

    @Test
    @DisplayName("알 수 없는 소스는 SourceNotFoundException")
    void unknownSource() {
        assertThatThrownBy(() -> service.recent("nope", 10)).isInstanceOf(SourceNotFoundException.class);
    }
}
