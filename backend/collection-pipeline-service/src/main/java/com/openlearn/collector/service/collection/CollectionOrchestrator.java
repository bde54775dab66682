package com.openlearn.collector.service.collection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openlearn.collector.config.CollectorProperties;
import com.openlearn.collector.entity.Alert;
import com.openlearn.collector.entity.SourceKind;
import com.openlearn.collector.exception.CapacityExceededException;
import com.openlearn.collector.exception.CollectionFailedException;
import com.openlearn.collector.exception.ItemValidationException;
import com.openlearn.collector.exception.TransientSourceException;
import com.openlearn.collector.repository.AlertRepository;
import com.openlearn.collector.repository.PersistedRecordRepository;
import com.openlearn.collector.service.AlertEventPublisher;
import com.openlearn.collector.service.SourceDefinition;
import com.openlearn.collector.service.adapter.RawItem;
import com.openlearn.collector.service.adapter.SourceAdapter;
import com.openlearn.collector.service.adapter.SourceAdapterRegistry;
import com.openlearn.collector.service.cache.CacheCategory;
import com.openlearn.collector.service.cache.LayeredCacheManager;
import com.openlearn.collector.service.enrichment.BatchEnrichmentProcessor;
import com.openlearn.collector.service.enrichment.EnrichmentResult;
import com.openlearn.collector.service.ratelimit.RateLimiterRegistry;
import com.openlearn.collector.service.ratelimit.SourceRateLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 소스 한 개에 대한 수집 실행.
 *
 * rate limit → fetch (하드 타임아웃) → 검증 → 중복 제거 → 파생 필드/enrichment → 알림 규칙
 * → 단일 트랜잭션 저장 → 커밋 후 캐시 무효화 및 알림 발행.
 *
 * 어댑터/저장소 오류는 여기서 분류되어 {@link CollectionFailedException} 으로만 밖으로 나갑니다.
 */
@Service
@Slf4j
public class CollectionOrchestrator {

    private static final int HASH_LOOKUP_CHUNK = 500;

    private final SourceAdapterRegistry adapterRegistry;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final ItemValidator itemValidator;
    private final ContentHasher contentHasher;
    private final DifficultyScorer difficultyScorer;
    private final AlertRuleEvaluator alertRuleEvaluator;
    private final FailureClassifier failureClassifier;
    private final BatchEnrichmentProcessor enrichmentProcessor;
    private final PersistedRecordRepository recordRepository;
    private final AlertRepository alertRepository;
    private final TransactionTemplate transactionTemplate;
    private final LayeredCacheManager cacheManager;
    private final AlertEventPublisher alertEventPublisher;
    private final ObjectMapper objectMapper;
    private final CollectorProperties properties;
    private final Executor fetchExecutor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public CollectionOrchestrator(SourceAdapterRegistry adapterRegistry,
                                  RateLimiterRegistry rateLimiterRegistry,
                                  ItemValidator itemValidator,
                                  ContentHasher contentHasher,
                                  DifficultyScorer difficultyScorer,
                                  AlertRuleEvaluator alertRuleEvaluator,
                                  FailureClassifier failureClassifier,
                                  BatchEnrichmentProcessor enrichmentProcessor,
                                  PersistedRecordRepository recordRepository,
                                  AlertRepository alertRepository,
                                  PlatformTransactionManager transactionManager,
                                  LayeredCacheManager cacheManager,
                                  AlertEventPublisher alertEventPublisher,
                                  ObjectMapper objectMapper,
                                  CollectorProperties properties,
                                  @Qualifier("fetchExecutor") Executor fetchExecutor,
                                  Clock clock,
                                  MeterRegistry meterRegistry) {
        this.adapterRegistry = adapterRegistry;
        this.rateLimiterRegistry = rateLimiterRegistry;
        this.itemValidator = itemValidator;
        this.contentHasher = contentHasher;
        this.difficultyScorer = difficultyScorer;
        this.alertRuleEvaluator = alertRuleEvaluator;
        this.failureClassifier = failureClassifier;
        this.enrichmentProcessor = enrichmentProcessor;
        this.recordRepository = recordRepository;
        this.alertRepository = alertRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.cacheManager = cacheManager;
        this.alertEventPublisher = alertEventPublisher;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @throws CollectionFailedException 수집 실패 (분류 포함)
     */
    public CollectionResult collect(SourceDefinition source) {
        long startTime = System.currentTimeMillis();

        List<RawItem> fetched;
        try {
            SourceAdapter adapter = adapterRegistry.adapterFor(source);
            acquirePermit(source);
            fetched = fetchWithTimeout(source, adapter);
        } catch (RuntimeException e) {
            throw failureClassifier.toFailure(source.key(), e);
        }

        Prepared prepared;
        try {
            prepared = prepare(source, fetched);
        } catch (RuntimeException e) {
            throw failureClassifier.toFailure(source.key(), e);
        }

        Persisted persisted;
        try {
            persisted = transactionTemplate.execute(status -> persist(prepared.candidates()));
        } catch (RuntimeException e) {
            log.error("Persisting {} items from {} rolled back: {}",
                    prepared.candidates().size(), source.key(), e.getMessage(), e);
            throw failureClassifier.toFailure(source.key(), e);
        }
        if (persisted == null) {
            persisted = new Persisted(0, 0, List.of());
        }

        afterCommit(source, persisted);

        CollectionResult result = new CollectionResult(
                fetched.size(),
                persisted.stored(),
                prepared.duplicates() + persisted.conflicts(),
                prepared.errors(),
                persisted.alerts().size(),
                prepared.enrichmentFailures()
        );
        record(source, result);
        log.info("Collected {}: fetched={}, stored={}, duplicate={}, errors={}, alerts={}, enrichmentFailures={} ({}ms)",
                source.key(), result.itemsFetched(), result.itemsStored(), result.itemsDuplicate(),
                result.errors(), result.alertsRaised(), result.enrichmentFailures(),
                System.currentTimeMillis() - startTime);
        return result;
    }

    private void acquirePermit(SourceDefinition source) {
        SourceRateLimiter limiter = rateLimiterRegistry.forSource(source);
        try {
            if (!limiter.tryAcquire(properties.getRateLimit().getAcquireTimeout())) {
                throw CapacityExceededException.rateLimited(source.key(), limiter.timeUntilNextPermit());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientSourceException("Interrupted while waiting for rate limit", source.key(), e);
        }
    }

    private List<RawItem> fetchWithTimeout(SourceDefinition source, SourceAdapter adapter) {
        Duration timeout = properties.getFetch().getTimeout();
        CompletableFuture<List<RawItem>> future;
        try {
            future = CompletableFuture.supplyAsync(adapter::fetch, fetchExecutor);
        } catch (RejectedExecutionException e) {
            throw new CapacityExceededException("Fetch pool saturated", source.key(),
                    properties.getRetry().getCapacityDelay(), e);
        }
        try {
            List<RawItem> items = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return items != null ? items : List.of();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw TransientSourceException.timeout(source.key(), timeout.toMillis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new TransientSourceException("Fetch failed: " + cause, source.key(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientSourceException("Interrupted during fetch", source.key(), e);
        }
    }

    /**
     * 검증, 중복 제거, 파생 필드 계산. 저장소는 조회만 합니다.
     */
    private Prepared prepare(SourceDefinition source, List<RawItem> fetched) {
        int errors = 0;
        int duplicates = 0;
        LocalDateTime now = LocalDateTime.now(clock);

        Map<String, RawItem> unique = new LinkedHashMap<>();
        for (RawItem item : fetched) {
            try {
                itemValidator.validate(item);
                String hash = contentHasher.hash(item);
                if (unique.putIfAbsent(hash, item.withContentHash(hash)) != null) {
                    duplicates++;
                }
            } catch (ItemValidationException e) {
                errors++;
                log.debug("Invalid item from {}: {}", source.key(), e.getMessage());
            }
        }

        Set<String> existing = existingHashes(source.key(), unique.keySet());
        duplicates += existing.size();
        existing.forEach(unique::remove);

        List<RawItem> fresh = new ArrayList<>(unique.values());
        Map<String, CompletableFuture<EnrichmentResult>> enrichments = submitEnrichments(source, fresh);

        int enrichmentFailures = 0;
        List<Candidate> candidates = new ArrayList<>(fresh.size());
        for (RawItem item : fresh) {
            Map<String, Object> derived = new LinkedHashMap<>();
            String text = item.stringField("content");
            if (item.kind() == SourceKind.SCRAPER) {
                derived.put("difficulty", difficultyScorer.score(text));
                derived.put("word_count", difficultyScorer.wordCount(text));
            }
            CompletableFuture<EnrichmentResult> enrichment = enrichments.get(item.contentHash());
            if (enrichment != null) {
                EnrichmentResult result = await(source, enrichment);
                if (result != null) {
                    derived.put("enrichment", result);
                } else {
                    enrichmentFailures++;
                }
            }
            List<Alert> alerts = alertRuleEvaluator.evaluate(item, now);
            candidates.add(new Candidate(item, toJson(derived), toJson(item.payload()), alerts, now));
        }
        return new Prepared(candidates, duplicates, errors, enrichmentFailures);
    }

    private Set<String> existingHashes(String sourceKey, Set<String> hashes) {
        Set<String> existing = new HashSet<>();
        List<String> all = new ArrayList<>(hashes);
        for (int i = 0; i < all.size(); i += HASH_LOOKUP_CHUNK) {
            List<String> chunk = all.subList(i, Math.min(all.size(), i + HASH_LOOKUP_CHUNK));
            existing.addAll(recordRepository.findExistingHashes(sourceKey, chunk));
        }
        return existing;
    }

    private Map<String, CompletableFuture<EnrichmentResult>> submitEnrichments(SourceDefinition source,
                                                                               List<RawItem> items) {
        Map<String, CompletableFuture<EnrichmentResult>> futures = new LinkedHashMap<>();
        if (!properties.getEnrichment().isEnabled()) {
            return futures;
        }
        for (RawItem item : items) {
            String text = item.stringField("content");
            if (item.kind() == SourceKind.SCRAPER && text != null && !text.isBlank()) {
                futures.put(item.contentHash(),
                        enrichmentProcessor.submit(text, source.priority().toEnrichmentPriority()));
            }
        }
        return futures;
    }

    /**
     * Enrichment 결과 대기. 실패하면 null 을 반환하고 레코드는 enrichment 없이 저장됩니다.
     */
    private EnrichmentResult await(SourceDefinition source, CompletableFuture<EnrichmentResult> future) {
        try {
            return future.get(properties.getEnrichment().getAwaitTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Enrichment unavailable for an item from {}: {}", source.key(),
                    e instanceof ExecutionException ? e.getCause().getMessage() : "timed out");
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientSourceException("Interrupted while awaiting enrichment", source.key(), e);
        }
    }

    private Persisted persist(List<Candidate> candidates) {
        int stored = 0;
        int conflicts = 0;
        List<Alert> savedAlerts = new ArrayList<>();
        for (Candidate candidate : candidates) {
            RawItem item = candidate.item();
            int rows = recordRepository.insertOrIgnore(
                    item.sourceKey(),
                    item.contentHash(),
                    item.kind().name(),
                    item.stringField("title"),
                    item.stringField("url"),
                    candidate.derivedFieldsJson(),
                    candidate.payloadJson(),
                    candidate.createdAt());
            if (rows == 0) {
                // 동시 수집이 먼저 저장한 경우
                conflicts++;
                continue;
            }
            stored++;
            for (Alert alert : candidate.alerts()) {
                savedAlerts.add(alertRepository.save(alert));
            }
        }
        return new Persisted(stored, conflicts, savedAlerts);
    }

    private void afterCommit(SourceDefinition source, Persisted persisted) {
        if (persisted.stored() > 0) {
            cacheManager.invalidatePattern(CacheCategory.RECORDS.pattern(source.key()));
            cacheManager.invalidatePattern(CacheCategory.RECORDS.pattern("all"));
        }
        if (!persisted.alerts().isEmpty()) {
            cacheManager.invalidatePattern(CacheCategory.ALERTS.pattern());
            for (Alert alert : persisted.alerts()) {
                log.warn("Alert raised for {}: {}", source.key(), alert.getMessage());
            }
            alertEventPublisher.publishAll(persisted.alerts());
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize collected item", e);
        }
    }

    private void record(SourceDefinition source, CollectionResult result) {
        meterRegistry.counter("collector.items", "source", source.key(), "outcome", "fetched")
                .increment(result.itemsFetched());
        meterRegistry.counter("collector.items", "source", source.key(), "outcome", "stored")
                .increment(result.itemsStored());
        meterRegistry.counter("collector.items", "source", source.key(), "outcome", "duplicate")
                .increment(result.itemsDuplicate());
        meterRegistry.counter("collector.items", "source", source.key(), "outcome", "error")
                .increment(result.errors());
    }

    private record Candidate(RawItem item, String derivedFieldsJson, String payloadJson,
                             List<Alert> alerts, LocalDateTime createdAt) {
    }

    private record Prepared(List<Candidate> candidates, int duplicates, int errors, int enrichmentFailures) {
    }

    private record Persisted(int stored, int conflicts, List<Alert> alerts) {
    }
}
