package com.openlearn.collector.service.enrichment;

import com.openlearn.collector.exception.EnrichmentException;
import com.openlearn.collector.service.cache.CacheCategory;
import com.openlearn.collector.service.cache.LayeredCacheManager;
import com.openlearn.collector.util.HashUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 우선순위 배치 enrichment 처리기.
 *
 * 요청은 우선순위 큐에 쌓이고, 큐가 batchSize 이상이 되거나 가장 오래된 요청이
 * batchTimeout 만큼 기다렸을 때 한 번의 모델 호출로 처리됩니다.
 * 동일 텍스트는 캐시(nlp:v1:&lt;hash&gt;) 또는 대기 중인 future를 공유합니다.
 */
@Slf4j
public class BatchEnrichmentProcessor {

    private static final Comparator<Pending> ORDER = Comparator
            .comparingInt((Pending p) -> p.request().priority().getRank())
            .thenComparingLong(p -> p.request().sequence());

    private final EnrichmentModel model;
    private final LayeredCacheManager cacheManager;
    private final Executor workerExecutor;
    private final int batchSize;
    private final long batchTimeoutNanos;
    private final Duration cacheTtl;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final PriorityQueue<Pending> queue = new PriorityQueue<>(ORDER);
    private final Map<String, CompletableFuture<EnrichmentResult>> pending = new HashMap<>();
    private long sequence;
    private volatile boolean running;
    private Thread dispatcher;

    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong deduplicated = new AtomicLong();
    private final AtomicLong batches = new AtomicLong();
    private final AtomicLong modelInvocations = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    private final Counter submittedCounter;
    private final Counter cacheHitCounter;
    private final Counter batchCounter;
    private final Counter failureCounter;

    public BatchEnrichmentProcessor(EnrichmentModel model,
                                    LayeredCacheManager cacheManager,
                                    Executor workerExecutor,
                                    int batchSize,
                                    Duration batchTimeout,
                                    Duration cacheTtl,
                                    MeterRegistry meterRegistry) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.model = model;
        this.cacheManager = cacheManager;
        this.workerExecutor = workerExecutor;
        this.batchSize = batchSize;
        this.batchTimeoutNanos = batchTimeout.toNanos();
        this.cacheTtl = cacheTtl;
        this.submittedCounter = meterRegistry.counter("collector.enrichment", "event", "submitted");
        this.cacheHitCounter = meterRegistry.counter("collector.enrichment", "event", "cache_hit");
        this.batchCounter = meterRegistry.counter("collector.enrichment", "event", "batch");
        this.failureCounter = meterRegistry.counter("collector.enrichment", "event", "failure");
    }

    @PostConstruct
    public void start() {
        lock.lock();
        try {
            if (running) {
                return;
            }
            running = true;
            dispatcher = new Thread(this::dispatchLoop, "enrichment-dispatcher");
            dispatcher.setDaemon(true);
            dispatcher.start();
        } finally {
            lock.unlock();
        }
        log.info("Enrichment processor started: model={}, batchSize={}, batchTimeout={}ms",
                model.name(), batchSize, Duration.ofNanos(batchTimeoutNanos).toMillis());
    }

    /**
     * 남은 요청을 모두 배치로 내보낸 뒤 dispatcher를 종료합니다.
     */
    @PreDestroy
    public void stop() {
        Thread thread;
        lock.lock();
        try {
            running = false;
            changed.signalAll();
            thread = dispatcher;
        } finally {
            lock.unlock();
        }
        if (thread != null) {
            try {
                thread.join(Duration.ofSeconds(30).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Enrichment processor stopped: {}", stats());
    }

    public CompletableFuture<EnrichmentResult> submit(String text, EnrichmentPriority priority) {
        String textHash = HashUtils.sha256Hex(text == null ? "" : text);
        submitted.incrementAndGet();
        submittedCounter.increment();

        Optional<EnrichmentResult> cached = cacheManager.get(cacheKey(textHash), EnrichmentResult.class);
        if (cached.isPresent()) {
            recordCacheHit();
            return CompletableFuture.completedFuture(cached.get());
        }

        lock.lock();
        try {
            CompletableFuture<EnrichmentResult> existing = pending.get(textHash);
            if (existing != null) {
                deduplicated.incrementAndGet();
                return existing;
            }
            CompletableFuture<EnrichmentResult> future = new CompletableFuture<>();
            EnrichmentRequest request = new EnrichmentRequest(textHash, text, priority, sequence++);
            queue.add(new Pending(request, future, System.nanoTime()));
            pending.put(textHash, future);
            changed.signalAll();
            return future;
        } finally {
            lock.unlock();
        }
    }

    public EnrichmentStats stats() {
        int queued;
        lock.lock();
        try {
            queued = queue.size();
        } finally {
            lock.unlock();
        }
        return new EnrichmentStats(submitted.get(), cacheHits.get(), deduplicated.get(), batches.get(),
                modelInvocations.get(), failures.get(), queued);
    }

    private void dispatchLoop() {
        while (true) {
            List<Pending> batch;
            try {
                batch = nextBatch();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Enrichment dispatcher interrupted");
                return;
            }
            if (batch == null) {
                return;
            }
            try {
                workerExecutor.execute(() -> process(batch));
            } catch (RejectedExecutionException e) {
                log.warn("Enrichment worker pool rejected batch of {}, processing on dispatcher", batch.size());
                process(batch);
            }
        }
    }

    /**
     * 다음 배치를 꺼냅니다. 종료되었고 큐가 비었으면 null.
     */
    private List<Pending> nextBatch() throws InterruptedException {
        lock.lock();
        try {
            while (queue.isEmpty()) {
                if (!running) {
                    return null;
                }
                changed.await();
            }
            while (running && queue.size() < batchSize) {
                long oldest = queue.stream().mapToLong(Pending::arrivedAt).min().orElse(System.nanoTime());
                long wait = oldest + batchTimeoutNanos - System.nanoTime();
                if (wait <= 0) {
                    break;
                }
                changed.awaitNanos(wait);
            }
            List<Pending> batch = new ArrayList<>(Math.min(batchSize, queue.size()));
            while (batch.size() < batchSize && !queue.isEmpty()) {
                batch.add(queue.poll());
            }
            return batch;
        } finally {
            lock.unlock();
        }
    }

    private void process(List<Pending> batch) {
        batches.incrementAndGet();
        batchCounter.increment();

        List<Pending> misses = new ArrayList<>(batch.size());
        for (Pending p : batch) {
            Optional<EnrichmentResult> cached = cacheManager.get(cacheKey(p.request().textHash()), EnrichmentResult.class);
            if (cached.isPresent()) {
                recordCacheHit();
                complete(p, cached.get());
            } else {
                misses.add(p);
            }
        }
        if (misses.isEmpty()) {
            return;
        }

        List<EnrichmentResult> results;
        try {
            modelInvocations.incrementAndGet();
            results = model.enrichBatch(misses.stream().map(Pending::request).toList());
            if (results == null || results.size() != misses.size()) {
                throw new EnrichmentException("Model " + model.name() + " returned "
                        + (results == null ? 0 : results.size()) + " results for " + misses.size() + " texts");
            }
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            failureCounter.increment();
            log.error("Enrichment batch of {} failed: {}", misses.size(), e.getMessage(), e);
            EnrichmentException failure = e instanceof EnrichmentException ee
                    ? ee : new EnrichmentException("Enrichment model failed: " + e.getMessage(), e);
            misses.forEach(p -> fail(p, failure));
            return;
        }

        for (int i = 0; i < misses.size(); i++) {
            Pending p = misses.get(i);
            EnrichmentResult result = results.get(i);
            cacheManager.set(cacheKey(p.request().textHash()), result, cacheTtl);
            complete(p, result);
        }
    }

    private void complete(Pending p, EnrichmentResult result) {
        release(p);
        p.future().complete(result);
    }

    private void fail(Pending p, EnrichmentException e) {
        release(p);
        p.future().completeExceptionally(e);
    }

    private void release(Pending p) {
        lock.lock();
        try {
            pending.remove(p.request().textHash(), p.future());
        } finally {
            lock.unlock();
        }
    }

    private void recordCacheHit() {
        cacheHits.incrementAndGet();
        cacheHitCounter.increment();
    }

    static String cacheKey(String textHash) {
        return CacheCategory.ENRICHMENT.key(textHash);
    }

    private record Pending(EnrichmentRequest request, CompletableFuture<EnrichmentResult> future, long arrivedAt) {
    }

    public record EnrichmentStats(
            long submitted,
            long cacheHits,
            long deduplicated,
            long batches,
            long modelInvocations,
            long failures,
            int queued
    ) {
    }
}
