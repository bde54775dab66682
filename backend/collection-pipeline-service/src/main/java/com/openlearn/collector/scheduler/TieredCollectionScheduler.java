package com.openlearn.collector.scheduler;

import com.openlearn.collector.config.CollectorProperties;
import com.openlearn.collector.dto.SchedulerStatusDTO;
import com.openlearn.collector.dto.SourceStatusDTO;
import com.openlearn.collector.entity.CollectionJob;
import com.openlearn.collector.entity.JobStatus;
import com.openlearn.collector.entity.SourcePriority;
import com.openlearn.collector.entity.TriggerType;
import com.openlearn.collector.exception.JobAlreadyRunningException;
import com.openlearn.collector.exception.SchedulerHaltedException;
import com.openlearn.collector.service.JobLifecycleService;
import com.openlearn.collector.service.SourceDefinition;
import com.openlearn.collector.service.SourceRegistry;
import com.openlearn.collector.service.collection.FailureClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 티어별 수집 스케줄러.
 *
 * - 소스마다 주기 트리거를 등록하고 첫 실행은 initial-delay-max 안에서 무작위로 분산합니다.
 * - 트리거 시 작업 행(SCHEDULED)을 먼저 기록한 뒤 소스 티어의 실행자에 넘깁니다.
 * - 소스당 동시에 하나만 실행됩니다. 재시도/재큐잉 대기 중에는 주기 트리거를 건너뜁니다.
 * - 작업 저장소를 쓸 수 없으면 새 트리거를 멈추고 저장소가 응답할 때까지 주기적으로 확인합니다.
 *
 * 기동 시 복구 스캔을 먼저 실행한 뒤 트리거를 등록합니다. 저장소 장애가 풀리면 복구 스캔을 다시 실행합니다.
 * 연속 실패 횟수와 마지막 오류는 소스 상태를 처음 만들 때 작업 원장에서 읽어 옵니다.
 */
@Component
@Slf4j
public class TieredCollectionScheduler implements SmartLifecycle {

    private final SourceRegistry sourceRegistry;
    private final CollectionJobRunner jobRunner;
    private final JobLifecycleService lifecycle;
    private final JobRecoveryService recoveryService;
    private final FailureClassifier failureClassifier;
    private final TaskScheduler taskScheduler;
    private final Map<SourcePriority, Executor> tierExecutors;
    private final CollectorProperties.Scheduler settings;
    private final Duration capacityDelay;
    private final Clock clock;

    private final Map<String, SourceState> states = new ConcurrentHashMap<>();
    private final Object haltLock = new Object();

    private volatile boolean running;
    private volatile boolean halted;
    private volatile String haltReason;
    private volatile LocalDateTime haltedAt;
    private volatile Instant startedAt;
    private ScheduledFuture<?> heartbeatTask;
    private ScheduledFuture<?> healthCheckTask;

    private final AtomicLong executed = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong requeued = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();

    @Autowired
    public TieredCollectionScheduler(SourceRegistry sourceRegistry,
                                     CollectionJobRunner jobRunner,
                                     JobLifecycleService lifecycle,
                                     JobRecoveryService recoveryService,
                                     FailureClassifier failureClassifier,
                                     @Qualifier("collectionTaskScheduler") TaskScheduler taskScheduler,
                                     @Qualifier("highTierExecutor") Executor highTierExecutor,
                                     @Qualifier("mediumTierExecutor") Executor mediumTierExecutor,
                                     @Qualifier("lowTierExecutor") Executor lowTierExecutor,
                                     CollectorProperties properties,
                                     Clock clock) {
        this(sourceRegistry, jobRunner, lifecycle, recoveryService, failureClassifier, taskScheduler,
                tiers(highTierExecutor, mediumTierExecutor, lowTierExecutor), properties, clock);
    }

    TieredCollectionScheduler(SourceRegistry sourceRegistry,
                              CollectionJobRunner jobRunner,
                              JobLifecycleService lifecycle,
                              JobRecoveryService recoveryService,
                              FailureClassifier failureClassifier,
                              TaskScheduler taskScheduler,
                              Map<SourcePriority, Executor> tierExecutors,
                              CollectorProperties properties,
                              Clock clock) {
        this.sourceRegistry = sourceRegistry;
        this.jobRunner = jobRunner;
        this.lifecycle = lifecycle;
        this.recoveryService = recoveryService;
        this.failureClassifier = failureClassifier;
        this.taskScheduler = taskScheduler;
        this.tierExecutors = new EnumMap<>(tierExecutors);
        this.settings = properties.getScheduler();
        this.capacityDelay = properties.getRetry().getCapacityDelay();
        this.clock = clock;
    }

    // ========================================
    // Lifecycle
    // ========================================

    @Override
    public void start() {
        if (running) {
            return;
        }
        startedAt = clock.instant();
        running = true;

        List<JobRecoveryService.RecoveredJob> recovered = runRecovery();
        List<SourceDefinition> enabled = sourceRegistry.enabled();
        enabled.forEach(this::schedule);
        recovered.forEach(this::armRecovered);

        Duration heartbeat = settings.getHeartbeatInterval();
        heartbeatTask = taskScheduler.scheduleAtFixedRate(this::heartbeat, clock.instant().plus(heartbeat), heartbeat);
        log.info("[Scheduler] Started: {} sources scheduled, {} recovered jobs armed", enabled.size(), recovered.size());
    }

    @Override
    public void stop() {
        running = false;
        cancel(heartbeatTask);
        cancel(healthCheckTask);
        for (SourceState state : states.values()) {
            synchronized (state) {
                cancel(state.periodic);
                cancel(state.pendingFuture);
                state.periodic = null;
                state.pendingFuture = null;
            }
        }
        log.info("[Scheduler] Stopped: executed={}, succeeded={}, failed={}", executed.get(), succeeded.get(), failed.get());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return settings.isAutoStart();
    }

    // ========================================
    // Scheduling contract
    // ========================================

    /**
     * 주기 트리거 등록 (이미 있으면 교체)
     */
    public void schedule(SourceDefinition source) {
        SourceState state = stateOf(source);
        long maxDelay = settings.getInitialDelayMax().toMillis();
        long delay = maxDelay > 0 ? ThreadLocalRandom.current().nextLong(maxDelay + 1) : 0;
        Instant first = clock.instant().plusMillis(delay);
        synchronized (state) {
            cancel(state.periodic);
            state.periodic = taskScheduler.scheduleAtFixedRate(
                    () -> onPeriodicTrigger(source.key()), first, source.interval());
            state.nextPeriodicRun = toLocal(first);
        }
        log.debug("[Scheduler] {} scheduled every {} on the {} tier, first run at {}",
                source.key(), source.interval(), source.priority(), toLocal(first));
    }

    /**
     * 즉시 실행. 대기 중인 재시도가 있으면 새 작업을 만들지 않고 그 작업을 바로 실행합니다.
     *
     * @return 실행되는 작업 ID
     * @throws JobAlreadyRunningException 같은 소스가 실행 중
     * @throws SchedulerHaltedException   작업 저장소 장애로 스케줄링 중단 상태
     */
    public Long triggerNow(String sourceKey) {
        SourceDefinition source = sourceRegistry.get(sourceKey);
        if (halted) {
            throw new SchedulerHaltedException(haltReason);
        }
        SourceState state = stateOf(source);
        synchronized (state) {
            if (state.inFlight) {
                throw new JobAlreadyRunningException(sourceKey);
            }
            Long jobId;
            if (state.pendingJobId != null) {
                jobId = state.pendingJobId;
                clearPending(state);
                log.info("[Scheduler] Manual trigger for {} runs pending job {} now", sourceKey, jobId);
            } else {
                try {
                    jobId = lifecycle.createJob(sourceKey, TriggerType.MANUAL, 0, null, null).getId();
                } catch (RuntimeException e) {
                    if (failureClassifier.isStoreUnavailable(e)) {
                        halt("job store unavailable: " + e.getMessage());
                        throw new SchedulerHaltedException(haltReason);
                    }
                    throw e;
                }
                log.info("[Scheduler] Manual trigger for {} created job {}", sourceKey, jobId);
            }
            startLocked(state, jobId);
            return jobId;
        }
    }

    public void pause(String sourceKey) {
        SourceState state = stateOf(sourceRegistry.get(sourceKey));
        synchronized (state) {
            state.paused = true;
            cancel(state.pendingFuture);
            state.pendingFuture = null;
        }
        log.info("[Scheduler] {} paused", sourceKey);
    }

    public void resume(String sourceKey) {
        SourceState state = stateOf(sourceRegistry.get(sourceKey));
        synchronized (state) {
            state.paused = false;
            rearmParked(state);
        }
        log.info("[Scheduler] {} resumed", sourceKey);
    }

    public SourceStatusDTO getStatus(String sourceKey) {
        SourceDefinition source = sourceRegistry.get(sourceKey);
        SourceState state = stateOf(source);
        synchronized (state) {
            return new SourceStatusDTO(
                    source.key(),
                    source.name(),
                    source.kind(),
                    source.priority(),
                    source.enabled(),
                    source.interval().toSeconds(),
                    source.maxRetries(),
                    nextRun(state),
                    state.lastRun != null ? state.lastRun : lastCompletedFromStore(sourceKey),
                    state.consecutiveFailures,
                    state.lastError,
                    state.paused,
                    state.inFlight,
                    state.pendingJobId
            );
        }
    }

    public List<SourceStatusDTO> getAllStatuses() {
        List<SourceStatusDTO> statuses = new ArrayList<>();
        for (SourceDefinition source : sourceRegistry.all()) {
            statuses.add(getStatus(source.key()));
        }
        return statuses;
    }

    public SchedulerStatusDTO status() {
        int inFlight = 0;
        int pending = 0;
        int paused = 0;
        for (SourceState state : states.values()) {
            synchronized (state) {
                inFlight += state.inFlight ? 1 : 0;
                pending += state.pendingJobId != null ? 1 : 0;
                paused += state.paused ? 1 : 0;
            }
        }
        Instant started = startedAt;
        return new SchedulerStatusDTO(
                running,
                halted,
                haltReason,
                haltedAt,
                started != null ? toLocal(started) : null,
                started != null ? Duration.between(started, clock.instant()).toSeconds() : 0,
                sourceRegistry.all().size(),
                inFlight,
                pending,
                paused,
                executed.get(),
                succeeded.get(),
                failed.get(),
                retried.get(),
                requeued.get(),
                deadLettered.get()
        );
    }

    public boolean isHalted() {
        return halted;
    }

    // ========================================
    // Triggers and dispatch
    // ========================================

    void onPeriodicTrigger(String sourceKey) {
        SourceState state = states.get(sourceKey);
        if (state == null || !running) {
            return;
        }
        synchronized (state) {
            state.nextPeriodicRun = LocalDateTime.now(clock).plus(state.source.interval());
            if (halted) {
                log.debug("[Scheduler] Halted, skipping periodic trigger for {}", sourceKey);
                return;
            }
            if (state.paused) {
                log.debug("[Scheduler] {} paused, skipping periodic trigger", sourceKey);
                return;
            }
            if (state.inFlight) {
                log.info("[Scheduler] Previous run of {} still in flight, skipping periodic trigger", sourceKey);
                return;
            }
            if (state.pendingJobId != null) {
                log.debug("[Scheduler] {} has pending job {}, skipping periodic trigger", sourceKey, state.pendingJobId);
                return;
            }
            Long jobId;
            try {
                jobId = lifecycle.createJob(sourceKey, TriggerType.PERIODIC, 0, null, null).getId();
            } catch (RuntimeException e) {
                handleStoreError(e, "creating periodic job for " + sourceKey);
                return;
            }
            startLocked(state, jobId);
        }
    }

    /**
     * 티어 실행자에 작업을 넘깁니다. 호출자는 state 락을 잡고 있어야 합니다.
     */
    private void startLocked(SourceState state, Long jobId) {
        state.inFlight = true;
        state.currentJobId = jobId;
        try {
            tierExecutors.get(state.source.priority()).execute(() -> execute(state, jobId));
        } catch (RejectedExecutionException e) {
            state.inFlight = false;
            state.currentJobId = null;
            requeueRejected(state, jobId);
        }
    }

    private void requeueRejected(SourceState state, Long jobId) {
        LocalDateTime at = LocalDateTime.now(clock).plus(capacityDelay);
        try {
            lifecycle.defer(jobId, at);
        } catch (RuntimeException e) {
            handleStoreError(e, "deferring job " + jobId);
            return;
        }
        requeued.incrementAndGet();
        log.warn("[Scheduler] {} tier pool saturated, job {} for {} deferred to {}",
                state.source.priority(), jobId, state.source.key(), at);
        armLocked(state, jobId, at);
    }

    private void execute(SourceState state, Long jobId) {
        RunOutcome outcome;
        try {
            outcome = jobRunner.run(jobId, state.source);
        } catch (RuntimeException e) {
            log.error("[Scheduler] Unexpected error running job {} for {}: {}", jobId, state.source.key(), e.getMessage(), e);
            outcome = failureClassifier.isStoreUnavailable(e)
                    ? RunOutcome.halted(e.getMessage())
                    : RunOutcome.skipped("unexpected error: " + e.getMessage());
        }
        synchronized (state) {
            state.inFlight = false;
            state.currentJobId = null;
            apply(state, outcome);
        }
        if (outcome.status() == RunOutcome.Status.HALTED) {
            halt(outcome.error());
        }
    }

    private void apply(SourceState state, RunOutcome outcome) {
        LocalDateTime now = LocalDateTime.now(clock);
        switch (outcome.status()) {
            case SUCCEEDED -> {
                executed.incrementAndGet();
                succeeded.incrementAndGet();
                state.lastRun = now;
                state.consecutiveFailures = 0;
                state.lastError = null;
            }
            case RETRY_SCHEDULED -> {
                executed.incrementAndGet();
                failed.incrementAndGet();
                retried.incrementAndGet();
                recordFailure(state, now, outcome.error());
                armLocked(state, outcome.nextJobId(), outcome.nextRunAt());
            }
            case REQUEUED -> {
                executed.incrementAndGet();
                requeued.incrementAndGet();
                state.lastError = outcome.error();
                armLocked(state, outcome.nextJobId(), outcome.nextRunAt());
            }
            case DEAD_LETTERED -> {
                executed.incrementAndGet();
                failed.incrementAndGet();
                deadLettered.incrementAndGet();
                recordFailure(state, now, outcome.error());
            }
            case HALTED -> state.lastError = outcome.error();
            case SKIPPED -> log.debug("[Scheduler] Run for {} skipped: {}", state.source.key(), outcome.error());
        }
    }

    private void recordFailure(SourceState state, LocalDateTime now, String error) {
        state.lastRun = now;
        state.lastError = error;
        state.consecutiveFailures++;
        if (state.consecutiveFailures >= settings.getAlertOnFailureCount()) {
            log.error("[Scheduler] {} has failed {} consecutive times, last error: {}",
                    state.source.key(), state.consecutiveFailures, error);
        }
    }

    /**
     * 후속 작업을 at 시각에 실행하도록 예약합니다. 중단/일시정지 중이면 보류(parked)해 둡니다.
     */
    private void armLocked(SourceState state, Long jobId, LocalDateTime at) {
        cancel(state.pendingFuture);
        state.pendingJobId = jobId;
        state.pendingAt = at;
        state.pendingFuture = null;
        if (halted || state.paused || !running) {
            return;
        }
        state.pendingFuture = taskScheduler.schedule(() -> firePending(state, jobId), toInstant(at));
    }

    private void firePending(SourceState state, Long jobId) {
        synchronized (state) {
            if (!running || !Objects.equals(state.pendingJobId, jobId)) {
                return;
            }
            if (halted || state.paused) {
                state.pendingFuture = null;
                return;
            }
            if (state.inFlight) {
                state.pendingFuture = taskScheduler.schedule(() -> firePending(state, jobId),
                        clock.instant().plus(settings.getHealthCheckInterval()));
                return;
            }
            clearPending(state);
            startLocked(state, jobId);
        }
    }

    private void armRecovered(JobRecoveryService.RecoveredJob recovered) {
        sourceRegistry.find(recovered.sourceKey()).ifPresent(source -> {
            SourceState state = stateOf(source);
            synchronized (state) {
                armLocked(state, recovered.jobId(), recovered.dueAt());
            }
            log.info("[Recovery] Job {} for {} armed for {}", recovered.jobId(), recovered.sourceKey(), recovered.dueAt());
        });
    }

    private void rearmParked(SourceState state) {
        if (state.pendingJobId != null && state.pendingFuture == null) {
            LocalDateTime now = LocalDateTime.now(clock);
            LocalDateTime at = state.pendingAt != null && state.pendingAt.isAfter(now) ? state.pendingAt : now;
            armLocked(state, state.pendingJobId, at);
        }
    }

    private void clearPending(SourceState state) {
        cancel(state.pendingFuture);
        state.pendingFuture = null;
        state.pendingJobId = null;
        state.pendingAt = null;
    }

    // ========================================
    // Halt / health check
    // ========================================

    void halt(String reason) {
        synchronized (haltLock) {
            if (halted) {
                return;
            }
            halted = true;
            haltReason = reason;
            haltedAt = LocalDateTime.now(clock);
            Duration interval = settings.getHealthCheckInterval();
            healthCheckTask = taskScheduler.scheduleWithFixedDelay(this::checkStoreHealth, clock.instant().plus(interval), interval);
        }
        log.error("[Scheduler] Halting new triggers: {}", reason);
        for (SourceState state : states.values()) {
            synchronized (state) {
                cancel(state.pendingFuture);
                state.pendingFuture = null;
            }
        }
    }

    void checkStoreHealth() {
        try {
            lifecycle.ping();
        } catch (RuntimeException e) {
            log.warn("[Scheduler] Job store still unavailable: {}", e.getMessage());
            return;
        }
        synchronized (haltLock) {
            if (!halted) {
                return;
            }
            halted = false;
            haltReason = null;
            haltedAt = null;
            cancel(healthCheckTask);
            healthCheckTask = null;
        }
        log.info("[Scheduler] Job store reachable again, resuming triggers");
        runRecovery().forEach(this::armRecovered);
        for (SourceState state : states.values()) {
            synchronized (state) {
                if (!state.paused) {
                    rearmParked(state);
                }
            }
        }
    }

    private List<JobRecoveryService.RecoveredJob> runRecovery() {
        try {
            return recoveryService.recover(ownedJobIds());
        } catch (RuntimeException e) {
            log.error("[Recovery] Recovery scan failed: {}", e.getMessage(), e);
            if (failureClassifier.isStoreUnavailable(e)) {
                halt("job store unavailable during recovery: " + e.getMessage());
            }
            return List.of();
        }
    }

    /**
     * 이 프로세스가 실행 중이거나 예약해 둔 작업. 복구 스캔은 이 작업들을 건드리지 않습니다.
     */
    private Set<Long> ownedJobIds() {
        Set<Long> owned = new HashSet<>();
        for (SourceState state : states.values()) {
            synchronized (state) {
                if (state.currentJobId != null) {
                    owned.add(state.currentJobId);
                }
                if (state.pendingJobId != null) {
                    owned.add(state.pendingJobId);
                }
            }
        }
        return owned;
    }

    private void handleStoreError(RuntimeException e, String action) {
        if (failureClassifier.isStoreUnavailable(e)) {
            halt("job store unavailable while " + action + ": " + e.getMessage());
        } else {
            log.error("[Scheduler] Failed {}: {}", action, e.getMessage(), e);
        }
    }

    // ========================================
    // Heartbeat
    // ========================================

    void heartbeat() {
        List<Long> running = new ArrayList<>();
        for (SourceState state : states.values()) {
            Long jobId = state.currentJobId;
            if (jobId != null) {
                running.add(jobId);
            }
        }
        if (running.isEmpty()) {
            return;
        }
        try {
            lifecycle.touchHeartbeats(running);
        } catch (RuntimeException e) {
            handleStoreError(e, "updating heartbeats");
        }
    }

    // ========================================
    // Helpers
    // ========================================

    private SourceState stateOf(SourceDefinition source) {
        SourceState state = states.get(source.key());
        if (state != null) {
            return state;
        }
        SourceState created = new SourceState(source);
        synchronized (created) {
            SourceState existing = states.putIfAbsent(source.key(), created);
            if (existing != null) {
                return existing;
            }
            seedFromLedger(created);
        }
        return created;
    }

    /**
     * 마지막 SUCCEEDED 이후 실패한 실행 수와 그 중 가장 최근 오류.
     * 복구 스캔이 정리한 작업과 용량 부족으로 재큐잉된 작업은 세지 않습니다.
     */
    private void seedFromLedger(SourceState state) {
        List<CollectionJob> recent;
        try {
            recent = lifecycle.recentJobs(state.source.key());
        } catch (RuntimeException e) {
            log.debug("[Scheduler] Unable to read job history of {}: {}", state.source.key(), e.getMessage());
            return;
        }
        CollectionJob newer = null;
        for (CollectionJob job : recent) {
            if (job.getStatus() == JobStatus.SUCCEEDED) {
                break;
            }
            boolean requeued = newer != null && newer.getTriggerType() == TriggerType.REQUEUE;
            if (isFailedRun(job) && !requeued) {
                state.consecutiveFailures++;
                if (state.lastError == null) {
                    state.lastError = job.getLastError();
                }
            }
            newer = job;
        }
        if (state.consecutiveFailures > 0) {
            log.info("[Scheduler] {} resumes with {} consecutive failures, last error: {}",
                    state.source.key(), state.consecutiveFailures, state.lastError);
        }
    }

    private static boolean isFailedRun(CollectionJob job) {
        if (job.getStatus() != JobStatus.FAILED && job.getStatus() != JobStatus.DEAD_LETTERED) {
            return false;
        }
        String error = job.getLastError();
        return error == null || !(error.equals(JobRecoveryService.INTERRUPTED)
                || error.equals(JobRecoveryService.UNCONFIGURED)
                || error.startsWith(JobRecoveryService.SUPERSEDED));
    }

    private LocalDateTime nextRun(SourceState state) {
        if (state.paused) {
            return null;
        }
        if (state.pendingAt != null && (state.nextPeriodicRun == null || state.pendingAt.isBefore(state.nextPeriodicRun))) {
            return state.pendingAt;
        }
        return state.nextPeriodicRun;
    }

    private LocalDateTime lastCompletedFromStore(String sourceKey) {
        try {
            return lifecycle.lastCompleted(sourceKey).map(CollectionJob::getCompletedAt).orElse(null);
        } catch (RuntimeException e) {
            log.debug("[Scheduler] Unable to read last run of {}: {}", sourceKey, e.getMessage());
            return null;
        }
    }

    private Instant toInstant(LocalDateTime at) {
        return at.atZone(clock.getZone()).toInstant();
    }

    private LocalDateTime toLocal(Instant instant) {
        return LocalDateTime.ofInstant(instant, clock.getZone());
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    private static Map<SourcePriority, Executor> tiers(Executor high, Executor medium, Executor low) {
        Map<SourcePriority, Executor> tiers = new EnumMap<>(SourcePriority.class);
        tiers.put(SourcePriority.HIGH, high);
        tiers.put(SourcePriority.MEDIUM, medium);
        tiers.put(SourcePriority.LOW, low);
        return tiers;
    }

    /**
     * 소스별 가변 상태. 모든 접근은 인스턴스 락 안에서 이루어집니다 (currentJobId 읽기 제외).
     */
    private static final class SourceState {
        private final SourceDefinition source;
        private ScheduledFuture<?> periodic;
        private ScheduledFuture<?> pendingFuture;
        private Long pendingJobId;
        private LocalDateTime pendingAt;
        private LocalDateTime nextPeriodicRun;
        private LocalDateTime lastRun;
        private volatile Long currentJobId;
        private boolean inFlight;
        private boolean paused;
        private int consecutiveFailures;
        private String lastError;

        private SourceState(SourceDefinition source) {
            this.source = source;
        }
    }
}
