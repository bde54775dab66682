package com.openlearn.collector.scheduler;

import com.openlearn.collector.TestSources;
import com.openlearn.collector.config.CollectorProperties;
import com.openlearn.collector.entity.CollectionJob;
import com.openlearn.collector.entity.JobStatus;
import com.openlearn.collector.entity.SourcePriority;
import com.openlearn.collector.entity.TriggerType;
import com.openlearn.collector.exception.CollectionFailedException;
import com.openlearn.collector.exception.FailureKind;
import com.openlearn.collector.service.AlertService;
import com.openlearn.collector.service.JobLifecycleService;
import com.openlearn.collector.service.SourceDefinition;
import com.openlearn.collector.service.collection.CollectionOrchestrator;
import com.openlearn.collector.service.collection.CollectionResult;
import com.openlearn.collector.service.collection.FailureClassifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * CollectionJobRunner 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class CollectionJobRunnerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneId.of("UTC"));
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Mock
    private JobLifecycleService lifecycle;
    @Mock
    private CollectionOrchestrator orchestrator;
    @Mock
    private AlertService alertService;

    private final AtomicLong ids = new AtomicLong(100);
    private final SourceDefinition source = TestSources.api("dane_ipc", SourcePriority.HIGH, 3);
    private CollectionJobRunner runner;

    @BeforeEach
    void setUp() {
        CollectorProperties properties = new CollectorProperties();
        properties.getRetry().setCapacityDelay(Duration.ofSeconds(60));
        RetryPolicy retryPolicy = new RetryPolicy(Duration.ofSeconds(5), Duration.ofHours(1), 0.0, () -> 0.0);
        runner = new CollectionJobRunner(lifecycle, orchestrator, new FailureClassifier(), retryPolicy,
                alertService, properties, CLOCK, new SimpleMeterRegistry());
    }

    @Test
    @DisplayName("성공하면 결과를 기록하고 후속 작업이 없다")
    void success() {
        // given
        givenRunning(1L, 0, TriggerType.PERIODIC);
        CollectionResult result = new CollectionResult(10, 7, 3, 0, 0, 0);
        when(orchestrator.collect(source)).thenReturn(result);

        // when
        RunOutcome outcome = runner.run(1L, source);

        // then
        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.SUCCEEDED);
        assertThat(outcome.nextJobId()).isNull();
        verify(lifecycle).markSucceeded(1L, result);
    }

    @Test
    @DisplayName("일시적 실패는 5초, 10초, 20초 뒤 재시도하고 세 번째 재시도 실패 시 dead-letter")
    void transientFailuresBackOffThenDeadLetter() {
        // given
        when(orchestrator.collect(source)).thenThrow(failure(FailureKind.TRANSIENT));
        when(lifecycle.createJob(eq("dane_ipc"), eq(TriggerType.RETRY), anyInt(), any(), isNull()))
                .thenAnswer(inv -> job(ids.incrementAndGet(), inv.getArgument(2), TriggerType.RETRY));

        List<Duration> delays = new ArrayList<>();
        Long jobId = 1L;
        givenRunning(jobId, 0, TriggerType.PERIODIC);

        // when: 최초 실행 + 재시도 3회
        RunOutcome outcome = runner.run(jobId, source);
        while (outcome.status() == RunOutcome.Status.RETRY_SCHEDULED) {
            delays.add(Duration.between(NOW, outcome.nextRunAt()));
            jobId = outcome.nextJobId();
            givenRunning(jobId, delays.size(), TriggerType.RETRY);
            outcome = runner.run(jobId, source);
        }

        // then
        assertThat(delays).containsExactly(Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(20));
        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.DEAD_LETTERED);
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.TRANSIENT);
        verify(lifecycle, times(4)).markFailed(anyLong(), anyString());
        verify(lifecycle).markFailedAndDeadLettered(eq(jobId), anyString());
        verify(alertService).raiseDeadLetter(eq("dane_ipc"), eq(jobId), eq(3), eq(3), anyString());
    }

    @Test
    @DisplayName("검증 실패는 재시도하지 않고 즉시 dead-letter")
    void validationFailureDeadLettersImmediately() {
        // given
        givenRunning(1L, 0, TriggerType.PERIODIC);
        when(orchestrator.collect(source)).thenThrow(failure(FailureKind.VALIDATION));

        // when
        RunOutcome outcome = runner.run(1L, source);

        // then
        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.DEAD_LETTERED);
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.VALIDATION);
        verify(lifecycle, never()).createJob(any(), any(), anyInt(), any(), any());
        verify(alertService).raiseDeadLetter(eq("dane_ipc"), eq(1L), eq(0), eq(3), anyString());
    }

    @Test
    @DisplayName("용량 초과는 시도 횟수를 유지한 채 retry-after 뒤로 재큐잉")
    void capacityFailureRequeues() {
        // given
        givenRunning(1L, 2, TriggerType.RETRY);
        when(orchestrator.collect(source)).thenThrow(new CollectionFailedException(
                FailureKind.CAPACITY, "rate limited", "dane_ipc", Duration.ofSeconds(42), null));
        when(lifecycle.createJob("dane_ipc", TriggerType.REQUEUE, 2, NOW.plusSeconds(42), null))
                .thenReturn(job(7L, 2, TriggerType.REQUEUE));

        // when
        RunOutcome outcome = runner.run(1L, source);

        // then
        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.REQUEUED);
        assertThat(outcome.nextJobId()).isEqualTo(7L);
        assertThat(outcome.nextRunAt()).isEqualTo(NOW.plusSeconds(42));
        verify(lifecycle).markFailed(eq(1L), anyString());
        verifyNoInteractions(alertService);
    }

    @Test
    @DisplayName("작업 저장소 장애는 HALTED")
    void storeFailureHalts() {
        // given
        givenRunning(1L, 0, TriggerType.PERIODIC);
        when(orchestrator.collect(source)).thenReturn(CollectionResult.empty());
        when(lifecycle.markSucceeded(eq(1L), any())).thenThrow(new DataAccessResourceFailureException("db down"));

        // when
        RunOutcome outcome = runner.run(1L, source);

        // then
        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.HALTED);
        assertThat(outcome.isFailure()).isTrue();
    }

    @Test
    @DisplayName("이미 실행된 작업은 건너뛴다")
    void notRunnableIsSkipped() {
        // given
        when(lifecycle.markRunning(1L)).thenThrow(new IllegalStateException("Illegal job status transition"));

        // when
        RunOutcome outcome = runner.run(1L, source);

        // then
        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.SKIPPED);
        verifyNoInteractions(orchestrator);
    }

    private void givenRunning(Long jobId, int attempt, TriggerType type) {
        CollectionJob job = job(jobId, attempt, type);
        job.setStatus(JobStatus.RUNNING);
        when(lifecycle.markRunning(jobId)).thenReturn(job);
    }

    private static CollectionJob job(Long id, int attempt, TriggerType type) {
        return CollectionJob.builder()
                .id(id)
                .sourceKey("dane_ipc")
                .triggerTime(NOW)
                .triggerType(type)
                .attemptCount(attempt)
                .build();
    }

    private static CollectionFailedException failure(FailureKind kind) {
        return new CollectionFailedException(kind, kind + " failure", "dane_ipc", null);
    }
}
