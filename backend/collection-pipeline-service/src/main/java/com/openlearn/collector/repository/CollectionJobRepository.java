package com.openlearn.collector.repository;

import com.openlearn.collector.entity.CollectionJob;
import com.openlearn.collector.entity.JobStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface CollectionJobRepository extends JpaRepository<CollectionJob, Long> {

    /**
     * 복구 스캔 대상 (SCHEDULED / RUNNING) 조회
     */
    List<CollectionJob> findByStatusInOrderByTriggerTimeAsc(Collection<JobStatus> statuses);

    List<CollectionJob> findTop50BySourceKeyOrderByTriggerTimeDesc(String sourceKey);

    Optional<CollectionJob> findFirstBySourceKeyAndCompletedAtIsNotNullOrderByCompletedAtDesc(String sourceKey);

    long countByStatus(JobStatus status);

    /**
     * 관리용 작업 조회. null 파라미터는 필터에서 제외됩니다.
     */
    @Query("SELECT j FROM CollectionJob j " +
           "WHERE (:sourceKey IS NULL OR j.sourceKey = :sourceKey) " +
           "AND (:status IS NULL OR j.status = :status) " +
           "AND (:since IS NULL OR j.triggerTime >= :since) " +
           "ORDER BY j.triggerTime DESC")
    Page<CollectionJob> search(@Param("sourceKey") String sourceKey,
                               @Param("status") JobStatus status,
                               @Param("since") LocalDateTime since,
                               Pageable pageable);

    /**
     * 실행 중인 작업의 heartbeat 갱신 (버전 증가 없음)
     */
    @Modifying
    @Query("UPDATE CollectionJob j SET j.heartbeatAt = :now " +
           "WHERE j.id IN :ids AND j.status = com.openlearn.collector.entity.JobStatus.RUNNING")
    int touchHeartbeats(@Param("ids") Collection<Long> ids, @Param("now") LocalDateTime now);

    /**
     * 보존 기간이 지난 종료 작업 정리
     */
    @Modifying
    @Query("DELETE FROM CollectionJob j WHERE j.status IN :statuses AND j.completedAt < :cutoff")
    int deleteFinishedBefore(@Param("statuses") Collection<JobStatus> statuses,
                             @Param("cutoff") LocalDateTime cutoff);
}
