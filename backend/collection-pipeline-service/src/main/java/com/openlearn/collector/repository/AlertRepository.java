package com.openlearn.collector.repository;

import com.openlearn.collector.entity.Alert;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

@Repository
public interface AlertRepository extends JpaRepository<Alert, Long> {

    @Query("SELECT a FROM Alert a " +
           "WHERE (:sourceKey IS NULL OR a.sourceKey = :sourceKey) " +
           "AND (:kind IS NULL OR a.kind = :kind) " +
           "AND (:since IS NULL OR a.createdAt >= :since) " +
           "ORDER BY a.createdAt DESC")
    Page<Alert> search(@Param("sourceKey") String sourceKey,
                       @Param("kind") String kind,
                       @Param("since") LocalDateTime since,
                       Pageable pageable);

    long countByKind(String kind);
}
