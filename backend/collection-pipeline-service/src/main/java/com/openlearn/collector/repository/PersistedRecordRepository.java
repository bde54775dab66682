package com.openlearn.collector.repository;

import com.openlearn.collector.entity.PersistedRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface PersistedRecordRepository extends JpaRepository<PersistedRecord, Long> {

    boolean existsBySourceKeyAndContentHash(String sourceKey, String contentHash);

    /**
     * Content hashes among {@code hashes} that are already stored for the source.
     */
    @Query("SELECT r.contentHash FROM PersistedRecord r " +
           "WHERE r.sourceKey = :sourceKey AND r.contentHash IN :hashes")
    List<String> findExistingHashes(@Param("sourceKey") String sourceKey,
                                    @Param("hashes") Collection<String> hashes);

    /**
     * Insert guarded by the unique {@code (source_key, content_hash)} constraint.
     * Returns 0 when another writer stored the same content first.
     * Nullable text columns are cast so a null bind is not typed as bytea.
     */
    @Modifying
    @Query(value = """
        INSERT INTO persisted_records
            (source_key, content_hash, kind, title, url, derived_fields_json, payload_json, created_at)
        VALUES
            (:sourceKey, :contentHash, :kind, CAST(:title AS TEXT), CAST(:url AS TEXT),
             CAST(:derivedFieldsJson AS TEXT), :payloadJson, :createdAt)
        ON CONFLICT (source_key, content_hash) DO NOTHING
        """, nativeQuery = true)
    int insertOrIgnore(@Param("sourceKey") String sourceKey,
                       @Param("contentHash") String contentHash,
                       @Param("kind") String kind,
                       @Param("title") String title,
                       @Param("url") String url,
                       @Param("derivedFieldsJson") String derivedFieldsJson,
                       @Param("payloadJson") String payloadJson,
                       @Param("createdAt") LocalDateTime createdAt);

    List<PersistedRecord> findBySourceKeyOrderByCreatedAtDesc(String sourceKey, Pageable pageable);

    List<PersistedRecord> findAllByOrderByCreatedAtDesc(Pageable pageable);

    long countBySourceKey(String sourceKey);
}
