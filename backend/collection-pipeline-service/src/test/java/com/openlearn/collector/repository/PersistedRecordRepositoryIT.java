package com.openlearn.collector.repository;

import com.openlearn.collector.entity.PersistedRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * PersistedRecordRepository 통합 테스트 (Testcontainers 사용)
 * ON CONFLICT 기반 중복 무시 삽입은 실제 PostgreSQL 에서만 검증할 수 있습니다.
 */
@DataJpaTest
@Testcontainers
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class PersistedRecordRepositoryIT {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private PersistedRecordRepository recordRepository;

    private int insert(String sourceKey, String hash) {
        return recordRepository.insertOrIgnore(sourceKey, hash, "API", "IPC marzo", null,
                "{\"difficulty_score\":1.0}", "{\"valor\":1.5}", LocalDateTime.of(2026, 3, 1, 12, 0));
    }

    @Test
    @DisplayName("같은 소스의 같은 해시는 한 번만 저장된다")
    void insertOrIgnoreSkipsConflict() {
        assertThat(insert("dane_ipc", "abc")).isEqualTo(1);
        assertThat(insert("dane_ipc", "abc")).isZero();
        assertThat(insert("banrep_tasas", "abc")).isEqualTo(1);

        assertThat(recordRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("이미 저장된 해시만 돌려준다")
    void findExistingHashes() {
        insert("dane_ipc", "h1");
        insert("dane_ipc", "h2");
        insert("datos_gov", "h3");

        List<String> existing = recordRepository.findExistingHashes("dane_ipc", List.of("h1", "h3", "h9"));

        assertThat(existing).containsExactly("h1");
    }

    @Test
    @DisplayName("소스별 최근 레코드 조회")
    void findRecentBySource() {
        insert("dane_ipc", "r1");
        insert("el_tiempo", "r2");

        List<PersistedRecord> records = recordRepository.findBySourceKeyOrderByCreatedAtDesc("dane_ipc",
                PageRequest.of(0, 10));

        assertThat(records).extracting(PersistedRecord::getContentHash).containsExactly("r1");
    }
}
