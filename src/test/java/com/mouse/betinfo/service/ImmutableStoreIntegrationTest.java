package com.mouse.betinfo.service;

import com.mouse.betinfo.config.LedgerProperties;
import com.mouse.betinfo.config.StoreConfig;
import com.mouse.betinfo.entity.Analysis;
import com.mouse.betinfo.entity.InfoSnapshot;
import com.mouse.betinfo.enums.EntityType;
import com.mouse.betinfo.exception.HashMismatchException;
import com.mouse.betinfo.exception.ReferentialIntegrityException;
import com.mouse.betinfo.logservice.LedgerAuditLogService;
import com.mouse.betinfo.model.HashMismatch;
import com.mouse.betinfo.repository.AnalysisRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Store against a real database, every insert committing on its own.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({ImmutableStore.class, IntegrityVerifier.class, LedgerAuditLogService.class, LedgerProperties.class, StoreConfig.class})
class ImmutableStoreIntegrationTest {

    @Autowired
    ImmutableStore store;
    @Autowired
    IntegrityVerifier verifier;
    @Autowired
    AnalysisRepository analysisRepository;
    @Autowired
    JdbcTemplate jdbcTemplate;

    @Test
    void concurrentInsertsOfTheSameFact_storeOneRow() throws Exception {
        String gameId = "G-" + UUID.randomUUID();
        Instant at = Instant.parse("2024-10-01T10:00:00Z");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<InfoSnapshot>> writers = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                writers.add(() -> store.insertSnapshot(snapshot(gameId, at)));
            }
            Set<String> ids = pool.invokeAll(writers).stream()
                    .map(ImmutableStoreIntegrationTest::get)
                    .map(InfoSnapshot::getSnapshotId)
                    .collect(Collectors.toSet());

            assertThat(ids).hasSize(1);
            assertThat(store.listByGame(gameId)).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void analysisWithMissingSnapshot_leavesNoRow() {
        long before = analysisRepository.count();
        Analysis orphan = Analysis.builder()
                .analysisVersion("1.0.0")
                .codeVersion("test")
                .inputSnapshotIds(List.of("never-inserted"))
                .build();

        assertThatThrownBy(() -> store.insertAnalysis(orphan)).isInstanceOf(ReferentialIntegrityException.class);
        assertThat(analysisRepository.count()).isEqualTo(before);
        assertThat(analysisRepository.existsById(orphan.getAnalysisId())).isFalse();
    }

    @Test
    void timelineAndLineage_afterCommittedInserts() {
        String gameId = "G-" + UUID.randomUUID();
        Instant t0 = Instant.parse("2024-10-01T10:00:00Z");
        InfoSnapshot early = store.insertSnapshot(snapshot(gameId, t0));
        InfoSnapshot late = store.insertSnapshot(snapshot(gameId, t0.plusSeconds(3600)));

        Analysis root = store.insertAnalysis(analysis(null, t0.plusSeconds(10), early.getSnapshotId()));
        Analysis child = store.insertAnalysis(analysis(root.getAnalysisId(), t0.plusSeconds(3700), late.getSnapshotId()));

        assertThat(store.listByGameAsOf(gameId, t0.plusSeconds(60)))
                .extracting(InfoSnapshot::getSnapshotId).containsExactly(early.getSnapshotId());
        assertThat(store.latestSnapshot(gameId)).get()
                .extracting(InfoSnapshot::getSnapshotId).isEqualTo(late.getSnapshotId());
        assertThat(store.listLineagePath(child.getAnalysisId()))
                .extracting(Analysis::getAnalysisId).containsExactly(root.getAnalysisId(), child.getAnalysisId());
        assertThat(store.listChildren(root.getAnalysisId()))
                .extracting(Analysis::getAnalysisId).containsExactly(child.getAnalysisId());
        assertThat(store.listAnalysesForGame(gameId)).hasSize(2);
    }

    @Test
    void verifier_cleanLedger_reportsNothing() {
        store.insertSnapshot(snapshot("G-" + UUID.randomUUID(), Instant.now()));

        List<HashMismatch> mismatches = verifier.verify(EntityType.SNAPSHOT);

        assertThat(mismatches).isEmpty();
    }

    @Test
    void verifier_rowAlteredBehindTheStore_isReportedAndReadFails() {
        InfoSnapshot stored = store.insertSnapshot(snapshot("G-" + UUID.randomUUID(), Instant.now()));
        String original = jdbcTemplate.queryForObject(
                "SELECT raw_payloads FROM info_snapshot WHERE snapshot_id = ?", String.class, stored.getSnapshotId());
        jdbcTemplate.update("UPDATE info_snapshot SET raw_payloads = ? WHERE snapshot_id = ?",
                "{\"odds_api\":{\"id\":\"rewritten\"}}", stored.getSnapshotId());
        try {
            List<HashMismatch> mismatches = verifier.verify(EntityType.SNAPSHOT);

            assertThat(mismatches).singleElement().satisfies(m -> {
                assertThat(m.entityId()).isEqualTo(stored.getSnapshotId());
                assertThat(m.expected()).isEqualTo(stored.getContentHash());
                assertThat(m.actual()).isNotNull().isNotEqualTo(stored.getContentHash());
            });
            assertThatThrownBy(() -> store.getSnapshot(stored.getSnapshotId()))
                    .isInstanceOf(HashMismatchException.class);
        } finally {
            jdbcTemplate.update("UPDATE info_snapshot SET raw_payloads = ? WHERE snapshot_id = ?",
                    original, stored.getSnapshotId());
        }
        assertThat(verifier.verify(EntityType.SNAPSHOT)).isEmpty();
    }

    private static InfoSnapshot get(Future<InfoSnapshot> future) {
        try {
            return future.get();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static InfoSnapshot snapshot(String gameId, Instant at) {
        return InfoSnapshot.builder()
                .gameId(gameId)
                .collectedAt(at)
                .schemaVersion("1.0.0")
                .sourceVersions(Map.of("odds_api", "v4"))
                .rawPayloads(Map.of("odds_api", Map.of("id", gameId)))
                .normalizedFields(Map.of("odds_events", List.of()))
                .build();
    }

    private static Analysis analysis(String parentId, Instant createdAt, String snapshotId) {
        return Analysis.builder()
                .createdAt(createdAt)
                .analysisVersion("1.0.0")
                .codeVersion("test")
                .parentAnalysisId(parentId)
                .inputSnapshotIds(List.of(snapshotId))
                .derivedFeatures(Map.of("game", snapshotId))
                .build();
    }
}
