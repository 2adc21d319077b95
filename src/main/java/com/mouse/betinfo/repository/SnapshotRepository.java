package com.mouse.betinfo.repository;

import com.mouse.betinfo.entity.InfoSnapshot;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import com.mouse.betinfo.model.RecordKey;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface SnapshotRepository extends AppendOnlyRepository<InfoSnapshot, String> {

    Optional<InfoSnapshot> findByContentHash(String contentHash);

    // Timeline of one game, oldest first
    List<InfoSnapshot> findByGameIdOrderByCollectedAtAsc(String gameId);

    // What was known about a game at a point in time
    List<InfoSnapshot> findByGameIdAndCollectedAtLessThanEqualOrderByCollectedAtAsc(String gameId, Instant asOf);

    Optional<InfoSnapshot> findFirstByGameIdAndCollectedAtLessThanEqualOrderByCollectedAtDesc(String gameId, Instant asOf);

    Optional<InfoSnapshot> findFirstByGameIdOrderByCollectedAtDesc(String gameId);

    @Query("SELECT DISTINCT s.gameId FROM InfoSnapshot s ORDER BY s.gameId")
    List<String> findDistinctGameIds();

    @Query("SELECT MAX(s.collectedAt) FROM InfoSnapshot s WHERE s.gameId = :gameId")
    Optional<Instant> findLatestCollectedAt(@Param("gameId") String gameId);

    @Query("""
        SELECT DISTINCT s.gameId FROM InfoSnapshot s
        WHERE s.gameId NOT IN (SELECT o.gameId FROM Outcome o)
        ORDER BY s.gameId
        """)
    List<String> findGameIdsWithoutOutcome();

    @Query(value = "SELECT s.snapshotId AS id, s.contentHash AS contentHash FROM InfoSnapshot s ORDER BY s.snapshotId",
            countQuery = "SELECT COUNT(s) FROM InfoSnapshot s")
    Page<RecordKey> findRecordKeys(Pageable pageable);
}
