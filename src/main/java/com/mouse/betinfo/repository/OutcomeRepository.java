package com.mouse.betinfo.repository;

import com.mouse.betinfo.entity.Outcome;
import com.mouse.betinfo.model.RecordKey;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface OutcomeRepository extends AppendOnlyRepository<Outcome, String> {

    Optional<Outcome> findByGameId(String gameId);

    Optional<Outcome> findByContentHash(String contentHash);

    @Query(value = "SELECT o.outcomeId AS id, o.contentHash AS contentHash FROM Outcome o ORDER BY o.outcomeId",
            countQuery = "SELECT COUNT(o) FROM Outcome o")
    Page<RecordKey> findRecordKeys(Pageable pageable);
}
