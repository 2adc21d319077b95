package com.mouse.betinfo.repository;

import com.mouse.betinfo.entity.Evaluation;
import com.mouse.betinfo.model.RecordKey;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EvaluationRepository extends AppendOnlyRepository<Evaluation, String> {

    Optional<Evaluation> findByContentHash(String contentHash);

    List<Evaluation> findByAnalysisIdOrderByScoredAtAsc(String analysisId);

    List<Evaluation> findByGameIdOrderByScoredAtAsc(String gameId);

    boolean existsByAnalysisIdAndGameId(String analysisId, String gameId);

    @Query(value = "SELECT e.evaluationId AS id, e.contentHash AS contentHash FROM Evaluation e ORDER BY e.evaluationId",
            countQuery = "SELECT COUNT(e) FROM Evaluation e")
    Page<RecordKey> findRecordKeys(Pageable pageable);
}
