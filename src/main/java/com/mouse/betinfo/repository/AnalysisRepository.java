package com.mouse.betinfo.repository;

import com.mouse.betinfo.entity.Analysis;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import com.mouse.betinfo.model.RecordKey;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AnalysisRepository extends AppendOnlyRepository<Analysis, String> {

    Optional<Analysis> findByContentHash(String contentHash);

    List<Analysis> findByParentAnalysisIdOrderByCreatedAtAsc(String parentAnalysisId);

    List<Analysis> findByParentAnalysisIdIsNullOrderByCreatedAtAsc();

    /**
     * Analyses that used any of the given snapshots as input.
     */
    @Query("""
        SELECT DISTINCT a FROM Analysis a JOIN a.inputSnapshotIds s
        WHERE s IN :snapshotIds
        ORDER BY a.createdAt ASC
        """)
    List<Analysis> findByInputSnapshotIdIn(@Param("snapshotIds") Collection<String> snapshotIds);

    @Query(value = "SELECT a.analysisId AS id, a.contentHash AS contentHash FROM Analysis a ORDER BY a.analysisId",
            countQuery = "SELECT COUNT(a) FROM Analysis a")
    Page<RecordKey> findRecordKeys(Pageable pageable);
}
