package com.mouse.betinfo.repository;

import com.mouse.betinfo.entity.ImprovementProposal;
import com.mouse.betinfo.enums.ProposalStatus;
import com.mouse.betinfo.model.RecordKey;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProposalRepository extends AppendOnlyRepository<ImprovementProposal, String> {

    // Status is part of the hash, so two proposals can share one over time
    Optional<ImprovementProposal> findFirstByContentHash(String contentHash);

    List<ImprovementProposal> findByStatusOrderByCreatedAtAsc(ProposalStatus status);

    @Query(value = "SELECT p.proposalId AS id, p.contentHash AS contentHash FROM ImprovementProposal p ORDER BY p.proposalId",
            countQuery = "SELECT COUNT(p) FROM ImprovementProposal p")
    Page<RecordKey> findRecordKeys(Pageable pageable);
}
