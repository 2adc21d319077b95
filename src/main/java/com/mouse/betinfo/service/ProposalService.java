package com.mouse.betinfo.service;

import com.mouse.betinfo.entity.ImprovementProposal;
import com.mouse.betinfo.enums.ProposalStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Records improvement proposals against the evaluations that motivate them.
 * The proposal text itself is written elsewhere.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProposalService {

    private final ImmutableStore store;

    public ImprovementProposal propose(List<String> evaluationIds,
                                       String proposalText,
                                       Map<String, Object> suggestedSchemaAdditions,
                                       List<String> suggestedModules,
                                       Map<String, Object> expectedImpact) {
        ImprovementProposal proposal = ImprovementProposal.builder()
                .basedOnEvaluationIds(evaluationIds)
                .proposalText(proposalText)
                .suggestedSchemaAdditions(suggestedSchemaAdditions)
                .suggestedModules(suggestedModules)
                .expectedImpact(expectedImpact)
                .build();
        ImprovementProposal stored = store.insertProposal(proposal);
        log.info("📝 Proposal recorded | proposalId={} | evidence={}", stored.getProposalId(), evaluationIds.size());
        return stored;
    }

    public ImprovementProposal changeStatus(String proposalId, ProposalStatus status) {
        return store.updateProposalStatus(proposalId, status);
    }

    public List<ImprovementProposal> pending() {
        return store.listProposalsByStatus(ProposalStatus.PENDING);
    }
}
