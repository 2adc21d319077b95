package com.mouse.betinfo.service;

import com.mouse.betinfo.entity.ImprovementProposal;
import com.mouse.betinfo.enums.ProposalStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProposalServiceTest {

    @Mock
    ImmutableStore store;

    @InjectMocks
    ProposalService proposalService;

    @Test
    void propose_startsPendingWithDeduplicatedEvidence() {
        when(store.insertProposal(any(ImprovementProposal.class))).thenAnswer(inv -> inv.getArgument(0));

        ImprovementProposal proposal = proposalService.propose(
                List.of("eval-1", "eval-2", "eval-1"),
                "Add injury reports to the snapshot",
                Map.of("injuries", "list"),
                List.of("injury_feed"),
                Map.of("brier_delta", -0.02));

        assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.PENDING);
        assertThat(proposal.getBasedOnEvaluationIds()).containsExactly("eval-1", "eval-2");
        assertThat(proposal.getSuggestedModules()).containsExactly("injury_feed");
        assertThat(proposal.isHashValid()).isTrue();
    }

    @Test
    void changeStatus_delegatesToStore() {
        proposalService.changeStatus("p-1", ProposalStatus.ACCEPTED);

        verify(store).updateProposalStatus("p-1", ProposalStatus.ACCEPTED);
    }
}
