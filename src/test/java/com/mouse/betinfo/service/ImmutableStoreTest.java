package com.mouse.betinfo.service;

import com.mouse.betinfo.config.LedgerProperties;
import com.mouse.betinfo.entity.Analysis;
import com.mouse.betinfo.entity.Evaluation;
import com.mouse.betinfo.entity.EvaluationMetrics;
import com.mouse.betinfo.entity.FinalScore;
import com.mouse.betinfo.entity.ImprovementProposal;
import com.mouse.betinfo.entity.InfoSnapshot;
import com.mouse.betinfo.entity.Outcome;
import com.mouse.betinfo.enums.EntityType;
import com.mouse.betinfo.enums.ProposalStatus;
import com.mouse.betinfo.exception.EntityNotFoundException;
import com.mouse.betinfo.exception.HashMismatchException;
import com.mouse.betinfo.exception.ImmutabilityViolationException;
import com.mouse.betinfo.exception.IntegrityException;
import com.mouse.betinfo.exception.InvalidTransitionException;
import com.mouse.betinfo.exception.ReferentialIntegrityException;
import com.mouse.betinfo.exception.UniquenessViolationException;
import com.mouse.betinfo.logservice.LedgerAuditLogService;
import com.mouse.betinfo.repository.AnalysisRepository;
import com.mouse.betinfo.repository.EvaluationRepository;
import com.mouse.betinfo.repository.OutcomeRepository;
import com.mouse.betinfo.repository.ProposalRepository;
import com.mouse.betinfo.repository.SnapshotRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImmutableStoreTest {

    private static final Instant T0 = Instant.parse("2024-10-01T10:00:00Z");

    @Mock
    SnapshotRepository snapshotRepository;
    @Mock
    AnalysisRepository analysisRepository;
    @Mock
    OutcomeRepository outcomeRepository;
    @Mock
    EvaluationRepository evaluationRepository;
    @Mock
    ProposalRepository proposalRepository;
    @Mock
    LedgerAuditLogService auditLog;

    ImmutableStore store;

    @BeforeEach
    void setUp() {
        store = new ImmutableStore(snapshotRepository, analysisRepository, outcomeRepository,
                evaluationRepository, proposalRepository, TransactionOperations.withoutTransaction(),
                auditLog, new LedgerProperties());
    }

    // --------------- insert / idempotence ----------------

    @Test
    void insertSnapshot_new_isSaved() {
        InfoSnapshot snapshot = snapshot("G1", T0);
        when(snapshotRepository.findByContentHash(snapshot.getContentHash())).thenReturn(Optional.empty());
        when(snapshotRepository.saveAndFlush(snapshot)).thenReturn(snapshot);

        InfoSnapshot stored = store.insertSnapshot(snapshot);

        assertThat(stored).isSameAs(snapshot);
        verify(auditLog).logInserted(snapshot);
    }

    @Test
    void insertSnapshot_sameContent_returnsExistingRecord() {
        InfoSnapshot first = snapshot("G1", T0);
        InfoSnapshot again = snapshot("G1", T0);
        assertThat(again.getContentHash()).isEqualTo(first.getContentHash());
        assertThat(again.getSnapshotId()).isNotEqualTo(first.getSnapshotId());
        when(snapshotRepository.findByContentHash(first.getContentHash())).thenReturn(Optional.of(first));

        InfoSnapshot stored = store.insertSnapshot(again);

        assertThat(stored.getSnapshotId()).isEqualTo(first.getSnapshotId());
        verify(snapshotRepository, never()).saveAndFlush(any());
        verify(auditLog).logDeduplicated(first);
    }

    @Test
    void insert_recordWhoseHashWasTampered_isRefused() {
        InfoSnapshot snapshot = snapshot("G1", T0);
        ReflectionTestUtils.setField(snapshot, "contentHash", "0".repeat(64));

        assertThatThrownBy(() -> store.insertSnapshot(snapshot)).isInstanceOf(HashMismatchException.class);
        verify(snapshotRepository, never()).saveAndFlush(any());
    }

    // --------------- referential checks ----------------

    @Test
    void insertAnalysis_unknownInputSnapshot_rejectedAndNothingWritten() {
        Analysis analysis = analysis(null, T0, "missing-snapshot");
        when(analysisRepository.findByContentHash(analysis.getContentHash())).thenReturn(Optional.empty());
        when(snapshotRepository.existsById("missing-snapshot")).thenReturn(false);

        assertThatThrownBy(() -> store.insertAnalysis(analysis))
                .isInstanceOf(ReferentialIntegrityException.class)
                .satisfies(e -> assertThat(((ReferentialIntegrityException) e).getReferencedId()).isEqualTo("missing-snapshot"));
        verify(analysisRepository, never()).saveAndFlush(any());
    }

    @Test
    void insertAnalysis_unknownParent_rejected() {
        Analysis analysis = analysis("no-such-parent", T0, "S1");
        when(analysisRepository.findByContentHash(analysis.getContentHash())).thenReturn(Optional.empty());
        when(snapshotRepository.existsById("S1")).thenReturn(true);
        when(analysisRepository.findById("no-such-parent")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.insertAnalysis(analysis)).isInstanceOf(ReferentialIntegrityException.class);
        verify(analysisRepository, never()).saveAndFlush(any());
    }

    @Test
    void insertAnalysis_parentNewerThanChild_rejected() {
        Analysis parent = analysis(null, T0.plusSeconds(60), "S1");
        Analysis child = analysis(parent.getAnalysisId(), T0, "S1");
        when(analysisRepository.findByContentHash(child.getContentHash())).thenReturn(Optional.empty());
        when(snapshotRepository.existsById("S1")).thenReturn(true);
        when(analysisRepository.findById(parent.getAnalysisId())).thenReturn(Optional.of(parent));

        assertThatThrownBy(() -> store.insertAnalysis(child)).isInstanceOf(ReferentialIntegrityException.class);
    }

    @Test
    void insertAnalysis_withStoredParent_isSaved() {
        Analysis parent = analysis(null, T0, "S1");
        Analysis child = analysis(parent.getAnalysisId(), T0.plusSeconds(60), "S1");
        when(analysisRepository.findByContentHash(child.getContentHash())).thenReturn(Optional.empty());
        when(snapshotRepository.existsById("S1")).thenReturn(true);
        when(analysisRepository.findById(parent.getAnalysisId())).thenReturn(Optional.of(parent));
        when(analysisRepository.saveAndFlush(child)).thenReturn(child);

        assertThat(store.insertAnalysis(child).getParentAnalysisId()).isEqualTo(parent.getAnalysisId());
    }

    @Test
    void insertEvaluation_gameNotCoveredByAnalysis_rejected() {
        InfoSnapshot snapshot = snapshot("G1", T0);
        Analysis analysis = analysis(null, T0, snapshot.getSnapshotId());
        Evaluation evaluation = Evaluation.builder()
                .analysisId(analysis.getAnalysisId())
                .gameId("G2")
                .metrics(EvaluationMetrics.of(null, null, null, null))
                .build();
        when(evaluationRepository.findByContentHash(evaluation.getContentHash())).thenReturn(Optional.empty());
        when(analysisRepository.findById(analysis.getAnalysisId())).thenReturn(Optional.of(analysis));
        when(outcomeRepository.findByGameId("G2")).thenReturn(Optional.of(outcome("G2", 24, 17)));
        when(snapshotRepository.findById(snapshot.getSnapshotId())).thenReturn(Optional.of(snapshot));

        assertThatThrownBy(() -> store.insertEvaluation(evaluation)).isInstanceOf(ReferentialIntegrityException.class);
        verify(evaluationRepository, never()).saveAndFlush(any());
    }

    @Test
    void insertEvaluation_noOutcomeYet_rejected() {
        Analysis analysis = analysis(null, T0, "S1");
        Evaluation evaluation = Evaluation.builder().analysisId(analysis.getAnalysisId()).gameId("G1").build();
        when(evaluationRepository.findByContentHash(evaluation.getContentHash())).thenReturn(Optional.empty());
        when(analysisRepository.findById(analysis.getAnalysisId())).thenReturn(Optional.of(analysis));
        when(outcomeRepository.findByGameId("G1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.insertEvaluation(evaluation)).isInstanceOf(ReferentialIntegrityException.class);
    }

    @Test
    void insertProposal_unknownEvaluation_rejected() {
        ImprovementProposal proposal = proposal("E-404");
        when(proposalRepository.findFirstByContentHash(proposal.getContentHash())).thenReturn(Optional.empty());
        when(evaluationRepository.existsById("E-404")).thenReturn(false);

        assertThatThrownBy(() -> store.insertProposal(proposal)).isInstanceOf(ReferentialIntegrityException.class);
        verify(proposalRepository, never()).saveAndFlush(any());
    }

    // --------------- outcomes ----------------

    @Test
    void insertOutcome_differentResultForSettledGame_isUniquenessViolation() {
        Outcome settled = outcome("G1", 24, 17);
        Outcome correction = outcome("G1", 24, 20);
        when(outcomeRepository.findByContentHash(correction.getContentHash())).thenReturn(Optional.empty());
        when(outcomeRepository.findByGameId("G1")).thenReturn(Optional.of(settled));

        assertThatThrownBy(() -> store.insertOutcome(correction))
                .isInstanceOf(UniquenessViolationException.class)
                .satisfies(e -> assertThat(((UniquenessViolationException) e).getExistingId()).isEqualTo(settled.getOutcomeId()));
        verify(outcomeRepository, never()).saveAndFlush(any());
    }

    @Test
    void insertOutcome_sameResultTwice_returnsFirst() {
        Outcome first = outcome("G1", 24, 17);
        Outcome again = outcome("G1", 24, 17);
        when(outcomeRepository.findByContentHash(again.getContentHash())).thenReturn(Optional.of(first));

        assertThat(store.insertOutcome(again)).isSameAs(first);
        verify(outcomeRepository, never()).saveAndFlush(any());
    }

    @Test
    void insertOutcome_firstForGame_isSaved() {
        Outcome outcome = outcome("G1", 24, 17);
        when(outcomeRepository.findByContentHash(outcome.getContentHash())).thenReturn(Optional.empty());
        when(outcomeRepository.findByGameId("G1")).thenReturn(Optional.empty());
        when(snapshotRepository.findLatestCollectedAt("G1")).thenReturn(Optional.of(T0));
        when(outcomeRepository.saveAndFlush(outcome)).thenReturn(outcome);

        assertThat(store.insertOutcome(outcome).getWinner()).isEqualTo("Chiefs");
    }

    // --------------- proposal status ----------------

    @Test
    void updateProposalStatus_pendingToAccepted_changesOnlyStatusAndHash() {
        ImprovementProposal proposal = proposal("E1");
        Map<String, Object> before = new LinkedHashMap<>(proposal.canonicalFields());
        String hashBefore = proposal.getContentHash();
        when(proposalRepository.findById(proposal.getProposalId())).thenReturn(Optional.of(proposal));
        when(proposalRepository.saveAndFlush(any(ImprovementProposal.class))).thenAnswer(inv -> inv.getArgument(0));

        ImprovementProposal updated = store.updateProposalStatus(proposal.getProposalId(), ProposalStatus.ACCEPTED);

        Map<String, Object> after = new LinkedHashMap<>(updated.canonicalFields());
        assertThat(after.get("status")).isEqualTo("accepted");
        before.remove("status");
        after.remove("status");
        assertThat(after).isEqualTo(before);
        assertThat(updated.getContentHash()).isNotEqualTo(hashBefore).isEqualTo(updated.computeHash());
        verify(auditLog).logStatusTransition(proposal.getProposalId(), ProposalStatus.PENDING,
                ProposalStatus.ACCEPTED, updated.getContentHash());
    }

    @Test
    void updateProposalStatus_implementedBackToPending_isInvalidTransition() {
        ImprovementProposal proposal = proposal("E1");
        proposal.transitionTo(ProposalStatus.IMPLEMENTED);
        when(proposalRepository.findById(proposal.getProposalId())).thenReturn(Optional.of(proposal));

        assertThatThrownBy(() -> store.updateProposalStatus(proposal.getProposalId(), ProposalStatus.PENDING))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.IMPLEMENTED);
        verify(proposalRepository, never()).saveAndFlush(any());
    }

    @Test
    void modify_proposalStatus_isRoutedToTransition() {
        ImprovementProposal proposal = proposal("E1");
        when(proposalRepository.findById(proposal.getProposalId())).thenReturn(Optional.of(proposal));
        when(proposalRepository.saveAndFlush(any(ImprovementProposal.class))).thenAnswer(inv -> inv.getArgument(0));

        store.modify(EntityType.PROPOSAL, proposal.getProposalId(), "status", "rejected");

        ArgumentCaptor<ImprovementProposal> saved = ArgumentCaptor.forClass(ImprovementProposal.class);
        verify(proposalRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo(ProposalStatus.REJECTED);
    }

    // --------------- immutability ----------------

    @Test
    void modify_anyOtherField_isImmutabilityViolation() {
        assertThatThrownBy(() -> store.modify(EntityType.SNAPSHOT, "S1", "game_id", "G2"))
                .isInstanceOf(ImmutabilityViolationException.class);
        assertThatThrownBy(() -> store.modify(EntityType.PROPOSAL, "P1", "proposal_text", "rewritten"))
                .isInstanceOf(ImmutabilityViolationException.class);
        verify(auditLog).logMutationDenied("modify game_id", EntityType.SNAPSHOT, "S1");
    }

    @Test
    void remove_isAlwaysImmutabilityViolation() {
        for (EntityType type : EntityType.values()) {
            assertThatThrownBy(() -> store.remove(type, "X")).isInstanceOf(ImmutabilityViolationException.class);
        }
    }

    // --------------- reads ----------------

    @Test
    void getSnapshot_storedRowAlteredOutsideLedger_raisesHashMismatch() {
        InfoSnapshot snapshot = snapshot("G1", T0);
        ReflectionTestUtils.setField(snapshot, "gameId", "G-TAMPERED");
        when(snapshotRepository.findById(snapshot.getSnapshotId())).thenReturn(Optional.of(snapshot));

        assertThatThrownBy(() -> store.getSnapshot(snapshot.getSnapshotId()))
                .isInstanceOf(HashMismatchException.class);
    }

    @Test
    void getAnalysis_unknown_isNotFound() {
        when(analysisRepository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.getAnalysis("nope")).isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    void listLineagePath_isRootFirst() {
        Analysis root = analysis(null, T0, "S1");
        Analysis middle = analysis(root.getAnalysisId(), T0.plusSeconds(1), "S1");
        Analysis leaf = analysis(middle.getAnalysisId(), T0.plusSeconds(2), "S1");
        when(analysisRepository.findById(root.getAnalysisId())).thenReturn(Optional.of(root));
        when(analysisRepository.findById(middle.getAnalysisId())).thenReturn(Optional.of(middle));
        when(analysisRepository.findById(leaf.getAnalysisId())).thenReturn(Optional.of(leaf));

        List<Analysis> path = store.listLineagePath(leaf.getAnalysisId());

        assertThat(path).extracting(Analysis::getAnalysisId)
                .containsExactly(root.getAnalysisId(), middle.getAnalysisId(), leaf.getAnalysisId());
        assertThat(path.get(0).isRoot()).isTrue();
    }

    @Test
    void listLineagePath_loopInStoredChain_raisesIntegrityException() {
        Analysis a = analysis("placeholder", T0, "S1");
        Analysis b = analysis(a.getAnalysisId(), T0, "S1");
        ReflectionTestUtils.setField(a, "parentAnalysisId", b.getAnalysisId());
        ReflectionTestUtils.setField(a, "contentHash", a.computeHash());
        when(analysisRepository.findById(a.getAnalysisId())).thenReturn(Optional.of(a));
        when(analysisRepository.findById(b.getAnalysisId())).thenReturn(Optional.of(b));

        assertThatThrownBy(() -> store.listLineagePath(a.getAnalysisId())).isInstanceOf(IntegrityException.class);
    }

    // --------------- helpers ----------------

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

    private static Analysis analysis(String parentId, Instant createdAt, String... snapshotIds) {
        return Analysis.builder()
                .createdAt(createdAt)
                .analysisVersion("1.0.0")
                .codeVersion("test")
                .parentAnalysisId(parentId)
                .inputSnapshotIds(List.of(snapshotIds))
                .derivedFeatures(Map.of("comparisons", List.of()))
                .conclusions(Map.of("summary", "nothing"))
                .recommendedActions(List.of())
                .build();
    }

    private static Outcome outcome(String gameId, int home, int away) {
        return Outcome.builder()
                .gameId(gameId)
                .occurredAt(T0.plusSeconds(3 * 3600))
                .finalScore(FinalScore.of(home, away))
                .winner(home > away ? "Chiefs" : home < away ? "Bills" : null)
                .source("scores_api")
                .build();
    }

    private static ImprovementProposal proposal(String evaluationId) {
        return ImprovementProposal.builder()
                .createdAt(T0)
                .basedOnEvaluationIds(List.of(evaluationId))
                .proposalText("Add injury reports to snapshots")
                .suggestedModules(List.of("injury_feed"))
                .build();
    }
}
