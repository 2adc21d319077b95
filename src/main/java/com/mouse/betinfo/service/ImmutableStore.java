package com.mouse.betinfo.service;

import com.mouse.betinfo.config.LedgerProperties;
import com.mouse.betinfo.entity.Analysis;
import com.mouse.betinfo.entity.Evaluation;
import com.mouse.betinfo.entity.ImprovementProposal;
import com.mouse.betinfo.entity.InfoSnapshot;
import com.mouse.betinfo.entity.LedgerRecord;
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
import com.mouse.betinfo.model.RecordKey;
import com.mouse.betinfo.repository.AnalysisRepository;
import com.mouse.betinfo.repository.EvaluationRepository;
import com.mouse.betinfo.repository.OutcomeRepository;
import com.mouse.betinfo.repository.ProposalRepository;
import com.mouse.betinfo.repository.SnapshotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Append-only persistence for every ledger record.
 *
 * <p>Only inserts and reads are offered; the proposal status transition is the single
 * mutation. Inserts are idempotent on content hash and are serialised per logical key
 * (the hash, or the game id for outcomes) through a fixed array of lock stripes, so two
 * writers of the same fact end up with one row while unrelated keys proceed in parallel.
 * Each insert commits in its own transaction while the stripe is held: the second writer
 * always sees the first writer's committed row, and referential checks only ever see
 * committed data.
 *
 * <p>Every read re-verifies the content hash.
 */
@Slf4j
@Service
public class ImmutableStore {

    private final SnapshotRepository snapshotRepository;
    private final AnalysisRepository analysisRepository;
    private final OutcomeRepository outcomeRepository;
    private final EvaluationRepository evaluationRepository;
    private final ProposalRepository proposalRepository;
    private final TransactionOperations transactions;
    private final LedgerAuditLogService auditLog;
    private final ReentrantLock[] stripes;

    public ImmutableStore(SnapshotRepository snapshotRepository,
                          AnalysisRepository analysisRepository,
                          OutcomeRepository outcomeRepository,
                          EvaluationRepository evaluationRepository,
                          ProposalRepository proposalRepository,
                          TransactionOperations transactions,
                          LedgerAuditLogService auditLog,
                          LedgerProperties properties) {
        this.snapshotRepository = snapshotRepository;
        this.analysisRepository = analysisRepository;
        this.outcomeRepository = outcomeRepository;
        this.evaluationRepository = evaluationRepository;
        this.proposalRepository = proposalRepository;
        this.transactions = transactions;
        this.auditLog = auditLog;
        this.stripes = new ReentrantLock[Math.max(1, properties.getLockStripes())];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /* -------------------- Inserts -------------------- */

    public InfoSnapshot insertSnapshot(InfoSnapshot snapshot) {
        checkConstructed(snapshot);
        return locked(snapshot.getContentHash(), () -> {
            Optional<InfoSnapshot> existing = snapshotRepository.findByContentHash(snapshot.getContentHash());
            if (existing.isPresent()) {
                auditLog.logDeduplicated(existing.get());
                return existing.get();
            }
            InfoSnapshot saved = snapshotRepository.saveAndFlush(snapshot);
            auditLog.logInserted(saved);
            return saved;
        });
    }

    public Analysis insertAnalysis(Analysis analysis) {
        checkConstructed(analysis);
        return locked(analysis.getContentHash(), () -> {
            Optional<Analysis> existing = analysisRepository.findByContentHash(analysis.getContentHash());
            if (existing.isPresent()) {
                auditLog.logDeduplicated(existing.get());
                return existing.get();
            }

            for (String snapshotId : analysis.getInputSnapshotIds()) {
                if (!snapshotRepository.existsById(snapshotId)) {
                    throw rejected(new ReferentialIntegrityException(EntityType.ANALYSIS, "input_snapshot_ids", snapshotId));
                }
            }

            String parentId = analysis.getParentAnalysisId();
            if (parentId != null) {
                Analysis parent = analysisRepository.findById(parentId)
                        .orElseThrow(() -> rejected(new ReferentialIntegrityException(
                                EntityType.ANALYSIS, "parent_analysis_id", parentId)));
                if (parent.getCreatedAt().isAfter(analysis.getCreatedAt())) {
                    throw rejected(new ReferentialIntegrityException(EntityType.ANALYSIS, "parent_analysis_id", parentId,
                            String.format("Parent analysis %s was created at %s, after its child (%s)",
                                    parentId, parent.getCreatedAt(), analysis.getCreatedAt())));
                }
            }

            Analysis saved = analysisRepository.saveAndFlush(analysis);
            auditLog.logInserted(saved);
            return saved;
        });
    }

    /**
     * One outcome per game. Re-inserting the identical outcome returns the stored one;
     * a different outcome for a settled game is a {@link UniquenessViolationException}
     * naming the outcome already on record.
     */
    public Outcome insertOutcome(Outcome outcome) {
        checkConstructed(outcome);
        return locked("outcome:" + outcome.getGameId(), () -> {
            Optional<Outcome> existing = outcomeRepository.findByContentHash(outcome.getContentHash());
            if (existing.isPresent()) {
                auditLog.logDeduplicated(existing.get());
                return existing.get();
            }

            Optional<Outcome> settled = outcomeRepository.findByGameId(outcome.getGameId());
            if (settled.isPresent()) {
                throw rejected(new UniquenessViolationException(
                        EntityType.OUTCOME, outcome.getGameId(), settled.get().getOutcomeId()));
            }

            snapshotRepository.findLatestCollectedAt(outcome.getGameId())
                    .filter(latest -> outcome.getOccurredAt().isBefore(latest))
                    .ifPresent(latest -> log.warn(
                            "⚠️ Outcome predates latest snapshot | gameId={} | occurredAt={} | latestSnapshot={}",
                            outcome.getGameId(), outcome.getOccurredAt(), latest));

            Outcome saved = outcomeRepository.saveAndFlush(outcome);
            auditLog.logInserted(saved);
            return saved;
        });
    }

    public Evaluation insertEvaluation(Evaluation evaluation) {
        checkConstructed(evaluation);
        return locked(evaluation.getContentHash(), () -> {
            Optional<Evaluation> existing = evaluationRepository.findByContentHash(evaluation.getContentHash());
            if (existing.isPresent()) {
                auditLog.logDeduplicated(existing.get());
                return existing.get();
            }

            Analysis analysis = analysisRepository.findById(evaluation.getAnalysisId())
                    .orElseThrow(() -> rejected(new ReferentialIntegrityException(
                            EntityType.EVALUATION, "analysis_id", evaluation.getAnalysisId())));

            if (outcomeRepository.findByGameId(evaluation.getGameId()).isEmpty()) {
                throw rejected(new ReferentialIntegrityException(
                        EntityType.EVALUATION, "game_id", evaluation.getGameId(),
                        "No outcome recorded for game " + evaluation.getGameId()));
            }

            Set<String> analysisGames = gameIdsOf(analysis);
            if (!analysisGames.contains(evaluation.getGameId())) {
                throw rejected(new ReferentialIntegrityException(
                        EntityType.EVALUATION, "game_id", evaluation.getGameId(),
                        String.format("Analysis %s covers games %s, not %s",
                                analysis.getAnalysisId(), analysisGames, evaluation.getGameId())));
            }

            Evaluation saved = evaluationRepository.saveAndFlush(evaluation);
            auditLog.logInserted(saved);
            return saved;
        });
    }

    public ImprovementProposal insertProposal(ImprovementProposal proposal) {
        checkConstructed(proposal);
        return locked(proposal.getContentHash(), () -> {
            Optional<ImprovementProposal> existing = proposalRepository.findFirstByContentHash(proposal.getContentHash());
            if (existing.isPresent()) {
                auditLog.logDeduplicated(existing.get());
                return existing.get();
            }

            for (String evaluationId : proposal.getBasedOnEvaluationIds()) {
                if (!evaluationRepository.existsById(evaluationId)) {
                    throw rejected(new ReferentialIntegrityException(
                            EntityType.PROPOSAL, "based_on_evaluation_ids", evaluationId));
                }
            }

            ImprovementProposal saved = proposalRepository.saveAndFlush(proposal);
            auditLog.logInserted(saved);
            return saved;
        });
    }

    /* -------------------- The one mutation -------------------- */

    /**
     * Moves a proposal's status forward and re-stamps its hash over the new status.
     *
     * @throws InvalidTransitionException when {@code newStatus} is not a forward move
     */
    public ImprovementProposal updateProposalStatus(String proposalId, ProposalStatus newStatus) {
        return locked("proposal:" + proposalId, () -> {
            ImprovementProposal proposal = getProposal(proposalId);
            ProposalStatus from = proposal.getStatus();
            try {
                proposal.transitionTo(newStatus);
            } catch (InvalidTransitionException e) {
                auditLog.logRejected(EntityType.PROPOSAL, e.getMessage());
                throw e;
            }
            ImprovementProposal saved = proposalRepository.saveAndFlush(proposal);
            auditLog.logStatusTransition(proposalId, from, newStatus, saved.getContentHash());
            return saved;
        });
    }

    /**
     * Field-level change request. Only {@code status} on a proposal is honoured, by
     * routing it to {@link #updateProposalStatus}; everything else is refused.
     */
    public LedgerRecord modify(EntityType entityType, String id, String field, Object newValue) {
        if (entityType == EntityType.PROPOSAL && "status".equals(field)) {
            ProposalStatus next = newValue instanceof ProposalStatus
                    ? (ProposalStatus) newValue
                    : ProposalStatus.fromValue(String.valueOf(newValue))
                    .orElseThrow(() -> new IllegalArgumentException("Unknown proposal status: " + newValue));
            return updateProposalStatus(id, next);
        }
        auditLog.logMutationDenied("modify " + field, entityType, id);
        throw new ImmutabilityViolationException("modify " + field, entityType);
    }

    public void remove(EntityType entityType, String id) {
        auditLog.logMutationDenied("remove", entityType, id);
        throw new ImmutabilityViolationException("remove", entityType);
    }

    /* -------------------- Reads (hash re-verified) -------------------- */

    public InfoSnapshot getSnapshot(String snapshotId) {
        return verified(snapshotRepository.findById(snapshotId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.SNAPSHOT, snapshotId)));
    }

    public Analysis getAnalysis(String analysisId) {
        return verified(analysisRepository.findById(analysisId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.ANALYSIS, analysisId)));
    }

    public Outcome getOutcome(String outcomeId) {
        return verified(outcomeRepository.findById(outcomeId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.OUTCOME, outcomeId)));
    }

    public Evaluation getEvaluation(String evaluationId) {
        return verified(evaluationRepository.findById(evaluationId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.EVALUATION, evaluationId)));
    }

    public ImprovementProposal getProposal(String proposalId) {
        return verified(proposalRepository.findById(proposalId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.PROPOSAL, proposalId)));
    }

    public Optional<Outcome> findOutcomeByGame(String gameId) {
        return outcomeRepository.findByGameId(gameId).map(this::verified);
    }

    /** Snapshots of one game, oldest first. */
    public List<InfoSnapshot> listByGame(String gameId) {
        return verifiedAll(snapshotRepository.findByGameIdOrderByCollectedAtAsc(gameId));
    }

    /** What was known about a game at {@code asOf}: snapshots collected at or before it. */
    public List<InfoSnapshot> listByGameAsOf(String gameId, Instant asOf) {
        return verifiedAll(snapshotRepository.findByGameIdAndCollectedAtLessThanEqualOrderByCollectedAtAsc(gameId, asOf));
    }

    public Optional<InfoSnapshot> latestSnapshotAsOf(String gameId, Instant asOf) {
        return snapshotRepository.findFirstByGameIdAndCollectedAtLessThanEqualOrderByCollectedAtDesc(gameId, asOf)
                .map(this::verified);
    }

    public Optional<InfoSnapshot> latestSnapshot(String gameId) {
        return snapshotRepository.findFirstByGameIdOrderByCollectedAtDesc(gameId).map(this::verified);
    }

    public List<String> listGameIds() {
        return snapshotRepository.findDistinctGameIds();
    }

    public List<String> gamesWithoutOutcome() {
        return snapshotRepository.findGameIdsWithoutOutcome();
    }

    /**
     * Analyses from the root (no parent) down to {@code analysisId}.
     *
     * @throws EntityNotFoundException if any link of the chain is missing
     * @throws IntegrityException      if the stored chain loops back on itself
     */
    public List<Analysis> listLineagePath(String analysisId) {
        Deque<Analysis> path = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        String current = analysisId;
        while (current != null) {
            if (!visited.add(current)) {
                throw new IntegrityException("Cycle in analysis lineage at " + current + " while resolving " + analysisId);
            }
            Analysis node = getAnalysis(current);
            path.addFirst(node);
            current = node.getParentAnalysisId();
        }
        return List.copyOf(path);
    }

    public List<Analysis> listChildren(String analysisId) {
        return verifiedAll(analysisRepository.findByParentAnalysisIdOrderByCreatedAtAsc(analysisId));
    }

    public List<Analysis> listRoots() {
        return verifiedAll(analysisRepository.findByParentAnalysisIdIsNullOrderByCreatedAtAsc());
    }

    /** Analyses that read at least one snapshot of {@code gameId}. */
    public List<Analysis> listAnalysesForGame(String gameId) {
        List<String> snapshotIds = snapshotRepository.findByGameIdOrderByCollectedAtAsc(gameId).stream()
                .map(InfoSnapshot::getSnapshotId)
                .toList();
        if (snapshotIds.isEmpty()) {
            return List.of();
        }
        return verifiedAll(analysisRepository.findByInputSnapshotIdIn(snapshotIds));
    }

    /** Game ids reached through an analysis's input snapshots. */
    public Set<String> gameIdsOf(Analysis analysis) {
        Set<String> games = new LinkedHashSet<>();
        for (String snapshotId : analysis.getInputSnapshotIds()) {
            InfoSnapshot snapshot = snapshotRepository.findById(snapshotId)
                    .orElseThrow(() -> new EntityNotFoundException(EntityType.SNAPSHOT, snapshotId));
            games.add(snapshot.getGameId());
        }
        return games;
    }

    public List<Evaluation> listEvaluationsByAnalysis(String analysisId) {
        return verifiedAll(evaluationRepository.findByAnalysisIdOrderByScoredAtAsc(analysisId));
    }

    public List<Evaluation> listEvaluationsByGame(String gameId) {
        return verifiedAll(evaluationRepository.findByGameIdOrderByScoredAtAsc(gameId));
    }

    public List<Evaluation> listEvaluations() {
        return verifiedAll(evaluationRepository.findAll());
    }

    public boolean isEvaluated(String analysisId, String gameId) {
        return evaluationRepository.existsByAnalysisIdAndGameId(analysisId, gameId);
    }

    public List<ImprovementProposal> listProposalsByStatus(ProposalStatus status) {
        return verifiedAll(proposalRepository.findByStatusOrderByCreatedAtAsc(status));
    }

    public Map<EntityType, Long> counts() {
        Map<EntityType, Long> counts = new EnumMap<>(EntityType.class);
        counts.put(EntityType.SNAPSHOT, snapshotRepository.count());
        counts.put(EntityType.ANALYSIS, analysisRepository.count());
        counts.put(EntityType.OUTCOME, outcomeRepository.count());
        counts.put(EntityType.EVALUATION, evaluationRepository.count());
        counts.put(EntityType.PROPOSAL, proposalRepository.count());
        return counts;
    }

    /* -------------------- Raw access for verification -------------------- */

    /**
     * Ids and stored hashes, one page at a time, ordered by id.
     */
    public Page<RecordKey> recordKeys(EntityType entityType, Pageable pageable) {
        switch (entityType) {
            case SNAPSHOT:
                return snapshotRepository.findRecordKeys(pageable);
            case ANALYSIS:
                return analysisRepository.findRecordKeys(pageable);
            case OUTCOME:
                return outcomeRepository.findRecordKeys(pageable);
            case EVALUATION:
                return evaluationRepository.findRecordKeys(pageable);
            case PROPOSAL:
                return proposalRepository.findRecordKeys(pageable);
            default:
                throw new IllegalArgumentException("Unknown entity type " + entityType);
        }
    }

    /**
     * Loads a record without verifying its hash.
     */
    public LedgerRecord loadUnverified(EntityType entityType, String id) {
        Optional<? extends LedgerRecord> found;
        switch (entityType) {
            case SNAPSHOT:
                found = snapshotRepository.findById(id);
                break;
            case ANALYSIS:
                found = analysisRepository.findById(id);
                break;
            case OUTCOME:
                found = outcomeRepository.findById(id);
                break;
            case EVALUATION:
                found = evaluationRepository.findById(id);
                break;
            case PROPOSAL:
                found = proposalRepository.findById(id);
                break;
            default:
                throw new IllegalArgumentException("Unknown entity type " + entityType);
        }
        return found.orElseThrow(() -> new EntityNotFoundException(entityType, id));
    }

    /* -------------------- Internals -------------------- */

    private <T> T locked(String key, Supplier<T> work) {
        ReentrantLock lock = stripes[Math.floorMod(key.hashCode(), stripes.length)];
        lock.lock();
        try {
            return transactions.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }

    private void checkConstructed(LedgerRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("Cannot insert a null record");
        }
        String actual = record.computeHash();
        if (!actual.equals(record.getContentHash())) {
            throw new HashMismatchException(record.getEntityType(), record.getId(), record.getContentHash(), actual);
        }
    }

    private <T extends LedgerRecord> T verified(T record) {
        String actual = record.computeHash();
        if (!actual.equals(record.getContentHash())) {
            log.error("❌ HASH MISMATCH ON READ | type={} | id={}", record.getEntityType(), record.getId());
            throw new HashMismatchException(record.getEntityType(), record.getId(), record.getContentHash(), actual);
        }
        return record;
    }

    private <T extends LedgerRecord> List<T> verifiedAll(List<T> records) {
        records.forEach(this::verified);
        return records;
    }

    private <E extends RuntimeException> E rejected(E error) {
        EntityType type = error instanceof ReferentialIntegrityException r ? r.getEntityType()
                : error instanceof UniquenessViolationException u ? u.getEntityType()
                : null;
        auditLog.logRejected(type, error.getMessage());
        return error;
    }
}
