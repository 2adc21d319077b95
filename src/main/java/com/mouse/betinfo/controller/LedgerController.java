package com.mouse.betinfo.controller;

import com.mouse.betinfo.entity.Analysis;
import com.mouse.betinfo.entity.InfoSnapshot;
import com.mouse.betinfo.model.EvaluationReport;
import com.mouse.betinfo.model.HashMismatch;
import com.mouse.betinfo.model.LineageView;
import com.mouse.betinfo.service.EvaluationService;
import com.mouse.betinfo.service.ImmutableStore;
import com.mouse.betinfo.service.IntegrityVerifier;
import com.mouse.betinfo.service.LineageService;
import com.mouse.betinfo.service.SnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only views over the ledger. Nothing here writes.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/ledger")
public class LedgerController {

    private final ImmutableStore store;
    private final SnapshotService snapshotService;
    private final LineageService lineageService;
    private final EvaluationService evaluationService;
    private final IntegrityVerifier integrityVerifier;

    /**
     * Snapshots of a game, oldest first.
     *
     * @param asOf optional ISO-8601 cut-off; only snapshots collected at or before it are returned
     */
    @GetMapping("/games/{gameId}/timeline")
    public ResponseEntity<Map<String, Object>> timeline(
            @PathVariable String gameId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant asOf
    ) {
        log.info("GET /api/v1/ledger/games/{}/timeline - asOf={}", gameId, asOf);

        List<InfoSnapshot> snapshots = snapshotService.timeline(gameId, asOf);

        Map<String, Object> response = new HashMap<>();
        response.put("gameId", gameId);
        response.put("snapshots", snapshots);
        response.put("count", snapshots.size());
        response.put("timestamp", Instant.now());
        if (asOf != null) {
            response.put("asOf", asOf);
        }
        store.findOutcomeByGame(gameId).ifPresent(outcome -> response.put("outcome", outcome));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/analyses/{analysisId}/lineage")
    public ResponseEntity<Map<String, Object>> lineage(@PathVariable String analysisId) {
        log.info("GET /api/v1/ledger/analyses/{}/lineage", analysisId);

        LineageView view = lineageService.describe(analysisId);

        Map<String, Object> response = new HashMap<>();
        response.put("analysis", view.analysis());
        response.put("path", view.path().stream().map(LedgerController::summary).toList());
        response.put("children", view.children().stream().map(LedgerController::summary).toList());
        response.put("depth", view.depth());
        response.put("evaluations", store.listEvaluationsByAnalysis(analysisId));
        response.put("timestamp", Instant.now());
        return ResponseEntity.ok(response);
    }

    /**
     * Recomputes every stored hash. Mismatches come back in the body; the call itself succeeds.
     */
    @GetMapping("/verify")
    public ResponseEntity<Map<String, Object>> verify() {
        log.info("GET /api/v1/ledger/verify");

        List<HashMismatch> mismatches = integrityVerifier.verifyAll();

        Map<String, Object> response = new HashMap<>();
        response.put("valid", mismatches.isEmpty());
        response.put("mismatches", mismatches);
        response.put("timestamp", Instant.now());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/report")
    public ResponseEntity<Map<String, Object>> report() {
        log.info("GET /api/v1/ledger/report");

        EvaluationReport report = evaluationService.aggregateReport();

        Map<String, Object> response = new HashMap<>();
        response.put("report", report);
        response.put("timestamp", Instant.now());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Long> counts = new LinkedHashMap<>();
        store.counts().forEach((type, count) -> counts.put(type.getTableName(), count));

        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("counts", counts);
        response.put("gamesWithoutOutcome", store.gamesWithoutOutcome());
        response.put("timestamp", Instant.now());
        return ResponseEntity.ok(response);
    }

    private static Map<String, Object> summary(Analysis analysis) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("analysisId", analysis.getAnalysisId());
        summary.put("parentAnalysisId", analysis.getParentAnalysisId());
        summary.put("createdAt", analysis.getCreatedAt());
        summary.put("analysisVersion", analysis.getAnalysisVersion());
        summary.put("inputSnapshotIds", analysis.getInputSnapshotIds());
        return summary;
    }
}
