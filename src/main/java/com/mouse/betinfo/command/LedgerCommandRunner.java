package com.mouse.betinfo.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mouse.betinfo.entity.Analysis;
import com.mouse.betinfo.entity.Evaluation;
import com.mouse.betinfo.entity.ImprovementProposal;
import com.mouse.betinfo.entity.InfoSnapshot;
import com.mouse.betinfo.entity.LedgerRecord;
import com.mouse.betinfo.entity.Outcome;
import com.mouse.betinfo.enums.ProposalStatus;
import com.mouse.betinfo.exception.LedgerException;
import com.mouse.betinfo.model.BatchReport;
import com.mouse.betinfo.model.EvaluationReport;
import com.mouse.betinfo.model.GameResult;
import com.mouse.betinfo.model.HashMismatch;
import com.mouse.betinfo.model.LineageView;
import com.mouse.betinfo.service.AnalysisService;
import com.mouse.betinfo.service.DeltaComputer;
import com.mouse.betinfo.service.EvaluationService;
import com.mouse.betinfo.service.ImmutableStore;
import com.mouse.betinfo.service.IntegrityVerifier;
import com.mouse.betinfo.service.LineageService;
import com.mouse.betinfo.service.OutcomeService;
import com.mouse.betinfo.service.ProposalService;
import com.mouse.betinfo.service.SnapshotService;
import com.mouse.betinfo.utils.LedgerJson;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thin command surface: each command maps onto one core operation.
 * Exit codes: 0 success, 1 a ledger operation failed or verification found mismatches, 2 usage error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    public static final int OK = 0;
    public static final int FAILED = 1;
    public static final int USAGE = 2;

    private static final String USAGE_TEXT = String.join(System.lineSeparator(),
            "Usage: <command> [args]",
            "  init-db                                   create tables and show row counts",
            "  status                                    row counts, unsettled games, pending proposals",
            "  collect <gameId> [sport]                  take a snapshot from the registered providers",
            "  timeline <gameId> [asOf]                  snapshots of a game, oldest first",
            "  diff <gameId> | diff <olderId> <newerId>  field deltas between two snapshots",
            "  analyze <gameId>|--all [--parent <id>] [--as-of <ts>]",
            "  ingest-outcome <gameId> [home away homeScore awayScore] | --pending",
            "  evaluate [analysisId]                     score one analysis, or everything pending",
            "  lineage <analysisId>                      root-first path and children",
            "  verify                                    recompute every hash",
            "  report                                    aggregate evaluation metrics",
            "  propose <evalId[,evalId...]> <text>       record an improvement proposal",
            "  propose-status <proposalId> <status>      move a proposal forward");

    private final ImmutableStore store;
    private final SnapshotService snapshotService;
    private final AnalysisService analysisService;
    private final OutcomeService outcomeService;
    private final EvaluationService evaluationService;
    private final ProposalService proposalService;
    private final LineageService lineageService;
    private final DeltaComputer deltaComputer;
    private final IntegrityVerifier integrityVerifier;

    private final ObjectMapper json = LedgerJson.newObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private PrintStream out = System.out;
    private int exitCode = OK;

    @Override
    public void run(String... args) {
        if (args == null || args.length == 0 || args[0].startsWith("--")) {
            return;
        }
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public int execute(String... args) {
        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        log.info("COMMAND | name={} | args={}", command, rest);
        try {
            switch (command) {
                case "init-db":
                case "status":
                    return status();
                case "collect":
                    return collect(rest);
                case "timeline":
                    return timeline(rest);
                case "diff":
                    return diff(rest);
                case "analyze":
                    return analyze(rest);
                case "ingest-outcome":
                    return ingestOutcome(rest);
                case "evaluate":
                    return evaluate(rest);
                case "lineage":
                    return lineage(rest);
                case "verify":
                    return verify();
                case "report":
                    return report();
                case "propose":
                    return propose(rest);
                case "propose-status":
                    return proposeStatus(rest);
                case "help":
                    out.println(USAGE_TEXT);
                    return OK;
                default:
                    throw new UsageException("Unknown command: " + command);
            }
        } catch (UsageException e) {
            out.println("error: " + e.getMessage());
            out.println(USAGE_TEXT);
            return USAGE;
        } catch (LedgerException | IllegalArgumentException e) {
            log.error("COMMAND FAILED | name={} | error={}", command, e.getMessage());
            out.println("error: " + e.getMessage());
            return FAILED;
        }
    }

    /* -------------------- Commands -------------------- */

    private int status() {
        Map<String, Object> status = new LinkedHashMap<>();
        Map<String, Long> counts = new LinkedHashMap<>();
        store.counts().forEach((type, count) -> counts.put(type.getTableName(), count));
        status.put("counts", counts);
        status.put("gamesWithoutOutcome", store.gamesWithoutOutcome());
        status.put("pendingProposals", proposalService.pending().size());
        print(status);
        return OK;
    }

    private int collect(List<String> args) {
        String gameId = arg(args, 0, "gameId");
        String sport = args.size() > 1 ? args.get(1) : null;
        InfoSnapshot snapshot = snapshotService.collect(gameId, sport);
        print(Map.of("snapshotId", snapshot.getSnapshotId(), "gameId", gameId,
                "collectedAt", snapshot.getCollectedAt(), "hash", snapshot.getContentHash()));
        return OK;
    }

    private int timeline(List<String> args) {
        String gameId = arg(args, 0, "gameId");
        Instant asOf = args.size() > 1 ? instant(args.get(1)) : null;
        List<Map<String, Object>> rows = new ArrayList<>();
        for (InfoSnapshot snapshot : snapshotService.timeline(gameId, asOf)) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("snapshotId", snapshot.getSnapshotId());
            row.put("collectedAt", snapshot.getCollectedAt());
            row.put("sources", snapshot.getSourceVersions());
            row.put("hash", snapshot.getContentHash());
            rows.add(row);
        }
        print(rows);
        return OK;
    }

    private int diff(List<String> args) {
        InfoSnapshot older;
        InfoSnapshot newer;
        if (args.size() >= 2) {
            older = store.getSnapshot(args.get(0));
            newer = store.getSnapshot(args.get(1));
        } else {
            List<InfoSnapshot> timeline = store.listByGame(arg(args, 0, "gameId"));
            if (timeline.size() < 2) {
                out.println("Need at least two snapshots to diff, found " + timeline.size());
                return OK;
            }
            older = timeline.get(timeline.size() - 2);
            newer = timeline.get(timeline.size() - 1);
        }
        Map<String, Object> diff = new LinkedHashMap<>();
        diff.put("from", older.getSnapshotId());
        diff.put("to", newer.getSnapshotId());
        diff.put("changes", deltaComputer.changes(older, newer));
        diff.put("oddsMovements", deltaComputer.oddsMovements(older, newer));
        print(diff);
        return OK;
    }

    private int analyze(List<String> args) {
        String target = arg(args, 0, "gameId or --all");
        String parent = option(args, "--parent");
        String asOf = option(args, "--as-of");
        if ("--all".equals(target)) {
            return printBatch(analysisService.analyzeAll());
        }
        Optional<Analysis> analysis = asOf == null
                ? analysisService.analyzeGame(target, parent)
                : analysisService.analyzeGameAsOf(target, instant(asOf), parent);
        if (analysis.isEmpty()) {
            out.println("Nothing to analyze for " + target);
            return OK;
        }
        print(Map.of("analysisId", analysis.get().getAnalysisId(),
                "conclusions", analysis.get().getConclusions(),
                "recommendedActions", analysis.get().getRecommendedActions()));
        return OK;
    }

    private int ingestOutcome(List<String> args) {
        String gameId = arg(args, 0, "gameId or --pending");
        if ("--pending".equals(gameId)) {
            return printBatch(outcomeService.ingestPending());
        }
        if (args.size() >= 5) {
            GameResult result = new GameResult(gameId, args.get(1), args.get(2),
                    integer(args.get(3)), integer(args.get(4)), Instant.now(), Map.of(), "manual");
            printOutcome(outcomeService.record(result));
            return OK;
        }
        Optional<Outcome> outcome = outcomeService.ingest(gameId);
        if (outcome.isEmpty()) {
            out.println("Game " + gameId + " is not final yet");
            return OK;
        }
        printOutcome(outcome.get());
        return OK;
    }

    private int evaluate(List<String> args) {
        if (args.isEmpty()) {
            return printBatch(evaluationService.evaluateAllPending());
        }
        List<Evaluation> evaluations = evaluationService.evaluate(args.get(0));
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Evaluation evaluation : evaluations) {
            rows.add(Map.of("evaluationId", evaluation.getEvaluationId(),
                    "gameId", evaluation.getGameId(),
                    "metrics", evaluation.getMetrics().toMap()));
        }
        print(rows);
        return OK;
    }

    private int lineage(List<String> args) {
        LineageView view = lineageService.describe(arg(args, 0, "analysisId"));
        List<Map<String, Object>> path = new ArrayList<>();
        for (Analysis node : view.path()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("analysisId", node.getAnalysisId());
            row.put("parentAnalysisId", node.getParentAnalysisId());
            row.put("createdAt", node.getCreatedAt());
            row.put("analysisVersion", node.getAnalysisVersion());
            path.add(row);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("depth", view.depth());
        body.put("path", path);
        body.put("children", view.children().stream().map(Analysis::getAnalysisId).toList());
        print(body);
        return OK;
    }

    private int verify() {
        List<HashMismatch> mismatches = integrityVerifier.verifyAll();
        if (mismatches.isEmpty()) {
            out.println("All hashes verified");
            return OK;
        }
        print(mismatches);
        return FAILED;
    }

    private int report() {
        EvaluationReport report = evaluationService.aggregateReport();
        print(report);
        return OK;
    }

    private int propose(List<String> args) {
        List<String> evidence = Arrays.asList(arg(args, 0, "evaluationIds").split(","));
        String text = String.join(" ", args.subList(1, args.size()));
        if (text.isBlank()) {
            throw new UsageException("Missing argument: text");
        }
        ImprovementProposal proposal = proposalService.propose(evidence, text, null, null, null);
        print(Map.of("proposalId", proposal.getProposalId(), "status", proposal.getStatus()));
        return OK;
    }

    private int proposeStatus(List<String> args) {
        String proposalId = arg(args, 0, "proposalId");
        String value = arg(args, 1, "status");
        ProposalStatus status = ProposalStatus.fromValue(value)
                .orElseThrow(() -> new UsageException("Unknown status: " + value));
        ImprovementProposal proposal = proposalService.changeStatus(proposalId, status);
        print(Map.of("proposalId", proposalId, "status", proposal.getStatus(), "hash", proposal.getContentHash()));
        return OK;
    }

    /* -------------------- Helpers -------------------- */

    private void printOutcome(Outcome outcome) {
        print(Map.of("outcomeId", outcome.getOutcomeId(), "gameId", outcome.getGameId(),
                "winner", outcome.getWinner(), "finalScore", outcome.getFinalScore()));
    }

    private int printBatch(BatchReport<? extends LedgerRecord> report) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("operation", report.operation());
        body.put("succeeded", report.successes().stream().map(LedgerRecord::getId).toList());
        body.put("skipped", report.skipped());
        body.put("failures", report.failures());
        print(body);
        return report.hasFailures() ? FAILED : OK;
    }

    private void print(Object value) {
        try {
            out.println(json.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new LedgerException("Could not render command output", e);
        }
    }

    private static String arg(List<String> args, int index, String name) {
        if (args.size() <= index || args.get(index).isBlank()) {
            throw new UsageException("Missing argument: " + name);
        }
        return args.get(index);
    }

    private static String option(List<String> args, String name) {
        int index = args.indexOf(name);
        if (index < 0) {
            return null;
        }
        if (index + 1 >= args.size()) {
            throw new UsageException("Missing value for " + name);
        }
        return args.get(index + 1);
    }

    private static Instant instant(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new UsageException("Not an ISO-8601 instant: " + value);
        }
    }

    private static int integer(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException("Not a number: " + value);
        }
    }

    static class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
