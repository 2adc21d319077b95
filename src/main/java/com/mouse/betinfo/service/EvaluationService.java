package com.mouse.betinfo.service;

import com.mouse.betinfo.config.LedgerProperties;
import com.mouse.betinfo.entity.Analysis;
import com.mouse.betinfo.entity.Evaluation;
import com.mouse.betinfo.entity.EvaluationMetrics;
import com.mouse.betinfo.entity.Outcome;
import com.mouse.betinfo.enums.BetSide;
import com.mouse.betinfo.enums.EdgeDirection;
import com.mouse.betinfo.model.BatchReport;
import com.mouse.betinfo.model.EvaluationReport;
import com.mouse.betinfo.utils.ScoringCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import static com.mouse.betinfo.utils.NormalizedFields.asMap;
import static com.mouse.betinfo.utils.NormalizedFields.decimal;
import static com.mouse.betinfo.utils.NormalizedFields.intValue;
import static com.mouse.betinfo.utils.NormalizedFields.mapList;
import static com.mouse.betinfo.utils.NormalizedFields.text;

/**
 * Scores analyses against outcomes once the game is settled.
 *
 * <p>The forecast scored is the sportsbook no-vig probability of the home side. ROI is
 * taken on the analysis's recommended side for the game (one unit at the book line),
 * and edge realization follows the flagged edge direction. A tie counts as the home
 * side not winning.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationService {

    private static final int SCALE = EvaluationMetrics.SCALE;

    private final ImmutableStore store;
    private final LedgerProperties properties;
    private final BatchRunner batchRunner;

    /**
     * Evaluates one analysis against every settled game it covers and has not been scored on.
     */
    public List<Evaluation> evaluate(String analysisId) {
        Analysis analysis = store.getAnalysis(analysisId);
        List<Evaluation> created = new ArrayList<>();
        for (String gameId : store.gameIdsOf(analysis)) {
            if (store.isEvaluated(analysisId, gameId)) {
                log.debug("Already evaluated | analysisId={} | gameId={}", analysisId, gameId);
                continue;
            }
            Optional<Outcome> outcome = store.findOutcomeByGame(gameId);
            if (outcome.isEmpty()) {
                log.debug("No outcome yet | analysisId={} | gameId={}", analysisId, gameId);
                continue;
            }
            score(analysis, outcome.get(), properties.getLogLossEpsilon())
                    .map(store::insertEvaluation)
                    .ifPresent(evaluation -> {
                        log.info("📊 Evaluation stored | analysisId={} | gameId={} | brier={} | roi={}",
                                analysisId, gameId,
                                evaluation.getMetrics().getBrierScore(), evaluation.getMetrics().getRoi());
                        created.add(evaluation);
                    });
        }
        return created;
    }

    /**
     * Every settled game is one unit; within it, every analysis not yet scored is evaluated.
     */
    public BatchReport<Evaluation> evaluateAllPending() {
        List<String> settled = store.listGameIds().stream()
                .filter(gameId -> store.findOutcomeByGame(gameId).isPresent())
                .toList();
        return batchRunner.runMany("evaluate-all", settled, this::evaluateGame);
    }

    List<Evaluation> evaluateGame(String gameId) {
        List<Evaluation> created = new ArrayList<>();
        for (Analysis analysis : store.listAnalysesForGame(gameId)) {
            if (!store.isEvaluated(analysis.getAnalysisId(), gameId)) {
                created.addAll(evaluate(analysis.getAnalysisId()));
            }
        }
        return created;
    }

    /* -------------------- Scoring (pure) -------------------- */

    /**
     * Builds the evaluation of {@code analysis} for the outcome's game. Empty when the
     * analysis carries no priced comparison for that game.
     */
    public static Optional<Evaluation> score(Analysis analysis, Outcome outcome, double epsilon) {
        String gameId = outcome.getGameId();
        List<Map<String, Object>> comparisons = mapList(analysis.getDerivedFeatures(), "comparisons");
        Optional<Map<String, Object>> comparison = pickComparison(comparisons, gameId);
        if (comparison.isEmpty()) {
            log.info("No comparison to score | analysisId={} | gameId={}", analysis.getAnalysisId(), gameId);
            return Optional.empty();
        }

        Map<String, Object> c = comparison.get();
        BigDecimal predicted = decimal(c.get("book_home_prob"));
        if (predicted == null) {
            return Optional.empty();
        }

        boolean homeWon = outcome.getFinalScore().homeWon();
        boolean awayWon = outcome.getFinalScore().getAway() > outcome.getFinalScore().getHome();

        BigDecimal brier = ScoringCalculator.brierScore(predicted, homeWon);
        BigDecimal logLoss = ScoringCalculator.logLoss(predicted, homeWon, epsilon);

        Map<String, Object> recommendation = pickRecommendation(analysis, text(c.get("event_id")));
        BigDecimal roi = null;
        BetSide side = null;
        if (recommendation != null) {
            side = BetSide.fromValue(text(recommendation.get("side")));
            Integer odds = intValue(recommendation.get("american_odds"));
            if (side != null && odds != null) {
                roi = ScoringCalculator.roi(odds, side == BetSide.HOME ? homeWon : awayWon);
            }
        }

        BigDecimal delta = decimal(c.get("delta_home"));
        EdgeDirection direction = EdgeDirection.fromValue(text(c.get("edge_direction")));
        boolean flagged = Boolean.TRUE.equals(c.get("edge_candidate"));
        BigDecimal edgeRealized = ScoringCalculator.edgeRealized(delta, direction, flagged, homeWon);

        Map<String, Object> notes = new LinkedHashMap<>();
        notes.put("home_team", c.get("home_team"));
        notes.put("away_team", c.get("away_team"));
        notes.put("actual_winner", outcome.getWinner());
        notes.put("home_won", homeWon);
        notes.put("final_score", outcome.getFinalScore().getAway() + "-" + outcome.getFinalScore().getHome());
        notes.put("predicted_home_prob", predicted);
        notes.put("market_prob", c.get("market_prob"));
        notes.put("delta", delta);
        notes.put("edge_direction", direction == null ? null : direction.getValue());
        notes.put("recommended_side", side == null ? null : side.getValue());

        return Optional.of(Evaluation.builder()
                .analysisId(analysis.getAnalysisId())
                .gameId(gameId)
                .metrics(EvaluationMetrics.of(brier, logLoss, roi, edgeRealized))
                .notes(notes)
                .build());
    }

    /** The priced comparison whose event is this game. Comparisons of other events never score it. */
    static Optional<Map<String, Object>> pickComparison(List<Map<String, Object>> comparisons, String gameId) {
        return comparisons.stream()
                .filter(c -> c.get("book_home_prob") != null)
                .filter(c -> Objects.equals(text(c.get("event_id")), gameId))
                .findFirst();
    }

    static Map<String, Object> pickRecommendation(Analysis analysis, String eventId) {
        for (Object action : analysis.getRecommendedActions()) {
            Map<String, Object> map = asMap(action);
            if (map != null && Objects.equals(text(map.get("event_id")), eventId)) {
                return map;
            }
        }
        return null;
    }

    /* -------------------- Reporting -------------------- */

    public EvaluationReport aggregateReport() {
        List<Evaluation> evaluations = store.listEvaluations();
        if (evaluations.isEmpty()) {
            return new EvaluationReport(0, null, null, null, null, null, 0, 0, null, "Insufficient data");
        }

        BigDecimal avgBrier = average(evaluations, m -> m.getBrierScore());
        BigDecimal avgLogLoss = average(evaluations, m -> m.getLogLoss());
        BigDecimal avgRoi = average(evaluations, m -> m.getRoi());
        BigDecimal avgEdge = average(evaluations, m -> m.getEdgeRealized());
        BigDecimal totalRoi = evaluations.stream()
                .map(e -> e.getMetrics().getRoi())
                .filter(Objects::nonNull)
                .reduce(BigDecimal::add)
                .orElse(null);

        int edgeWins = 0;
        int edgeLosses = 0;
        for (Evaluation evaluation : evaluations) {
            BigDecimal edge = evaluation.getMetrics().getEdgeRealized();
            if (edge == null) continue;
            if (edge.signum() > 0) edgeWins++;
            else if (edge.signum() < 0) edgeLosses++;
        }
        BigDecimal winRate = edgeWins + edgeLosses == 0 ? null
                : BigDecimal.valueOf(edgeWins).divide(BigDecimal.valueOf(edgeWins + edgeLosses), SCALE, RoundingMode.HALF_UP);

        return new EvaluationReport(evaluations.size(), avgBrier, avgLogLoss, avgRoi, totalRoi, avgEdge,
                edgeWins, edgeLosses, winRate, interpret(avgBrier, avgRoi, winRate));
    }

    static String interpret(BigDecimal brier, BigDecimal roi, BigDecimal edgeWinRate) {
        List<String> parts = new ArrayList<>();
        if (brier != null) {
            String verdict = brier.compareTo(new BigDecimal("0.2")) < 0 ? "good calibration"
                    : brier.compareTo(new BigDecimal("0.25")) < 0 ? "fair calibration"
                    : "needs improvement";
            parts.add(String.format("Brier %.3f (%s)", brier, verdict));
        }
        if (roi != null) {
            parts.add(String.format("ROI %+.1f%% (%s)", roi.movePointRight(2), roi.signum() > 0 ? "profitable" : "losing"));
        }
        if (edgeWinRate != null) {
            String verdict = edgeWinRate.compareTo(new BigDecimal("0.55")) > 0 ? "edge working"
                    : edgeWinRate.compareTo(new BigDecimal("0.45")) > 0 ? "inconclusive"
                    : "edge not working";
            parts.add(String.format("Edge bets %.0f%% win rate (%s)", edgeWinRate.movePointRight(2), verdict));
        }
        return parts.isEmpty() ? "Insufficient data" : String.join(" | ", parts);
    }

    private static BigDecimal average(List<Evaluation> evaluations, Function<EvaluationMetrics, BigDecimal> metric) {
        List<BigDecimal> values = evaluations.stream()
                .map(e -> metric.apply(e.getMetrics()))
                .filter(Objects::nonNull)
                .toList();
        if (values.isEmpty()) {
            return null;
        }
        return values.stream().reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(values.size()), SCALE, RoundingMode.HALF_UP);
    }
}
