package com.mouse.betinfo.service;

import com.mouse.betinfo.config.LedgerProperties;
import com.mouse.betinfo.entity.Analysis;
import com.mouse.betinfo.entity.InfoSnapshot;
import com.mouse.betinfo.enums.BetSide;
import com.mouse.betinfo.enums.EdgeDirection;
import com.mouse.betinfo.model.BatchReport;
import com.mouse.betinfo.model.EdgeSignal;
import com.mouse.betinfo.model.NoVigProbabilities;
import com.mouse.betinfo.utils.OddsCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static com.mouse.betinfo.utils.NormalizedFields.AWAY_TEAM;
import static com.mouse.betinfo.utils.NormalizedFields.BEST_AWAY_ODDS;
import static com.mouse.betinfo.utils.NormalizedFields.BEST_HOME_ODDS;
import static com.mouse.betinfo.utils.NormalizedFields.COMMENCE_TIME;
import static com.mouse.betinfo.utils.NormalizedFields.EVENT_ID;
import static com.mouse.betinfo.utils.NormalizedFields.GAME_STATUS;
import static com.mouse.betinfo.utils.NormalizedFields.HOME_TEAM;
import static com.mouse.betinfo.utils.NormalizedFields.IMPLIED_PROBABILITY;
import static com.mouse.betinfo.utils.NormalizedFields.MARKET_ID;
import static com.mouse.betinfo.utils.NormalizedFields.ODDS_EVENTS;
import static com.mouse.betinfo.utils.NormalizedFields.PREDICTION_MARKETS;
import static com.mouse.betinfo.utils.NormalizedFields.TITLE;
import static com.mouse.betinfo.utils.NormalizedFields.VOLUME;
import static com.mouse.betinfo.utils.NormalizedFields.YES_ASK;
import static com.mouse.betinfo.utils.NormalizedFields.YES_BID;
import static com.mouse.betinfo.utils.NormalizedFields.decimal;
import static com.mouse.betinfo.utils.NormalizedFields.intValue;
import static com.mouse.betinfo.utils.NormalizedFields.mapList;
import static com.mouse.betinfo.utils.NormalizedFields.text;

/**
 * Turns snapshots into analyses: every sportsbook event of the snapshot is priced
 * without vig, matched to a prediction market by team names and compared against
 * the market mid. The same snapshot and the same version stamps always produce the
 * same derived features, so re-running an analysis deduplicates in the store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisService {

    public static final String ANALYSIS_TYPE = "market_vs_book_no_vig";

    // Leading words of franchise names that say nothing about the team
    private static final Set<String> CITY_WORDS = Set.of(
            "los", "angeles", "new", "york", "san", "francisco", "antonio",
            "golden", "state", "oklahoma", "city", "portland", "trail",
            "minnesota", "indiana", "milwaukee", "philadelphia", "phoenix",
            "detroit", "chicago", "boston", "miami", "orlando", "charlotte",
            "atlanta", "cleveland", "toronto", "brooklyn", "washington",
            "denver", "utah", "sacramento", "memphis", "dallas", "houston"
    );

    private final ImmutableStore store;
    private final LedgerProperties properties;
    private final BatchRunner batchRunner;

    /**
     * Analyses the latest snapshot of a game.
     *
     * @return empty when the game has no snapshot or nothing in it could be compared
     */
    public Optional<Analysis> analyzeGame(String gameId, String parentAnalysisId) {
        Optional<InfoSnapshot> latest = store.latestSnapshot(gameId);
        if (latest.isEmpty()) {
            log.warn("No snapshot to analyze | gameId={}", gameId);
            return Optional.empty();
        }
        return analyzeSnapshots(List.of(latest.get()), parentAnalysisId);
    }

    /**
     * Point-in-time variant: analyses what was known about the game at {@code asOf}.
     */
    public Optional<Analysis> analyzeGameAsOf(String gameId, Instant asOf, String parentAnalysisId) {
        Optional<InfoSnapshot> snapshot = store.latestSnapshotAsOf(gameId, asOf);
        if (snapshot.isEmpty()) {
            log.warn("No snapshot as of {} | gameId={}", asOf, gameId);
            return Optional.empty();
        }
        return analyzeSnapshots(List.of(snapshot.get()), parentAnalysisId);
    }

    /**
     * Compares the most recent of {@code snapshots}; all of them are recorded as inputs.
     */
    public Optional<Analysis> analyzeSnapshots(List<InfoSnapshot> snapshots, String parentAnalysisId) {
        if (snapshots == null || snapshots.isEmpty()) {
            throw new IllegalArgumentException("At least one snapshot is required");
        }
        InfoSnapshot primary = snapshots.stream()
                .max(Comparator.comparing(InfoSnapshot::getCollectedAt))
                .orElseThrow();

        Optional<Comparison> comparison = compare(primary, properties.getEdgeThreshold(), properties.getMaxRecommendations());
        if (comparison.isEmpty()) {
            log.info("Nothing comparable in snapshot | gameId={} | snapshotId={}", primary.getGameId(), primary.getSnapshotId());
            return Optional.empty();
        }

        Analysis analysis = Analysis.builder()
                .analysisVersion(properties.getAnalysisVersion())
                .codeVersion(properties.getCodeVersion())
                .modelVersion(properties.getModelVersion())
                .parentAnalysisId(parentAnalysisId)
                .inputSnapshotIds(snapshots.stream().map(InfoSnapshot::getSnapshotId).toList())
                .derivedFeatures(comparison.get().derivedFeatures())
                .conclusions(comparison.get().conclusions())
                .recommendedActions(comparison.get().recommendedActions())
                .build();

        Analysis stored = store.insertAnalysis(analysis);
        log.info("🧠 Analysis ready | gameId={} | analysisId={} | matched={} | edges={}",
                primary.getGameId(), stored.getAnalysisId(),
                comparison.get().conclusions().get("matched_with_market"),
                comparison.get().conclusions().get("significant_edges"));
        return Optional.of(stored);
    }

    /**
     * One unit per game that has snapshots. A failing game is reported, not fatal.
     */
    public BatchReport<Analysis> analyzeAll() {
        return batchRunner.run("analyze-all", store.listGameIds(), gameId -> analyzeGame(gameId, null));
    }

    /* -------------------- Comparison (pure) -------------------- */

    public record Comparison(Map<String, Object> derivedFeatures,
                             Map<String, Object> conclusions,
                             List<Map<String, Object>> recommendedActions) {
    }

    /**
     * Derived features, conclusions and recommendations for one snapshot. Empty when the
     * snapshot holds no event with a home team and both lines.
     */
    public static Optional<Comparison> compare(InfoSnapshot snapshot, BigDecimal threshold, int maxRecommendations) {
        Map<String, Object> normalized = snapshot.getNormalizedFields();
        List<Map<String, Object>> events = mapList(normalized, ODDS_EVENTS);
        List<Map<String, Object>> markets = mapList(normalized, PREDICTION_MARKETS);

        List<Map<String, Object>> comparisons = new ArrayList<>();
        for (Map<String, Object> event : events) {
            compareEvent(event, markets, threshold).ifPresent(comparisons::add);
        }
        if (comparisons.isEmpty()) {
            return Optional.empty();
        }

        List<Map<String, Object>> edges = comparisons.stream()
                .filter(c -> Boolean.TRUE.equals(c.get("edge_candidate")))
                .toList();

        Map<String, Object> features = new LinkedHashMap<>();
        features.put("analysis_type", ANALYSIS_TYPE);
        features.put("game_id", snapshot.getGameId());
        features.put("snapshot_collected_at", snapshot.getCollectedAt().toString());
        features.put("event_count", events.size());
        features.put("matched_count", comparisons.stream().filter(c -> Boolean.TRUE.equals(c.get("matched"))).count());
        features.put("edge_threshold", threshold);
        features.put("edges_above_threshold", edges.size());
        features.put("comparisons", comparisons);

        return Optional.of(new Comparison(features,
                buildConclusions(comparisons, edges, threshold),
                buildRecommendations(edges, maxRecommendations)));
    }

    static Optional<Map<String, Object>> compareEvent(Map<String, Object> event,
                                                      List<Map<String, Object>> markets,
                                                      BigDecimal threshold) {
        String homeTeam = text(event.get(HOME_TEAM));
        String awayTeam = text(event.get(AWAY_TEAM));
        Integer homeOdds = intValue(event.get(BEST_HOME_ODDS));
        Integer awayOdds = intValue(event.get(BEST_AWAY_ODDS));
        if (homeTeam == null || homeTeam.isBlank() || homeOdds == null || awayOdds == null) {
            return Optional.empty();
        }

        NoVigProbabilities book;
        try {
            book = OddsCalculator.noVig(homeOdds, awayOdds);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping event with unusable lines | eventId={} | home={} | away={} | reason={}",
                    event.get(EVENT_ID), homeOdds, awayOdds, e.getMessage());
            return Optional.empty();
        }

        Map<String, Object> comparison = new LinkedHashMap<>();
        comparison.put("event_id", text(event.get(EVENT_ID)));
        comparison.put("home_team", homeTeam);
        comparison.put("away_team", awayTeam);
        comparison.put("commence_time", text(event.get(COMMENCE_TIME)));
        comparison.put("game_status", event.getOrDefault(GAME_STATUS, "pre_game"));
        comparison.put("book_home_odds", homeOdds);
        comparison.put("book_away_odds", awayOdds);
        comparison.put("book_home_prob_raw", OddsCalculator.round(book.rawA()));
        comparison.put("book_away_prob_raw", OddsCalculator.round(book.rawB()));
        comparison.put("overround", OddsCalculator.round(book.overround()));
        comparison.put("vig", OddsCalculator.round(book.vig()));
        comparison.put("book_home_prob", OddsCalculator.round(book.noVigA()));
        comparison.put("book_away_prob", OddsCalculator.round(book.noVigB()));

        Optional<Map<String, Object>> market = findMarket(homeTeam, awayTeam, markets);
        if (market.isEmpty()) {
            comparison.put("matched", false);
            comparison.put("edge_candidate", false);
            comparison.put("match_note", "No prediction market found");
            return Optional.of(comparison);
        }

        BigDecimal marketProbability = marketProbability(market.get());
        comparison.put("market_id", text(market.get().get(MARKET_ID)));
        comparison.put("market_title", text(market.get().get(TITLE)));
        if (marketProbability == null) {
            comparison.put("matched", false);
            comparison.put("edge_candidate", false);
            comparison.put("match_note", "Prediction market found but no price");
            return Optional.of(comparison);
        }

        EdgeSignal signal = OddsCalculator.edge(marketProbability, book.noVigA(), threshold);
        comparison.put("market_yes_bid", decimal(market.get().get(YES_BID)));
        comparison.put("market_yes_ask", decimal(market.get().get(YES_ASK)));
        comparison.put("market_volume", decimal(market.get().get(VOLUME)));
        comparison.put("market_prob", OddsCalculator.round(marketProbability));
        comparison.put("delta_home", OddsCalculator.round(signal.delta()));
        comparison.put("edge_magnitude", OddsCalculator.round(signal.magnitude()));
        comparison.put("edge_direction", signal.direction().getValue());
        comparison.put("edge_candidate", signal.edgeCandidate());
        comparison.put("matched", true);
        return Optional.of(comparison);
    }

    /** Mid of bid/ask when both are quoted, else a provider-computed probability. */
    static BigDecimal marketProbability(Map<String, Object> market) {
        BigDecimal bid = decimal(market.get(YES_BID));
        BigDecimal ask = decimal(market.get(YES_ASK));
        if (bid != null && ask != null) {
            return OddsCalculator.midProbability(bid, ask);
        }
        return decimal(market.get(IMPLIED_PROBABILITY));
    }

    static Optional<Map<String, Object>> findMarket(String homeTeam, String awayTeam, List<Map<String, Object>> markets) {
        String homeLower = homeTeam.toLowerCase(Locale.ROOT);
        String awayLower = awayTeam == null ? "" : awayTeam.toLowerCase(Locale.ROOT);
        List<String> homeKeywords = teamKeywords(homeTeam);
        List<String> awayKeywords = teamKeywords(awayTeam);

        for (Map<String, Object> market : markets) {
            String title = text(market.get(TITLE));
            if (title == null) {
                continue;
            }
            String lower = title.toLowerCase(Locale.ROOT);
            boolean homeFound = homeKeywords.stream().anyMatch(lower::contains);
            boolean awayFound = awayKeywords.stream().anyMatch(lower::contains);
            if (homeFound && awayFound) {
                return Optional.of(market);
            }
            if (!awayLower.isEmpty() && lower.contains(homeLower) && lower.contains(awayLower)) {
                return Optional.of(market);
            }
        }
        return Optional.empty();
    }

    /** Full lower-cased name plus the nickname ("lakers" for "Los Angeles Lakers"). */
    static List<String> teamKeywords(String teamName) {
        if (teamName == null || teamName.isBlank()) {
            return List.of();
        }
        String lower = teamName.toLowerCase(Locale.ROOT).trim();
        List<String> keywords = new ArrayList<>();
        keywords.add(lower);
        String[] words = lower.split("\\s+");
        String last = words[words.length - 1];
        if (words.length > 1 && !CITY_WORDS.contains(last)) {
            keywords.add(last);
        }
        return keywords;
    }

    static Map<String, Object> buildConclusions(List<Map<String, Object>> comparisons,
                                                List<Map<String, Object>> edges,
                                                BigDecimal threshold) {
        List<Map<String, Object>> matched = comparisons.stream()
                .filter(c -> Boolean.TRUE.equals(c.get("matched")))
                .toList();
        long marketHigher = matched.stream()
                .filter(c -> EdgeDirection.MARKET_HIGHER.getValue().equals(c.get("edge_direction")))
                .count();

        BigDecimal avgDelta = average(matched.stream().map(c -> decimal(c.get("delta_home"))).toList());
        BigDecimal avgVig = average(comparisons.stream().map(c -> decimal(c.get("vig"))).toList());

        Map<String, Object> conclusions = new LinkedHashMap<>();
        conclusions.put("total_events", comparisons.size());
        conclusions.put("matched_with_market", matched.size());
        conclusions.put("unmatched", comparisons.size() - matched.size());
        conclusions.put("market_higher_count", marketHigher);
        conclusions.put("book_higher_count", matched.size() - marketHigher);
        conclusions.put("avg_delta", avgDelta);
        conclusions.put("avg_vig", avgVig);
        conclusions.put("significant_edges", edges.size());
        conclusions.put("summary", summary(matched, edges, threshold));
        return conclusions;
    }

    static String summary(List<Map<String, Object>> matched, List<Map<String, Object>> edges, BigDecimal threshold) {
        String pct = threshold.movePointRight(2).stripTrailingZeros().toPlainString() + "%";
        if (matched.isEmpty()) {
            return "No prediction markets matched to sportsbook events.";
        }
        if (edges.isEmpty()) {
            return String.format("Analyzed %d matched events. No edges above %s.", matched.size(), pct);
        }
        String teams = edges.stream()
                .limit(3)
                .map(e -> text(e.get("home_team")))
                .collect(Collectors.joining(", "));
        return String.format("Found %d edge(s) above %s across %d matched events. Top: %s",
                edges.size(), pct, matched.size(), teams);
    }

    static List<Map<String, Object>> buildRecommendations(List<Map<String, Object>> edges, int limit) {
        List<Map<String, Object>> ranked = new ArrayList<>(edges);
        ranked.sort(Comparator.comparing((Map<String, Object> e) -> decimal(e.get("edge_magnitude"))).reversed());

        List<Map<String, Object>> actions = new ArrayList<>();
        for (Map<String, Object> edge : ranked.subList(0, Math.min(limit, ranked.size()))) {
            EdgeDirection direction = EdgeDirection.fromValue(text(edge.get("edge_direction")));
            BetSide side = direction.backedSide();
            String team = text(edge.get(side == BetSide.HOME ? "home_team" : "away_team"));
            Object odds = edge.get(side == BetSide.HOME ? "book_home_odds" : "book_away_odds");

            Map<String, Object> action = new LinkedHashMap<>();
            action.put("type", "potential_edge");
            action.put("event_id", edge.get("event_id"));
            action.put("game", edge.get("away_team") + " @ " + edge.get("home_team"));
            action.put("side", side.getValue());
            action.put("team", team);
            action.put("american_odds", odds);
            action.put("stake_units", 1);
            action.put("market_id", edge.get("market_id"));
            action.put("market_prob", edge.get("market_prob"));
            action.put("book_prob", edge.get("book_home_prob"));
            action.put("delta", edge.get("delta_home"));
            action.put("edge_direction", direction.getValue());
            action.put("signal", String.format("Market %s%% vs book on %s, back %s",
                    decimal(edge.get("delta_home")).movePointRight(2).setScale(2, RoundingMode.HALF_UP).toPlainString(),
                    edge.get("home_team"), team));
            actions.add(action);
        }
        return actions;
    }

    private static BigDecimal average(List<BigDecimal> values) {
        List<BigDecimal> present = values.stream().filter(v -> v != null).toList();
        if (present.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal sum = present.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(present.size()), OddsCalculator.PROBABILITY_SCALE, RoundingMode.HALF_UP);
    }
}
