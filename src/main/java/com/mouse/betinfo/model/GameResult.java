package com.mouse.betinfo.model;

import java.time.Instant;
import java.util.Map;

/**
 * Final result of a game as reported by an outcome source.
 */
public record GameResult(String gameId,
                         String homeTeam,
                         String awayTeam,
                         int homeScore,
                         int awayScore,
                         Instant completedAt,
                         Map<String, Object> stats,
                         String source) {

    public String winner() {
        if (homeScore > awayScore) return homeTeam;
        if (awayScore > homeScore) return awayTeam;
        return null;
    }
}
