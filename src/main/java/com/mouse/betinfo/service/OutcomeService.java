package com.mouse.betinfo.service;

import com.mouse.betinfo.entity.FinalScore;
import com.mouse.betinfo.entity.Outcome;
import com.mouse.betinfo.exception.LedgerException;
import com.mouse.betinfo.interfaces.OutcomeSource;
import com.mouse.betinfo.model.BatchReport;
import com.mouse.betinfo.model.GameResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class OutcomeService {

    private final ImmutableStore store;
    private final List<OutcomeSource> sources;
    private final BatchRunner batchRunner;

    /**
     * Asks the outcome sources, in order, for a final result and records the first one found.
     *
     * @return empty while no source reports the game as final
     */
    public Optional<Outcome> ingest(String gameId) {
        if (sources.isEmpty()) {
            throw new LedgerException("No outcome source registered");
        }
        for (OutcomeSource source : sources) {
            Optional<GameResult> result = source.fetchResult(gameId);
            if (result.isPresent()) {
                return Optional.of(record(result.get()));
            }
        }
        log.info("⏳ Game not final yet | gameId={}", gameId);
        return Optional.empty();
    }

    public Outcome record(GameResult result) {
        String winner = result.winner();
        Outcome outcome = Outcome.builder()
                .gameId(result.gameId())
                .occurredAt(result.completedAt())
                .finalScore(FinalScore.of(result.homeScore(), result.awayScore()))
                .winner(winner == null ? Outcome.TIE : winner)
                .statsSummary(result.stats())
                .source(result.source())
                .build();
        Outcome stored = store.insertOutcome(outcome);
        log.info("🏁 Outcome recorded | gameId={} | score={}-{} | winner={}",
                stored.getGameId(), result.homeScore(), result.awayScore(), stored.getWinner());
        return stored;
    }

    /** Settles every game that has snapshots but no outcome yet. */
    public BatchReport<Outcome> ingestPending() {
        return batchRunner.run("ingest-outcomes", store.gamesWithoutOutcome(), this::ingest);
    }
}
