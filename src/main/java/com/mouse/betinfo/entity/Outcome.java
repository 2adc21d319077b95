package com.mouse.betinfo.entity;

import com.mouse.betinfo.converter.JsonMapConverter;
import com.mouse.betinfo.enums.EntityType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Ground truth for a finished game. Exactly one per game id.
 */
@Entity
@Immutable
@EntityListeners(ImmutableEntityListener.class)
@Table(
        name = "outcome",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_outcome_game", columnNames = {"game_id"}),
                @UniqueConstraint(name = "uq_outcome_hash", columnNames = {"content_hash"})
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@ToString(exclude = "statsSummary")
public class Outcome extends LedgerRecord {

    public static final String TIE = "tie";

    @Id
    @Column(name = "outcome_id", length = 36)
    private String outcomeId;

    @Column(name = "game_id", nullable = false, length = 128)
    private String gameId;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Embedded
    private FinalScore finalScore;

    /** Winning team name, or {@link #TIE}. */
    @Column(name = "winner", nullable = false, length = 128)
    private String winner;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "stats_summary", columnDefinition = "TEXT")
    private Map<String, Object> statsSummary;

    @Column(name = "source", nullable = false, length = 64)
    private String source;

    @Builder
    private Outcome(String gameId,
                    Instant occurredAt,
                    FinalScore finalScore,
                    String winner,
                    Map<String, Object> statsSummary,
                    String source) {
        if (finalScore == null) {
            throw new IllegalArgumentException("finalScore is required");
        }
        this.outcomeId = UUID.randomUUID().toString();
        this.gameId = require(gameId, "gameId");
        this.occurredAt = stamp(occurredAt);
        this.finalScore = finalScore;
        this.winner = settleWinner(winner, finalScore);
        this.statsSummary = statsSummary == null ? new LinkedHashMap<>() : new LinkedHashMap<>(statsSummary);
        this.source = require(source, "source");
        stampHash();
    }

    /**
     * A tied score settles as {@link #TIE}; any other score needs a named winner.
     */
    private static String settleWinner(String winner, FinalScore finalScore) {
        boolean named = winner != null && !winner.isBlank() && !TIE.equals(winner);
        if (finalScore.isTie() && named) {
            throw new IllegalArgumentException("Winner " + winner + " given for a tied score " + finalScore.getHome() + "-" + finalScore.getAway());
        }
        if (!finalScore.isTie() && !named) {
            throw new IllegalArgumentException("A winner is required for score " + finalScore.getHome() + "-" + finalScore.getAway());
        }
        return named ? winner : TIE;
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.OUTCOME;
    }

    @Override
    public Map<String, Object> canonicalFields() {
        Map<String, Object> score = new LinkedHashMap<>();
        score.put("home", finalScore.getHome());
        score.put("away", finalScore.getAway());

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("game_id", gameId);
        fields.put("occurred_at", timestamp(occurredAt));
        fields.put("final_score", score);
        fields.put("winner", winner);
        fields.put("stats_summary", statsSummary);
        fields.put("source", source);
        return fields;
    }

    public boolean isTie() {
        return TIE.equals(winner);
    }

    @Override
    public String getId() {
        return outcomeId;
    }

    public Map<String, Object> getStatsSummary() {
        return readOnly(statsSummary);
    }
}
