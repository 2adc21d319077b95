package com.mouse.betinfo.entity;

import com.mouse.betinfo.converter.JsonMapConverter;
import com.mouse.betinfo.enums.EntityType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
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
 * An analysis scored against the outcome of its game.
 */
@Entity
@Immutable
@EntityListeners(ImmutableEntityListener.class)
@Table(
        name = "evaluation",
        indexes = {
                @Index(name = "idx_evaluation_analysis", columnList = "analysis_id"),
                @Index(name = "idx_evaluation_game", columnList = "game_id")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_evaluation_hash", columnNames = {"content_hash"})
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@ToString(exclude = "notes")
public class Evaluation extends LedgerRecord {

    @Id
    @Column(name = "evaluation_id", length = 36)
    private String evaluationId;

    @Column(name = "analysis_id", nullable = false, length = 36)
    private String analysisId;

    @Column(name = "game_id", nullable = false, length = 128)
    private String gameId;

    @Column(name = "scored_at", nullable = false)
    private Instant scoredAt;

    @Embedded
    private EvaluationMetrics metrics;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "notes", columnDefinition = "TEXT")
    private Map<String, Object> notes;

    @Builder
    private Evaluation(String analysisId,
                       String gameId,
                       Instant scoredAt,
                       EvaluationMetrics metrics,
                       Map<String, Object> notes) {
        this.evaluationId = UUID.randomUUID().toString();
        this.analysisId = require(analysisId, "analysisId");
        this.gameId = require(gameId, "gameId");
        this.scoredAt = stamp(scoredAt);
        this.metrics = metrics == null ? EvaluationMetrics.of(null, null, null, null) : metrics;
        this.notes = notes == null ? null : new LinkedHashMap<>(notes);
        stampHash();
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.EVALUATION;
    }

    @Override
    public Map<String, Object> canonicalFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("analysis_id", analysisId);
        fields.put("game_id", gameId);
        fields.put("metrics", getMetrics().toMap());
        fields.put("notes", notes);
        return fields;
    }

    @Override
    public String getId() {
        return evaluationId;
    }

    /** Hibernate hands back null for an embeddable whose columns are all null. */
    public EvaluationMetrics getMetrics() {
        return metrics == null ? EvaluationMetrics.of(null, null, null, null) : metrics;
    }

    public Map<String, Object> getNotes() {
        return readOnly(notes);
    }
}
