package com.mouse.betinfo.entity;

import com.mouse.betinfo.converter.JsonListConverter;
import com.mouse.betinfo.converter.JsonMapConverter;
import com.mouse.betinfo.enums.EntityType;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.FetchType;
import jakarta.persistence.ForeignKey;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A node of the lineage DAG: reasoning derived from one or more snapshots,
 * optionally refining an earlier analysis.
 */
@Entity
@Immutable
@EntityListeners(ImmutableEntityListener.class)
@Table(
        name = "analysis",
        indexes = {
                @Index(name = "idx_analysis_parent", columnList = "parent_analysis_id"),
                @Index(name = "idx_analysis_created", columnList = "created_at")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_analysis_hash", columnNames = {"content_hash"})
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@ToString(exclude = {"derivedFeatures", "conclusions", "recommendedActions"})
public class Analysis extends LedgerRecord {

    @Id
    @Column(name = "analysis_id", length = 36)
    private String analysisId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "analysis_version", nullable = false, length = 32)
    private String analysisVersion;

    @Column(name = "code_version", nullable = false, length = 64)
    private String codeVersion;

    @Column(name = "model_version", length = 64)
    private String modelVersion;

    @Column(name = "parent_analysis_id", length = 36)
    private String parentAnalysisId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
            name = "analysis_snapshot",
            joinColumns = @JoinColumn(name = "analysis_id", foreignKey = @ForeignKey(name = "fk_analysis_snapshot_analysis"))
    )
    @OrderColumn(name = "position")
    @Column(name = "snapshot_id", length = 36, nullable = false)
    private List<String> inputSnapshotIds = new ArrayList<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "derived_features", columnDefinition = "TEXT", nullable = false)
    private Map<String, Object> derivedFeatures;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "conclusions", columnDefinition = "TEXT", nullable = false)
    private Map<String, Object> conclusions;

    @Convert(converter = JsonListConverter.class)
    @Column(name = "recommended_actions", columnDefinition = "TEXT", nullable = false)
    private List<Object> recommendedActions;

    @Builder
    private Analysis(Instant createdAt,
                     String analysisVersion,
                     String codeVersion,
                     String modelVersion,
                     String parentAnalysisId,
                     List<String> inputSnapshotIds,
                     Map<String, Object> derivedFeatures,
                     Map<String, Object> conclusions,
                     List<?> recommendedActions) {
        if (inputSnapshotIds == null || inputSnapshotIds.isEmpty()) {
            throw new IllegalArgumentException("An analysis needs at least one input snapshot");
        }
        this.analysisId = UUID.randomUUID().toString();
        this.createdAt = stamp(createdAt);
        this.analysisVersion = require(analysisVersion, "analysisVersion");
        this.codeVersion = require(codeVersion, "codeVersion");
        this.modelVersion = modelVersion;
        this.parentAnalysisId = parentAnalysisId;
        // ordered, duplicates collapsed
        this.inputSnapshotIds = new ArrayList<>(new LinkedHashSet<>(inputSnapshotIds));
        this.derivedFeatures = derivedFeatures == null ? new LinkedHashMap<>() : new LinkedHashMap<>(derivedFeatures);
        this.conclusions = conclusions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(conclusions);
        this.recommendedActions = recommendedActions == null ? new ArrayList<>() : new ArrayList<>(recommendedActions);
        stampHash();
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.ANALYSIS;
    }

    @Override
    public Map<String, Object> canonicalFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("analysis_version", analysisVersion);
        fields.put("code_version", codeVersion);
        fields.put("model_version", modelVersion);
        fields.put("parent_analysis_id", parentAnalysisId);
        fields.put("input_snapshot_ids", new ArrayList<>(inputSnapshotIds));
        fields.put("derived_features", derivedFeatures);
        fields.put("conclusions", conclusions);
        fields.put("recommended_actions", recommendedActions);
        return fields;
    }

    public boolean isRoot() {
        return parentAnalysisId == null;
    }

    @Override
    public String getId() {
        return analysisId;
    }

    public List<String> getInputSnapshotIds() {
        return readOnly(inputSnapshotIds);
    }

    public Map<String, Object> getDerivedFeatures() {
        return readOnly(derivedFeatures);
    }

    public Map<String, Object> getConclusions() {
        return readOnly(conclusions);
    }

    public List<Object> getRecommendedActions() {
        return readOnly(recommendedActions);
    }
}
