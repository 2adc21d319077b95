package com.mouse.betinfo.entity;

import com.mouse.betinfo.converter.JsonMapConverter;
import com.mouse.betinfo.converter.StringMapConverter;
import com.mouse.betinfo.enums.EntityType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
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
import java.util.TreeMap;
import java.util.UUID;

/**
 * What was known about one game at one moment: the verbatim provider payloads
 * plus the fields computed from them.
 */
@Entity
@Immutable
@EntityListeners(ImmutableEntityListener.class)
@Table(
        name = "info_snapshot",
        indexes = {
                @Index(name = "idx_snapshot_game_collected", columnList = "game_id,collected_at")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_snapshot_hash", columnNames = {"content_hash"})
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@ToString(exclude = {"rawPayloads", "normalizedFields"})
public class InfoSnapshot extends LedgerRecord {

    @Id
    @Column(name = "snapshot_id", length = 36)
    private String snapshotId;

    @Column(name = "game_id", nullable = false, length = 128)
    private String gameId;

    @Column(name = "collected_at", nullable = false)
    private Instant collectedAt;

    @Column(name = "schema_version", nullable = false, length = 32)
    private String schemaVersion;

    @Convert(converter = StringMapConverter.class)
    @Column(name = "source_versions", columnDefinition = "TEXT")
    private Map<String, String> sourceVersions;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "raw_payloads", columnDefinition = "TEXT", nullable = false)
    private Map<String, Object> rawPayloads;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "normalized_fields", columnDefinition = "TEXT", nullable = false)
    private Map<String, Object> normalizedFields;

    @Builder
    private InfoSnapshot(String gameId,
                         Instant collectedAt,
                         String schemaVersion,
                         Map<String, String> sourceVersions,
                         Map<String, Object> rawPayloads,
                         Map<String, Object> normalizedFields) {
        this.snapshotId = UUID.randomUUID().toString();
        this.gameId = require(gameId, "gameId");
        this.collectedAt = stamp(collectedAt);
        this.schemaVersion = require(schemaVersion, "schemaVersion");
        this.sourceVersions = sourceVersions == null ? new TreeMap<>() : new TreeMap<>(sourceVersions);
        this.rawPayloads = rawPayloads == null ? new LinkedHashMap<>() : new LinkedHashMap<>(rawPayloads);
        this.normalizedFields = normalizedFields == null ? new LinkedHashMap<>() : new LinkedHashMap<>(normalizedFields);
        stampHash();
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.SNAPSHOT;
    }

    @Override
    public Map<String, Object> canonicalFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("game_id", gameId);
        fields.put("collected_at", timestamp(collectedAt));
        fields.put("schema_version", schemaVersion);
        fields.put("source_versions", sourceVersions);
        fields.put("raw_payloads", rawPayloads);
        fields.put("normalized_fields", normalizedFields);
        return fields;
    }

    @Override
    public String getId() {
        return snapshotId;
    }

    public Map<String, String> getSourceVersions() {
        return readOnly(sourceVersions);
    }

    public Map<String, Object> getRawPayloads() {
        return readOnly(rawPayloads);
    }

    public Map<String, Object> getNormalizedFields() {
        return readOnly(normalizedFields);
    }
}
