package com.mouse.betinfo.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.mouse.betinfo.enums.EntityType;
import com.mouse.betinfo.utils.CanonicalHasher;
import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Transient;
import lombok.Getter;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Common shape of every ledger record: an assigned id and a content hash over the
 * record's canonical field set. Ids are assigned at construction, so {@link #isNew()}
 * is tracked explicitly and a save always becomes a plain INSERT.
 */
@MappedSuperclass
public abstract class LedgerRecord implements Persistable<String> {

    @Getter
    @Column(name = "content_hash", length = 64, nullable = false)
    protected String contentHash;

    @Transient
    private boolean newRecord = true;

    @JsonIgnore
    public abstract EntityType getEntityType();

    /**
     * Fields covered by the content hash, keyed by their persisted names.
     * Never includes the hash itself.
     */
    public abstract Map<String, Object> canonicalFields();

    public String computeHash() {
        return CanonicalHasher.hash(canonicalFields());
    }

    @JsonIgnore
    public boolean isHashValid() {
        return Objects.equals(contentHash, computeHash());
    }

    protected void stampHash() {
        this.contentHash = computeHash();
    }

    @Override
    @JsonIgnore
    public boolean isNew() {
        return newRecord;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.newRecord = false;
    }

    protected static Instant stamp(Instant instant) {
        return (instant == null ? Instant.now() : instant).truncatedTo(ChronoUnit.MILLIS);
    }

    protected static String timestamp(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    protected static String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    protected static <T> List<T> readOnly(List<T> list) {
        return list == null ? null : Collections.unmodifiableList(list);
    }

    protected static <K, V> Map<K, V> readOnly(Map<K, V> map) {
        return map == null ? null : Collections.unmodifiableMap(map);
    }
}
