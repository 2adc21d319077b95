package com.mouse.betinfo.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.mouse.betinfo.converter.JsonListConverter;
import com.mouse.betinfo.converter.JsonMapConverter;
import com.mouse.betinfo.enums.EntityType;
import com.mouse.betinfo.enums.ProposalStatus;
import com.mouse.betinfo.exception.InvalidTransitionException;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.ForeignKey;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PostUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A suggested change to the system, backed by evaluations. The status is the one
 * field in the ledger that may change after insert, and only forward.
 */
@Entity
@EntityListeners(ImmutableEntityListener.class)
@Table(
        name = "improvement_proposal",
        indexes = {
                @Index(name = "idx_proposal_status", columnList = "status")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@ToString(exclude = {"suggestedSchemaAdditions", "suggestedModules", "expectedImpact"})
public class ImprovementProposal extends LedgerRecord {

    @Id
    @Column(name = "proposal_id", length = 36)
    private String proposalId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
            name = "proposal_evaluation",
            joinColumns = @JoinColumn(name = "proposal_id", foreignKey = @ForeignKey(name = "fk_proposal_evaluation_proposal"))
    )
    @OrderColumn(name = "position")
    @Column(name = "evaluation_id", length = 36, nullable = false)
    private List<String> basedOnEvaluationIds = new ArrayList<>();

    @Column(name = "proposal_text", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String proposalText;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "suggested_schema_additions", columnDefinition = "TEXT", updatable = false)
    private Map<String, Object> suggestedSchemaAdditions;

    @Convert(converter = JsonListConverter.class)
    @Column(name = "suggested_modules", columnDefinition = "TEXT", updatable = false)
    private List<Object> suggestedModules;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "expected_impact", columnDefinition = "TEXT", updatable = false)
    private Map<String, Object> expectedImpact;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ProposalStatus status;

    @Transient
    private boolean statusTransitionAuthorised;

    @Builder
    private ImprovementProposal(Instant createdAt,
                                List<String> basedOnEvaluationIds,
                                String proposalText,
                                Map<String, Object> suggestedSchemaAdditions,
                                List<?> suggestedModules,
                                Map<String, Object> expectedImpact) {
        if (basedOnEvaluationIds == null || basedOnEvaluationIds.isEmpty()) {
            throw new IllegalArgumentException("A proposal must cite at least one evaluation");
        }
        this.proposalId = UUID.randomUUID().toString();
        this.createdAt = stamp(createdAt);
        this.basedOnEvaluationIds = new ArrayList<>(new LinkedHashSet<>(basedOnEvaluationIds));
        this.proposalText = require(proposalText, "proposalText");
        this.suggestedSchemaAdditions = suggestedSchemaAdditions == null ? null : new LinkedHashMap<>(suggestedSchemaAdditions);
        this.suggestedModules = suggestedModules == null ? null : new ArrayList<>(suggestedModules);
        this.expectedImpact = expectedImpact == null ? null : new LinkedHashMap<>(expectedImpact);
        this.status = ProposalStatus.PENDING;
        stampHash();
    }

    /**
     * Moves the status forward and re-stamps the hash. Nothing else is touched.
     *
     * @throws InvalidTransitionException if {@code next} is not reachable from the current status
     */
    public void transitionTo(ProposalStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidTransitionException(status, next);
        }
        this.status = next;
        this.statusTransitionAuthorised = true;
        stampHash();
    }

    @JsonIgnore
    public boolean isStatusTransitionAuthorised() {
        return statusTransitionAuthorised;
    }

    @PostUpdate
    void clearTransitionAuthorisation() {
        this.statusTransitionAuthorised = false;
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.PROPOSAL;
    }

    @Override
    public Map<String, Object> canonicalFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("based_on_evaluation_ids", new ArrayList<>(basedOnEvaluationIds));
        fields.put("proposal_text", proposalText);
        fields.put("suggested_schema_additions", suggestedSchemaAdditions);
        fields.put("suggested_modules", suggestedModules);
        fields.put("expected_impact", expectedImpact);
        fields.put("status", status.getValue());
        return fields;
    }

    @Override
    public String getId() {
        return proposalId;
    }

    public List<String> getBasedOnEvaluationIds() {
        return readOnly(basedOnEvaluationIds);
    }

    public Map<String, Object> getSuggestedSchemaAdditions() {
        return readOnly(suggestedSchemaAdditions);
    }

    public List<Object> getSuggestedModules() {
        return readOnly(suggestedModules);
    }

    public Map<String, Object> getExpectedImpact() {
        return readOnly(expectedImpact);
    }
}
