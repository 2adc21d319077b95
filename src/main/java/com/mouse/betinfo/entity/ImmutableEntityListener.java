package com.mouse.betinfo.entity;

import com.mouse.betinfo.exception.ImmutabilityViolationException;
import jakarta.persistence.PreRemove;
import jakarta.persistence.PreUpdate;
import lombok.extern.slf4j.Slf4j;

/**
 * Last line of defence below the store: Hibernate never gets to flush an UPDATE or
 * DELETE for a ledger record. The one exception is a proposal whose status change
 * went through {@link ImprovementProposal#transitionTo}.
 */
@Slf4j
public class ImmutableEntityListener {

    @PreUpdate
    public void beforeUpdate(Object entity) {
        if (entity instanceof ImprovementProposal proposal && proposal.isStatusTransitionAuthorised()) {
            return;
        }
        LedgerRecord record = (LedgerRecord) entity;
        log.error("🚫 UPDATE BLOCKED | type={} | id={}", record.getEntityType(), record.getId());
        throw new ImmutabilityViolationException("update", record.getEntityType());
    }

    @PreRemove
    public void beforeRemove(Object entity) {
        LedgerRecord record = (LedgerRecord) entity;
        log.error("🚫 DELETE BLOCKED | type={} | id={}", record.getEntityType(), record.getId());
        throw new ImmutabilityViolationException("delete", record.getEntityType());
    }
}
