package com.mouse.betinfo.exception;

import com.mouse.betinfo.enums.EntityType;
import lombok.Getter;

/**
 * Raised on any attempt to change or delete a stored record outside the
 * proposal status transition. Never retried.
 */
@Getter
public class ImmutabilityViolationException extends LedgerException {

    private final String operation;
    private final EntityType entityType;

    public ImmutabilityViolationException(String operation, EntityType entityType) {
        super(String.format("Cannot %s on immutable %s", operation, entityType));
        this.operation = operation;
        this.entityType = entityType;
    }
}
