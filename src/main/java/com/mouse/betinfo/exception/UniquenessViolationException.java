package com.mouse.betinfo.exception;

import com.mouse.betinfo.enums.EntityType;
import lombok.Getter;

@Getter
public class UniquenessViolationException extends LedgerException {

    private final EntityType entityType;
    private final String key;
    private final String existingId;

    public UniquenessViolationException(EntityType entityType, String key, String existingId) {
        super(String.format("%s already exists for key %s (existing id %s)", entityType, key, existingId));
        this.entityType = entityType;
        this.key = key;
        this.existingId = existingId;
    }
}
