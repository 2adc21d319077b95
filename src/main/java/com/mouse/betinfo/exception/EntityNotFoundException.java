package com.mouse.betinfo.exception;

import com.mouse.betinfo.enums.EntityType;
import lombok.Getter;

@Getter
public class EntityNotFoundException extends LedgerException {

    private final EntityType entityType;
    private final String entityId;

    public EntityNotFoundException(EntityType entityType, String entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }
}
