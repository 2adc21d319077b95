package com.mouse.betinfo.exception;

import com.mouse.betinfo.enums.EntityType;
import lombok.Getter;

/**
 * An insert referenced an id that is not stored (or that points at the wrong game).
 * The insert is rejected as a whole.
 */
@Getter
public class ReferentialIntegrityException extends LedgerException {

    private final EntityType entityType;
    private final String field;
    private final String referencedId;

    public ReferentialIntegrityException(EntityType entityType, String field, String referencedId) {
        this(entityType, field, referencedId,
                String.format("%s.%s references missing id %s", entityType, field, referencedId));
    }

    public ReferentialIntegrityException(EntityType entityType, String field, String referencedId, String message) {
        super(message);
        this.entityType = entityType;
        this.field = field;
        this.referencedId = referencedId;
    }
}
