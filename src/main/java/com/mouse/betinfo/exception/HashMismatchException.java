package com.mouse.betinfo.exception;

import com.mouse.betinfo.enums.EntityType;
import lombok.Getter;

@Getter
public class HashMismatchException extends IntegrityException {

    private final EntityType entityType;
    private final String entityId;
    private final String expected;
    private final String actual;

    public HashMismatchException(EntityType entityType, String entityId, String expected, String actual) {
        super(String.format("Hash mismatch for %s %s: expected %s..., got %s...",
                entityType, entityId, abbreviate(expected), abbreviate(actual)));
        this.entityType = entityType;
        this.entityId = entityId;
        this.expected = expected;
        this.actual = actual;
    }

    private static String abbreviate(String hash) {
        if (hash == null) return "null";
        return hash.length() > 16 ? hash.substring(0, 16) : hash;
    }
}
