package com.mouse.betinfo.model;

import com.mouse.betinfo.enums.EntityType;

/**
 * A stored record whose recomputed hash differs from the stored one.
 * {@code actual} is null when the row could not be read back at all.
 */
public record HashMismatch(EntityType entityType, String entityId, String expected, String actual) {
}
