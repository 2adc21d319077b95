package com.mouse.betinfo.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Lifecycle of an improvement proposal. Transitions only move forward.
 */
@Getter
@RequiredArgsConstructor
public enum ProposalStatus {

    /**
     * Proposal recorded, nobody has acted on it yet
     */
    PENDING("pending"),

    /**
     * Proposal approved for implementation
     */
    ACCEPTED("accepted"),

    /**
     * Proposal turned down (terminal)
     */
    REJECTED("rejected"),

    /**
     * Proposal shipped (terminal)
     */
    IMPLEMENTED("implemented");

    private final String value;

    public Set<ProposalStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(ACCEPTED, REJECTED, IMPLEMENTED);
            case ACCEPTED:
                return EnumSet.of(IMPLEMENTED);
            default:
                return EnumSet.noneOf(ProposalStatus.class);
        }
    }

    public boolean canTransitionTo(ProposalStatus next) {
        return next != null && allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return allowedNext().isEmpty();
    }

    /**
     * Get status from its stored value (case-insensitive)
     * @param value e.g. "accepted"
     * @return Optional containing the status if found
     */
    public static Optional<ProposalStatus> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value.trim()) || s.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
