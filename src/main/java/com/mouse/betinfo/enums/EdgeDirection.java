package com.mouse.betinfo.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;

/**
 * Sign of (market mid - sportsbook no-vig) for the home side.
 */
@Getter
@RequiredArgsConstructor
public enum EdgeDirection {
    MARKET_HIGHER("market_higher"),

    BOOK_HIGHER("book_higher");

    private final String value;

    /**
     * Side the edge says to back: the side the market prices below the book.
     */
    public BetSide backedSide() {
        return this == BOOK_HIGHER ? BetSide.HOME : BetSide.AWAY;
    }

    public static EdgeDirection of(BigDecimal delta) {
        return delta.signum() > 0 ? MARKET_HIGHER : BOOK_HIGHER;
    }

    public static EdgeDirection fromValue(String value) {
        for (EdgeDirection direction : values()) {
            if (direction.value.equalsIgnoreCase(value) || direction.name().equalsIgnoreCase(value)) {
                return direction;
            }
        }
        return null;
    }
}
