package com.mouse.betinfo.model;

import com.mouse.betinfo.enums.EdgeDirection;

import java.math.BigDecimal;

/**
 * Prediction-market mid against a sportsbook no-vig probability for the same side.
 */
public record EdgeSignal(BigDecimal marketProbability,
                         BigDecimal bookProbability,
                         BigDecimal delta,
                         EdgeDirection direction,
                         boolean edgeCandidate) {

    public BigDecimal magnitude() {
        return delta.abs();
    }
}
