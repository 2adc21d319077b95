package com.mouse.betinfo.model;

import java.math.BigDecimal;

/**
 * Two-way market with the bookmaker margin removed.
 *
 * @param rawA      implied probability of side A, vig included
 * @param rawB      implied probability of side B, vig included
 * @param overround rawA + rawB
 * @param noVigA    rawA / overround
 * @param noVigB    rawB / overround
 */
public record NoVigProbabilities(BigDecimal rawA,
                                 BigDecimal rawB,
                                 BigDecimal overround,
                                 BigDecimal noVigA,
                                 BigDecimal noVigB) {

    public BigDecimal vig() {
        return overround.subtract(BigDecimal.ONE);
    }
}
