package com.mouse.betinfo.utils;

import com.mouse.betinfo.enums.EdgeDirection;
import com.mouse.betinfo.model.EdgeSignal;
import com.mouse.betinfo.model.NoVigProbabilities;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Price conversions used to compare a prediction market with a sportsbook.
 * Everything here is a pure function of its arguments.
 */
@Slf4j
public final class OddsCalculator {

    public static final int PROBABILITY_SCALE = 6;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    // High precision for intermediate steps; rounding only when a value is reported.
    private static final MathContext MC = new MathContext(34, RoundingMode.HALF_EVEN);

    private OddsCalculator() {
    }

    /**
     * American line to implied probability, vig included.
     * -L gives L / (L + 100); +L gives 100 / (L + 100).
     */
    public static BigDecimal americanToProbability(int americanOdds) {
        if (americanOdds == 0 || Math.abs(americanOdds) < 100) {
            throw new IllegalArgumentException("Not a valid American line: " + americanOdds);
        }
        BigDecimal line = BigDecimal.valueOf(Math.abs((long) americanOdds));
        BigDecimal denominator = line.add(HUNDRED);
        return americanOdds < 0
                ? line.divide(denominator, MC)
                : HUNDRED.divide(denominator, MC);
    }

    /**
     * Removes the bookmaker margin from a two-way market: each raw probability is
     * divided by their sum, so the pair adds up to one.
     */
    public static NoVigProbabilities noVig(int americanOddsA, int americanOddsB) {
        return noVig(americanToProbability(americanOddsA), americanToProbability(americanOddsB));
    }

    public static NoVigProbabilities noVig(BigDecimal rawA, BigDecimal rawB) {
        BigDecimal overround = rawA.add(rawB, MC);
        if (overround.signum() <= 0) {
            throw new IllegalArgumentException("Implied probabilities must sum above zero");
        }
        return new NoVigProbabilities(rawA, rawB, overround,
                rawA.divide(overround, MC),
                rawB.divide(overround, MC));
    }

    /**
     * Mid of best bid and best ask, quoted in cents, as a probability.
     */
    public static BigDecimal midProbability(BigDecimal bidCents, BigDecimal askCents) {
        if (bidCents == null || askCents == null) {
            throw new IllegalArgumentException("Both bid and ask are required");
        }
        return bidCents.add(askCents).divide(TWO, MC).divide(HUNDRED, MC);
    }

    /**
     * Signed delta = market - book. Magnitude strictly above {@code threshold} flags an edge candidate.
     */
    public static EdgeSignal edge(BigDecimal marketProbability, BigDecimal bookProbability, BigDecimal threshold) {
        BigDecimal delta = marketProbability.subtract(bookProbability, MC);
        boolean candidate = delta.abs().compareTo(threshold) > 0;
        if (candidate) {
            log.debug("Edge candidate | market={} | book={} | delta={}", marketProbability, bookProbability, delta);
        }
        return new EdgeSignal(marketProbability, bookProbability, delta, EdgeDirection.of(delta), candidate);
    }

    /**
     * Profit on a one-unit winning stake: +L pays L/100, -L pays 100/L.
     */
    public static BigDecimal winProfitPerUnit(int americanOdds) {
        if (americanOdds == 0 || Math.abs(americanOdds) < 100) {
            throw new IllegalArgumentException("Not a valid American line: " + americanOdds);
        }
        return americanOdds > 0
                ? BigDecimal.valueOf(americanOdds).divide(HUNDRED, MC)
                : HUNDRED.divide(BigDecimal.valueOf(Math.abs((long) americanOdds)), MC);
    }

    public static BigDecimal round(BigDecimal value) {
        return value == null ? null : value.setScale(PROBABILITY_SCALE, RoundingMode.HALF_UP);
    }
}
