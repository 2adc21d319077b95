package com.mouse.betinfo.utils;

import com.mouse.betinfo.enums.EdgeDirection;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Proper scoring rules and betting returns for a single binary forecast.
 */
public final class ScoringCalculator {

    public static final double DEFAULT_EPSILON = 1e-9;
    private static final MathContext MC = new MathContext(34, RoundingMode.HALF_EVEN);

    private ScoringCalculator() {
    }

    /**
     * (p - a)^2 with a in {0, 1}. Always within [0, 1].
     */
    public static BigDecimal brierScore(BigDecimal probability, boolean happened) {
        checkProbability(probability);
        BigDecimal actual = happened ? BigDecimal.ONE : BigDecimal.ZERO;
        BigDecimal error = probability.subtract(actual);
        return error.multiply(error, MC);
    }

    /**
     * -[a ln p + (1 - a) ln(1 - p)], p clamped to [epsilon, 1 - epsilon].
     */
    public static BigDecimal logLoss(BigDecimal probability, boolean happened, double epsilon) {
        checkProbability(probability);
        double p = Math.min(Math.max(probability.doubleValue(), epsilon), 1.0 - epsilon);
        double loss = happened ? -Math.log(p) : -Math.log(1.0 - p);
        return BigDecimal.valueOf(loss);
    }

    public static BigDecimal logLoss(BigDecimal probability, boolean happened) {
        return logLoss(probability, happened, DEFAULT_EPSILON);
    }

    /**
     * (payout - stake) / stake for one unit staked at {@code americanOdds}:
     * the win profit when the bet landed, -1 when it did not.
     */
    public static BigDecimal roi(int americanOdds, boolean won) {
        return won ? OddsCalculator.winProfitPerUnit(americanOdds) : BigDecimal.ONE.negate();
    }

    /**
     * +|delta| when the flagged direction matched what happened to the home side,
     * -|delta| when it did not, null when no edge was flagged.
     * BOOK_HIGHER backs home (the market is cheap on home), MARKET_HIGHER backs away.
     */
    public static BigDecimal edgeRealized(BigDecimal delta, EdgeDirection direction, boolean edgeFlagged, boolean homeWon) {
        if (!edgeFlagged || delta == null || direction == null) {
            return null;
        }
        boolean backedHome = direction == EdgeDirection.BOOK_HIGHER;
        return backedHome == homeWon ? delta.abs() : delta.abs().negate();
    }

    private static void checkProbability(BigDecimal probability) {
        if (probability == null || probability.signum() < 0 || probability.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Probability must be within [0, 1]: " + probability);
        }
    }
}
