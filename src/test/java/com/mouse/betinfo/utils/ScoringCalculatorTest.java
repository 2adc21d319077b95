package com.mouse.betinfo.utils;

import com.mouse.betinfo.enums.EdgeDirection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScoringCalculatorTest {

    @Test
    void brierAndLogLoss_p07_win() {
        BigDecimal p = new BigDecimal("0.7");

        assertThat(ScoringCalculator.brierScore(p, true)).isEqualByComparingTo("0.09");
        assertThat(ScoringCalculator.logLoss(p, true).doubleValue()).isCloseTo(0.3567, within(1e-4));
    }

    @Test
    void brierAndLogLoss_p07_loss() {
        BigDecimal p = new BigDecimal("0.7");

        assertThat(ScoringCalculator.brierScore(p, false)).isEqualByComparingTo("0.49");
        assertThat(ScoringCalculator.logLoss(p, false).doubleValue()).isCloseTo(-Math.log(0.3), within(1e-12));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "0.000001", "0.25", "0.5", "0.579832", "0.999999", "1"})
    void brierScore_alwaysWithinUnitInterval(String probability) {
        BigDecimal p = new BigDecimal(probability);

        for (boolean happened : new boolean[]{true, false}) {
            BigDecimal brier = ScoringCalculator.brierScore(p, happened);
            assertThat(brier).isBetween(BigDecimal.ZERO, BigDecimal.ONE);
        }
    }

    @Test
    void logLoss_certainForecastIsClamped() {
        BigDecimal loss = ScoringCalculator.logLoss(BigDecimal.ZERO, true, 1e-9);

        assertThat(loss.doubleValue()).isCloseTo(-Math.log(1e-9), within(1e-9));
        assertThat(ScoringCalculator.logLoss(BigDecimal.ONE, true).doubleValue()).isCloseTo(0.0, within(1e-8));
    }

    @Test
    void outOfRangeProbability_throws() {
        assertThatThrownBy(() -> ScoringCalculator.brierScore(new BigDecimal("1.2"), true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScoringCalculator.logLoss(new BigDecimal("-0.1"), false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScoringCalculator.brierScore(null, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void roi_winPaysLineLossCostsStake() {
        assertThat(ScoringCalculator.roi(130, true)).isEqualByComparingTo("1.3");
        assertThat(ScoringCalculator.roi(-200, true)).isEqualByComparingTo("0.5");
        assertThat(ScoringCalculator.roi(-200, false)).isEqualByComparingTo("-1");
    }

    @Test
    void edgeRealized_followsBackedSide() {
        BigDecimal delta = new BigDecimal("-0.05");

        // book higher backs the home side
        assertThat(ScoringCalculator.edgeRealized(delta, EdgeDirection.BOOK_HIGHER, true, true)).isEqualByComparingTo("0.05");
        assertThat(ScoringCalculator.edgeRealized(delta, EdgeDirection.BOOK_HIGHER, true, false)).isEqualByComparingTo("-0.05");

        BigDecimal positive = new BigDecimal("0.04");
        assertThat(ScoringCalculator.edgeRealized(positive, EdgeDirection.MARKET_HIGHER, true, false)).isEqualByComparingTo("0.04");
        assertThat(ScoringCalculator.edgeRealized(positive, EdgeDirection.MARKET_HIGHER, true, true)).isEqualByComparingTo("-0.04");
    }

    @Test
    void edgeRealized_nothingFlagged_isNull() {
        assertThat(ScoringCalculator.edgeRealized(new BigDecimal("-0.009832"), EdgeDirection.BOOK_HIGHER, false, true)).isNull();
        assertThat(ScoringCalculator.edgeRealized(null, null, true, true)).isNull();
    }
}
