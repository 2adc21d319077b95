package com.mouse.betinfo.utils;

import com.mouse.betinfo.enums.EdgeDirection;
import com.mouse.betinfo.model.EdgeSignal;
import com.mouse.betinfo.model.NoVigProbabilities;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OddsCalculatorTest {

    private static final BigDecimal THRESHOLD = bd("0.03");

    // --------------- americanToProbability ----------------

    @Test
    void americanToProbability_favoriteAndUnderdog() {
        assertThat(OddsCalculator.round(OddsCalculator.americanToProbability(-150))).isEqualByComparingTo("0.6");
        assertThat(OddsCalculator.round(OddsCalculator.americanToProbability(130))).isEqualByComparingTo("0.434783");
        assertThat(OddsCalculator.americanToProbability(100)).isEqualByComparingTo("0.5");
        assertThat(OddsCalculator.americanToProbability(-100)).isEqualByComparingTo("0.5");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 99, -99, 50})
    void americanToProbability_invalidLine_throws(int line) {
        assertThatThrownBy(() -> OddsCalculator.americanToProbability(line))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // --------------- noVig ----------------

    @Test
    void noVig_minus150_plus130_matchesWorkedExample() {
        NoVigProbabilities p = OddsCalculator.noVig(-150, 130);

        assertThat(OddsCalculator.round(p.rawA())).isEqualByComparingTo("0.6");
        assertThat(OddsCalculator.round(p.rawB())).isEqualByComparingTo("0.434783");
        assertThat(OddsCalculator.round(p.overround())).isEqualByComparingTo("1.034783");
        assertThat(OddsCalculator.round(p.noVigA())).isEqualByComparingTo("0.579832");
        assertThat(OddsCalculator.round(p.noVigB())).isEqualByComparingTo("0.420168");
        assertThat(OddsCalculator.round(p.vig())).isEqualByComparingTo("0.034783");
    }

    @ParameterizedTest
    @CsvSource({"-150,130", "-110,-110", "250,-300", "-2000,1200", "100,100", "-105,-115"})
    void noVig_alwaysSumsToOne(int a, int b) {
        NoVigProbabilities p = OddsCalculator.noVig(a, b);

        assertThat(p.noVigA().add(p.noVigB()).doubleValue()).isCloseTo(1.0, within(1e-9));
        assertThat(p.noVigA().signum()).isPositive();
        assertThat(p.noVigB().signum()).isPositive();
    }

    // --------------- midProbability / edge ----------------

    @Test
    void midProbability_55and59cents_is057() {
        assertThat(OddsCalculator.midProbability(bd("55"), bd("59"))).isEqualByComparingTo("0.57");
    }

    @Test
    void midProbability_missingSide_throws() {
        assertThatThrownBy(() -> OddsCalculator.midProbability(null, bd("59")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void edge_smallDelta_notFlagged() {
        BigDecimal book = OddsCalculator.noVig(-150, 130).noVigA();
        BigDecimal market = OddsCalculator.midProbability(bd("55"), bd("59"));

        EdgeSignal signal = OddsCalculator.edge(market, book, THRESHOLD);

        assertThat(OddsCalculator.round(signal.delta())).isEqualByComparingTo("-0.009832");
        assertThat(signal.edgeCandidate()).isFalse();
        assertThat(signal.direction()).isEqualTo(EdgeDirection.BOOK_HIGHER);
    }

    @Test
    void edge_largeDelta_flaggedWithDirection() {
        EdgeSignal higher = OddsCalculator.edge(bd("0.65"), bd("0.58"), THRESHOLD);
        EdgeSignal lower = OddsCalculator.edge(bd("0.50"), bd("0.58"), THRESHOLD);

        assertThat(higher.edgeCandidate()).isTrue();
        assertThat(higher.direction()).isEqualTo(EdgeDirection.MARKET_HIGHER);
        assertThat(higher.magnitude()).isEqualByComparingTo("0.07");
        assertThat(lower.edgeCandidate()).isTrue();
        assertThat(lower.direction()).isEqualTo(EdgeDirection.BOOK_HIGHER);
    }

    @Test
    void edge_exactlyAtThreshold_notFlagged() {
        assertThat(OddsCalculator.edge(bd("0.63"), bd("0.60"), THRESHOLD).edgeCandidate()).isFalse();
    }

    // --------------- winProfitPerUnit ----------------

    @Test
    void winProfitPerUnit_positiveAndNegativeLines() {
        assertThat(OddsCalculator.winProfitPerUnit(130)).isEqualByComparingTo("1.3");
        assertThat(OddsCalculator.winProfitPerUnit(-200)).isEqualByComparingTo("0.5");
        assertThat(OddsCalculator.round(OddsCalculator.winProfitPerUnit(-150))).isEqualByComparingTo("0.666667");
    }

    private static BigDecimal bd(String s) {
        return new BigDecimal(s);
    }
}
