package com.mouse.betinfo.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores for one analysis against one outcome. Values are fixed at six decimals
 * before hashing so that what the database hands back hashes the same.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EvaluationMetrics {

    public static final int SCALE = 6;

    @Column(name = "brier_score", precision = 12, scale = SCALE)
    private BigDecimal brierScore;

    @Column(name = "log_loss", precision = 12, scale = SCALE)
    private BigDecimal logLoss;

    @Column(name = "roi", precision = 12, scale = SCALE)
    private BigDecimal roi;

    @Column(name = "edge_realized", precision = 12, scale = SCALE)
    private BigDecimal edgeRealized;

    private EvaluationMetrics(BigDecimal brierScore, BigDecimal logLoss, BigDecimal roi, BigDecimal edgeRealized) {
        this.brierScore = fix(brierScore);
        this.logLoss = fix(logLoss);
        this.roi = fix(roi);
        this.edgeRealized = fix(edgeRealized);
    }

    public static EvaluationMetrics of(BigDecimal brierScore, BigDecimal logLoss, BigDecimal roi, BigDecimal edgeRealized) {
        return new EvaluationMetrics(brierScore, logLoss, roi, edgeRealized);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("brier_score", brierScore);
        map.put("log_loss", logLoss);
        map.put("roi", roi);
        map.put("edge_realized", edgeRealized);
        return map;
    }

    private static BigDecimal fix(BigDecimal value) {
        return value == null ? null : value.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
