package com.mouse.betinfo.model;

import java.math.BigDecimal;

public record EvaluationReport(long totalEvaluations,
                               BigDecimal avgBrierScore,
                               BigDecimal avgLogLoss,
                               BigDecimal avgRoi,
                               BigDecimal totalRoi,
                               BigDecimal avgEdgeRealized,
                               int edgeBetsWon,
                               int edgeBetsLost,
                               BigDecimal edgeWinRate,
                               String interpretation) {
}
