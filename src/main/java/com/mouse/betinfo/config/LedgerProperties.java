package com.mouse.betinfo.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Everything tunable about the ledger, bound from {@code ledger.*}.
 * Services get these values handed in; nothing below reads the environment.
 */
@Component
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    /** |delta| above this flags an edge candidate. */
    private BigDecimal edgeThreshold = new BigDecimal("0.03");

    private String schemaVersion = "1.0.0";

    /** Bump when the comparison logic changes. */
    private String analysisVersion = "1.0.0";

    /** Build or commit id stamped on every analysis. */
    private String codeVersion = "unknown";

    private String modelVersion;

    private double logLossEpsilon = 1e-9;

    /** Recommendations kept per analysis, ranked by edge magnitude. */
    private int maxRecommendations = 5;

    private int lockStripes = 64;

    private Batch batch = new Batch();

    private Verify verify = new Verify();

    @Getter
    @Setter
    public static class Batch {
        private int threads = 4;
        private long timeoutSeconds = 60;
    }

    @Getter
    @Setter
    public static class Verify {
        private int pageSize = 500;
    }
}
