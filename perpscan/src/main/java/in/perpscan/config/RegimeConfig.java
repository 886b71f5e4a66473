package in.perpscan.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Regime and holding-style thresholds.
 */
public record RegimeConfig(
    @JsonProperty("breakoutLookback")
    int breakoutLookback,            // bars inspected for band penetration and width expansion

    @JsonProperty("bandExpansionFactor")
    BigDecimal bandExpansionFactor,  // latest width must exceed factor x width lookback bars ago

    @JsonProperty("persistenceScalpMax")
    int persistenceScalpMax,         // persistence <= this is SCALP

    @JsonProperty("persistenceTrendMin")
    int persistenceTrendMin          // persistence >= this is TREND
) {
    public static RegimeConfig defaults() {
        return new RegimeConfig(5, BigDecimal.ONE, 3, 12);
    }
}
