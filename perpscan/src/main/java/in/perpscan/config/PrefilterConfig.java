package in.perpscan.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Liquidity and volatility gates applied to the medium horizon before scoring.
 */
public record PrefilterConfig(
    @JsonProperty("enabled")
    boolean enabled,

    @JsonProperty("minVolume")
    BigDecimal minVolume,

    @JsonProperty("minAtrRatio")
    BigDecimal minAtrRatio,

    @JsonProperty("rsiLower")
    BigDecimal rsiLower,             // exclusive

    @JsonProperty("rsiUpper")
    BigDecimal rsiUpper              // exclusive
) {
    public static PrefilterConfig defaults() {
        return new PrefilterConfig(true, new BigDecimal("1000"), new BigDecimal("0.001"),
            new BigDecimal("20"), new BigDecimal("80"));
    }

    public static PrefilterConfig disabled() {
        PrefilterConfig d = defaults();
        return new PrefilterConfig(false, d.minVolume(), d.minAtrRatio(), d.rsiLower(), d.rsiUpper());
    }
}
