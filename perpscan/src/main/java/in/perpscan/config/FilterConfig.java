package in.perpscan.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional statistical signal filter.
 */
public record FilterConfig(
    @JsonProperty("enabled")
    boolean enabled,

    @JsonProperty("adjustmentCap")
    BigDecimal adjustmentCap,        // max absolute change to score or confidence

    @JsonProperty("vetoProbability")
    BigDecimal vetoProbability,      // model probability below which a candidate is vetoed

    @JsonProperty("minWinRateSamples")
    int minWinRateSamples,           // closed trades needed before a win rate is used

    @JsonProperty("bias")
    BigDecimal bias,

    @JsonProperty("weights")
    Map<String, BigDecimal> weights  // logistic coefficients keyed by feature name
) {
    public FilterConfig {
        weights = weights == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public static FilterConfig defaults() {
        Map<String, BigDecimal> w = new LinkedHashMap<>();
        w.put("rsiZ", new BigDecimal("0.3"));
        w.put("macdHistogramZ", new BigDecimal("0.4"));
        w.put("volatilityZ", new BigDecimal("-0.2"));
        w.put("bandPosition", new BigDecimal("0.3"));
        w.put("trendAgreement", new BigDecimal("1.0"));
        w.put("baseScore", new BigDecimal("1.0"));
        w.put("winRate", new BigDecimal("1.5"));
        return new FilterConfig(false, new BigDecimal("10"), new BigDecimal("0.2"), 10,
            new BigDecimal("-2.5"), w);
    }

    public FilterConfig withEnabled(boolean on) {
        return new FilterConfig(on, adjustmentCap, vetoProbability, minWinRateSamples, bias, weights);
    }
}
