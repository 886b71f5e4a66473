package in.perpscan.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Configuration for the trailing stop attached to each trade structure.
 *
 * The trail distance is an ATR multiple tighter than the stop-loss multiple.
 * It arms only after price covers {@code activationFraction} of the way to take-profit.
 */
public record TrailingStopConfig(
    @JsonProperty("atrMultiplier")
    BigDecimal atrMultiplier,        // trail distance in ATRs (e.g., 1.0)

    @JsonProperty("activationFraction")
    BigDecimal activationFraction    // fraction of entry->TP distance before arming (e.g., 0.5)
) {
    /**
     * Default configuration with conservative settings.
     */
    public static TrailingStopConfig defaults() {
        return new TrailingStopConfig(
            BigDecimal.ONE,          // Trail one ATR behind the best price
            new BigDecimal("0.5")    // Arm halfway to take-profit
        );
    }
}
