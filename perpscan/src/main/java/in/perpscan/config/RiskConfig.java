package in.perpscan.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.perpscan.domain.model.Horizon;

import java.math.BigDecimal;

/**
 * Position sizing and stop geometry.
 */
public record RiskConfig(
    @JsonProperty("riskFraction")
    BigDecimal riskFraction,             // fraction of equity committed per trade

    @JsonProperty("stopLossAtrMultiplier")
    BigDecimal stopLossAtrMultiplier,

    @JsonProperty("takeProfitAtrMultiplier")
    BigDecimal takeProfitAtrMultiplier,

    @JsonProperty("maxStopDistanceFraction")
    BigDecimal maxStopDistanceFraction,  // cap on any level's distance from entry, as fraction of entry

    @JsonProperty("maintenanceMarginRate")
    BigDecimal maintenanceMarginRate,

    @JsonProperty("entryMode")
    EntryMode entryMode,

    @JsonProperty("structureHorizon")
    Horizon structureHorizon             // horizon supplying reference price and ATR
) {
    public static RiskConfig defaults() {
        return new RiskConfig(
            new BigDecimal("0.75"),
            new BigDecimal("1.5"),
            new BigDecimal("3.0"),
            new BigDecimal("0.5"),
            new BigDecimal("0.005"),
            EntryMode.MARKET,
            Horizon.MEDIUM
        );
    }

    public RiskConfig withEntryMode(EntryMode mode) {
        return new RiskConfig(riskFraction, stopLossAtrMultiplier, takeProfitAtrMultiplier,
            maxStopDistanceFraction, maintenanceMarginRate, mode, structureHorizon);
    }

    public RiskConfig withMultipliers(BigDecimal stopLoss, BigDecimal takeProfit) {
        return new RiskConfig(riskFraction, stopLoss, takeProfit,
            maxStopDistanceFraction, maintenanceMarginRate, entryMode, structureHorizon);
    }
}
