package in.perpscan.domain.model;

/**
 * Why an instrument produced no tradeable signal in a scan cycle.
 *
 * None of these abort the cycle: each one ends the pipeline for a single instrument.
 */
public enum NoSignalReason {
    // Data constraints
    INSUFFICIENT_DATA("Warm-up not satisfied for one or more horizons"),

    // Prefilter constraints
    LOW_VOLUME("Latest medium-horizon volume below minimum"),
    LOW_VOLATILITY("ATR/price ratio below minimum"),
    RSI_OUT_OF_ZONE("Medium-horizon RSI outside tradeable zone"),

    // Direction constraints
    NO_DIRECTION("No horizon majority for either side"),
    HORIZON_DISAGREEMENT("Horizon trends do not unanimously agree"),

    // Score constraints
    FILTER_VETO("Vetoed by signal filter"),
    BELOW_THRESHOLD("Score or confidence below threshold"),

    // Structuring constraints
    INVALID_ACCOUNT_STATE("Non-positive equity or leverage"),
    INVALID_TRADE_GEOMETRY("Trade levels violate ordering or positivity");

    private final String description;

    NoSignalReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Reasons that mean the instrument could not be evaluated at all,
     * as opposed to being evaluated and rejected.
     */
    public boolean isSkip() {
        return this == INSUFFICIENT_DATA || this == INVALID_ACCOUNT_STATE;
    }
}
