package in.perpscan.domain.model;

/**
 * Intended holding duration, derived from medium-horizon trend persistence.
 */
public enum TradingStyle {
    SCALP,
    SWING,
    TREND
}
