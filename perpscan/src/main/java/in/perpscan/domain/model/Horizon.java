package in.perpscan.domain.model;

/**
 * Time-aggregation levels used for multi-timeframe alignment.
 */
public enum Horizon {
    /**
     * Short horizon: 15-minute bars.
     */
    SHORT(15, "15m"),

    /**
     * Medium horizon: 1-hour bars. Primary horizon for prefilters and trade structuring.
     */
    MEDIUM(60, "1h"),

    /**
     * Long horizon: 4-hour bars. Drives regime classification.
     */
    LONG(240, "4h");

    private final int intervalMinutes;
    private final String code;

    Horizon(int intervalMinutes, String code) {
        this.intervalMinutes = intervalMinutes;
        this.code = code;
    }

    public int getIntervalMinutes() {
        return intervalMinutes;
    }

    /**
     * Short interval code as used by market data feeds (15m, 1h, 4h).
     */
    public String getCode() {
        return code;
    }
}
