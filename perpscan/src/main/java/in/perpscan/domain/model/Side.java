package in.perpscan.domain.model;

/**
 * Trade side.
 */
public enum Side {
    LONG,
    SHORT;

    /**
     * +1 for LONG, -1 for SHORT. Used to orient price offsets.
     */
    public int sign() {
        return this == LONG ? 1 : -1;
    }

    public TrendLabel trend() {
        return this == LONG ? TrendLabel.UP : TrendLabel.DOWN;
    }
}
