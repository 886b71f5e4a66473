package in.perpscan.domain.model;

/**
 * Per-horizon trend label derived from EMA relation and price position vs SMA.
 */
public enum TrendLabel {
    UP,
    DOWN,
    FLAT;

    /**
     * Side this trend points to, or null for FLAT.
     */
    public Side toSide() {
        return switch (this) {
            case UP -> Side.LONG;
            case DOWN -> Side.SHORT;
            case FLAT -> null;
        };
    }
}
