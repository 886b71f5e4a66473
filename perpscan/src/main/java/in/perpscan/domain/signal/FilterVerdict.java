package in.perpscan.domain.signal;

import java.math.BigDecimal;

/**
 * Output of a signal filter: unbounded adjustments plus an optional veto.
 * The filter stage clamps adjustments before applying them.
 */
public record FilterVerdict(
    BigDecimal scoreAdjustment,
    BigDecimal confidenceAdjustment,
    boolean veto
) {
    private static final FilterVerdict PASS_THROUGH = new FilterVerdict(BigDecimal.ZERO, BigDecimal.ZERO, false);

    public static FilterVerdict passThrough() {
        return PASS_THROUGH;
    }

    public static FilterVerdict vetoed() {
        return new FilterVerdict(BigDecimal.ZERO, BigDecimal.ZERO, true);
    }
}
