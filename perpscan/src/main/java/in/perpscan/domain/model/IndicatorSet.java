package in.perpscan.domain.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;

/**
 * Indicator values for one bar.
 *
 * Aligned 1:1 with the bar sequence it was computed from. Entries inside the
 * warm-up period have {@code sufficient=false} and null indicator values.
 */
public record IndicatorSet(
        Instant timestamp,
        BigDecimal close,
        boolean sufficient,
        BigDecimal emaFast,
        BigDecimal emaSlow,
        BigDecimal sma,
        BigDecimal rsi,
        BigDecimal macdLine,
        BigDecimal macdSignal,
        BigDecimal atr,
        BigDecimal bbUpper,
        BigDecimal bbMid,
        BigDecimal bbLower) {

    /**
     * Warm-up placeholder: no indicator values.
     */
    public static IndicatorSet insufficient(Instant timestamp, BigDecimal close) {
        return new IndicatorSet(timestamp, close, false,
                null, null, null, null, null, null, null, null, null, null);
    }

    public BigDecimal macdHistogram() {
        if (macdLine == null || macdSignal == null) {
            return null;
        }
        return macdLine.subtract(macdSignal);
    }

    /**
     * Relative Bollinger width: (upper - lower) / mid. Null when bands are undefined or mid is zero.
     */
    public BigDecimal bandWidth() {
        if (bbUpper == null || bbLower == null || bbMid == null || bbMid.signum() == 0) {
            return null;
        }
        return bbUpper.subtract(bbLower).divide(bbMid, MathContext.DECIMAL64);
    }

    public boolean closedOutsideBands() {
        if (!sufficient) {
            return false;
        }
        return close.compareTo(bbUpper) > 0 || close.compareTo(bbLower) < 0;
    }
}
