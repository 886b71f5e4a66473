package in.perpscan.service.indicator;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Simple and exponential moving averages over a value series.
 *
 * Output lists are aligned with the input; positions without a full window are null.
 */
public final class MovingAverageCalculator {

    private static final MathContext MC = MathContext.DECIMAL64;

    /**
     * Rolling simple moving average.
     */
    public static List<BigDecimal> sma(List<BigDecimal> values, int window) {
        requirePositive(window);
        List<BigDecimal> out = nulls(values.size());
        if (values.size() < window) {
            return out;
        }
        BigDecimal n = BigDecimal.valueOf(window);
        BigDecimal sum = BigDecimal.ZERO;
        for (int i = 0; i < values.size(); i++) {
            sum = sum.add(values.get(i));
            if (i >= window) {
                sum = sum.subtract(values.get(i - window));
            }
            if (i >= window - 1) {
                out.set(i, sum.divide(n, MC));
            }
        }
        return out;
    }

    /**
     * Exponential moving average with smoothing factor 2/(window+1).
     *
     * Leading nulls in the input are skipped (used for the MACD signal line). The EMA is
     * seeded with the SMA of the first {@code window} defined values, so a constant series
     * yields exactly that constant from the first defined position on.
     */
    public static List<BigDecimal> ema(List<BigDecimal> values, int window) {
        requirePositive(window);
        List<BigDecimal> out = nulls(values.size());

        int first = 0;
        while (first < values.size() && values.get(first) == null) {
            first++;
        }
        int seedIndex = first + window - 1;
        if (seedIndex >= values.size()) {
            return out;
        }

        BigDecimal seed = BigDecimal.ZERO;
        for (int i = first; i <= seedIndex; i++) {
            seed = seed.add(values.get(i));
        }
        BigDecimal ema = seed.divide(BigDecimal.valueOf(window), MC);
        out.set(seedIndex, ema);

        BigDecimal k = smoothingFactor(window);
        for (int i = seedIndex + 1; i < values.size(); i++) {
            // ema = (p - ema) * k + ema
            ema = values.get(i).subtract(ema, MC).multiply(k, MC).add(ema, MC);
            out.set(i, ema);
        }
        return out;
    }

    public static BigDecimal smoothingFactor(int window) {
        return BigDecimal.valueOf(2).divide(BigDecimal.valueOf(window + 1L), MC);
    }

    static List<BigDecimal> nulls(int size) {
        return new ArrayList<>(Collections.nCopies(size, (BigDecimal) null));
    }

    private static void requirePositive(int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("Window must be positive: " + window);
        }
    }

    private MovingAverageCalculator() {}
}
