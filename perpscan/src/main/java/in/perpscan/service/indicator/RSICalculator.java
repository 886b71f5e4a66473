package in.perpscan.service.indicator;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Relative Strength Index with Wilder's smoothing.
 *
 * avgGain/avgLoss start as simple means of the first {@code period} changes, then
 * avg_t = (avg_{t-1} × (n-1) + x_t) / n.
 * RSI = 100 - 100 / (1 + avgGain/avgLoss), evaluated as 100 × avgGain / (avgGain + avgLoss)
 * so that a zero average loss yields 100. A flat series (both averages zero) yields 50.
 */
public final class RSICalculator {

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal NEUTRAL = BigDecimal.valueOf(50);

    /**
     * RSI per close; the first value lands on index {@code period}.
     */
    public static List<BigDecimal> calculateSeries(List<BigDecimal> closes, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("RSI period must be positive: " + period);
        }
        List<BigDecimal> out = MovingAverageCalculator.nulls(closes.size());
        if (closes.size() < period + 1) {
            return out;
        }

        BigDecimal gainSum = BigDecimal.ZERO;
        BigDecimal lossSum = BigDecimal.ZERO;
        for (int i = 1; i <= period; i++) {
            BigDecimal change = closes.get(i).subtract(closes.get(i - 1));
            if (change.signum() > 0) {
                gainSum = gainSum.add(change);
            } else {
                lossSum = lossSum.add(change.negate());
            }
        }

        BigDecimal n = BigDecimal.valueOf(period);
        BigDecimal prevWeight = BigDecimal.valueOf(period - 1L);
        BigDecimal avgGain = gainSum.divide(n, MC);
        BigDecimal avgLoss = lossSum.divide(n, MC);
        out.set(period, rsi(avgGain, avgLoss));

        for (int i = period + 1; i < closes.size(); i++) {
            BigDecimal change = closes.get(i).subtract(closes.get(i - 1));
            BigDecimal gain = change.signum() > 0 ? change : BigDecimal.ZERO;
            BigDecimal loss = change.signum() < 0 ? change.negate() : BigDecimal.ZERO;
            avgGain = avgGain.multiply(prevWeight, MC).add(gain, MC).divide(n, MC);
            avgLoss = avgLoss.multiply(prevWeight, MC).add(loss, MC).divide(n, MC);
            out.set(i, rsi(avgGain, avgLoss));
        }
        return out;
    }

    static BigDecimal rsi(BigDecimal avgGain, BigDecimal avgLoss) {
        BigDecimal total = avgGain.add(avgLoss);
        if (total.signum() == 0) {
            return NEUTRAL;
        }
        BigDecimal value = HUNDRED.multiply(avgGain).divide(total, MC);
        // Rounding can not push a ratio in [0,1] outside [0,100], but keep the bound explicit
        return value.max(BigDecimal.ZERO).min(HUNDRED);
    }

    private RSICalculator() {}
}
