package in.perpscan.service.indicator;

import in.perpscan.domain.model.Bar;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ATR Calculator - Average True Range over a bar sequence.
 *
 * Usage:
 * 1. Stop geometry: SL/TP/trailing distances are ATR multiples
 * 2. Volatility ratio: ATR / SMA feeds regime classification and confidence
 *
 * Calculation Method:
 * - True Range: TR = max(H-L, |H-PC|, |L-PC|)
 * - Seed: simple average of the first {@code period} TRs
 * - Wilder's smoothing: ATR_t = ((ATR_{t-1} × (n-1)) + TR_t) / n
 */
public final class ATRCalculator {

    private static final MathContext MC = MathContext.DECIMAL64;

    /**
     * Calculate the ATR series aligned with the bars.
     *
     * Index 0 has no previous close, so the first ATR lands on index {@code period}.
     * Earlier entries are null.
     *
     * @param bars   Bars in chronological order (oldest first)
     * @param period ATR period (typically 14)
     * @return ATR per bar, null before warm-up
     */
    public static List<BigDecimal> calculateSeries(List<Bar> bars, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("ATR period must be positive: " + period);
        }
        if (bars == null || bars.isEmpty()) {
            return List.of();
        }

        List<BigDecimal> out = new ArrayList<>(Collections.nCopies(bars.size(), (BigDecimal) null));
        if (bars.size() < period + 1) {
            return out;
        }

        // Step 1: Initial ATR as simple average of first 'period' TRs
        BigDecimal sumTR = BigDecimal.ZERO;
        for (int i = 1; i <= period; i++) {
            sumTR = sumTR.add(calculateTrueRange(bars.get(i), bars.get(i - 1)));
        }
        BigDecimal n = BigDecimal.valueOf(period);
        BigDecimal atr = sumTR.divide(n, MC);
        out.set(period, atr);

        // Step 2: Wilder's smoothing for remaining bars
        BigDecimal prevWeight = BigDecimal.valueOf(period - 1L);
        for (int i = period + 1; i < bars.size(); i++) {
            BigDecimal tr = calculateTrueRange(bars.get(i), bars.get(i - 1));
            atr = atr.multiply(prevWeight, MC).add(tr, MC).divide(n, MC);
            out.set(i, atr);
        }
        return out;
    }

    /**
     * Calculate True Range for a bar.
     *
     * TR = max(H - L, |H - PC|, |L - PC|)
     *
     * @param current  Current bar
     * @param previous Previous bar (supplies PC, the previous close)
     * @return True Range value
     */
    public static BigDecimal calculateTrueRange(Bar current, Bar previous) {
        if (current == null || previous == null) {
            throw new IllegalArgumentException("Bars cannot be null");
        }

        BigDecimal high = current.high();
        BigDecimal low = current.low();
        BigDecimal prevClose = previous.close();

        BigDecimal highLow = high.subtract(low);
        BigDecimal highPrevClose = high.subtract(prevClose).abs();
        BigDecimal lowPrevClose = low.subtract(prevClose).abs();

        return highLow.max(highPrevClose).max(lowPrevClose);
    }

    private ATRCalculator() {}
}
