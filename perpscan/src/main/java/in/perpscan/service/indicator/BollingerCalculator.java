package in.perpscan.service.indicator;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Bollinger bands: SMA midline ± k population standard deviations.
 */
public final class BollingerCalculator {

    private static final MathContext MC = MathContext.DECIMAL64;

    public record Band(BigDecimal upper, BigDecimal mid, BigDecimal lower) {
    }

    /**
     * Bands per close, null before the first full window.
     */
    public static List<Band> calculateSeries(List<BigDecimal> closes, int window, BigDecimal stdDevs) {
        if (window <= 1) {
            throw new IllegalArgumentException("Bollinger window must be > 1: " + window);
        }
        List<BigDecimal> mids = MovingAverageCalculator.sma(closes, window);
        List<Band> out = new ArrayList<>(closes.size());
        BigDecimal n = BigDecimal.valueOf(window);

        for (int i = 0; i < closes.size(); i++) {
            BigDecimal mid = mids.get(i);
            if (mid == null) {
                out.add(null);
                continue;
            }
            BigDecimal sumSq = BigDecimal.ZERO;
            for (int j = i - window + 1; j <= i; j++) {
                BigDecimal d = closes.get(j).subtract(mid, MC);
                sumSq = sumSq.add(d.multiply(d, MC), MC);
            }
            BigDecimal std = sumSq.divide(n, MC).sqrt(MC);
            BigDecimal offset = std.multiply(stdDevs, MC);
            out.add(new Band(mid.add(offset, MC), mid, mid.subtract(offset, MC)));
        }
        return out;
    }

    private BollingerCalculator() {}
}
