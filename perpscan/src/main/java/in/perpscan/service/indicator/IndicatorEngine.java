package in.perpscan.service.indicator;

import in.perpscan.config.IndicatorWindows;
import in.perpscan.domain.model.Bar;
import in.perpscan.domain.model.IndicatorSet;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes the fixed indicator set over one bar sequence.
 *
 * Indicators: EMA fast/slow, SMA, RSI (Wilder), MACD line/signal, ATR (Wilder), Bollinger bands.
 *
 * The first {@code warmupBars() - 1} entries are marked insufficient rather than computed
 * with truncated windows; a sequence shorter than {@code warmupBars()} is entirely insufficient.
 * Pure: no state beyond the immutable windows.
 */
public final class IndicatorEngine {

    private static final MathContext MC = MathContext.DECIMAL64;

    private final IndicatorWindows windows;

    public IndicatorEngine(IndicatorWindows windows) {
        this.windows = windows;
    }

    public int warmupBars() {
        return windows.warmupBars();
    }

    /**
     * Compute indicator sets aligned 1:1 with {@code bars}.
     *
     * @param bars Bars in chronological order (oldest first)
     * @return One IndicatorSet per bar
     */
    public List<IndicatorSet> compute(List<Bar> bars) {
        if (bars == null) {
            throw new IllegalArgumentException("Bars cannot be null");
        }
        int n = bars.size();
        List<IndicatorSet> out = new ArrayList<>(n);
        int warmup = windows.warmupBars();

        if (n < warmup) {
            for (Bar bar : bars) {
                out.add(IndicatorSet.insufficient(bar.timestamp(), bar.close()));
            }
            return out;
        }

        List<BigDecimal> closes = bars.stream().map(Bar::close).toList();

        List<BigDecimal> emaFast = MovingAverageCalculator.ema(closes, windows.emaFast());
        List<BigDecimal> emaSlow = MovingAverageCalculator.ema(closes, windows.emaSlow());
        List<BigDecimal> sma = MovingAverageCalculator.sma(closes, windows.sma());
        List<BigDecimal> rsi = RSICalculator.calculateSeries(closes, windows.rsi());
        List<BigDecimal> atr = ATRCalculator.calculateSeries(bars, windows.atr());
        List<BollingerCalculator.Band> bands =
            BollingerCalculator.calculateSeries(closes, windows.bollinger(), windows.bollingerStdDevs());

        // MACD line = EMA(fast) - EMA(slow); signal = EMA of the MACD line
        List<BigDecimal> macdFast = MovingAverageCalculator.ema(closes, windows.macdFast());
        List<BigDecimal> macdSlow = MovingAverageCalculator.ema(closes, windows.macdSlow());
        List<BigDecimal> macdLine = MovingAverageCalculator.nulls(n);
        for (int i = 0; i < n; i++) {
            if (macdFast.get(i) != null && macdSlow.get(i) != null) {
                macdLine.set(i, macdFast.get(i).subtract(macdSlow.get(i), MC));
            }
        }
        List<BigDecimal> macdSignal = MovingAverageCalculator.ema(macdLine, windows.macdSignal());

        for (int i = 0; i < n; i++) {
            Bar bar = bars.get(i);
            if (i < warmup - 1) {
                out.add(IndicatorSet.insufficient(bar.timestamp(), bar.close()));
                continue;
            }
            BollingerCalculator.Band band = bands.get(i);
            out.add(new IndicatorSet(
                bar.timestamp(),
                bar.close(),
                true,
                emaFast.get(i),
                emaSlow.get(i),
                sma.get(i),
                rsi.get(i),
                macdLine.get(i),
                macdSignal.get(i),
                atr.get(i),
                band.upper(),
                band.mid(),
                band.lower()
            ));
        }
        return out;
    }
}
