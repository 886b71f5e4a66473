package in.perpscan.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Lookback windows for the indicator set.
 */
public record IndicatorWindows(
    @JsonProperty("emaFast")
    int emaFast,

    @JsonProperty("emaSlow")
    int emaSlow,

    @JsonProperty("sma")
    int sma,

    @JsonProperty("rsi")
    int rsi,

    @JsonProperty("macdFast")
    int macdFast,

    @JsonProperty("macdSlow")
    int macdSlow,

    @JsonProperty("macdSignal")
    int macdSignal,

    @JsonProperty("atr")
    int atr,

    @JsonProperty("bollinger")
    int bollinger,

    @JsonProperty("bollingerStdDevs")
    BigDecimal bollingerStdDevs      // band half-width in standard deviations
) {
    public static IndicatorWindows defaults() {
        return new IndicatorWindows(9, 21, 20, 14, 12, 26, 9, 14, 20, new BigDecimal("2"));
    }

    /**
     * Bars needed before every indicator in the set is defined.
     *
     * RSI and ATR need one extra bar for the first price change; the MACD signal
     * line needs a full signal window of MACD values after the slow EMA is seeded.
     */
    public int warmupBars() {
        int bars = Math.max(emaFast, emaSlow);
        bars = Math.max(bars, sma);
        bars = Math.max(bars, bollinger);
        bars = Math.max(bars, rsi + 1);
        bars = Math.max(bars, atr + 1);
        bars = Math.max(bars, Math.max(macdFast, macdSlow) + macdSignal - 1);
        return bars;
    }
}
