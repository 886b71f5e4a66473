package in.perpscan.domain.signal;

import in.perpscan.domain.model.Regime;
import in.perpscan.domain.model.Side;
import in.perpscan.domain.model.TradingStyle;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Feature vector handed to a signal filter.
 *
 * Z-scores compare the latest medium-horizon value against that horizon's own history.
 * Direction-sensitive features are oriented so that positive values favor the signal's side.
 */
public record FilterFeatures(
    String symbol,
    Side side,
    Regime regime,
    TradingStyle style,
    double baseScore,
    double confidence,
    double rsiZ,
    double macdHistogramZ,
    double volatilityZ,
    double bandPosition,          // (close - mid) / (upper - mid), side-oriented
    double trendAgreement,        // agreeing horizons / 3
    OptionalDouble winRate,       // historical win rate for symbol/regime/style, if known
    int winRateSamples
) {
    public static final String RSI_Z = "rsiZ";
    public static final String MACD_HISTOGRAM_Z = "macdHistogramZ";
    public static final String VOLATILITY_Z = "volatilityZ";
    public static final String BAND_POSITION = "bandPosition";
    public static final String TREND_AGREEMENT = "trendAgreement";
    public static final String BREAKOUT = "breakout";
    public static final String LONG_SIDE = "longSide";
    public static final String BASE_SCORE = "baseScore";
    public static final String WIN_RATE = "winRate";

    /**
     * Named numeric view of the features, in a stable order.
     * Categorical values are encoded as 0/1, the win rate as 0.5 when unknown.
     */
    public Map<String, Double> asVector() {
        Map<String, Double> v = new LinkedHashMap<>();
        v.put(RSI_Z, rsiZ);
        v.put(MACD_HISTOGRAM_Z, macdHistogramZ);
        v.put(VOLATILITY_Z, volatilityZ);
        v.put(BAND_POSITION, bandPosition);
        v.put(TREND_AGREEMENT, trendAgreement);
        v.put(BREAKOUT, regime == Regime.BREAKOUT ? 1.0 : 0.0);
        v.put(LONG_SIDE, side == Side.LONG ? 1.0 : 0.0);
        v.put(BASE_SCORE, baseScore / 100.0);
        v.put(WIN_RATE, winRate.orElse(0.5));
        return v;
    }
}
