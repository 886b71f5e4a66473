package in.perpscan.service.regime;

import in.perpscan.config.RegimeConfig;
import in.perpscan.domain.model.IndicatorSet;
import in.perpscan.domain.model.Regime;
import in.perpscan.domain.model.TradingStyle;
import in.perpscan.domain.signal.HorizonView;
import in.perpscan.domain.signal.RegimeClassification;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Classifies market regime from the long horizon and holding style from the medium horizon.
 *
 * BREAKOUT needs both an expanding Bollinger width and a close outside the bands within
 * the lookback window. Everything else is MEAN.
 */
public final class RegimeClassifier {

    private static final MathContext MC = MathContext.DECIMAL64;

    private final RegimeConfig config;

    public RegimeClassifier(RegimeConfig config) {
        this.config = config;
    }

    public RegimeClassification classify(HorizonView longView, HorizonView mediumView) {
        if (!longView.isReady() || !mediumView.isReady()) {
            throw new IllegalArgumentException("Regime classification needs ready long and medium views");
        }

        IndicatorSet latest = longView.latest();
        BigDecimal volatilityRatio = latest.sma().signum() == 0
            ? BigDecimal.ZERO
            : latest.atr().divide(latest.sma(), MC);

        List<IndicatorSet> history = longView.history();
        int lookback = config.breakoutLookback();
        BigDecimal width = latest.bandWidth();

        boolean expanding = false;
        if (width != null && history.size() > lookback) {
            BigDecimal earlier = history.get(history.size() - 1 - lookback).bandWidth();
            expanding = earlier != null
                && width.compareTo(config.bandExpansionFactor().multiply(earlier, MC)) > 0;
        }

        boolean penetrated = false;
        for (int i = Math.max(0, history.size() - lookback); i < history.size(); i++) {
            if (history.get(i).closedOutsideBands()) {
                penetrated = true;
                break;
            }
        }

        Regime regime = expanding && penetrated ? Regime.BREAKOUT : Regime.MEAN;
        int persistence = mediumView.trendPersistence();

        return new RegimeClassification(
            regime,
            styleFor(persistence),
            volatilityRatio,
            width,
            expanding,
            penetrated,
            persistence
        );
    }

    TradingStyle styleFor(int persistence) {
        if (persistence <= config.persistenceScalpMax()) {
            return TradingStyle.SCALP;
        }
        if (persistence >= config.persistenceTrendMin()) {
            return TradingStyle.TREND;
        }
        return TradingStyle.SWING;
    }
}
