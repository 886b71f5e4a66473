package in.perpscan.service.signal;

import in.perpscan.config.PrefilterConfig;
import in.perpscan.domain.model.IndicatorSet;
import in.perpscan.domain.model.NoSignalReason;
import in.perpscan.domain.signal.HorizonView;

import java.math.MathContext;
import java.util.Optional;

/**
 * Liquidity and volatility gates on the medium horizon, checked before scoring.
 *
 * Gates, in order:
 * 1. latest volume &gt;= minVolume
 * 2. ATR / close &gt;= minAtrRatio
 * 3. rsiLower &lt; RSI &lt; rsiUpper
 */
public final class InstrumentPrefilter {

    private final PrefilterConfig config;

    public InstrumentPrefilter(PrefilterConfig config) {
        this.config = config;
    }

    /**
     * @return the rejection reason, or empty when the instrument passes
     */
    public Optional<NoSignalReason> check(HorizonView medium) {
        if (!config.enabled()) {
            return Optional.empty();
        }
        if (medium.latestBar().volume().compareTo(config.minVolume()) < 0) {
            return Optional.of(NoSignalReason.LOW_VOLUME);
        }
        IndicatorSet latest = medium.latest();
        if (latest.close().signum() <= 0
                || latest.atr().divide(latest.close(), MathContext.DECIMAL64).compareTo(config.minAtrRatio()) < 0) {
            return Optional.of(NoSignalReason.LOW_VOLATILITY);
        }
        if (latest.rsi().compareTo(config.rsiLower()) <= 0 || latest.rsi().compareTo(config.rsiUpper()) >= 0) {
            return Optional.of(NoSignalReason.RSI_OUT_OF_ZONE);
        }
        return Optional.empty();
    }
}
