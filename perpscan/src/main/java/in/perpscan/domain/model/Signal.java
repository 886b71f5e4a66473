package in.perpscan.domain.model;

import in.perpscan.domain.signal.AgreementType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Candidate trading signal produced by the score model.
 *
 * Immutable. The signal filter never edits a candidate: acceptance passes an
 * adjusted copy downstream, rejection produces nothing.
 */
public record Signal(
        String symbol,
        Side side,
        BigDecimal baseScore,
        BigDecimal confidence,
        Regime regime,
        TradingStyle style,

        // Reference values from the structure horizon
        BigDecimal referencePrice,
        BigDecimal atrAtSignal,
        BigDecimal volatilityRatio,

        // MTF context
        Map<Horizon, TrendLabel> horizonTrends,
        AgreementType agreement,

        // Close time of the latest bar used
        Instant asOf) {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public Signal {
        requireInRange("baseScore", baseScore);
        requireInRange("confidence", confidence);
        EnumMap<Horizon, TrendLabel> trends = new EnumMap<>(Horizon.class);
        trends.putAll(horizonTrends);
        horizonTrends = Collections.unmodifiableMap(trends);
    }

    /**
     * All three horizon trends point in the signal's direction.
     */
    public boolean horizonsAgree() {
        return agreement.isUnanimous();
    }

    /**
     * Valid iff score and confidence meet their (inclusive) thresholds and all horizons agree.
     */
    public boolean meetsThresholds(BigDecimal minScore, BigDecimal minConfidence) {
        return baseScore.compareTo(minScore) >= 0
                && confidence.compareTo(minConfidence) >= 0
                && horizonsAgree();
    }

    /**
     * Copy with filter-adjusted score and confidence.
     */
    public Signal withAdjustedScores(BigDecimal newScore, BigDecimal newConfidence) {
        return new Signal(symbol, side, newScore, newConfidence, regime, style,
                referencePrice, atrAtSignal, volatilityRatio, horizonTrends, agreement, asOf);
    }

    private static void requireInRange(String name, BigDecimal value) {
        if (value == null || value.signum() < 0 || value.compareTo(HUNDRED) > 0) {
            throw new IllegalArgumentException(name + " must be in [0,100]: " + value);
        }
    }
}
