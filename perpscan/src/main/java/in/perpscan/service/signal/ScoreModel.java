package in.perpscan.service.signal;

import in.perpscan.config.ScoringConfig;
import in.perpscan.domain.model.Horizon;
import in.perpscan.domain.model.IndicatorSet;
import in.perpscan.domain.model.Side;
import in.perpscan.domain.model.Signal;
import in.perpscan.domain.model.TrendLabel;
import in.perpscan.domain.signal.AgreementType;
import in.perpscan.domain.signal.AlignmentResult;
import in.perpscan.domain.signal.HorizonView;
import in.perpscan.domain.signal.RegimeClassification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fuses the three horizon views and the regime into one scored candidate signal.
 *
 * Score components:
 * - Trend agreement: weight × agreeing/3
 * - RSI: average over horizons of weight × clamp(±(rsi - 50)/fullScale, 0, 1)
 * - MACD: weight × fraction of horizons whose line/signal relation matches the side
 * - Regime bonus
 *
 * Without full agreement the score is capped below the acceptance threshold.
 */
public final class ScoreModel {
    private static final Logger log = LoggerFactory.getLogger(ScoreModel.class);

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal FIFTY = BigDecimal.valueOf(50);
    private static final BigDecimal HORIZONS = BigDecimal.valueOf(Horizon.values().length);
    private static final int SCALE = 4;

    private final ScoringConfig config;
    private final Horizon referenceHorizon;

    public ScoreModel(ScoringConfig config) {
        this(config, Horizon.MEDIUM);
    }

    /**
     * @param referenceHorizon horizon supplying reference price and ATR for the signal
     */
    public ScoreModel(ScoringConfig config, Horizon referenceHorizon) {
        this.config = config;
        this.referenceHorizon = referenceHorizon;
    }

    /**
     * Score a ready alignment.
     *
     * @return the candidate, or empty when no side can be decided (all flat or an up/down tie)
     */
    public Optional<Signal> score(AlignmentResult alignment, RegimeClassification regime) {
        if (!alignment.ready()) {
            throw new IllegalArgumentException("Cannot score unready alignment for " + alignment.symbol());
        }

        Map<Horizon, TrendLabel> trends = new EnumMap<>(Horizon.class);
        int up = 0;
        int down = 0;
        for (Horizon h : Horizon.values()) {
            TrendLabel label = alignment.view(h).trend();
            trends.put(h, label);
            if (label == TrendLabel.UP) {
                up++;
            } else if (label == TrendLabel.DOWN) {
                down++;
            }
        }

        if (up == down) {
            log.debug("[SCORE] {} no direction (up={} down={})", alignment.symbol(), up, down);
            return Optional.empty();
        }

        Side side = up > down ? Side.LONG : Side.SHORT;
        int agreeing = Math.max(up, down);
        BigDecimal agreementFraction = BigDecimal.valueOf(agreeing).divide(HORIZONS, MC);
        BigDecimal macdFraction = macdFraction(alignment, side);

        // Score
        BigDecimal score = config.trendAgreementWeight().multiply(agreementFraction, MC)
            .add(rsiComponent(alignment, side), MC)
            .add(config.macdWeight().multiply(macdFraction, MC), MC)
            .add(regimeBonus(regime), MC);
        if (agreeing < Horizon.values().length) {
            score = score.min(config.partialAgreementCap());
        }

        // Confidence
        BigDecimal confidence = config.confidenceBase()
            .add(config.confidenceAgreementWeight().multiply(agreementFraction, MC), MC)
            .add(config.confidenceMacdWeight().multiply(macdFraction, MC), MC);
        BigDecimal volRatio = regime.volatilityRatio();
        if (volRatio.compareTo(config.minVolatilityRatio()) < 0 || volRatio.compareTo(config.maxVolatilityRatio()) > 0) {
            confidence = confidence.subtract(config.volatilityPenalty(), MC);
        }
        BigDecimal mediumRsi = alignment.view(Horizon.MEDIUM).latest().rsi();
        if (mediumRsi.compareTo(config.rsiExtremeLower()) < 0 || mediumRsi.compareTo(config.rsiExtremeUpper()) > 0) {
            confidence = confidence.subtract(config.rsiExtremePenalty(), MC);
        }

        HorizonView ref = alignment.view(referenceHorizon);
        Signal signal = new Signal(
            alignment.symbol(),
            side,
            bounded(score),
            bounded(confidence),
            regime.regime(),
            regime.style(),
            ref.close(),
            ref.latest().atr(),
            volRatio,
            trends,
            AgreementType.fromCount(agreeing),
            asOf(alignment)
        );

        log.debug("[SCORE] {} {} score={} conf={} agreement={} regime={} style={}",
            signal.symbol(), side, signal.baseScore(), signal.confidence(),
            signal.agreement(), signal.regime(), signal.style());
        return Optional.of(signal);
    }

    private BigDecimal rsiComponent(AlignmentResult alignment, Side side) {
        BigDecimal sum = BigDecimal.ZERO;
        for (Horizon h : Horizon.values()) {
            BigDecimal rsi = alignment.view(h).latest().rsi();
            BigDecimal deviation = rsi.subtract(FIFTY).multiply(BigDecimal.valueOf(side.sign()))
                .divide(config.rsiFullScale(), MC);
            sum = sum.add(clamp(deviation, BigDecimal.ZERO, BigDecimal.ONE), MC);
        }
        return config.rsiWeight().multiply(sum.divide(HORIZONS, MC), MC);
    }

    private static BigDecimal macdFraction(AlignmentResult alignment, Side side) {
        int matching = 0;
        for (Horizon h : Horizon.values()) {
            BigDecimal histogram = alignment.view(h).latest().macdHistogram();
            if (histogram.signum() == side.sign()) {
                matching++;
            }
        }
        return BigDecimal.valueOf(matching).divide(HORIZONS, MC);
    }

    private BigDecimal regimeBonus(RegimeClassification regime) {
        return switch (regime.regime()) {
            case BREAKOUT -> config.breakoutRegimeBonus();
            case MEAN -> config.meanRegimeBonus();
        };
    }

    private static Instant asOf(AlignmentResult alignment) {
        return alignment.views().values().stream()
            .map(HorizonView::latest)
            .map(IndicatorSet::timestamp)
            .max(Comparator.naturalOrder())
            .orElseThrow();
    }

    private static BigDecimal bounded(BigDecimal value) {
        return clamp(value, BigDecimal.ZERO, HUNDRED).setScale(SCALE, RoundingMode.FLOOR);
    }

    private static BigDecimal clamp(BigDecimal value, BigDecimal min, BigDecimal max) {
        return value.max(min).min(max);
    }
}
