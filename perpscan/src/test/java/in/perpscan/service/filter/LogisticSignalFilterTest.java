package in.perpscan.service.filter;

import in.perpscan.config.FilterConfig;
import in.perpscan.domain.model.Regime;
import in.perpscan.domain.model.Side;
import in.perpscan.domain.model.TradingStyle;
import in.perpscan.domain.signal.FilterFeatures;
import in.perpscan.domain.signal.FilterVerdict;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class LogisticSignalFilterTest {

    private static FilterConfig config(String bias, Map<String, BigDecimal> weights) {
        return new FilterConfig(true, new BigDecimal("10"), new BigDecimal("0.2"), 10, new BigDecimal(bias), weights);
    }

    private static FilterFeatures features(OptionalDouble winRate) {
        return new FilterFeatures("BTCUSDT", Side.LONG, Regime.MEAN, TradingStyle.SWING,
            80, 85, 0.5, 0.5, 0.0, 0.4, 1.0, winRate, winRate.isPresent() ? 20 : 0);
    }

    @Test
    void testNoCoefficientsIsUnavailable() {
        LogisticSignalFilter filter = new LogisticSignalFilter(config("0", Map.of()));
        assertThrows(SignalFilterUnavailableException.class, () -> filter.score(features(OptionalDouble.empty())));
    }

    @Test
    void testUnknownFeatureIsUnavailable() {
        LogisticSignalFilter filter = new LogisticSignalFilter(config("0", Map.of("orderBookImbalance", BigDecimal.ONE)));
        assertThrows(SignalFilterUnavailableException.class, () -> filter.score(features(OptionalDouble.empty())));
    }

    @Test
    void testProbability() {
        LogisticSignalFilter filter = new LogisticSignalFilter(
            config("-1", Map.of(FilterFeatures.TREND_AGREEMENT, new BigDecimal("2"))));
        // z = -1 + 2 * 1.0 = 1
        assertEquals(1.0 / (1.0 + Math.exp(-1.0)), filter.probability(features(OptionalDouble.empty())), 1e-12);
    }

    @Test
    void testNeutralProbabilityGivesNoAdjustment() {
        LogisticSignalFilter filter = new LogisticSignalFilter(
            config("0", Map.of(FilterFeatures.VOLATILITY_Z, BigDecimal.ONE)));

        FilterVerdict verdict = filter.score(features(OptionalDouble.empty()));

        assertEquals(0, verdict.scoreAdjustment().signum());
        assertEquals(0, verdict.confidenceAdjustment().signum(), "no win rate, no confidence adjustment");
        assertFalse(verdict.veto());
    }

    @Test
    void testStrongModelRaisesScore() {
        LogisticSignalFilter filter = new LogisticSignalFilter(
            config("10", Map.of(FilterFeatures.VOLATILITY_Z, BigDecimal.ONE)));

        FilterVerdict verdict = filter.score(features(OptionalDouble.empty()));

        assertTrue(verdict.scoreAdjustment().compareTo(new BigDecimal("9.9")) > 0);
        assertTrue(verdict.scoreAdjustment().compareTo(new BigDecimal("10")) <= 0);
        assertFalse(verdict.veto());
    }

    @Test
    void testWeakModelVetoes() {
        LogisticSignalFilter filter = new LogisticSignalFilter(
            config("-10", Map.of(FilterFeatures.VOLATILITY_Z, BigDecimal.ONE)));
        assertTrue(filter.score(features(OptionalDouble.empty())).veto());
    }

    @Test
    void testWinRateDrivesConfidenceAdjustment() {
        LogisticSignalFilter filter = new LogisticSignalFilter(
            config("0", Map.of(FilterFeatures.VOLATILITY_Z, BigDecimal.ONE)));

        FilterVerdict verdict = filter.score(features(OptionalDouble.of(0.8)));

        // (2 * 0.8 - 1) * 10
        assertEquals(0, verdict.confidenceAdjustment().compareTo(new BigDecimal("6")));
    }

    @Test
    void testDefaultCoefficientsCoverKnownFeatures() {
        LogisticSignalFilter filter = new LogisticSignalFilter(FilterConfig.defaults().withEnabled(true));
        double p = filter.probability(features(OptionalDouble.of(0.6)));
        assertTrue(p > 0 && p < 1);
    }
}
