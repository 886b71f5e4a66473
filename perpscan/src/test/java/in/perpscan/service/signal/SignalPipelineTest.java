package in.perpscan.service.signal;

import in.perpscan.application.port.output.WinRateSource;
import in.perpscan.config.FilterConfig;
import in.perpscan.config.PrefilterConfig;
import in.perpscan.config.ScannerConfig;
import in.perpscan.domain.model.AccountSnapshot;
import in.perpscan.domain.model.Bar;
import in.perpscan.domain.model.Horizon;
import in.perpscan.domain.model.NoSignalReason;
import in.perpscan.domain.model.RankedTrade;
import in.perpscan.domain.model.Regime;
import in.perpscan.domain.model.Side;
import in.perpscan.domain.model.TradeStructure;
import in.perpscan.domain.model.TradingStyle;
import in.perpscan.domain.signal.FilterFeatures;
import in.perpscan.domain.signal.FilterVerdict;
import in.perpscan.infrastructure.json.SignalJsonMapper;
import in.perpscan.service.filter.FeatureExtractor;
import in.perpscan.service.filter.InMemoryWinRateTracker;
import in.perpscan.service.filter.SignalFilter;
import in.perpscan.service.filter.SignalFilterStage;
import in.perpscan.service.signal.SignalPipeline.InstrumentOutcome;
import in.perpscan.support.SyntheticBars;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SignalPipelineTest {

    private static final AccountSnapshot ACCOUNT = new AccountSnapshot(new BigDecimal("1000"), new BigDecimal("10"));
    private static final BigDecimal MIN_SCORE = new BigDecimal("60");
    private static final BigDecimal MIN_CONFIDENCE = new BigDecimal("70");

    private static SignalPipeline pipeline(ScannerConfig config) {
        return new SignalPipeline(config, SignalFilterStage.create(config.filter(), WinRateSource.NONE));
    }

    private final SignalPipeline pipeline = pipeline(ScannerConfig.defaults());

    @Test
    void testUptrendOnAllHorizonsProducesLongTrade() {
        InstrumentOutcome outcome = pipeline.evaluate("BTCUSDT", SyntheticBars.allUp(120, "100"), ACCOUNT);

        assertTrue(outcome.isAccepted(), "expected acceptance, got " + outcome.reason());
        RankedTrade trade = outcome.trade();
        assertEquals(Side.LONG, trade.signal().side());
        assertTrue(trade.signal().baseScore().compareTo(MIN_SCORE) >= 0, "score " + trade.signal().baseScore());
        assertTrue(trade.signal().confidence().compareTo(MIN_CONFIDENCE) >= 0, "conf " + trade.signal().confidence());
        assertTrue(trade.signal().horizonsAgree());

        TradeStructure t = trade.structure();
        assertTrue(t.stopLoss().compareTo(t.entry()) < 0 && t.entry().compareTo(t.takeProfit()) < 0);
        assertEquals(0, t.entry().compareTo(trade.signal().referencePrice()), "market entry");
        List<Bar> medium = SyntheticBars.uptrend(Horizon.MEDIUM, 120, "100");
        assertEquals(0, t.entry().compareTo(medium.get(medium.size() - 1).close()), "reference is the latest medium close");
        assertFalse(outcome.filterDegraded());
    }

    @Test
    void testDowntrendOnAllHorizonsProducesShortTrade() {
        InstrumentOutcome outcome = pipeline.evaluate("ETHUSDT", SyntheticBars.allDown(120, "200"), ACCOUNT);

        assertTrue(outcome.isAccepted(), "expected acceptance, got " + outcome.reason());
        TradeStructure t = outcome.trade().structure();
        assertEquals(Side.SHORT, t.side());
        assertTrue(t.takeProfit().compareTo(t.entry()) < 0 && t.entry().compareTo(t.stopLoss()) < 0);
        assertTrue(t.estimatedLiquidationPrice().compareTo(t.entry()) > 0);
    }

    @Test
    void testHorizonDisagreement() {
        Map<Horizon, List<Bar>> bars = new EnumMap<>(SyntheticBars.allUp(120, "100"));
        bars.put(Horizon.LONG, SyntheticBars.downtrend(Horizon.LONG, 120, "200"));

        InstrumentOutcome outcome = pipeline.evaluate("SOLUSDT", bars, ACCOUNT);

        assertFalse(outcome.isAccepted());
        assertEquals(NoSignalReason.HORIZON_DISAGREEMENT, outcome.reason());
    }

    @Test
    void testInsufficientData() {
        Map<Horizon, List<Bar>> bars = new EnumMap<>(SyntheticBars.allUp(120, "100"));
        bars.put(Horizon.SHORT, SyntheticBars.uptrend(Horizon.SHORT, 10, "100"));

        assertEquals(NoSignalReason.INSUFFICIENT_DATA, pipeline.evaluate("NEWUSDT", bars, ACCOUNT).reason());
    }

    @Test
    void testFlatMarketHasNoDirection() {
        Map<Horizon, List<Bar>> bars = new EnumMap<>(Horizon.class);
        for (Horizon h : Horizon.values()) {
            bars.put(h, SyntheticBars.constant(h, 120, "50"));
        }
        assertEquals(NoSignalReason.NO_DIRECTION, pipeline.evaluate("USDCUSDT", bars, ACCOUNT).reason());
    }

    @Test
    void testLowVolumeRejectedByPrefilter() {
        PrefilterConfig strict = new PrefilterConfig(true, new BigDecimal("10000"), new BigDecimal("0.001"),
            new BigDecimal("20"), new BigDecimal("80"));
        SignalPipeline p = pipeline(ScannerConfig.defaults().withPrefilter(strict));

        assertEquals(NoSignalReason.LOW_VOLUME, p.evaluate("BTCUSDT", SyntheticBars.allUp(120, "100"), ACCOUNT).reason());
    }

    @Test
    void testRsiZoneRejectedByPrefilter() {
        PrefilterConfig narrow = new PrefilterConfig(true, new BigDecimal("1000"), new BigDecimal("0.001"),
            new BigDecimal("40"), new BigDecimal("60"));
        SignalPipeline p = pipeline(ScannerConfig.defaults().withPrefilter(narrow));

        assertEquals(NoSignalReason.RSI_OUT_OF_ZONE, p.evaluate("BTCUSDT", SyntheticBars.allUp(120, "100"), ACCOUNT).reason());
    }

    @Test
    void testBelowThreshold() {
        ScannerConfig config = ScannerConfig.defaults().withScoring(
            ScannerConfig.defaults().scoring().withThresholds(new BigDecimal("60"), new BigDecimal("99")));

        assertEquals(NoSignalReason.BELOW_THRESHOLD,
            pipeline(config).evaluate("BTCUSDT", SyntheticBars.allUp(120, "100"), ACCOUNT).reason());
    }

    @Test
    void testInvalidAccount() {
        AccountSnapshot broke = new AccountSnapshot(BigDecimal.ZERO, BigDecimal.TEN);
        assertEquals(NoSignalReason.INVALID_ACCOUNT_STATE,
            pipeline.evaluate("BTCUSDT", SyntheticBars.allUp(120, "100"), broke).reason());
    }

    @Test
    void testFilterVeto() {
        SignalFilter veto = mock(SignalFilter.class);
        when(veto.score(any())).thenReturn(FilterVerdict.vetoed());
        SignalPipeline p = new SignalPipeline(ScannerConfig.defaults(),
            new SignalFilterStage(veto, new FeatureExtractor(WinRateSource.NONE, 10), new BigDecimal("10")));

        assertEquals(NoSignalReason.FILTER_VETO, p.evaluate("BTCUSDT", SyntheticBars.allUp(120, "100"), ACCOUNT).reason());
    }

    @Test
    void testLogisticFilterAdjustsAcceptedSignal() {
        // z = 2 + 1.0 * trendAgreement(1.0) = 3, p = 0.952574..., score adjustment (2p - 1) * 10 = 9.0514
        FilterConfig filter = new FilterConfig(true, new BigDecimal("10"), new BigDecimal("0.2"), 10,
            new BigDecimal("2"), Map.of(FilterFeatures.TREND_AGREEMENT, BigDecimal.ONE));
        InMemoryWinRateTracker history = new InMemoryWinRateTracker();
        for (Regime regime : Regime.values()) {
            for (TradingStyle style : TradingStyle.values()) {
                for (int i = 0; i < 10; i++) {
                    history.recordOutcome("BTCUSDT", regime, style, i < 8);
                }
            }
        }
        Map<Horizon, List<Bar>> bars = SyntheticBars.allUp(120, "100");

        InstrumentOutcome plain = pipeline.evaluate("BTCUSDT", bars, ACCOUNT);
        InstrumentOutcome filtered = new SignalPipeline(ScannerConfig.defaults().withFilter(filter),
            SignalFilterStage.create(filter, history)).evaluate("BTCUSDT", bars, ACCOUNT);

        assertTrue(plain.isAccepted());
        assertTrue(filtered.isAccepted(), "got " + filtered.reason());
        assertFalse(filtered.filterDegraded());
        BigDecimal hundred = BigDecimal.valueOf(100);
        BigDecimal expectedScore = plain.trade().signal().baseScore().add(new BigDecimal("9.0514")).min(hundred);
        // win rate 0.8 over 10 samples: (2 * 0.8 - 1) * 10 = 6
        BigDecimal expectedConfidence = plain.trade().signal().confidence().add(new BigDecimal("6")).min(hundred);
        assertEquals(0, expectedScore.compareTo(filtered.trade().signal().baseScore()),
            "score " + filtered.trade().signal().baseScore());
        assertEquals(0, expectedConfidence.compareTo(filtered.trade().signal().confidence()),
            "confidence " + filtered.trade().signal().confidence());
    }

    @Test
    void testDeterministicIncludingJson() {
        Map<Horizon, List<Bar>> bars = SyntheticBars.allUp(150, "100");
        SignalJsonMapper json = new SignalJsonMapper();

        InstrumentOutcome first = pipeline.evaluate("BTCUSDT", bars, ACCOUNT);
        InstrumentOutcome second = pipeline(ScannerConfig.defaults()).evaluate("BTCUSDT", bars, ACCOUNT);

        assertEquals(first, second);
        assertEquals(json.toJson(List.of(first.trade())), json.toJson(List.of(second.trade())));
    }
}
