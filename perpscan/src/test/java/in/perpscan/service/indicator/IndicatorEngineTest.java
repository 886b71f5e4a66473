package in.perpscan.service.indicator;

import in.perpscan.config.IndicatorWindows;
import in.perpscan.domain.model.Bar;
import in.perpscan.domain.model.Horizon;
import in.perpscan.domain.model.IndicatorSet;
import in.perpscan.support.SyntheticBars;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IndicatorEngineTest {

    private final IndicatorEngine engine = new IndicatorEngine(IndicatorWindows.defaults());

    @Test
    void testWarmupIs34WithDefaultWindows() {
        assertEquals(34, engine.warmupBars());
    }

    @Test
    void testEntriesBeforeWarmupAreInsufficient() {
        List<IndicatorSet> sets = engine.compute(SyntheticBars.uptrend(Horizon.MEDIUM, 60, "100"));

        assertEquals(60, sets.size());
        for (int i = 0; i < 33; i++) {
            assertFalse(sets.get(i).sufficient(), "index " + i + " should be insufficient");
            assertNull(sets.get(i).emaFast());
            assertNull(sets.get(i).rsi());
            assertNull(sets.get(i).atr());
        }
        for (int i = 33; i < 60; i++) {
            IndicatorSet s = sets.get(i);
            assertTrue(s.sufficient(), "index " + i + " should be sufficient");
            assertNotNull(s.emaFast());
            assertNotNull(s.emaSlow());
            assertNotNull(s.sma());
            assertNotNull(s.rsi());
            assertNotNull(s.macdLine());
            assertNotNull(s.macdSignal());
            assertNotNull(s.atr());
            assertNotNull(s.bbUpper());
            assertNotNull(s.bbLower());
        }
    }

    @Test
    void testShortSequenceIsEntirelyInsufficient() {
        List<Bar> bars = SyntheticBars.uptrend(Horizon.MEDIUM, 33, "100");
        List<IndicatorSet> sets = engine.compute(bars);

        assertEquals(33, sets.size());
        assertTrue(sets.stream().noneMatch(IndicatorSet::sufficient));
        assertEquals(bars.get(32).close(), sets.get(32).close(), "close is carried even when insufficient");
    }

    @Test
    void testConstantSeriesConvergesToConstant() {
        BigDecimal price = new BigDecimal("100");
        List<IndicatorSet> sets = engine.compute(SyntheticBars.constant(Horizon.MEDIUM, 80, "100"));
        IndicatorSet last = sets.get(sets.size() - 1);

        assertEquals(0, last.emaFast().compareTo(price), "EMA fast of constant series");
        assertEquals(0, last.emaSlow().compareTo(price), "EMA slow of constant series");
        assertEquals(0, last.sma().compareTo(price), "SMA of constant series");
        assertEquals(0, last.rsi().compareTo(new BigDecimal("50")), "RSI of flat series is neutral");
        assertEquals(0, last.macdLine().signum(), "MACD line of constant series");
        assertEquals(0, last.bbUpper().compareTo(last.bbLower()), "Bands collapse on constant series");
    }

    @Test
    void testRsiStaysWithinBoundsOnRandomWalk() {
        for (long seed = 1; seed <= 20; seed++) {
            for (IndicatorSet s : engine.compute(SyntheticBars.randomWalk(Horizon.SHORT, 150, seed))) {
                if (s.sufficient()) {
                    assertTrue(s.rsi().signum() >= 0, "RSI >= 0");
                    assertTrue(s.rsi().compareTo(new BigDecimal("100")) <= 0, "RSI <= 100");
                    assertTrue(s.atr().signum() >= 0, "ATR >= 0");
                    assertTrue(s.bbUpper().compareTo(s.bbLower()) >= 0, "upper >= lower");
                }
            }
        }
    }

    @Test
    void testUptrendIndicators() {
        List<IndicatorSet> sets = engine.compute(SyntheticBars.uptrend(Horizon.MEDIUM, 120, "100"));
        IndicatorSet last = sets.get(sets.size() - 1);

        assertTrue(last.emaFast().compareTo(last.emaSlow()) > 0, "fast EMA above slow in uptrend");
        assertTrue(last.close().compareTo(last.sma()) > 0, "close above SMA in uptrend");
        assertTrue(last.macdHistogram().signum() > 0, "MACD above signal after an up move");
        assertTrue(last.rsi().compareTo(new BigDecimal("60")) > 0 && last.rsi().compareTo(new BigDecimal("75")) < 0,
            "RSI around 65, was " + last.rsi());
    }

    @Test
    void testIsPureAndRepeatable() {
        List<Bar> bars = SyntheticBars.randomWalk(Horizon.LONG, 100, 42);
        assertEquals(engine.compute(bars), engine.compute(bars));
    }

    @Test
    void testNullBarsRejected() {
        assertThrows(IllegalArgumentException.class, () -> engine.compute(null));
    }
}
