package in.perpscan.service.signal;

import in.perpscan.domain.model.RankedTrade;
import in.perpscan.domain.model.Side;
import org.junit.jupiter.api.Test;

import java.util.List;

import static in.perpscan.support.TestViews.signal;
import static org.junit.jupiter.api.Assertions.*;

class SignalRankerTest {

    private final SignalRanker ranker = new SignalRanker();

    private static RankedTrade trade(String symbol, String score, String confidence) {
        return new RankedTrade(signal(symbol, Side.LONG, score, confidence), null);
    }

    private static List<String> symbols(List<RankedTrade> trades) {
        return trades.stream().map(RankedTrade::symbol).toList();
    }

    @Test
    void testOrdersByScoreThenConfidenceThenSymbol() {
        List<RankedTrade> trades = List.of(
            trade("ETHUSDT", "80", "75"),
            trade("SOLUSDT", "90", "70"),
            trade("BTCUSDT", "80", "75"),
            trade("XRPUSDT", "80", "90"));

        assertEquals(List.of("SOLUSDT", "XRPUSDT", "BTCUSDT", "ETHUSDT"), symbols(ranker.rank(trades)));
    }

    @Test
    void testScaleDoesNotAffectOrder() {
        List<RankedTrade> trades = List.of(trade("B", "80.0000", "75"), trade("A", "80", "75.00"));
        assertEquals(List.of("A", "B"), symbols(ranker.rank(trades)));
    }

    @Test
    void testTop() {
        List<RankedTrade> trades = List.of(
            trade("A", "70", "70"), trade("B", "90", "70"), trade("C", "80", "70"));

        assertEquals(List.of("B", "C"), symbols(ranker.top(trades, 2)));
        assertEquals(3, ranker.top(trades, 10).size());
        assertTrue(ranker.top(trades, 0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> ranker.top(trades, -1));
    }

    @Test
    void testEmptyInput() {
        assertTrue(ranker.rank(List.of()).isEmpty());
    }
}
