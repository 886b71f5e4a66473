package in.perpscan.service.filter;

import in.perpscan.application.port.output.WinRateSource;
import in.perpscan.domain.model.Regime;
import in.perpscan.domain.model.TradingStyle;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Win/loss tally per (symbol, regime, style), fed with closed trade outcomes.
 */
public final class InMemoryWinRateTracker implements WinRateSource {

    private record Key(String symbol, Regime regime, TradingStyle style) {}

    private final Map<Key, WinRate> tallies = new ConcurrentHashMap<>();

    public void recordOutcome(String symbol, Regime regime, TradingStyle style, boolean win) {
        tallies.merge(new Key(symbol, regime, style),
            new WinRate(win ? 1 : 0, 1),
            (a, b) -> new WinRate(a.wins() + b.wins(), a.total() + b.total()));
    }

    @Override
    public Optional<WinRate> winRate(String symbol, Regime regime, TradingStyle style) {
        return Optional.ofNullable(tallies.get(new Key(symbol, regime, style)));
    }
}
