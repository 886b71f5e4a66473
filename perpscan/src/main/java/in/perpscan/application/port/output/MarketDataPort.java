package in.perpscan.application.port.output;

import in.perpscan.domain.model.Bar;
import in.perpscan.domain.model.Horizon;

import java.util.List;

/**
 * Output port: already-fetched market data.
 *
 * Implementations talk to an exchange, a cache or local files; the core never sees which.
 */
public interface MarketDataPort {

    /**
     * Symbols ordered by traded volume, most liquid first.
     *
     * @param n maximum number of symbols
     */
    List<String> topSymbolsByVolume(int n);

    /**
     * Most recent closed bars for a symbol on one horizon, oldest first.
     */
    List<Bar> bars(String symbol, Horizon horizon, int limit);
}
