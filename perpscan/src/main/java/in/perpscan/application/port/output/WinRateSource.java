package in.perpscan.application.port.output;

import in.perpscan.domain.model.Regime;
import in.perpscan.domain.model.TradingStyle;

import java.util.Optional;

/**
 * Output port: historical trade outcomes per symbol, regime and style.
 */
public interface WinRateSource {

    Optional<WinRate> winRate(String symbol, Regime regime, TradingStyle style);

    record WinRate(int wins, int total) {
        public WinRate {
            if (wins < 0 || total < 0 || wins > total) {
                throw new IllegalArgumentException("Invalid win rate " + wins + "/" + total);
            }
        }

        public double rate() {
            return total == 0 ? 0.5 : (double) wins / total;
        }
    }

    WinRateSource NONE = (symbol, regime, style) -> Optional.empty();
}
