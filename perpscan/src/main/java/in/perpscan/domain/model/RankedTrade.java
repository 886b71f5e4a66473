package in.perpscan.domain.model;

/**
 * Accepted signal paired with its trade structure.
 */
public record RankedTrade(Signal signal, TradeStructure structure) {

    public String symbol() {
        return signal.symbol();
    }
}
