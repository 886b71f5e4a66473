package in.perpscan.service.signal;

import in.perpscan.domain.model.RankedTrade;

import java.util.Comparator;
import java.util.List;

/**
 * Orders accepted trades: score descending, then confidence descending, then symbol ascending.
 */
public final class SignalRanker {

    public static final Comparator<RankedTrade> ORDER =
        Comparator.comparing((RankedTrade t) -> t.signal().baseScore()).reversed()
            .thenComparing(Comparator.comparing((RankedTrade t) -> t.signal().confidence()).reversed())
            .thenComparing(RankedTrade::symbol);

    public List<RankedTrade> rank(List<RankedTrade> trades) {
        return trades.stream().sorted(ORDER).toList();
    }

    /**
     * Best {@code k} trades in rank order.
     */
    public List<RankedTrade> top(List<RankedTrade> trades, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be >= 0: " + k);
        }
        return trades.stream().sorted(ORDER).limit(k).toList();
    }
}
