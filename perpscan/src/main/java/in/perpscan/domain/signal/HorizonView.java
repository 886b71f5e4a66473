package in.perpscan.domain.signal;

import in.perpscan.domain.model.Bar;
import in.perpscan.domain.model.Horizon;
import in.perpscan.domain.model.IndicatorSet;
import in.perpscan.domain.model.TrendLabel;

import java.math.BigDecimal;
import java.util.List;

/**
 * Analysis result for a single horizon.
 * Immutable snapshot of the horizon's state at the latest bar.
 */
public record HorizonView(
    Horizon horizon,
    Status status,

    // Trend
    TrendLabel trend,
    int trendPersistence,     // Consecutive latest bars carrying the same trend label

    // Latest values
    Bar latestBar,
    IndicatorSet latest,

    // Sufficient indicator sets, oldest first (for regime and z-score features)
    List<IndicatorSet> history,

    // Data coverage
    int barCount,
    int requiredBars
) {
    public enum Status {
        READY,
        INSUFFICIENT
    }

    public HorizonView {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public boolean isReady() {
        return status == Status.READY;
    }

    public BigDecimal close() {
        return latestBar == null ? null : latestBar.close();
    }

    /**
     * View for a horizon whose warm-up is not satisfied. Carries no trend.
     */
    public static HorizonView insufficient(Horizon horizon, int barCount, int requiredBars) {
        return new HorizonView(horizon, Status.INSUFFICIENT, TrendLabel.FLAT, 0,
            null, null, List.of(), barCount, requiredBars);
    }

    /**
     * Builder for creating ready views.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Horizon horizon;
        private TrendLabel trend = TrendLabel.FLAT;
        private int trendPersistence = 0;
        private Bar latestBar;
        private IndicatorSet latest;
        private List<IndicatorSet> history = List.of();
        private int barCount;
        private int requiredBars;

        public Builder horizon(Horizon horizon) { this.horizon = horizon; return this; }
        public Builder trend(TrendLabel trend) { this.trend = trend; return this; }
        public Builder trendPersistence(int n) { this.trendPersistence = n; return this; }
        public Builder latestBar(Bar bar) { this.latestBar = bar; return this; }
        public Builder latest(IndicatorSet set) { this.latest = set; return this; }
        public Builder history(List<IndicatorSet> history) { this.history = history; return this; }
        public Builder barCount(int n) { this.barCount = n; return this; }
        public Builder requiredBars(int n) { this.requiredBars = n; return this; }

        public HorizonView build() {
            return new HorizonView(
                horizon, Status.READY,
                trend, trendPersistence,
                latestBar, latest,
                history,
                barCount, requiredBars
            );
        }
    }
}
