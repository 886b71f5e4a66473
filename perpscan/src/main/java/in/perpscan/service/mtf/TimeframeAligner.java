package in.perpscan.service.mtf;

import in.perpscan.domain.model.Bar;
import in.perpscan.domain.model.Horizon;
import in.perpscan.domain.model.IndicatorSet;
import in.perpscan.domain.model.TrendLabel;
import in.perpscan.domain.signal.AlignmentResult;
import in.perpscan.domain.signal.HorizonView;
import in.perpscan.service.indicator.IndicatorEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-Timeframe alignment.
 * Runs the indicator engine on the short, medium and long horizon of a symbol and
 * labels each horizon's trend.
 */
public final class TimeframeAligner {
    private static final Logger log = LoggerFactory.getLogger(TimeframeAligner.class);

    private final IndicatorEngine indicatorEngine;

    public TimeframeAligner(IndicatorEngine indicatorEngine) {
        this.indicatorEngine = indicatorEngine;
    }

    /**
     * Analyze all three horizons for a symbol.
     *
     * @param barsByHorizon Bars per horizon, oldest first. Missing horizons count as empty.
     */
    public AlignmentResult align(String symbol, Map<Horizon, List<Bar>> barsByHorizon) {
        Map<Horizon, HorizonView> views = new EnumMap<>(Horizon.class);
        List<Horizon> insufficient = new ArrayList<>();

        for (Horizon horizon : Horizon.values()) {
            List<Bar> bars = barsByHorizon.getOrDefault(horizon, List.of());
            HorizonView view = analyzeHorizon(horizon, bars);
            views.put(horizon, view);
            if (!view.isReady()) {
                insufficient.add(horizon);
            }
        }

        boolean ready = insufficient.isEmpty();
        if (ready) {
            log.debug("[MTF] {} aligned: short={} medium={} long={}", symbol,
                views.get(Horizon.SHORT).trend(), views.get(Horizon.MEDIUM).trend(), views.get(Horizon.LONG).trend());
        } else {
            log.warn("[MTF] {} insufficient data on {}", symbol, insufficient);
        }
        return new AlignmentResult(symbol, views, ready, insufficient);
    }

    /**
     * Analyze a single horizon.
     */
    public HorizonView analyzeHorizon(Horizon horizon, List<Bar> bars) {
        int required = indicatorEngine.warmupBars();
        if (bars == null || bars.size() < required) {
            return HorizonView.insufficient(horizon, bars == null ? 0 : bars.size(), required);
        }

        List<IndicatorSet> sets = indicatorEngine.compute(bars);
        List<IndicatorSet> history = sets.stream().filter(IndicatorSet::sufficient).toList();
        IndicatorSet latest = history.get(history.size() - 1);
        TrendLabel trend = labelTrend(latest);

        return HorizonView.builder()
            .horizon(horizon)
            .trend(trend)
            .trendPersistence(countPersistence(history, trend))
            .latestBar(bars.get(bars.size() - 1))
            .latest(latest)
            .history(history)
            .barCount(bars.size())
            .requiredBars(required)
            .build();
    }

    /**
     * UP iff emaFast &gt; emaSlow and close &gt; sma; DOWN iff both inverted; FLAT otherwise.
     */
    public static TrendLabel labelTrend(IndicatorSet set) {
        if (set == null || !set.sufficient()) {
            return TrendLabel.FLAT;
        }
        int emaCmp = set.emaFast().compareTo(set.emaSlow());
        int closeCmp = set.close().compareTo(set.sma());
        if (emaCmp > 0 && closeCmp > 0) {
            return TrendLabel.UP;
        }
        if (emaCmp < 0 && closeCmp < 0) {
            return TrendLabel.DOWN;
        }
        return TrendLabel.FLAT;
    }

    /**
     * Consecutive most-recent sets whose label equals {@code trend}.
     */
    static int countPersistence(List<IndicatorSet> history, TrendLabel trend) {
        int count = 0;
        for (int i = history.size() - 1; i >= 0; i--) {
            if (labelTrend(history.get(i)) != trend) {
                break;
            }
            count++;
        }
        return count;
    }
}
