package in.perpscan.service.filter;

import in.perpscan.application.port.output.WinRateSource;
import in.perpscan.domain.model.Horizon;
import in.perpscan.domain.model.IndicatorSet;
import in.perpscan.domain.model.Signal;
import in.perpscan.domain.signal.AlignmentResult;
import in.perpscan.domain.signal.FilterFeatures;
import in.perpscan.domain.signal.HorizonView;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;

/**
 * Builds filter features for a candidate from its medium-horizon history.
 */
public final class FeatureExtractor {

    private final WinRateSource winRates;
    private final int minWinRateSamples;

    public FeatureExtractor(WinRateSource winRates, int minWinRateSamples) {
        this.winRates = winRates;
        this.minWinRateSamples = minWinRateSamples;
    }

    public FilterFeatures extract(Signal candidate, AlignmentResult alignment) {
        HorizonView medium = alignment.view(Horizon.MEDIUM);
        List<IndicatorSet> history = medium.history();
        IndicatorSet latest = medium.latest();
        int sign = candidate.side().sign();

        double rsiZ = sign * zScore(history, s -> s.rsi().doubleValue());
        double macdZ = sign * zScore(history, s -> s.macdHistogram().doubleValue());
        double volZ = zScore(history, FeatureExtractor::atrRatio);

        double halfBand = latest.bbUpper().subtract(latest.bbMid()).doubleValue();
        double bandPosition = halfBand == 0.0
            ? 0.0
            : sign * latest.close().subtract(latest.bbMid()).doubleValue() / halfBand;

        OptionalDouble winRate = OptionalDouble.empty();
        int samples = 0;
        Optional<WinRateSource.WinRate> known = winRates.winRate(candidate.symbol(), candidate.regime(), candidate.style());
        if (known.isPresent()) {
            samples = known.get().total();
            if (samples >= minWinRateSamples) {
                winRate = OptionalDouble.of(known.get().rate());
            }
        }

        return new FilterFeatures(
            candidate.symbol(),
            candidate.side(),
            candidate.regime(),
            candidate.style(),
            candidate.baseScore().doubleValue(),
            candidate.confidence().doubleValue(),
            rsiZ,
            macdZ,
            volZ,
            bandPosition,
            candidate.agreement().getCount() / 3.0,
            winRate,
            samples
        );
    }

    /**
     * Z-score of the latest value against the whole series (population std).
     * Zero when the series is too short or constant.
     */
    static double zScore(List<IndicatorSet> history, Function<IndicatorSet, Double> metric) {
        int n = history.size();
        if (n < 2) {
            return 0.0;
        }
        double sum = 0;
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = metric.apply(history.get(i));
            sum += values[i];
        }
        double mean = sum / n;
        double sq = 0;
        for (double v : values) {
            sq += (v - mean) * (v - mean);
        }
        double std = Math.sqrt(sq / n);
        if (std < 1e-12) {
            return 0.0;
        }
        return (values[n - 1] - mean) / std;
    }

    private static double atrRatio(IndicatorSet set) {
        return set.close().signum() == 0 ? 0.0 : set.atr().doubleValue() / set.close().doubleValue();
    }
}
