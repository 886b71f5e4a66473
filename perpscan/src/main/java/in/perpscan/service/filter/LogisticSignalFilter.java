package in.perpscan.service.filter;

import in.perpscan.config.FilterConfig;
import in.perpscan.domain.signal.FilterFeatures;
import in.perpscan.domain.signal.FilterVerdict;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Logistic model over the filter features.
 *
 * p = σ(bias + Σ wᵢ·xᵢ)
 * scoreAdjustment      = (2p - 1) × cap
 * confidenceAdjustment = (2·winRate - 1) × cap, zero without a known win rate
 * veto                 = p &lt; vetoProbability
 */
public final class LogisticSignalFilter implements SignalFilter {

    private static final int SCALE = 4;

    private final FilterConfig config;

    public LogisticSignalFilter(FilterConfig config) {
        this.config = config;
    }

    @Override
    public FilterVerdict score(FilterFeatures features) {
        if (config.weights().isEmpty() || config.bias() == null) {
            throw new SignalFilterUnavailableException("No logistic coefficients configured");
        }

        double p = probability(features);
        double cap = config.adjustmentCap().doubleValue();

        double scoreAdj = (2 * p - 1) * cap;
        double confAdj = features.winRate().isPresent()
            ? (2 * features.winRate().getAsDouble() - 1) * cap
            : 0.0;
        boolean veto = p < config.vetoProbability().doubleValue();

        return new FilterVerdict(decimal(scoreAdj), decimal(confAdj), veto);
    }

    /**
     * Model probability that the candidate is worth taking.
     */
    public double probability(FilterFeatures features) {
        Map<String, Double> vector = features.asVector();
        double z = config.bias().doubleValue();
        for (Map.Entry<String, BigDecimal> w : config.weights().entrySet()) {
            Double x = vector.get(w.getKey());
            if (x == null) {
                throw new SignalFilterUnavailableException("Unknown filter feature: " + w.getKey());
            }
            z += w.getValue().doubleValue() * x;
        }
        if (!Double.isFinite(z)) {
            throw new SignalFilterUnavailableException("Non-finite logit for " + features.symbol());
        }
        return 1.0 / (1.0 + Math.exp(-z));
    }

    private static BigDecimal decimal(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.FLOOR);
    }
}
