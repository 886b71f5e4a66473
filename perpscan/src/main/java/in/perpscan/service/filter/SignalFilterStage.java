package in.perpscan.service.filter;

import in.perpscan.application.port.output.WinRateSource;
import in.perpscan.config.FilterConfig;
import in.perpscan.domain.model.Signal;
import in.perpscan.domain.signal.AlignmentResult;
import in.perpscan.domain.signal.FilterFeatures;
import in.perpscan.domain.signal.FilterVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Applies the configured signal filter to a scored candidate.
 *
 * Fail-open: any filter failure lets the candidate through unchanged and marks the
 * outcome as degraded.
 */
public final class SignalFilterStage {
    private static final Logger log = LoggerFactory.getLogger(SignalFilterStage.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final SignalFilter filter;
    private final FeatureExtractor extractor;
    private final BigDecimal cap;

    public SignalFilterStage(SignalFilter filter, FeatureExtractor extractor, BigDecimal adjustmentCap) {
        this.filter = filter;
        this.extractor = extractor;
        this.cap = adjustmentCap;
    }

    /**
     * Stage for the given config: logistic filter when enabled, no-op otherwise.
     */
    public static SignalFilterStage create(FilterConfig config, WinRateSource winRates) {
        SignalFilter filter = config.enabled() ? new LogisticSignalFilter(config) : NoOpSignalFilter.INSTANCE;
        return new SignalFilterStage(filter, new FeatureExtractor(winRates, config.minWinRateSamples()),
            config.adjustmentCap());
    }

    public boolean isEnabled() {
        return filter != NoOpSignalFilter.INSTANCE;
    }

    public String filterName() {
        return filter.name();
    }

    public FilterOutcome apply(Signal candidate, AlignmentResult alignment) {
        if (!isEnabled()) {
            return FilterOutcome.accepted(candidate);
        }

        FilterVerdict verdict;
        try {
            FilterFeatures features = extractor.extract(candidate, alignment);
            verdict = filter.score(features);
        } catch (RuntimeException e) {
            log.warn("[FILTER] ⚠️ {} unavailable for {}, passing candidate through: {}",
                filter.name(), candidate.symbol(), e.getMessage());
            return FilterOutcome.degraded(candidate);
        }

        if (verdict.veto()) {
            log.debug("[FILTER] {} vetoed {} {}", filter.name(), candidate.symbol(), candidate.side());
            return FilterOutcome.vetoed(candidate);
        }

        BigDecimal scoreAdj = clampAdjustment(verdict.scoreAdjustment());
        BigDecimal confAdj = clampAdjustment(verdict.confidenceAdjustment());
        if (scoreAdj.signum() == 0 && confAdj.signum() == 0) {
            return FilterOutcome.accepted(candidate);
        }

        Signal adjusted = candidate.withAdjustedScores(
            bounded(candidate.baseScore().add(scoreAdj)),
            bounded(candidate.confidence().add(confAdj)));
        log.debug("[FILTER] {} {} score {} -> {}, conf {} -> {}", filter.name(), candidate.symbol(),
            candidate.baseScore(), adjusted.baseScore(), candidate.confidence(), adjusted.confidence());
        return FilterOutcome.accepted(adjusted);
    }

    private BigDecimal clampAdjustment(BigDecimal adjustment) {
        if (adjustment == null) {
            return BigDecimal.ZERO;
        }
        return adjustment.max(cap.negate()).min(cap);
    }

    private static BigDecimal bounded(BigDecimal value) {
        return value.max(BigDecimal.ZERO).min(HUNDRED).setScale(4, RoundingMode.FLOOR);
    }
}
