package in.perpscan.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration validator.
 *
 * Validates configuration before any scanner component is constructed.
 * Throws IllegalStateException listing every problem if the configuration is inconsistent,
 * and the scanner refuses to start.
 */
public final class ScannerConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(ScannerConfigValidator.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Validate configuration at startup.
     *
     * @param config Loaded configuration
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(ScannerConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running scanner config validation...");
        log.info("════════════════════════════════════════════════════════");

        List<String> errors = new ArrayList<>();
        checkIndicators(config.indicators(), errors);
        checkScoring(config.scoring(), errors);
        checkRegime(config.regime(), errors);
        checkRisk(config.risk(), config.trailingStop(), errors);
        checkFilter(config.filter(), errors);
        checkScan(config.scan(), config.indicators(), errors);

        if (!errors.isEmpty()) {
            errors.forEach(e -> log.error("❌ {}", e));
            throw new IllegalStateException(
                "❌ INVALID CONFIG: scanner refuses to start\n  - " + String.join("\n  - ", errors));
        }

        if (!config.filter().enabled()) {
            log.info("Signal filter disabled - candidates pass through unadjusted");
        }
        if (!config.prefilter().enabled()) {
            log.warn("⚠️  Prefilter disabled - volume/volatility/RSI gates skipped");
        }

        log.info("✅ Scanner config validation passed (warm-up {} bars, thresholds {}/{})",
            config.indicators().warmupBars(), config.scoring().minScore(), config.scoring().minConfidence());
        log.info("════════════════════════════════════════════════════════");
    }

    private static void checkIndicators(IndicatorWindows w, List<String> errors) {
        if (w.emaFast() <= 0 || w.emaSlow() <= 0 || w.sma() <= 0 || w.rsi() <= 0 || w.atr() <= 0
            || w.bollinger() <= 1 || w.macdFast() <= 0 || w.macdSlow() <= 0 || w.macdSignal() <= 0) {
            errors.add("Indicator windows must be positive (Bollinger window > 1): " + w);
        }
        if (w.emaFast() >= w.emaSlow()) {
            errors.add("emaFast (" + w.emaFast() + ") must be shorter than emaSlow (" + w.emaSlow() + ")");
        }
        if (w.macdFast() >= w.macdSlow()) {
            errors.add("macdFast (" + w.macdFast() + ") must be shorter than macdSlow (" + w.macdSlow() + ")");
        }
        if (!positive(w.bollingerStdDevs())) {
            errors.add("bollingerStdDevs must be positive: " + w.bollingerStdDevs());
        }
    }

    private static void checkScoring(ScoringConfig s, List<String> errors) {
        if (!percent(s.minScore()) || !percent(s.minConfidence())) {
            errors.add("minScore/minConfidence must be in [0,100]: " + s.minScore() + "/" + s.minConfidence());
        }
        // Structural guarantee: partial agreement can never reach the threshold
        if (s.partialAgreementCap() == null || s.partialAgreementCap().compareTo(s.minScore()) >= 0) {
            errors.add("partialAgreementCap (" + s.partialAgreementCap()
                + ") must be below minScore (" + s.minScore() + ")");
        }
        if (!positive(s.rsiFullScale())) {
            errors.add("rsiFullScale must be positive: " + s.rsiFullScale());
        }
        if (s.minVolatilityRatio().compareTo(s.maxVolatilityRatio()) >= 0) {
            errors.add("minVolatilityRatio must be below maxVolatilityRatio");
        }
        if (s.rsiExtremeLower().compareTo(s.rsiExtremeUpper()) >= 0) {
            errors.add("rsiExtremeLower must be below rsiExtremeUpper");
        }
        for (BigDecimal weight : List.of(s.trendAgreementWeight(), s.rsiWeight(), s.macdWeight(),
                s.breakoutRegimeBonus(), s.meanRegimeBonus(), s.confidenceBase(),
                s.confidenceAgreementWeight(), s.confidenceMacdWeight(),
                s.volatilityPenalty(), s.rsiExtremePenalty())) {
            if (weight == null || weight.signum() < 0) {
                errors.add("Score and confidence weights must be non-negative: " + weight);
                break;
            }
        }
    }

    private static void checkRegime(RegimeConfig r, List<String> errors) {
        if (r.breakoutLookback() <= 0) {
            errors.add("breakoutLookback must be positive: " + r.breakoutLookback());
        }
        if (!positive(r.bandExpansionFactor())) {
            errors.add("bandExpansionFactor must be positive: " + r.bandExpansionFactor());
        }
        if (r.persistenceScalpMax() >= r.persistenceTrendMin()) {
            errors.add("persistenceScalpMax (" + r.persistenceScalpMax()
                + ") must be below persistenceTrendMin (" + r.persistenceTrendMin() + ")");
        }
    }

    private static void checkRisk(RiskConfig r, TrailingStopConfig t, List<String> errors) {
        if (!positive(r.riskFraction()) || r.riskFraction().compareTo(BigDecimal.ONE) > 0) {
            errors.add("riskFraction must be in (0,1]: " + r.riskFraction());
        }
        if (!positive(r.stopLossAtrMultiplier()) || !positive(r.takeProfitAtrMultiplier())) {
            errors.add("ATR multipliers for SL/TP must be positive");
        }
        if (!positive(r.maxStopDistanceFraction()) || r.maxStopDistanceFraction().compareTo(BigDecimal.ONE) >= 0) {
            errors.add("maxStopDistanceFraction must be in (0,1): " + r.maxStopDistanceFraction());
        }
        if (r.maintenanceMarginRate() == null || r.maintenanceMarginRate().signum() < 0) {
            errors.add("maintenanceMarginRate must be non-negative");
        }
        if (r.entryMode() == null || r.structureHorizon() == null) {
            errors.add("entryMode and structureHorizon are required");
        }
        if (!positive(t.atrMultiplier()) || t.atrMultiplier().compareTo(r.stopLossAtrMultiplier()) >= 0) {
            errors.add("Trailing ATR multiplier (" + t.atrMultiplier()
                + ") must be positive and tighter than the stop-loss multiplier (" + r.stopLossAtrMultiplier() + ")");
        }
        if (!positive(t.activationFraction()) || t.activationFraction().compareTo(BigDecimal.ONE) > 0) {
            errors.add("Trailing activationFraction must be in (0,1]: " + t.activationFraction());
        }
    }

    private static void checkFilter(FilterConfig f, List<String> errors) {
        if (f.adjustmentCap() == null || f.adjustmentCap().signum() < 0 || f.adjustmentCap().compareTo(HUNDRED) > 0) {
            errors.add("Filter adjustmentCap must be in [0,100]: " + f.adjustmentCap());
        }
        if (f.vetoProbability() == null || f.vetoProbability().signum() < 0
            || f.vetoProbability().compareTo(BigDecimal.ONE) > 0) {
            errors.add("Filter vetoProbability must be in [0,1]: " + f.vetoProbability());
        }
        if (f.minWinRateSamples() < 0) {
            errors.add("minWinRateSamples must be non-negative");
        }
    }

    private static void checkScan(ScanConfig s, IndicatorWindows w, List<String> errors) {
        if (s.topSymbols() <= 0 || s.topSignals() <= 0 || s.parallelism() <= 0) {
            errors.add("topSymbols, topSignals and parallelism must be positive");
        }
        if (s.barLimit() < w.warmupBars()) {
            errors.add("barLimit (" + s.barLimit() + ") is below the indicator warm-up (" + w.warmupBars() + ")");
        }
        if (s.cycleTimeoutSeconds() <= 0 || s.scanIntervalSeconds() <= 0) {
            errors.add("cycleTimeoutSeconds and scanIntervalSeconds must be positive");
        }
    }

    private static boolean positive(BigDecimal v) {
        return v != null && v.signum() > 0;
    }

    private static boolean percent(BigDecimal v) {
        return v != null && v.signum() >= 0 && v.compareTo(HUNDRED) <= 0;
    }

    private ScannerConfigValidator() {}
}
