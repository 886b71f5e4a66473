package in.perpscan.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Complete, immutable scanner configuration.
 *
 * Built once at startup (see {@link ScannerConfigLoader}) and passed to each
 * component at construction.
 */
public record ScannerConfig(
    @JsonProperty("indicators")
    IndicatorWindows indicators,

    @JsonProperty("scoring")
    ScoringConfig scoring,

    @JsonProperty("regime")
    RegimeConfig regime,

    @JsonProperty("prefilter")
    PrefilterConfig prefilter,

    @JsonProperty("risk")
    RiskConfig risk,

    @JsonProperty("trailingStop")
    TrailingStopConfig trailingStop,

    @JsonProperty("filter")
    FilterConfig filter,

    @JsonProperty("scan")
    ScanConfig scan
) {
    public static ScannerConfig defaults() {
        return new ScannerConfig(
            IndicatorWindows.defaults(),
            ScoringConfig.defaults(),
            RegimeConfig.defaults(),
            PrefilterConfig.defaults(),
            RiskConfig.defaults(),
            TrailingStopConfig.defaults(),
            FilterConfig.defaults(),
            ScanConfig.defaults()
        );
    }

    public ScannerConfig withScoring(ScoringConfig s) {
        return new ScannerConfig(indicators, s, regime, prefilter, risk, trailingStop, filter, scan);
    }

    public ScannerConfig withPrefilter(PrefilterConfig p) {
        return new ScannerConfig(indicators, scoring, regime, p, risk, trailingStop, filter, scan);
    }

    public ScannerConfig withRisk(RiskConfig r) {
        return new ScannerConfig(indicators, scoring, regime, prefilter, r, trailingStop, filter, scan);
    }

    public ScannerConfig withFilter(FilterConfig f) {
        return new ScannerConfig(indicators, scoring, regime, prefilter, risk, trailingStop, f, scan);
    }

    public ScannerConfig withScan(ScanConfig s) {
        return new ScannerConfig(indicators, scoring, regime, prefilter, risk, trailingStop, filter, s);
    }
}
