package in.perpscan.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Weights and thresholds for the score model and the final signal gate.
 */
public record ScoringConfig(
    // Final gate (inclusive)
    @JsonProperty("minScore")
    BigDecimal minScore,

    @JsonProperty("minConfidence")
    BigDecimal minConfidence,

    // Score components
    @JsonProperty("trendAgreementWeight")
    BigDecimal trendAgreementWeight,

    @JsonProperty("rsiWeight")
    BigDecimal rsiWeight,

    @JsonProperty("rsiFullScale")
    BigDecimal rsiFullScale,         // RSI distance from 50 that earns the full RSI weight

    @JsonProperty("macdWeight")
    BigDecimal macdWeight,

    @JsonProperty("breakoutRegimeBonus")
    BigDecimal breakoutRegimeBonus,

    @JsonProperty("meanRegimeBonus")
    BigDecimal meanRegimeBonus,

    @JsonProperty("partialAgreementCap")
    BigDecimal partialAgreementCap,  // max score unless all horizons agree; must be < minScore

    // Confidence components
    @JsonProperty("confidenceBase")
    BigDecimal confidenceBase,

    @JsonProperty("confidenceAgreementWeight")
    BigDecimal confidenceAgreementWeight,

    @JsonProperty("confidenceMacdWeight")
    BigDecimal confidenceMacdWeight,

    @JsonProperty("minVolatilityRatio")
    BigDecimal minVolatilityRatio,

    @JsonProperty("maxVolatilityRatio")
    BigDecimal maxVolatilityRatio,

    @JsonProperty("volatilityPenalty")
    BigDecimal volatilityPenalty,

    @JsonProperty("rsiExtremeLower")
    BigDecimal rsiExtremeLower,

    @JsonProperty("rsiExtremeUpper")
    BigDecimal rsiExtremeUpper,

    @JsonProperty("rsiExtremePenalty")
    BigDecimal rsiExtremePenalty
) {
    public static ScoringConfig defaults() {
        return new ScoringConfig(
            new BigDecimal("60"),
            new BigDecimal("70"),
            new BigDecimal("50"),
            new BigDecimal("20"),
            new BigDecimal("20"),
            new BigDecimal("20"),
            new BigDecimal("10"),
            new BigDecimal("5"),
            new BigDecimal("55"),
            new BigDecimal("60"),
            new BigDecimal("20"),
            new BigDecimal("10"),
            new BigDecimal("0.002"),
            new BigDecimal("0.05"),
            new BigDecimal("30"),
            new BigDecimal("20"),
            new BigDecimal("80"),
            new BigDecimal("10")
        );
    }

    public ScoringConfig withThresholds(BigDecimal score, BigDecimal confidence) {
        return new ScoringConfig(score, confidence, trendAgreementWeight, rsiWeight, rsiFullScale,
            macdWeight, breakoutRegimeBonus, meanRegimeBonus, partialAgreementCap,
            confidenceBase, confidenceAgreementWeight, confidenceMacdWeight,
            minVolatilityRatio, maxVolatilityRatio, volatilityPenalty,
            rsiExtremeLower, rsiExtremeUpper, rsiExtremePenalty);
    }
}
