package in.perpscan.config;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ScannerConfigValidatorTest {

    private static final ScannerConfig DEFAULTS = ScannerConfig.defaults();

    private static String failureOf(ScannerConfig config) {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> ScannerConfigValidator.validate(config));
        assertTrue(e.getMessage().contains("INVALID CONFIG"), e.getMessage());
        return e.getMessage();
    }

    @Test
    void testDefaultsAreValid() {
        assertDoesNotThrow(() -> ScannerConfigValidator.validate(DEFAULTS));
        assertDoesNotThrow(() -> ScannerConfigValidator.validate(
            DEFAULTS.withFilter(DEFAULTS.filter().withEnabled(true))));
    }

    @Test
    void testPartialAgreementCapMustStayBelowMinScore() {
        ScannerConfig config = DEFAULTS.withScoring(
            DEFAULTS.scoring().withThresholds(new BigDecimal("50"), new BigDecimal("70")));
        assertTrue(failureOf(config).contains("partialAgreementCap"));
    }

    @Test
    void testTrailingDistanceMustBeTighterThanStopLoss() {
        ScannerConfig config = DEFAULTS.withRisk(
            DEFAULTS.risk().withMultipliers(BigDecimal.ONE, new BigDecimal("3")));
        assertTrue(failureOf(config).contains("Trailing ATR multiplier"));
    }

    @Test
    void testBarLimitBelowWarmup() {
        ScannerConfig config = DEFAULTS.withScan(new ScanConfig(100, 5, 10, 4, 120, 3600));
        assertTrue(failureOf(config).contains("barLimit"));
    }

    @Test
    void testAllProblemsReportedTogether() {
        ScannerConfig config = DEFAULTS
            .withScan(new ScanConfig(0, 5, 10, 4, 120, 3600))
            .withScoring(DEFAULTS.scoring().withThresholds(new BigDecimal("120"), new BigDecimal("70")));

        String message = failureOf(config);
        assertTrue(message.contains("minScore/minConfidence"));
        assertTrue(message.contains("topSymbols"));
        assertTrue(message.contains("barLimit"));
    }

    @Test
    void testRiskFractionOutOfRange() {
        RiskConfig r = DEFAULTS.risk();
        RiskConfig bad = new RiskConfig(new BigDecimal("1.5"), r.stopLossAtrMultiplier(), r.takeProfitAtrMultiplier(),
            r.maxStopDistanceFraction(), r.maintenanceMarginRate(), r.entryMode(), r.structureHorizon());
        assertTrue(failureOf(DEFAULTS.withRisk(bad)).contains("riskFraction"));
    }
}
