package in.perpscan.domain.model;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Concrete trade recommendation derived from an accepted signal.
 * Owned by the caller once returned.
 */
public record TradeStructure(
        Side side,
        BigDecimal entry,
        BigDecimal takeProfit,
        BigDecimal stopLoss,
        TrailingStop trailingStop,
        BigDecimal positionSize,
        BigDecimal marginRequired,
        BigDecimal estimatedLiquidationPrice,
        BigDecimal leverage) {

    /**
     * Ordering invariant: long SL &lt; entry &lt; TP, short TP &lt; entry &lt; SL, both levels positive.
     */
    public boolean isWellOrdered() {
        if (stopLoss.signum() <= 0 || takeProfit.signum() <= 0) {
            return false;
        }
        return switch (side) {
            case LONG -> stopLoss.compareTo(entry) < 0 && entry.compareTo(takeProfit) < 0;
            case SHORT -> takeProfit.compareTo(entry) < 0 && entry.compareTo(stopLoss) < 0;
        };
    }

    public BigDecimal notional() {
        return positionSize.multiply(entry);
    }

    /**
     * Reward/risk ratio: |TP - entry| / |entry - SL|.
     */
    public BigDecimal rewardToRisk() {
        BigDecimal risk = entry.subtract(stopLoss).abs();
        if (risk.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return takeProfit.subtract(entry).abs().divide(risk, MathContext.DECIMAL64);
    }
}
