package in.perpscan.service.trade;

import in.perpscan.config.EntryMode;
import in.perpscan.config.RiskConfig;
import in.perpscan.config.TrailingStopConfig;
import in.perpscan.domain.model.AccountSnapshot;
import in.perpscan.domain.model.IndicatorSet;
import in.perpscan.domain.model.NoSignalReason;
import in.perpscan.domain.model.Side;
import in.perpscan.domain.model.Signal;
import in.perpscan.domain.model.TradeStructure;
import in.perpscan.domain.model.TrailingStop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns an accepted signal into a concrete trade structure.
 *
 * Sizing:     positionSize = equity × riskFraction / referencePrice
 * Margin:     positionSize × referencePrice / leverage
 * Geometry:   SL and TP are ATR multiples from entry, each capped at maxStopDistanceFraction × entry
 * Trailing:   ATR-multiple distance, armed part of the way to TP
 * Liquidation (isolated, estimate):
 *   long  = entry × (1 - 1/leverage + mmr)
 *   short = entry × (1 + 1/leverage - mmr)
 */
public final class TradeStructurer {
    private static final Logger log = LoggerFactory.getLogger(TradeStructurer.class);

    private static final MathContext MC = MathContext.DECIMAL64;

    private final RiskConfig risk;
    private final TrailingStopConfig trailing;

    public TradeStructurer(RiskConfig risk, TrailingStopConfig trailing) {
        this.risk = risk;
        this.trailing = trailing;
    }

    /**
     * Structure at the signal's reference price.
     */
    public StructuringResult structure(Signal signal, AccountSnapshot account) {
        return structure(signal, account, null);
    }

    /**
     * Structure a trade for an accepted signal.
     *
     * @param signal    accepted signal
     * @param account   current equity and leverage
     * @param reference latest indicator set of the structure horizon; supplies the
     *                  moving averages for NEAREST_AVERAGE entries (may be null)
     * @return the structure, or a failure with INVALID_ACCOUNT_STATE / INVALID_TRADE_GEOMETRY
     */
    public StructuringResult structure(Signal signal, AccountSnapshot account, IndicatorSet reference) {
        if (account == null || !account.isTradeable()) {
            return StructuringResult.failure(NoSignalReason.INVALID_ACCOUNT_STATE,
                "equity and leverage must be positive: " + account);
        }

        BigDecimal refPrice = signal.referencePrice();
        BigDecimal atr = signal.atrAtSignal();
        if (refPrice == null || refPrice.signum() <= 0) {
            return StructuringResult.failure(NoSignalReason.INVALID_TRADE_GEOMETRY,
                "non-positive reference price " + refPrice);
        }
        if (atr == null || atr.signum() <= 0) {
            return StructuringResult.failure(NoSignalReason.INVALID_TRADE_GEOMETRY,
                "non-positive ATR " + atr);
        }

        Side side = signal.side();
        BigDecimal sign = BigDecimal.valueOf(side.sign());
        BigDecimal entry = selectEntry(refPrice, reference);
        BigDecimal maxDistance = risk.maxStopDistanceFraction().multiply(entry, MC);

        BigDecimal slDistance = atr.multiply(risk.stopLossAtrMultiplier(), MC).min(maxDistance);
        BigDecimal tpDistance = atr.multiply(risk.takeProfitAtrMultiplier(), MC).min(maxDistance);
        BigDecimal stopLoss = entry.subtract(sign.multiply(slDistance), MC);
        BigDecimal takeProfit = entry.add(sign.multiply(tpDistance), MC);

        BigDecimal trailDistance = atr.multiply(trailing.atrMultiplier(), MC).min(maxDistance);
        BigDecimal activation = entry.add(sign.multiply(trailing.activationFraction().multiply(tpDistance, MC)), MC);
        TrailingStop trailingStop = new TrailingStop(side, activation, trailDistance);

        BigDecimal leverage = account.leverage();
        BigDecimal positionSize = account.equity().multiply(risk.riskFraction(), MC).divide(refPrice, MC);
        BigDecimal margin = positionSize.multiply(refPrice, MC).divide(leverage, MC);
        BigDecimal liquidation = liquidationPrice(side, entry, leverage);

        TradeStructure structure = new TradeStructure(
            side,
            entry,
            takeProfit,
            stopLoss,
            trailingStop,
            positionSize,
            margin,
            liquidation,
            leverage
        );

        if (!structure.isWellOrdered() || trailingStop.isActivatedAt(entry)) {
            return StructuringResult.failure(NoSignalReason.INVALID_TRADE_GEOMETRY,
                String.format("%s entry=%s sl=%s tp=%s", side, entry, stopLoss, takeProfit));
        }

        log.debug("[STRUCTURE] {} {} entry={} sl={} tp={} size={} margin={} liq={}",
            signal.symbol(), side, entry, stopLoss, takeProfit, positionSize, margin, liquidation);
        return StructuringResult.success(structure);
    }

    BigDecimal liquidationPrice(Side side, BigDecimal entry, BigDecimal leverage) {
        BigDecimal inverse = BigDecimal.ONE.divide(leverage, MC);
        BigDecimal mmr = risk.maintenanceMarginRate();
        BigDecimal factor = switch (side) {
            case LONG -> BigDecimal.ONE.subtract(inverse).add(mmr);
            case SHORT -> BigDecimal.ONE.add(inverse).subtract(mmr);
        };
        return entry.multiply(factor, MC);
    }

    /**
     * Entry price per the configured mode. NEAREST_AVERAGE picks the SMA, fast EMA or
     * slow EMA closest to the reference price; it falls back to the reference price
     * when no averages are available.
     */
    BigDecimal selectEntry(BigDecimal refPrice, IndicatorSet reference) {
        if (risk.entryMode() == EntryMode.MARKET || reference == null || !reference.sufficient()) {
            return refPrice;
        }
        List<BigDecimal> candidates = new ArrayList<>();
        candidates.add(reference.sma());
        candidates.add(reference.emaFast());
        candidates.add(reference.emaSlow());

        BigDecimal best = null;
        BigDecimal bestDistance = null;
        for (BigDecimal c : candidates) {
            if (c == null || c.signum() <= 0) {
                continue;
            }
            BigDecimal d = c.subtract(refPrice).abs();
            if (bestDistance == null || d.compareTo(bestDistance) < 0) {
                best = c;
                bestDistance = d;
            }
        }
        return best == null ? refPrice : best;
    }

    /**
     * Outcome of structuring: a trade structure or a failure reason.
     */
    public record StructuringResult(
        TradeStructure structure,   // null on failure
        NoSignalReason failure,     // null on success
        String detail
    ) {
        public static StructuringResult success(TradeStructure structure) {
            return new StructuringResult(structure, null, null);
        }

        public static StructuringResult failure(NoSignalReason reason, String detail) {
            return new StructuringResult(null, reason, detail);
        }

        public boolean isSuccess() {
            return structure != null;
        }
    }
}
