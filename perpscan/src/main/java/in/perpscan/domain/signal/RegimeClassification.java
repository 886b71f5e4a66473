package in.perpscan.domain.signal;

import in.perpscan.domain.model.Regime;
import in.perpscan.domain.model.TradingStyle;

import java.math.BigDecimal;

/**
 * Regime and holding style of an instrument, with the features that decided them.
 */
public record RegimeClassification(
    Regime regime,
    TradingStyle style,
    BigDecimal volatilityRatio,   // long-horizon ATR / SMA
    BigDecimal bandWidth,         // latest long-horizon Bollinger width
    boolean bandExpanding,
    boolean bandPenetrated,
    int mediumPersistence
) {
}
