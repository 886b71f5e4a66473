package in.perpscan.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * OHLCV price bar for one horizon of one instrument.
 */
public record Bar(
        Instant timestamp,
        BigDecimal open,
        BigDecimal high,
        BigDecimal low,
        BigDecimal close,
        BigDecimal volume) {
}
