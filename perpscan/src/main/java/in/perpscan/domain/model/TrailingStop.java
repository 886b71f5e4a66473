package in.perpscan.domain.model;

import java.math.BigDecimal;

/**
 * Trailing stop plan attached to a trade structure.
 *
 * Inactive at entry. Once price reaches {@code activationPrice} the stop trails the
 * best price seen by {@code distance} and only ever moves in the trade's favor.
 */
public record TrailingStop(
        Side side,
        BigDecimal activationPrice,
        BigDecimal distance) {

    /**
     * Whether the trailing stop is armed at the given price.
     */
    public boolean isActivatedAt(BigDecimal price) {
        return switch (side) {
            case LONG -> price.compareTo(activationPrice) >= 0;
            case SHORT -> price.compareTo(activationPrice) <= 0;
        };
    }

    /**
     * Stop level for a given best price, ignoring the ratchet.
     */
    public BigDecimal levelFor(BigDecimal bestPrice) {
        return switch (side) {
            case LONG -> bestPrice.subtract(distance);
            case SHORT -> bestPrice.add(distance);
        };
    }

    /**
     * Next stop level after observing {@code price}.
     *
     * @param currentStop current trailing stop, null if not yet activated
     * @param price       latest observed price
     * @return updated stop, or null while not activated
     */
    public BigDecimal ratchet(BigDecimal currentStop, BigDecimal price) {
        if (currentStop == null) {
            return isActivatedAt(price) ? levelFor(price) : null;
        }
        BigDecimal candidate = levelFor(price);
        return switch (side) {
            case LONG -> candidate.max(currentStop);
            case SHORT -> candidate.min(currentStop);
        };
    }
}
