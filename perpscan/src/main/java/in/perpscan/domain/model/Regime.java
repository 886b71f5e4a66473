package in.perpscan.domain.model;

/**
 * Market character of an instrument.
 */
public enum Regime {
    /**
     * Range-bound, price reverts to the band midline.
     */
    MEAN,

    /**
     * Trending with volatility expansion and band penetration.
     */
    BREAKOUT
}
