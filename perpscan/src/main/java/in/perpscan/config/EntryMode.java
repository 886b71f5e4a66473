package in.perpscan.config;

/**
 * How the entry price is chosen.
 */
public enum EntryMode {
    /**
     * Enter at the reference (latest close) price.
     */
    MARKET,

    /**
     * Enter at whichever of SMA, fast EMA and slow EMA is nearest to the reference price.
     */
    NEAREST_AVERAGE
}
