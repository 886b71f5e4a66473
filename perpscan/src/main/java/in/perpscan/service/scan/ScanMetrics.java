package in.perpscan.service.scan;

import in.perpscan.domain.model.NoSignalReason;

import java.time.Duration;

/**
 * Scan metrics interface for monitoring.
 *
 * Implementations can publish to Prometheus or anything else. Key metrics:
 * - Cycle count and duration
 * - Per-instrument outcomes (accepted or the rejection reason)
 * - Data fetch failures and timeouts
 * - Degraded (fail-open) filter evaluations
 */
public interface ScanMetrics {

    /**
     * Record an instrument that produced an accepted trade.
     */
    void recordAccepted();

    /**
     * Record an instrument that produced no trade.
     *
     * @param reason Why no trade was produced
     */
    void recordRejected(NoSignalReason reason);

    /**
     * Record a symbol whose data could not be fetched or whose task timed out.
     */
    void recordFailure(boolean timedOut);

    void recordFilterDegraded();

    /**
     * Record a finished cycle.
     *
     * @param duration  Wall time of the cycle
     * @param published Number of ranked trades emitted
     */
    void recordCycle(Duration duration, int published);

    ScanMetrics NOOP = new ScanMetrics() {
        @Override public void recordAccepted() {}
        @Override public void recordRejected(NoSignalReason reason) {}
        @Override public void recordFailure(boolean timedOut) {}
        @Override public void recordFilterDegraded() {}
        @Override public void recordCycle(Duration duration, int published) {}
    };
}
