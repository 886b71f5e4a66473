package in.perpscan.infrastructure.metrics;

import in.perpscan.domain.model.NoSignalReason;
import in.perpscan.service.scan.ScanMetrics;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of ScanMetrics.
 *
 * Key Metrics:
 * - scanner_cycles_total - Completed scan cycles
 * - scanner_cycle_duration_seconds - Cycle wall time distribution
 * - scanner_instrument_outcomes_total{outcome} - ACCEPTED or the rejection reason
 * - scanner_symbol_failures_total{kind} - FETCH or TIMEOUT
 * - scanner_filter_degraded_total - Filter evaluations that failed open
 * - scanner_published_signals - Ranked trades emitted by the last cycle
 * - scanner_last_cycle_timestamp_seconds - Completion time of the last cycle
 */
public class PrometheusScanMetrics implements ScanMetrics {

    static final String ACCEPTED = "ACCEPTED";

    private final CollectorRegistry registry;

    private final Counter cycleCounter;
    private final Histogram cycleDuration;
    private final Counter outcomeCounter;
    private final Counter failureCounter;
    private final Counter filterDegradedCounter;
    private final Gauge publishedSignals;
    private final Gauge lastCycleTimestamp;

    public PrometheusScanMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusScanMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.cycleCounter = Counter.build()
            .name("scanner_cycles_total")
            .help("Total number of completed scan cycles")
            .register(registry);

        this.cycleDuration = Histogram.build()
            .name("scanner_cycle_duration_seconds")
            .help("Scan cycle duration in seconds")
            .buckets(0.5, 1.0, 2.0, 5.0, 10.0, 30.0, 60.0, 120.0, 300.0)
            .register(registry);

        this.outcomeCounter = Counter.build()
            .name("scanner_instrument_outcomes_total")
            .help("Per-instrument pipeline outcomes")
            .labelNames("outcome")
            .register(registry);

        this.failureCounter = Counter.build()
            .name("scanner_symbol_failures_total")
            .help("Symbols that failed to produce an outcome")
            .labelNames("kind")
            .register(registry);

        this.filterDegradedCounter = Counter.build()
            .name("scanner_filter_degraded_total")
            .help("Signal filter evaluations that failed open")
            .register(registry);

        this.publishedSignals = Gauge.build()
            .name("scanner_published_signals")
            .help("Ranked trades published by the last cycle")
            .register(registry);

        this.lastCycleTimestamp = Gauge.build()
            .name("scanner_last_cycle_timestamp_seconds")
            .help("Unix time at which the last cycle completed")
            .register(registry);
    }

    @Override
    public void recordAccepted() {
        outcomeCounter.labels(ACCEPTED).inc();
    }

    @Override
    public void recordRejected(NoSignalReason reason) {
        outcomeCounter.labels(reason.name()).inc();
    }

    @Override
    public void recordFailure(boolean timedOut) {
        failureCounter.labels(timedOut ? "TIMEOUT" : "FETCH").inc();
    }

    @Override
    public void recordFilterDegraded() {
        filterDegradedCounter.inc();
    }

    @Override
    public void recordCycle(Duration duration, int published) {
        cycleCounter.inc();
        cycleDuration.observe(duration.toMillis() / 1000.0);
        publishedSignals.set(published);
        lastCycleTimestamp.setToCurrentTime();
    }

    /**
     * One-line totals since start, for the per-cycle log.
     */
    public String getSummary() {
        return String.format("cycles=%.0f accepted=%.0f fetchFailures=%.0f timeouts=%.0f filterDegraded=%.0f published=%.0f",
            cycleCounter.get(),
            outcomeCounter.labels(ACCEPTED).get(),
            failureCounter.labels("FETCH").get(),
            failureCounter.labels("TIMEOUT").get(),
            filterDegradedCounter.get(),
            publishedSignals.get());
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
