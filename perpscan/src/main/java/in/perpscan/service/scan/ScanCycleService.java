package in.perpscan.service.scan;

import in.perpscan.application.port.output.AccountPort;
import in.perpscan.application.port.output.MarketDataPort;
import in.perpscan.config.ScanConfig;
import in.perpscan.domain.model.AccountSnapshot;
import in.perpscan.domain.model.Bar;
import in.perpscan.domain.model.Horizon;
import in.perpscan.domain.model.NoSignalReason;
import in.perpscan.domain.model.RankedTrade;
import in.perpscan.service.signal.SignalPipeline;
import in.perpscan.service.signal.SignalPipeline.InstrumentOutcome;
import in.perpscan.service.signal.SignalRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scan cycle orchestration.
 *
 * Pulls the most liquid symbols, runs one pipeline per symbol on a bounded pool and
 * ranks the accepted trades. A failure on one symbol is logged and counted, never fatal
 * to the cycle. Tasks still running at the cycle timeout are cancelled and discarded.
 */
public final class ScanCycleService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScanCycleService.class);

    private static final String BANNER = "[SCAN] ════════════════════════════════════════════════════════";

    private final ScanConfig config;
    private final MarketDataPort marketData;
    private final AccountPort accountPort;
    private final SignalPipeline pipeline;
    private final SignalRanker ranker;
    private final ScanMetrics metrics;
    private final Clock clock;
    private final ExecutorService executor;

    public ScanCycleService(
        ScanConfig config,
        MarketDataPort marketData,
        AccountPort accountPort,
        SignalPipeline pipeline,
        ScanMetrics metrics
    ) {
        this(config, marketData, accountPort, pipeline, metrics, Clock.systemUTC());
    }

    public ScanCycleService(
        ScanConfig config,
        MarketDataPort marketData,
        AccountPort accountPort,
        SignalPipeline pipeline,
        ScanMetrics metrics,
        Clock clock
    ) {
        this.config = config;
        this.marketData = marketData;
        this.accountPort = accountPort;
        this.pipeline = pipeline;
        this.ranker = new SignalRanker();
        this.metrics = metrics;
        this.clock = clock;
        this.executor = Executors.newFixedThreadPool(config.parallelism(), workerThreads());
    }

    /**
     * Run one scan cycle.
     *
     * @throws RuntimeException if the symbol universe or the account cannot be fetched
     */
    public ScanReport runCycle() {
        Instant started = clock.instant();
        log.info(BANNER);
        log.info("[SCAN] Starting scan cycle (top {} symbols, parallelism {})",
            config.topSymbols(), config.parallelism());
        log.info(BANNER);

        AccountSnapshot account = accountPort.currentAccount();
        List<String> symbols = marketData.topSymbolsByVolume(config.topSymbols());
        if (symbols.isEmpty()) {
            log.info("[SCAN] No symbols returned by market data source");
        }

        List<Callable<SymbolResult>> tasks = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            tasks.add(() -> evaluateSymbol(symbol, account));
        }

        List<Future<SymbolResult>> futures = List.of();
        try {
            futures = executor.invokeAll(tasks, config.cycleTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[SCAN] ⚠️ Scan cycle interrupted, reporting no results");
        }

        List<RankedTrade> accepted = new ArrayList<>();
        Map<NoSignalReason, Integer> counts = new EnumMap<>(NoSignalReason.class);
        int analyzed = 0;
        int failed = 0;
        int timedOut = 0;
        int degraded = 0;

        for (int i = 0; i < futures.size(); i++) {
            SymbolResult result;
            try {
                result = futures.get(i).get();
            } catch (CancellationException e) {
                log.warn("[SCAN] ⚠️ {} timed out after {}s, discarded", symbols.get(i), config.cycleTimeoutSeconds());
                timedOut++;
                failed++;
                metrics.recordFailure(true);
                continue;
            } catch (ExecutionException e) {
                log.error("[SCAN] Error analyzing {}: {}", symbols.get(i), e.getCause().getMessage(), e.getCause());
                failed++;
                metrics.recordFailure(false);
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            if (result.outcome() == null) {
                failed++;
                metrics.recordFailure(false);
                continue;
            }

            InstrumentOutcome outcome = result.outcome();
            analyzed++;
            if (outcome.filterDegraded()) {
                degraded++;
                metrics.recordFilterDegraded();
            }
            if (outcome.isAccepted()) {
                accepted.add(outcome.trade());
                metrics.recordAccepted();
            } else {
                counts.merge(outcome.reason(), 1, Integer::sum);
                metrics.recordRejected(outcome.reason());
            }
        }

        List<RankedTrade> ranked = ranker.top(accepted, config.topSignals());
        Duration elapsed = Duration.between(started, clock.instant());
        metrics.recordCycle(elapsed, ranked.size());

        ScanReport report = new ScanReport(started, elapsed, ranked, accepted.size(), analyzed,
            failed, timedOut, counts, degraded);

        log.info(BANNER);
        log.info("[SCAN] Cycle complete: {}", report.getSummary());
        for (RankedTrade trade : ranked) {
            log.info("[SCAN] ✓ {} {} score={} conf={} entry={} sl={} tp={}",
                trade.symbol(), trade.signal().side(), trade.signal().baseScore(), trade.signal().confidence(),
                trade.structure().entry(), trade.structure().stopLoss(), trade.structure().takeProfit());
        }
        if (!counts.isEmpty()) {
            log.info("[SCAN] Rejections: {}", counts);
        }
        log.info(BANNER);
        return report;
    }

    /**
     * Fetch bars for every horizon and run the pipeline. A fetch failure yields an empty result.
     */
    SymbolResult evaluateSymbol(String symbol, AccountSnapshot account) {
        Map<Horizon, List<Bar>> bars = new EnumMap<>(Horizon.class);
        try {
            for (Horizon horizon : Horizon.values()) {
                bars.put(horizon, marketData.bars(symbol, horizon, config.barLimit()));
            }
        } catch (RuntimeException e) {
            log.error("[SCAN] Failed to fetch bars for {}: {}", symbol, e.getMessage(), e);
            return new SymbolResult(symbol, null);
        }
        InstrumentOutcome outcome = pipeline.evaluate(symbol, bars, account);
        if (outcome.reason() != null && outcome.reason().isSkip()) {
            log.warn("[SCAN] ⚠️ {} skipped: {}", symbol, outcome.reason().getDescription());
        } else {
            log.debug("[SCAN] {} -> {}", symbol, outcome.isAccepted() ? "ACCEPTED" : outcome.reason());
        }
        return new SymbolResult(symbol, outcome);
    }

    record SymbolResult(String symbol, InstrumentOutcome outcome) {}

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[SCAN] Worker pool did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "scan-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
