package in.perpscan.bootstrap;

import in.perpscan.config.ScannerConfig;
import in.perpscan.config.ScannerConfigLoader;
import in.perpscan.config.ScannerConfigValidator;
import in.perpscan.infrastructure.history.JsonTradeHistoryLoader;
import in.perpscan.infrastructure.json.SignalJsonMapper;
import in.perpscan.infrastructure.marketdata.JsonFileMarketDataSource;
import in.perpscan.infrastructure.marketdata.StaticAccountSource;
import in.perpscan.infrastructure.metrics.PrometheusScanMetrics;
import in.perpscan.service.filter.InMemoryWinRateTracker;
import in.perpscan.service.filter.SignalFilterStage;
import in.perpscan.service.scan.ScanCycleService;
import in.perpscan.service.scan.ScanReport;
import in.perpscan.service.signal.SignalPipeline;
import in.perpscan.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Scanner entry point.
 *
 * Environment:
 * - SCANNER_CONFIG     optional JSON config file (see ScannerConfigLoader for overrides)
 * - MARKET_DATA_DIR    directory read by JsonFileMarketDataSource (default: data)
 * - ACCOUNT_EQUITY / ACCOUNT_LEVERAGE
 * - TRADE_HISTORY_FILE closed trades seeding the filter's win rates (default: trades/trades.json)
 * - SCAN_LOOP          true to scan at the configured interval instead of once
 *
 * Ranked trades of each cycle are written to stdout as JSON and metric totals are logged.
 * Metrics live in {@code CollectorRegistry.defaultRegistry}; a process embedding the scanner
 * exposes them by serving that registry (e.g. through simpleclient's TextFormat).
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== PerpScan Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        // ═══════════════════════════════════════════════════════════════
        // Configuration + startup validation gate
        // ═══════════════════════════════════════════════════════════════
        ScannerConfig config;
        try {
            config = new ScannerConfigLoader().load();
            ScannerConfigValidator.validate(config);
        } catch (IllegalStateException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
            return;
        }

        PrometheusScanMetrics metrics = new PrometheusScanMetrics();
        log.info("✓ Prometheus metrics initialized");

        Path dataDir = Path.of(Env.get("MARKET_DATA_DIR", "data"));
        JsonFileMarketDataSource marketData = new JsonFileMarketDataSource(dataDir);
        StaticAccountSource account = StaticAccountSource.fromEnv();
        log.info("✓ Market data from {}, equity={} leverage={}", dataDir.toAbsolutePath(),
            account.currentAccount().equity(), account.currentAccount().leverage());

        InMemoryWinRateTracker winRates = new InMemoryWinRateTracker();
        new JsonTradeHistoryLoader(Path.of(Env.get("TRADE_HISTORY_FILE", "trades/trades.json"))).loadInto(winRates);
        SignalFilterStage filterStage = SignalFilterStage.create(config.filter(), winRates);
        log.info("✓ Signal filter: {}", filterStage.filterName());

        SignalPipeline pipeline = new SignalPipeline(config, filterStage);
        SignalJsonMapper json = new SignalJsonMapper();
        ScanCycleService scanner = new ScanCycleService(config.scan(), marketData, account, pipeline, metrics);

        if (!Env.getBool("SCAN_LOOP", false)) {
            runAndPublish(scanner, json, metrics);
            scanner.close();
            return;
        }

        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "scan-scheduler");
            t.setDaemon(false);
            return t;
        });
        scheduler.scheduleAtFixedRate(() -> runAndPublish(scanner, json, metrics),
            0, config.scan().scanIntervalSeconds(), TimeUnit.SECONDS);
        log.info("✓ Scan loop started (every {}s)", config.scan().scanIntervalSeconds());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down scanner...");
            scheduler.shutdownNow();
            scanner.close();
        }, "scan-shutdown"));
    }

    private static void runAndPublish(ScanCycleService scanner, SignalJsonMapper json, PrometheusScanMetrics metrics) {
        try {
            ScanReport report = scanner.runCycle();
            System.out.println(json.toJson(report.ranked()));
            log.info("[METRICS] {}", metrics.getSummary());
        } catch (RuntimeException e) {
            // Scheduled executors stop rescheduling after an exception
            log.error("[SCAN] Cycle failed: {}", e.getMessage(), e);
        }
    }

    private App() {}
}
