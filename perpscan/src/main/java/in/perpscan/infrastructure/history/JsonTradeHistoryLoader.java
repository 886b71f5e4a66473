package in.perpscan.infrastructure.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.perpscan.domain.model.Regime;
import in.perpscan.domain.model.TradingStyle;
import in.perpscan.service.filter.InMemoryWinRateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Seeds a win-rate tracker from a JSON file of closed trades.
 *
 * <pre>
 * [{"symbol": "BTCUSDT", "regime": "BREAKOUT", "style": "SWING", "profit": 1}, ...]
 * </pre>
 *
 * A trade counts as a win when {@code profit > 0}. Regime and style match case-insensitively
 * ("Breakout" is BREAKOUT). Rows missing a field or carrying an unknown regime/style are skipped.
 */
public final class JsonTradeHistoryLoader {
    private static final Logger log = LoggerFactory.getLogger(JsonTradeHistoryLoader.class);

    private final Path file;
    private final ObjectMapper mapper;

    public JsonTradeHistoryLoader(Path file) {
        this.file = file;
        this.mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private record TradeRow(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("regime") String regime,
        @JsonProperty("style") String style,
        @JsonProperty("profit") BigDecimal profit
    ) {}

    /**
     * Record every usable trade in the tracker.
     *
     * @return number of trades recorded; 0 when the file does not exist
     * @throws UncheckedIOException if the file exists but cannot be read or parsed
     */
    public int loadInto(InMemoryWinRateTracker tracker) {
        if (!Files.exists(file)) {
            log.info("[HISTORY] No trade history at {}, win rates start empty", file);
            return 0;
        }

        List<TradeRow> rows;
        try {
            rows = mapper.readValue(file.toFile(), new TypeReference<List<TradeRow>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read trade history " + file, e);
        }

        int loaded = 0;
        int skipped = 0;
        for (TradeRow row : rows) {
            Regime regime = parse(Regime.class, row.regime());
            TradingStyle style = parse(TradingStyle.class, row.style());
            if (row.symbol() == null || regime == null || style == null || row.profit() == null) {
                skipped++;
                continue;
            }
            tracker.recordOutcome(row.symbol(), regime, style, row.profit().signum() > 0);
            loaded++;
        }

        if (skipped > 0) {
            log.warn("[HISTORY] ⚠️ Skipped {} incomplete trades in {}", skipped, file);
        }
        log.info("[HISTORY] ✓ Loaded {} closed trades from {}", loaded, file);
        return loaded;
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value) {
        if (value == null) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
