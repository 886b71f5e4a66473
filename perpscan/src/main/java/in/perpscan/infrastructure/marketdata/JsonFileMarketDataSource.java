package in.perpscan.infrastructure.marketdata;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.perpscan.application.port.output.MarketDataPort;
import in.perpscan.domain.model.Bar;
import in.perpscan.domain.model.Horizon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Market data read from JSON files in a directory.
 *
 * Layout:
 * <pre>
 * symbols.json           [{"symbol": "BTCUSDT", "volume": 123456789.0}, ...]
 * BTCUSDT_15m.json       [{"timestamp": "2024-01-01T00:00:00Z", "open": .., "high": .., "low": .., "close": .., "volume": ..}, ...]
 * BTCUSDT_1h.json
 * BTCUSDT_4h.json
 * </pre>
 */
public final class JsonFileMarketDataSource implements MarketDataPort {
    private static final Logger log = LoggerFactory.getLogger(JsonFileMarketDataSource.class);

    static final String SYMBOLS_FILE = "symbols.json";

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonFileMarketDataSource(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private record SymbolRow(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("volume") BigDecimal volume
    ) {}

    private record BarRow(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("open") BigDecimal open,
        @JsonProperty("high") BigDecimal high,
        @JsonProperty("low") BigDecimal low,
        @JsonProperty("close") BigDecimal close,
        @JsonProperty("volume") BigDecimal volume
    ) {
        Bar toBar() {
            return new Bar(timestamp, open, high, low, close, volume);
        }
    }

    @Override
    public List<String> topSymbolsByVolume(int n) {
        List<SymbolRow> rows = read(directory.resolve(SYMBOLS_FILE), new TypeReference<List<SymbolRow>>() {});
        List<String> symbols = rows.stream()
            .sorted(Comparator.comparing(SymbolRow::volume, Comparator.nullsLast(Comparator.reverseOrder()))
                .thenComparing(SymbolRow::symbol))
            .limit(n)
            .map(SymbolRow::symbol)
            .toList();
        log.debug("[MARKET DATA] {} of {} symbols selected by volume", symbols.size(), rows.size());
        return symbols;
    }

    @Override
    public List<Bar> bars(String symbol, Horizon horizon, int limit) {
        Path file = barsFile(symbol, horizon);
        if (!Files.exists(file)) {
            log.warn("[MARKET DATA] No bar file for {} {} ({})", symbol, horizon.getCode(), file);
            return List.of();
        }
        List<Bar> bars = read(file, new TypeReference<List<BarRow>>() {}).stream()
            .map(BarRow::toBar)
            .sorted(Comparator.comparing(Bar::timestamp))
            .toList();
        return bars.size() <= limit ? bars : bars.subList(bars.size() - limit, bars.size());
    }

    Path barsFile(String symbol, Horizon horizon) {
        return directory.resolve(symbol + "_" + horizon.getCode() + ".json");
    }

    private <T> T read(Path file, TypeReference<T> type) {
        try {
            return mapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
