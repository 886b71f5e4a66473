package in.perpscan.infrastructure.json;

import com.fasterxml.jackson.databind.JsonNode;
import in.perpscan.domain.model.RankedTrade;
import in.perpscan.domain.model.Side;
import in.perpscan.domain.model.TradeStructure;
import in.perpscan.domain.model.TrailingStop;
import in.perpscan.support.TestViews;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignalJsonMapperTest {

    private final SignalJsonMapper mapper = new SignalJsonMapper();

    private static RankedTrade trade() {
        TradeStructure structure = new TradeStructure(Side.LONG,
            new BigDecimal("100"), new BigDecimal("106"), new BigDecimal("97"),
            new TrailingStop(Side.LONG, new BigDecimal("103"), new BigDecimal("2")),
            new BigDecimal("7.5"), new BigDecimal("75"), new BigDecimal("90.5"), new BigDecimal("10"));
        return new RankedTrade(TestViews.signal("BTCUSDT", Side.LONG, "82.5", "90"), structure);
    }

    @Test
    void testTradeRendering() throws Exception {
        String json = mapper.toJson(List.of(trade()));
        JsonNode root = mapper.mapper().readTree(json);

        assertTrue(root.isArray());
        JsonNode first = root.get(0);
        assertEquals("BTCUSDT", first.get("signal").get("symbol").asText());
        assertEquals("LONG", first.get("structure").get("side").asText());
        assertEquals("2024-03-01T00:00:00Z", first.get("signal").get("asOf").asText());
        assertFalse(json.contains("E+"), "decimals rendered plain: " + json);
    }

    @Test
    void testPlainDecimals() {
        String json = mapper.toJson(List.of(new RankedTrade(
            TestViews.signal("TINYUSDT", Side.SHORT, "75", "80"),
            new TradeStructure(Side.SHORT,
                new BigDecimal("1E-7"), new BigDecimal("0.9E-7"), new BigDecimal("1.1E-7"),
                new TrailingStop(Side.SHORT, new BigDecimal("0.95E-7"), new BigDecimal("1E-8")),
                new BigDecimal("1E+9"), new BigDecimal("10"), new BigDecimal("2E-7"), new BigDecimal("10")))));

        assertTrue(json.contains("0.0000001"), json);
        assertTrue(json.contains("1000000000"), json);
    }

    @Test
    void testDeterministicOutput() {
        assertEquals(mapper.toJson(List.of(trade())), new SignalJsonMapper().toJson(List.of(trade())));
    }
}
