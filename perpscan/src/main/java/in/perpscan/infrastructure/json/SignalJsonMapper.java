package in.perpscan.infrastructure.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.perpscan.domain.model.RankedTrade;
import in.perpscan.service.scan.ScanReport;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * JSON rendering of ranked trades and scan reports for downstream collaborators.
 * Timestamps as ISO-8601, decimals in plain notation.
 */
public final class SignalJsonMapper {

    private final ObjectMapper mapper;

    public SignalJsonMapper() {
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);
    }

    public String toJson(List<RankedTrade> trades) {
        return write(trades);
    }

    public String toJson(ScanReport report) {
        return write(report);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
