package in.perpscan.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scan cycle settings.
 */
public record ScanConfig(
    @JsonProperty("topSymbols")
    int topSymbols,              // instruments requested by traded volume

    @JsonProperty("topSignals")
    int topSignals,              // ranked trades kept per cycle

    @JsonProperty("barLimit")
    int barLimit,                // bars requested per horizon

    @JsonProperty("parallelism")
    int parallelism,

    @JsonProperty("cycleTimeoutSeconds")
    long cycleTimeoutSeconds,

    @JsonProperty("scanIntervalSeconds")
    long scanIntervalSeconds
) {
    public static ScanConfig defaults() {
        return new ScanConfig(100, 5, 200, 4, 120, 3600);
    }
}
