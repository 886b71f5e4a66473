package in.perpscan.service.scan;

import in.perpscan.domain.model.NoSignalReason;
import in.perpscan.domain.model.RankedTrade;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one scan cycle.
 */
public record ScanReport(
    Instant startedAt,
    Duration elapsed,
    List<RankedTrade> ranked,                    // top trades in rank order
    int accepted,                                // trades accepted before the top-k cut
    int analyzed,                                // symbols that reached an outcome
    int failed,                                  // fetch failures and timeouts
    int timedOut,
    Map<NoSignalReason, Integer> outcomeCounts,
    int degradedFilters
) {
    public ScanReport {
        ranked = List.copyOf(ranked);
        EnumMap<NoSignalReason, Integer> counts = new EnumMap<>(NoSignalReason.class);
        counts.putAll(outcomeCounts);
        outcomeCounts = Collections.unmodifiableMap(counts);
    }

    public int countOf(NoSignalReason reason) {
        return outcomeCounts.getOrDefault(reason, 0);
    }

    public String getSummary() {
        return String.format("%d analyzed, %d accepted, %d published, %d failed (%d timed out), %d degraded filters",
            analyzed, accepted, ranked.size(), failed, timedOut, degradedFilters);
    }
}
