package in.perpscan.domain.signal;

import in.perpscan.domain.model.Horizon;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-horizon views for one symbol.
 * Ready only when every horizon satisfied its warm-up.
 */
public record AlignmentResult(
    String symbol,
    Map<Horizon, HorizonView> views,
    boolean ready,
    List<Horizon> insufficientHorizons
) {
    public AlignmentResult {
        EnumMap<Horizon, HorizonView> copy = new EnumMap<>(Horizon.class);
        copy.putAll(views);
        views = Collections.unmodifiableMap(copy);
        insufficientHorizons = List.copyOf(insufficientHorizons);
    }

    public HorizonView view(Horizon horizon) {
        return views.get(horizon);
    }
}
