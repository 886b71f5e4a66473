package in.perpscan.service.filter;

import in.perpscan.domain.signal.FilterFeatures;
import in.perpscan.domain.signal.FilterVerdict;

/**
 * Thin port so the pipeline does not know how a candidate is judged.
 * Implementations may be a fitted model, a remote service or nothing at all.
 */
public interface SignalFilter {

    /**
     * @throws SignalFilterUnavailableException when the filter cannot produce a verdict
     */
    FilterVerdict score(FilterFeatures features);

    default String name() {
        return getClass().getSimpleName();
    }
}
