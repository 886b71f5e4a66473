package in.perpscan.service.filter;

import in.perpscan.domain.signal.FilterFeatures;
import in.perpscan.domain.signal.FilterVerdict;

/**
 * Filter used when filtering is disabled: never adjusts, never vetoes.
 */
public final class NoOpSignalFilter implements SignalFilter {

    public static final NoOpSignalFilter INSTANCE = new NoOpSignalFilter();

    private NoOpSignalFilter() {}

    @Override
    public FilterVerdict score(FilterFeatures features) {
        return FilterVerdict.passThrough();
    }
}
