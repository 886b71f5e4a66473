package in.perpscan.service.filter;

import in.perpscan.domain.model.Signal;

/**
 * Result of passing a candidate through the filter stage.
 *
 * @param signal   the signal to continue with (adjusted copy, or the untouched candidate)
 * @param vetoed   the filter rejected the candidate
 * @param degraded the filter failed and the candidate passed through unchanged
 */
public record FilterOutcome(Signal signal, boolean vetoed, boolean degraded) {

    public static FilterOutcome accepted(Signal signal) {
        return new FilterOutcome(signal, false, false);
    }

    public static FilterOutcome vetoed(Signal candidate) {
        return new FilterOutcome(candidate, true, false);
    }

    public static FilterOutcome degraded(Signal candidate) {
        return new FilterOutcome(candidate, false, true);
    }
}
