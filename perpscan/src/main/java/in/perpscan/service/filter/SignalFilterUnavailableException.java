package in.perpscan.service.filter;

/**
 * Raised by a signal filter that cannot score (missing model, unknown feature, remote failure).
 */
public class SignalFilterUnavailableException extends RuntimeException {

    public SignalFilterUnavailableException(String message) {
        super(message);
    }

    public SignalFilterUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
