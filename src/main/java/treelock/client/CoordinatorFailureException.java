package treelock.client;

/**
 * The coordinator was reached but the request failed there: it answered with
 * a server error, the connection broke mid-request, or no answer came in
 * time. The coordinator may still hold or queue the request, so callers
 * must not fall back to degraded mode.
 */
public class CoordinatorFailureException extends SchedulerUnavailableException {

    private final boolean timedOut;

    public CoordinatorFailureException(String message, boolean timedOut, Throwable cause) {
        super(message, cause);
        this.timedOut = timedOut;
    }

    public CoordinatorFailureException(String message) {
        this(message, false, null);
    }

    /** True if no response arrived within the request timeout. */
    public boolean timedOut() {
        return timedOut;
    }
}
