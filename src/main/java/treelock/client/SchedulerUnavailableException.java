package treelock.client;

/**
 * The coordinator process could not be reached. Submissions fall back to
 * degraded mode on this type itself; the {@link CoordinatorFailureException}
 * subtype means the coordinator was reached and does not allow a fallback.
 */
public class SchedulerUnavailableException extends RuntimeException {

    public SchedulerUnavailableException(String message) {
        super(message);
    }

    public SchedulerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
