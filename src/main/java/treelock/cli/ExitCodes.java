package treelock.cli;

import treelock.coordinator.model.OperationResult;

/**
 * Process exit codes of {@code treelock run}.
 */
public final class ExitCodes {

    public static final int SUCCESS = 0;
    /** Acquisition timed out after the retry */
    public static final int TIMEOUT = 1;
    /** Coordinator unreachable and degraded mode failed too */
    public static final int UNAVAILABLE = 2;
    /** The wrapped command itself failed */
    public static final int FAILED = 3;
    public static final int CANCELLED_OR_CONFLICT = 4;

    private ExitCodes() {
    }

    public static int of(OperationResult result) {
        return switch (result.status()) {
            case SUCCESS -> SUCCESS;
            case TIMEOUT -> TIMEOUT;
            case UNAVAILABLE -> UNAVAILABLE;
            case FAILED -> FAILED;
            case CANCELLED, CONFLICT -> CANCELLED_OR_CONFLICT;
        };
    }
}
