package treelock.coordinator.model;

import java.util.Locale;

/**
 * Final status of a submitted operation as seen by the caller.
 */
public enum OperationStatus {
    /** Lock granted, operation ran and succeeded */
    SUCCESS,
    /** Lock granted, operation ran and failed */
    FAILED,
    /** Acquisition timed out after retry */
    TIMEOUT,
    /** Cancelled before dispatch */
    CANCELLED,
    /** Refused: would deadlock against the caller's own lock */
    CONFLICT,
    /** Coordinator unreachable and degraded mode failed as well */
    UNAVAILABLE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
