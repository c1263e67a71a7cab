package treelock.coordinator.model;

/**
 * Synchronous result handed back to the submitting caller.
 *
 * @param scopeUsed  scope id the operation ran (or waited) under
 * @param durationMs total time from submission to result
 * @param waitedMs   time spent waiting for the lock
 * @param degraded   true when the coordinator was bypassed via file locks
 */
public record OperationResult(
        OperationStatus status,
        String scopeUsed,
        long durationMs,
        long waitedMs,
        boolean degraded,
        String message) {

    public boolean isSuccess() {
        return status == OperationStatus.SUCCESS;
    }
}
