package treelock.coordinator.model;

/**
 * Result of reporting an operation as finished.
 */
public enum CompleteResult {
    /** Lock released (or handed to an advisory reservation) */
    COMPLETED,

    /** Already completed - idempotent success */
    ALREADY_COMPLETED,

    /** Lock had been reclaimed as stale before the caller finished */
    LOCK_LOST,

    /** Request unknown or not running */
    NOT_FOUND
}
