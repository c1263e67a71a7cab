package treelock.coordinator.model;

/**
 * Result of releasing a lock.
 */
public enum ReleaseResult {
    /** Lock was held by the presented holder and generation and is now free */
    RELEASED,

    /** Scope is not held any more (already released or reclaimed) - idempotent success */
    ALREADY_RELEASED,

    /** Scope is held by a newer tenure; the presented lock reference is stale */
    STALE_GENERATION
}
