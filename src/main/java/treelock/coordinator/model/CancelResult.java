package treelock.coordinator.model;

/**
 * Result of cancelling a request.
 */
public enum CancelResult {
    /** Request was queued and has been removed without side effects */
    CANCELLED,

    /** Request is dispatched, running or already terminal */
    NOT_CANCELLABLE,

    /** Request unknown */
    NOT_FOUND
}
