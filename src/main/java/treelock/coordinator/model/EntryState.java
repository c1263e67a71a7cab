package treelock.coordinator.model;

/**
 * Lifecycle of a queue entry:
 * {@code QUEUED -> DISPATCHED -> RUNNING -> COMPLETED | TIMED_OUT | CANCELLED}.
 * {@code REJECTED} is reached straight from submission on a scope conflict,
 * {@code RECLAIMED} from {@code RUNNING} when the holder died.
 */
public enum EntryState {
    /** Waiting in the queue */
    QUEUED,
    /** Popped by the dispatcher, acquiring its lock on a worker slot */
    DISPATCHED,
    /** Lock granted, caller is executing */
    RUNNING,
    /** Caller reported completion and the lock was released */
    COMPLETED,
    /** Acquisition timed out twice */
    TIMED_OUT,
    /** Cancelled while queued */
    CANCELLED,
    /** Refused because it would deadlock against the caller's own lock */
    REJECTED,
    /** Holder died while running; its lock was reclaimed */
    RECLAIMED;

    public boolean isTerminal() {
        return this == COMPLETED || this == TIMED_OUT || this == CANCELLED || this == REJECTED
                || this == RECLAIMED;
    }
}
