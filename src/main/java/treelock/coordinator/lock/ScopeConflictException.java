package treelock.coordinator.lock;

import treelock.coordinator.model.Lock;
import treelock.coordinator.model.Scope;

/**
 * The requesting session already holds a lock that the requested scope would
 * have to wait on. Rejected up front: a session may hold several worktree
 * locks, but never global together with anything else.
 */
public class ScopeConflictException extends RuntimeException {

    private final Scope requested;
    private final Lock heldLock;

    public ScopeConflictException(Scope requested, Lock heldLock) {
        super("cannot acquire " + requested.id() + " while holding " + heldLock.scope().id()
                + " (generation " + heldLock.generation() + ")");
        this.requested = requested;
        this.heldLock = heldLock;
    }

    public Scope requested() {
        return requested;
    }

    public Lock heldLock() {
        return heldLock;
    }
}
