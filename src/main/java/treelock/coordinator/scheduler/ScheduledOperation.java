package treelock.coordinator.scheduler;

import treelock.coordinator.model.Admission;
import treelock.coordinator.model.EntryState;
import treelock.coordinator.model.Lock;
import treelock.coordinator.model.OperationRequest;
import treelock.coordinator.model.Scope;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Scheduler-side state of one submitted request, from enqueue to its terminal
 * state. The admission future completes once, when the request is granted or
 * reaches a terminal state without a grant.
 */
public final class ScheduledOperation {

    private final OperationRequest request;
    private final Scope scope;
    private final CompletableFuture<Admission> admission = new CompletableFuture<>();

    private volatile EntryState state = EntryState.QUEUED;
    private volatile Lock lock;
    private volatile int attempt = 1;
    private volatile Boolean succeeded;
    private volatile Instant updatedAt = Instant.now();

    ScheduledOperation(OperationRequest request, Scope scope) {
        this.request = request;
        this.scope = scope;
    }

    public OperationRequest request() {
        return request;
    }

    public String id() {
        return request.id();
    }

    public Scope scope() {
        return scope;
    }

    public CompletableFuture<Admission> admission() {
        return admission;
    }

    public EntryState state() {
        return state;
    }

    /** Lock granted to this request, null unless running or completed. */
    public Lock lock() {
        return lock;
    }

    public int attempt() {
        return attempt;
    }

    /** Caller-reported outcome, null until completed. */
    public Boolean succeeded() {
        return succeeded;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    synchronized void transition(EntryState next) {
        this.state = next;
        this.updatedAt = Instant.now();
    }

    synchronized void requeued(int attempt) {
        this.attempt = attempt;
        transition(EntryState.QUEUED);
    }

    synchronized void granted(Lock lock, Admission grant) {
        this.lock = lock;
        transition(EntryState.RUNNING);
        admission.complete(grant);
    }

    synchronized void finish(EntryState terminal, Admission result) {
        transition(terminal);
        admission.complete(result);
    }

    synchronized void fail(RuntimeException error) {
        transition(EntryState.REJECTED);
        admission.completeExceptionally(error);
    }

    /**
     * The registry force-released this operation's lock.
     *
     * @return false if the operation had already left {@code RUNNING}
     */
    synchronized boolean markReclaimed() {
        if (state != EntryState.RUNNING) {
            return false;
        }
        transition(EntryState.RECLAIMED);
        return true;
    }

    /**
     * @return the lock to release, or null if this operation was not running
     */
    synchronized Lock markCompleted(boolean success) {
        if (state != EntryState.RUNNING) {
            return null;
        }
        this.succeeded = success;
        transition(EntryState.COMPLETED);
        return lock;
    }
}
