package treelock.coordinator.model;

import java.time.Instant;

/**
 * Notification published by the lock registry for every transition.
 * Carries the caller id on top of the metric fields so that sequence
 * learning can follow individual callers, and the request id (null for
 * advisory holders) so the scheduler can settle the operation behind a lock.
 */
public record LockEvent(
        Instant timestamp,
        LockEventType type,
        Scope scope,
        long durationMs,
        String verb,
        String callerId,
        String requestId) {

    public static LockEvent of(LockEventType type, Scope scope, long durationMs, Holder holder) {
        return new LockEvent(Instant.now(), type, scope, Math.max(0, durationMs), holder.verb(), holder.callerId(),
                holder.requestId());
    }
}
