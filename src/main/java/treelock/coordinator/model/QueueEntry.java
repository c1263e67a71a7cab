package treelock.coordinator.model;

import java.time.Duration;
import java.time.Instant;

/**
 * A queued request with its resolved scope. Immutable; a retry after an
 * acquisition timeout produces a new entry that keeps the original enqueue
 * time and sequence, so it keeps aging from where it was.
 *
 * @param attemptStartedAt start of the current acquisition attempt, the base of its timeout
 * @param sequence         insertion order, the final tie-break after enqueue time
 * @param attempt          1 for the first dispatch, 2 after a timeout requeue
 * @param boost            extra priority granted on requeue
 */
public record QueueEntry(
        OperationRequest request,
        Scope scope,
        Instant enqueueTime,
        Instant attemptStartedAt,
        long sequence,
        int attempt,
        int boost) {

    public static QueueEntry first(OperationRequest request, Scope scope, Instant enqueueTime, long sequence) {
        return new QueueEntry(request, scope, enqueueTime, enqueueTime, sequence, 1, 0);
    }

    public String requestId() {
        return request.id();
    }

    /**
     * {@code priority + boost + floor(wait / agingInterval)}, capped at the maximum priority.
     */
    public int effectivePriority(Instant now, Duration agingInterval) {
        long aging = 0;
        long intervalMs = agingInterval.toMillis();
        if (intervalMs > 0) {
            long waitedMs = Math.max(0, Duration.between(enqueueTime, now).toMillis());
            aging = waitedMs / intervalMs;
        }
        long effective = (long) request.priority() + boost + aging;
        return (int) Math.min(OperationRequest.MAX_PRIORITY, effective);
    }

    public QueueEntry retry(int retryBoost, Instant now) {
        return new QueueEntry(request, scope, enqueueTime, now, sequence, attempt + 1, boost + retryBoost);
    }

    /** Time left of the current attempt's acquisition timeout, never negative. */
    public Duration remaining(Instant now, Duration acquireTimeout) {
        Duration left = acquireTimeout.minus(Duration.between(attemptStartedAt, now));
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean canRetry() {
        return attempt < 2;
    }
}
