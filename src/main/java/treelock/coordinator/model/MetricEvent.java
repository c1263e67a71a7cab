package treelock.coordinator.model;

import java.time.Instant;

/**
 * One line of the metrics feed: {@code timestamp,event_type,scope_id,duration_ms,verb}.
 */
public record MetricEvent(Instant timestamp, LockEventType type, String scopeId, long durationMs, String verb) {

    public static MetricEvent from(LockEvent event) {
        return new MetricEvent(event.timestamp(), event.type(), event.scope().id(), event.durationMs(), event.verb());
    }

    public ScopeType scopeType() {
        return Scope.GLOBAL_ID.equals(scopeId) ? ScopeType.GLOBAL : ScopeType.WORKTREE;
    }
}
