package treelock.coordinator.model;

import java.time.Duration;
import java.time.Instant;

/**
 * A held lock. Immutable: TTL extension and hand-off produce new instances.
 * {@code generation} identifies one tenure of the scope; a release presenting
 * an older generation is a stale reference.
 */
public record Lock(Scope scope, Holder holder, Instant acquiredAt, Instant ttlDeadline, long generation) {

    public boolean isExpired(Instant now) {
        return ttlDeadline.isBefore(now);
    }

    public Duration heldFor(Instant now) {
        Duration held = Duration.between(acquiredAt, now);
        return held.isNegative() ? Duration.ZERO : held;
    }

    public Lock withTtlDeadline(Instant deadline) {
        return new Lock(scope, holder, acquiredAt, deadline, generation);
    }
}
