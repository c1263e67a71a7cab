package treelock.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.config.CoordinatorConfig;
import treelock.coordinator.lock.LockRegistry;
import treelock.coordinator.metrics.MetricsRecorder;
import treelock.coordinator.model.Holder;
import treelock.coordinator.model.Lock;
import treelock.coordinator.model.Scope;
import treelock.coordinator.model.ScopeHint;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Speculative pre-acquisition of the scope a caller is predicted to need next.
 *
 * Two forms:
 * <ul>
 * <li>the predicted scope is the one the caller holds now: a reservation is
 * recorded and, when the caller releases, the lock is handed to an advisory
 * holder instead of being freed;</li>
 * <li>the predicted scope is another free scope: it is taken right away,
 * without waiting.</li>
 * </ul>
 * The caller's next matching request claims the advisory lock without
 * queueing behind anyone. Advisory locks left unclaimed for the grace window
 * are released and counted as misfires.
 */
public class AdvisoryLocks {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryLocks.class);

    private record Reservation(Holder owner, String predictedVerb) {
    }

    private record Held(Lock lock, String predictedVerb, Instant expiresAt) {
    }

    private final LockRegistry registry;
    private final MetricsRecorder metrics;
    private final Duration grace;

    private final Map<Scope, Reservation> reservations = new HashMap<>();
    private final Map<Scope, Held> held = new HashMap<>();

    private volatile Runnable onFreed = () -> {
    };

    public AdvisoryLocks(LockRegistry registry, MetricsRecorder metrics, CoordinatorConfig config) {
        this.registry = registry;
        this.metrics = metrics;
        this.grace = config.advisoryGrace();
    }

    /**
     * Callback run whenever an advisory lock is given back to the registry.
     * Advisory holders emit no lock events, so this is how the dispatcher hears about it.
     */
    public void onFreed(Runnable callback) {
        this.onFreed = callback;
    }

    /**
     * Act on a prediction made while {@code current} is held.
     */
    public synchronized void prepare(Lock current, ScopeHint hint) {
        Holder owner = current.holder();
        Scope predicted = hint.scope();
        if (predicted.equals(current.scope())) {
            reservations.put(predicted, new Reservation(owner, hint.verb()));
            log.debug("Reserved {} for {} (predicted {}, confidence {})",
                    predicted, owner.callerId(), hint.verb(), hint.confidence());
            return;
        }
        if (held.containsKey(predicted)) {
            return;
        }
        registry.tryAcquireNow(predicted, Holder.advisory(owner.callerId(), owner.pid()))
                .ifPresent(lock -> {
                    held.put(predicted, new Held(lock, hint.verb(), Instant.now().plus(grace)));
                    log.debug("Pre-acquired {} for {} (predicted {}, confidence {})",
                            predicted, owner.callerId(), hint.verb(), hint.confidence());
                });
    }

    /**
     * Called instead of a plain release. If the releasing holder reserved its
     * own scope, the lock changes hands to an advisory holder.
     *
     * @return the advisory lock, or empty if the caller must release normally
     */
    public synchronized Optional<Lock> onRelease(Lock lock) {
        Reservation reservation = reservations.remove(lock.scope());
        if (reservation == null || !reservation.owner().equals(lock.holder())) {
            return Optional.empty();
        }
        if (registry.isDraining()) {
            log.debug("Skipping hand-off of {}: global request draining", lock.scope());
            return Optional.empty();
        }
        Holder owner = reservation.owner();
        Optional<Lock> advisory = registry.handOff(lock, Holder.advisory(owner.callerId(), owner.pid()));
        advisory.ifPresent(next -> held.put(next.scope(),
                new Held(next, reservation.predictedVerb(), Instant.now().plus(grace))));
        return advisory;
    }

    /**
     * Hand an advisory lock held on {@code requester}'s behalf over to it.
     */
    public synchronized Optional<Lock> claim(Scope scope, Holder requester) {
        Held advisory = held.get(scope);
        if (advisory == null || !advisory.lock().holder().callerId().equals(requester.callerId())) {
            return Optional.empty();
        }
        held.remove(scope);
        Optional<Lock> claimed = registry.handOff(advisory.lock(), requester);
        if (claimed.isPresent()) {
            metrics.recordAdvisoryHit();
            log.debug("Advisory hit on {} by {} ({})", scope, requester.callerId(), requester.verb());
        }
        return claimed;
    }

    /**
     * Release advisory locks past their grace window, or all of them while a
     * global request is draining. Drops reservations whose lock changed hands.
     *
     * @return number of advisory locks released
     */
    public int expire(Instant now) {
        List<Lock> released = new ArrayList<>();
        synchronized (this) {
            boolean draining = registry.isDraining();
            held.entrySet().removeIf(entry -> {
                Held advisory = entry.getValue();
                if (!draining && !advisory.expiresAt().isBefore(now)) {
                    return false;
                }
                registry.release(advisory.lock());
                released.add(advisory.lock());
                metrics.recordMisfire();
                log.debug("Advisory misfire: {} unused for {} (predicted {})",
                        entry.getKey(), advisory.lock().holder().callerId(), advisory.predictedVerb());
                return true;
            });
            reservations.entrySet().removeIf(entry -> registry.lockFor(entry.getKey())
                    .map(lock -> !lock.holder().equals(entry.getValue().owner()))
                    .orElse(true));
        }
        if (!released.isEmpty()) {
            onFreed.run();
        }
        return released.size();
    }

    public synchronized int heldCount() {
        return held.size();
    }

    public synchronized boolean isReserved(Scope scope) {
        return reservations.containsKey(scope);
    }
}
