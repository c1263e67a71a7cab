package treelock.coordinator.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.config.CoordinatorConfig;
import treelock.coordinator.core.LockEventBus;
import treelock.coordinator.model.Holder;
import treelock.coordinator.model.Lock;
import treelock.coordinator.model.LockEvent;
import treelock.coordinator.model.LockEventType;
import treelock.coordinator.model.ReleaseResult;
import treelock.coordinator.model.Scope;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory table of scope to current holder.
 *
 * All state sits behind one mutex. Waiters block on a per-scope condition and
 * are woken one at a time on release; each wait is also bounded by the backoff
 * delay, so a missed signal costs at most one backoff period.
 *
 * Global and worktree scopes exclude each other. A global request that finds
 * worktree locks held marks the registry as draining: no new worktree lock is
 * granted until the global request acquires or gives up.
 */
public class LockRegistry {

    private static final Logger log = LoggerFactory.getLogger(LockRegistry.class);

    private final ReentrantLock mutex = new ReentrantLock();
    private final Map<Scope, Lock> held = new HashMap<>();
    private final Map<Scope, Long> generations = new HashMap<>();
    private final Map<Scope, Condition> conditions = new HashMap<>();
    private final Map<Scope, Integer> waiters = new HashMap<>();

    private int worktreeLocksHeld = 0;
    private Holder draining = null;

    private final Duration defaultTimeout;
    private final Duration ttl;
    private final Backoff backoff;
    private final HolderLiveness liveness;
    private final LockEventBus bus;

    public LockRegistry(CoordinatorConfig config, HolderLiveness liveness, LockEventBus bus) {
        this.defaultTimeout = config.acquireTimeout();
        this.ttl = config.staleTtl();
        this.backoff = new Backoff(config.backoffBase(), config.backoffCap(), Backoff.DEFAULT_FACTOR);
        this.liveness = liveness;
        this.bus = bus;
    }

    public Lock tryAcquire(Scope scope, Holder holder) throws InterruptedException {
        return tryAcquire(scope, holder, defaultTimeout);
    }

    /**
     * Block until the scope can be granted to {@code holder} or the timeout elapses.
     *
     * @throws AcquisitionTimeoutException scope still busy at the deadline
     * @throws ScopeConflictException      the holder's own session holds a conflicting lock
     */
    public Lock tryAcquire(Scope scope, Holder holder, Duration timeout) throws InterruptedException {
        return tryAcquire(scope, holder, timeout, Instant.now(), false);
    }

    /**
     * Acquisition for a request that has been waiting since {@code waitingSince}
     * already, e.g. in the scheduler's queue. Reported wait durations include
     * that time; the timeout counts from now.
     *
     * @param contended the request was already kept waiting for this scope
     */
    public Lock tryAcquire(Scope scope, Holder holder, Duration timeout, Instant waitingSince, boolean contended)
            throws InterruptedException {
        long priorMs = Math.max(0, Duration.between(waitingSince, Instant.now()).toMillis());
        long startNanos = System.nanoTime() - TimeUnit.MILLISECONDS.toNanos(priorMs);
        long deadline = System.nanoTime() + timeout.toNanos();
        int attempt = 0;
        boolean waited = contended;

        mutex.lockInterruptibly();
        try {
            Lock conflicting = findConflict(scope, holder);
            if (conflicting != null) {
                log.warn("Scope conflict: {} requested {} while holding {}",
                        holder.describe(), scope, conflicting.scope());
                throw new ScopeConflictException(scope, conflicting);
            }

            while (true) {
                if (canGrant(scope, holder)) {
                    long waitedMs = elapsedMs(startNanos);
                    Lock lock = grant(scope, holder);
                    if (waited) {
                        publish(LockEventType.WAITED, scope, waitedMs, holder);
                    }
                    publish(LockEventType.ACQUIRED, scope, waitedMs, holder);
                    return lock;
                }

                if (scope.isGlobal() && draining == null && !held.containsKey(Scope.GLOBAL)) {
                    draining = holder;
                    log.info("Global request from {} draining {} worktree lock(s)",
                            holder.describe(), worktreeLocksHeld);
                }

                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    Holder blocker = contendedHolder(scope, holder);
                    abandonDrain(holder);
                    long waitedMs = elapsedMs(startNanos);
                    publish(LockEventType.TIMED_OUT, scope, waitedMs, holder);
                    throw new AcquisitionTimeoutException(scope, Duration.ofMillis(waitedMs), blocker);
                }

                waited = true;
                long pause = Math.min(remaining, backoff.delay(attempt++).toNanos());
                awaitWake(scope, pause);
            }
        } catch (InterruptedException e) {
            abandonDrain(holder);
            throw e;
        } finally {
            mutex.unlock();
        }
    }

    /**
     * Report a request that gave up waiting for {@code scope} before reaching
     * the registry.
     *
     * @return the holder that was in the way, if any
     */
    public Holder recordTimeout(Scope scope, Holder requester, long waitedMs) {
        mutex.lock();
        try {
            publish(LockEventType.TIMED_OUT, scope, waitedMs, requester);
            return contendedHolder(scope, requester);
        } finally {
            mutex.unlock();
        }
    }

    /**
     * Non-blocking acquisition, used for advisory pre-acquisition.
     */
    public Optional<Lock> tryAcquireNow(Scope scope, Holder holder) {
        mutex.lock();
        try {
            if (findConflict(scope, holder) != null || !canGrant(scope, holder)) {
                return Optional.empty();
            }
            Lock lock = grant(scope, holder);
            publish(LockEventType.ACQUIRED, scope, 0, holder);
            return Optional.of(lock);
        } finally {
            mutex.unlock();
        }
    }

    /**
     * Release a lock and wake a single waiter of the freed scope.
     */
    public ReleaseResult release(Lock lock) {
        mutex.lock();
        try {
            Lock current = held.get(lock.scope());
            if (current == null) {
                log.debug("Release of {} generation {}: already released", lock.scope(), lock.generation());
                return ReleaseResult.ALREADY_RELEASED;
            }
            if (current.generation() != lock.generation() || !current.holder().equals(lock.holder())) {
                log.warn("Stale release of {}: presented generation {}, current generation {} held by {}",
                        lock.scope(), lock.generation(), current.generation(), current.holder().describe());
                return ReleaseResult.STALE_GENERATION;
            }
            Instant now = Instant.now();
            remove(current);
            publish(LockEventType.RELEASED, current.scope(), current.heldFor(now).toMillis(), current.holder());
            return ReleaseResult.RELEASED;
        } finally {
            mutex.unlock();
        }
    }

    /**
     * Transfer a held lock to a new holder without letting anyone else in.
     * The generation increments as for any change of hands.
     *
     * @return the new lock, or empty if {@code lock} is no longer the current tenure
     */
    public Optional<Lock> handOff(Lock lock, Holder newHolder) {
        mutex.lock();
        try {
            Lock current = held.get(lock.scope());
            if (current == null || current.generation() != lock.generation()
                    || !current.holder().equals(lock.holder())) {
                return Optional.empty();
            }
            Instant now = Instant.now();
            long generation = generations.merge(lock.scope(), 1L, Long::sum);
            Lock next = new Lock(lock.scope(), newHolder, now, now.plus(ttl), generation);
            held.put(lock.scope(), next);
            publish(LockEventType.RELEASED, lock.scope(), current.heldFor(now).toMillis(), current.holder());
            publish(LockEventType.ACQUIRED, lock.scope(), 0, newHolder);
            return Optional.of(next);
        } finally {
            mutex.unlock();
        }
    }

    /**
     * Sweep locks past their TTL. Dead holders are force-released; live holders
     * are legitimately long-running and get their TTL extended.
     *
     * @return locks that were reclaimed
     */
    public List<Lock> reclaimStale(Instant now) {
        mutex.lock();
        try {
            List<Lock> reclaimed = new ArrayList<>();
            for (Lock lock : new ArrayList<>(held.values())) {
                if (!lock.isExpired(now)) {
                    continue;
                }
                if (liveness.isAlive(lock.holder())) {
                    held.put(lock.scope(), lock.withTtlDeadline(now.plus(ttl)));
                    log.debug("Extended TTL of {} held by live {}", lock.scope(), lock.holder().describe());
                    continue;
                }
                remove(lock);
                reclaimed.add(lock);
                long heldMs = lock.heldFor(now).toMillis();
                log.warn("Reclaimed stale lock {} (generation {}) held by {} for {}ms",
                        lock.scope(), lock.generation(), lock.holder().describe(), heldMs);
                publish(LockEventType.STALE_RECLAIMED, lock.scope(), heldMs, lock.holder());
            }
            return reclaimed;
        } finally {
            mutex.unlock();
        }
    }

    /**
     * Whether a request for {@code scope} from {@code callerId} could be granted
     * right now. An advisory lock held on the caller's behalf counts as free.
     */
    public boolean isAvailableTo(Scope scope, String callerId) {
        mutex.lock();
        try {
            Lock global = held.get(Scope.GLOBAL);
            if (scope.isGlobal()) {
                // held worktree locks do not count: the request drains them
                return draining == null && (global == null || isAdvisoryFor(global, callerId));
            }
            if (global != null || draining != null) {
                return false;
            }
            Lock current = held.get(scope);
            return current == null || isAdvisoryFor(current, callerId);
        } finally {
            mutex.unlock();
        }
    }

    /**
     * Lock held by the same session that would make {@code scope} wait on itself.
     */
    public Optional<Lock> checkConflict(Scope scope, Holder holder) {
        mutex.lock();
        try {
            return Optional.ofNullable(findConflict(scope, holder));
        } finally {
            mutex.unlock();
        }
    }

    public Optional<Lock> lockFor(Scope scope) {
        mutex.lock();
        try {
            return Optional.ofNullable(held.get(scope));
        } finally {
            mutex.unlock();
        }
    }

    public List<Lock> snapshot() {
        mutex.lock();
        try {
            List<Lock> locks = new ArrayList<>(held.values());
            locks.sort(Comparator.comparing(lock -> lock.scope().id()));
            return locks;
        } finally {
            mutex.unlock();
        }
    }

    public Optional<Holder> drainingHolder() {
        mutex.lock();
        try {
            return Optional.ofNullable(draining);
        } finally {
            mutex.unlock();
        }
    }

    public boolean isDraining() {
        return drainingHolder().isPresent();
    }

    public int heldCount() {
        mutex.lock();
        try {
            return held.size();
        } finally {
            mutex.unlock();
        }
    }

    // ---- internals, mutex held ----

    private boolean canGrant(Scope scope, Holder holder) {
        if (scope.isGlobal()) {
            return !held.containsKey(Scope.GLOBAL)
                    && worktreeLocksHeld == 0
                    && (draining == null || draining.equals(holder));
        }
        return !held.containsKey(scope) && !held.containsKey(Scope.GLOBAL) && draining == null;
    }

    private Lock grant(Scope scope, Holder holder) {
        Instant now = Instant.now();
        long generation = generations.computeIfAbsent(scope, s -> 1L);
        Lock lock = new Lock(scope, holder, now, now.plus(ttl), generation);
        held.put(scope, lock);
        if (scope.isGlobal()) {
            if (holder.equals(draining)) {
                draining = null;
            }
        } else {
            worktreeLocksHeld++;
        }
        return lock;
    }

    private void remove(Lock lock) {
        Scope scope = lock.scope();
        held.remove(scope);
        if (!scope.isGlobal()) {
            worktreeLocksHeld--;
        }
        generations.merge(scope, 1L, Long::sum);
        wakeAfterRelease(scope);
        if (!waiters.containsKey(scope)) {
            conditions.remove(scope);
        }
    }

    private Lock findConflict(Scope scope, Holder holder) {
        for (Lock lock : held.values()) {
            if (lock.holder().advisory() || !lock.holder().sameSession(holder)) {
                continue;
            }
            if (lock.scope().equals(scope) || lock.scope().isGlobal() || scope.isGlobal()) {
                return lock;
            }
        }
        return null;
    }

    private Holder contendedHolder(Scope scope, Holder requester) {
        Lock direct = held.get(scope);
        if (direct != null) {
            return direct.holder();
        }
        Lock global = held.get(Scope.GLOBAL);
        if (global != null) {
            return global.holder();
        }
        if (scope.isGlobal()) {
            return held.values().stream()
                    .min(Comparator.comparing(Lock::acquiredAt))
                    .map(Lock::holder)
                    .orElse(null);
        }
        return draining != null && !draining.equals(requester) ? draining : null;
    }

    private void abandonDrain(Holder holder) {
        if (holder.equals(draining)) {
            draining = null;
            log.info("Global request from {} stopped draining", holder.describe());
            for (Scope waiting : new ArrayList<>(waiters.keySet())) {
                signal(waiting);
            }
        }
    }

    private void awaitWake(Scope scope, long nanos) throws InterruptedException {
        Condition condition = conditions.computeIfAbsent(scope, s -> mutex.newCondition());
        waiters.merge(scope, 1, Integer::sum);
        try {
            condition.await(nanos, TimeUnit.NANOSECONDS);
        } finally {
            waiters.computeIfPresent(scope, (s, n) -> n > 1 ? n - 1 : null);
        }
    }

    private void wakeAfterRelease(Scope released) {
        if (released.isGlobal()) {
            // every blocked scope may proceed now; one waiter each
            for (Scope waiting : new ArrayList<>(waiters.keySet())) {
                signal(waiting);
            }
            return;
        }
        signal(released);
        if (draining != null && worktreeLocksHeld == 0) {
            signal(Scope.GLOBAL);
        }
    }

    private void signal(Scope scope) {
        Condition condition = conditions.get(scope);
        if (condition != null && waiters.containsKey(scope)) {
            condition.signal();
        }
    }

    private static boolean isAdvisoryFor(Lock lock, String callerId) {
        return lock.holder().advisory() && lock.holder().callerId().equals(callerId);
    }

    private void publish(LockEventType type, Scope scope, long durationMs, Holder holder) {
        if (holder.advisory()) {
            return;
        }
        bus.publish(LockEvent.of(type, scope, durationMs, holder));
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
