package treelock.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.config.CoordinatorConfig;
import treelock.coordinator.core.LockEventBus;
import treelock.coordinator.lock.AcquisitionTimeoutException;
import treelock.coordinator.lock.LockRegistry;
import treelock.coordinator.lock.ScopeConflictException;
import treelock.coordinator.model.Admission;
import treelock.coordinator.model.CancelResult;
import treelock.coordinator.model.CompleteResult;
import treelock.coordinator.model.EntryState;
import treelock.coordinator.model.Holder;
import treelock.coordinator.model.Lock;
import treelock.coordinator.model.LockEvent;
import treelock.coordinator.model.LockEventType;
import treelock.coordinator.model.OperationRequest;
import treelock.coordinator.model.QueueEntry;
import treelock.coordinator.model.ReleaseResult;
import treelock.coordinator.model.Scope;
import treelock.coordinator.prediction.PatternPredictor;
import treelock.coordinator.scope.ScopeResolver;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accepts operation requests, orders them and hands them to worker slots that
 * acquire their locks.
 *
 * Queue mutation happens under one lock. A single dispatcher thread walks the
 * queue in effective-priority order and dispatches every entry whose scope is
 * free; an entry whose scope is busy stays queued and blocks only later
 * entries of the same scope. Worker slots run the (possibly blocking) lock
 * acquisition so that unrelated scopes proceed in parallel.
 *
 * The operation itself runs in the caller's process. The scheduler's part ends
 * with the grant; {@link #complete} releases the lock afterwards.
 */
public class PriorityScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PriorityScheduler.class);

    private static final Duration MAX_DISPATCH_WAIT = Duration.ofSeconds(1);

    private final ScopeResolver resolver;
    private final LockRegistry registry;
    private final PatternPredictor predictor;
    private final AdvisoryLocks advisory;
    private final Duration agingInterval;
    private final Duration acquireTimeout;
    private final int workerSlots;
    private final int retryBoost;

    private final ReentrantLock queueLock = new ReentrantLock();
    private final Condition changed = queueLock.newCondition();
    private final DispatchQueue queue;
    private final Map<Scope, Integer> inFlight = new HashMap<>();
    private final Set<String> contended = new HashSet<>();
    private int busySlots = 0;
    private long nextSequence = 0;

    private final Map<String, ScheduledOperation> operations = new ConcurrentHashMap<>();

    private final ExecutorService workers;
    private final Thread dispatcher;
    private volatile boolean running = false;

    public PriorityScheduler(ScopeResolver resolver, LockRegistry registry, PatternPredictor predictor,
            AdvisoryLocks advisory, LockEventBus bus, CoordinatorConfig config) {
        this.resolver = resolver;
        this.registry = registry;
        this.predictor = predictor;
        this.advisory = advisory;
        this.agingInterval = config.agingInterval();
        this.acquireTimeout = config.acquireTimeout();
        this.workerSlots = config.workerSlots();
        this.retryBoost = config.retryBoost();
        this.queue = new DispatchQueue(agingInterval);

        AtomicInteger workerIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerSlots, r -> {
            Thread t = new Thread(r, "treelock-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.dispatcher = new Thread(this::dispatchLoop, "treelock-dispatcher");
        this.dispatcher.setDaemon(true);

        bus.subscribe(event -> {
            if (event.type() == LockEventType.STALE_RECLAIMED) {
                settleReclaimed(event);
            }
            if (event.type() != LockEventType.ACQUIRED) {
                wake();
            }
        });
        advisory.onFreed(this::wake);
    }

    public void start() {
        if (running) {
            log.warn("Priority scheduler already running");
            return;
        }
        running = true;
        dispatcher.start();
        log.info("Priority scheduler started with {} worker slot(s), aging every {}ms",
                workerSlots, agingInterval.toMillis());
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Enqueue a request. The returned future completes when the request is
     * granted its lock, or with a timeout, cancellation or conflict admission.
     */
    public CompletableFuture<Admission> submit(OperationRequest request) {
        Scope scope = resolver.resolve(request);
        ScheduledOperation op = new ScheduledOperation(request, scope);
        if (operations.putIfAbsent(request.id(), op) != null) {
            throw new IllegalArgumentException("duplicate request id: " + request.id());
        }

        Optional<Lock> conflict = registry.checkConflict(scope, Holder.of(request));
        if (conflict.isPresent()) {
            Lock heldLock = conflict.get();
            String message = new ScopeConflictException(scope, heldLock).getMessage();
            log.warn("Rejected {} from {}: {}", request.verb(), request.callerId(), message);
            op.finish(EntryState.REJECTED, Admission.conflict(request.id(), scope, heldLock, message));
            return op.admission();
        }

        queueLock.lock();
        try {
            if (!running) {
                operations.remove(request.id());
                throw new IllegalStateException("scheduler is not running");
            }
            queue.add(QueueEntry.first(request, scope, Instant.now(), nextSequence++));
            changed.signal();
        } finally {
            queueLock.unlock();
        }
        log.debug("Queued {} {} for {} at priority {}", request.id(), request.verb(), scope, request.priority());
        return op.admission();
    }

    /**
     * Report that a granted operation finished and release its lock.
     */
    public CompleteResult complete(String requestId, boolean success) {
        ScheduledOperation op = operations.get(requestId);
        if (op == null) {
            return CompleteResult.NOT_FOUND;
        }
        if (op.state() == EntryState.COMPLETED) {
            return CompleteResult.ALREADY_COMPLETED;
        }
        if (op.state() == EntryState.RECLAIMED) {
            return CompleteResult.LOCK_LOST;
        }
        Lock lock = op.markCompleted(success);
        if (lock == null) {
            return op.state() == EntryState.COMPLETED ? CompleteResult.ALREADY_COMPLETED : CompleteResult.NOT_FOUND;
        }

        if (advisory.onRelease(lock).isPresent()) {
            wake();
            return CompleteResult.COMPLETED;
        }
        ReleaseResult released = registry.release(lock);
        if (released != ReleaseResult.RELEASED) {
            log.warn("Operation {} completed after losing its lock on {} ({})", requestId, lock.scope(), released);
            return CompleteResult.LOCK_LOST;
        }
        return CompleteResult.COMPLETED;
    }

    /**
     * Cancel a request that is still queued. Dispatched and running requests
     * cannot be cancelled here.
     */
    public CancelResult cancel(String requestId) {
        ScheduledOperation op = operations.get(requestId);
        if (op == null) {
            return CancelResult.NOT_FOUND;
        }
        queueLock.lock();
        try {
            if (op.state() != EntryState.QUEUED || queue.remove(requestId).isEmpty()) {
                return CancelResult.NOT_CANCELLABLE;
            }
            contended.remove(requestId);
            op.finish(EntryState.CANCELLED, Admission.cancelled(requestId, op.scope(), "cancelled while queued"));
        } finally {
            queueLock.unlock();
        }
        log.info("Cancelled queued request {} ({} on {})", requestId, op.request().verb(), op.scope());
        return CancelResult.CANCELLED;
    }

    /**
     * A running operation whose holder died ends here, so it can be purged
     * like any other finished request.
     */
    private void settleReclaimed(LockEvent event) {
        if (event.requestId() == null) {
            return;
        }
        ScheduledOperation op = operations.get(event.requestId());
        if (op != null && op.scope().equals(event.scope()) && op.markReclaimed()) {
            log.info("Operation {} ({} on {}) ended with its holder, lock reclaimed",
                    op.id(), op.request().verb(), op.scope());
        }
    }

    public Optional<ScheduledOperation> find(String requestId) {
        return Optional.ofNullable(operations.get(requestId));
    }

    /**
     * Queued entries in dispatch order.
     */
    public List<QueueEntry> queueSnapshot() {
        queueLock.lock();
        try {
            return queue.ordered(Instant.now());
        } finally {
            queueLock.unlock();
        }
    }

    public int queueDepth() {
        queueLock.lock();
        try {
            return queue.size();
        } finally {
            queueLock.unlock();
        }
    }

    public Duration agingInterval() {
        return agingInterval;
    }

    /**
     * Forget terminal operations last updated before the cutoff.
     *
     * @return number forgotten
     */
    public int purgeFinished(Instant cutoff) {
        int before = operations.size();
        operations.values().removeIf(op -> op.state().isTerminal() && op.updatedAt().isBefore(cutoff));
        return before - operations.size();
    }

    public void wake() {
        queueLock.lock();
        try {
            changed.signal();
        } finally {
            queueLock.unlock();
        }
    }

    // ---- dispatcher ----

    private void dispatchLoop() {
        long waitMs = Math.max(10, Math.min(Math.min(agingInterval.toMillis(), MAX_DISPATCH_WAIT.toMillis()),
                acquireTimeout.toMillis() / 10));
        queueLock.lock();
        try {
            while (running) {
                dispatchReady(Instant.now());
                changed.await(waitMs, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            queueLock.unlock();
        }
        log.debug("Dispatcher stopped");
    }

    /** Queue lock held. */
    private void dispatchReady(Instant now) {
        Set<Scope> blocked = new HashSet<>();
        for (QueueEntry entry : queue.ordered(now)) {
            Scope scope = entry.scope();
            if (blocked.contains(scope) || busySlots >= workerSlots || !isDispatchable(entry)) {
                // later entries of this scope must not overtake it
                blocked.add(scope);
                contended.add(entry.requestId());
                expireIfDue(entry, now);
                continue;
            }
            queue.remove(entry.requestId());
            boolean waited = contended.remove(entry.requestId());
            inFlight.merge(scope, 1, Integer::sum);
            busySlots++;
            ScheduledOperation op = operations.get(entry.requestId());
            op.transition(EntryState.DISPATCHED);
            workers.execute(() -> acquire(entry, op, waited));
        }
    }

    /**
     * Time out an entry whose scope stayed busy for the whole attempt while it
     * was still queued. Queue lock held.
     */
    private void expireIfDue(QueueEntry entry, Instant now) {
        if (!entry.remaining(now, timeoutFor(entry)).isZero()) {
            return;
        }
        OperationRequest request = entry.request();
        ScheduledOperation op = operations.get(request.id());
        queue.remove(request.id());
        long waitedMs = Math.max(0, Duration.between(entry.enqueueTime(), now).toMillis());
        Holder blocker = registry.recordTimeout(entry.scope(), Holder.of(request), waitedMs);

        if (entry.canRetry()) {
            QueueEntry retry = entry.retry(retryBoost, now);
            queue.add(retry);
            op.requeued(retry.attempt());
            log.info("Request {} waited {}ms for {} in queue, requeued with boost (attempt {})",
                    request.id(), waitedMs, entry.scope(), retry.attempt());
            return;
        }
        contended.remove(request.id());
        String message = new AcquisitionTimeoutException(entry.scope(), Duration.ofMillis(waitedMs), blocker)
                .getMessage();
        log.warn("Request {} ({} on {}) timed out after retry: {}",
                request.id(), request.verb(), entry.scope(), message);
        op.finish(EntryState.TIMED_OUT, Admission.timedOut(request.id(), entry.scope(), waitedMs, blocker, message));
    }

    private Duration timeoutFor(QueueEntry entry) {
        Duration requested = entry.request().acquireTimeout();
        return requested != null ? requested : acquireTimeout;
    }

    private boolean isDispatchable(QueueEntry entry) {
        Scope scope = entry.scope();
        if (inFlight.containsKey(scope) || inFlight.containsKey(Scope.GLOBAL)) {
            return false;
        }
        return registry.isAvailableTo(scope, entry.request().callerId());
    }

    // ---- worker slot ----

    private void acquire(QueueEntry entry, ScheduledOperation op, boolean waited) {
        OperationRequest request = entry.request();
        Holder holder = Holder.of(request);
        QueueEntry retry = null;
        try {
            Optional<Lock> claimed = advisory.claim(entry.scope(), holder);
            Lock lock = claimed.isPresent()
                    ? claimed.get()
                    : registry.tryAcquire(entry.scope(), holder, entry.remaining(Instant.now(), timeoutFor(entry)),
                            entry.enqueueTime(), waited);
            long waitedMs = waitedSince(entry.enqueueTime());
            op.granted(lock, Admission.granted(request.id(), lock, waitedMs, claimed.isPresent()));
            log.debug("Granted {} {} on {} (generation {}) after {}ms",
                    request.id(), request.verb(), lock.scope(), lock.generation(), waitedMs);
            predictAhead(request, lock);
        } catch (AcquisitionTimeoutException e) {
            if (entry.canRetry()) {
                retry = entry.retry(retryBoost, Instant.now());
                log.info("Acquisition of {} for {} timed out, requeued with boost (attempt {})",
                        entry.scope(), request.id(), retry.attempt());
            } else {
                long waitedMs = waitedSince(entry.enqueueTime());
                log.warn("Request {} ({} on {}) timed out after retry: {}",
                        request.id(), request.verb(), entry.scope(), e.getMessage());
                op.finish(EntryState.TIMED_OUT, Admission.timedOut(request.id(), entry.scope(), waitedMs,
                        e.contendedHolder(), e.getMessage()));
            }
        } catch (ScopeConflictException e) {
            log.warn("Rejected {} from {}: {}", request.verb(), request.callerId(), e.getMessage());
            op.finish(EntryState.REJECTED,
                    Admission.conflict(request.id(), entry.scope(), e.heldLock(), e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            op.finish(EntryState.CANCELLED,
                    Admission.cancelled(request.id(), entry.scope(), "coordinator shutting down"));
        } catch (RuntimeException e) {
            log.error("Dispatch of {} failed", request.id(), e);
            op.fail(e);
        } finally {
            queueLock.lock();
            try {
                inFlight.computeIfPresent(entry.scope(), (s, n) -> n > 1 ? n - 1 : null);
                busySlots--;
                if (retry != null) {
                    queue.add(retry);
                    op.requeued(retry.attempt());
                }
                changed.signal();
            } finally {
                queueLock.unlock();
            }
        }
    }

    private void predictAhead(OperationRequest request, Lock lock) {
        try {
            List<String> recent = new ArrayList<>(predictor.recentVerbs(request.callerId()));
            recent.add(request.verb());
            predictor.predict(recent, request.targetScopeHint())
                    .ifPresent(hint -> advisory.prepare(lock, hint));
        } catch (RuntimeException e) {
            log.warn("Prediction after {} failed: {}", request.id(), e.getMessage());
        }
    }

    private static long waitedSince(Instant enqueueTime) {
        return Math.max(0, Duration.between(enqueueTime, Instant.now()).toMillis());
    }

    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        dispatcher.interrupt();
        workers.shutdownNow();

        List<QueueEntry> abandoned;
        queueLock.lock();
        try {
            abandoned = queue.drain();
            contended.clear();
        } finally {
            queueLock.unlock();
        }
        for (QueueEntry entry : abandoned) {
            ScheduledOperation op = operations.get(entry.requestId());
            if (op != null) {
                op.finish(EntryState.CANCELLED,
                        Admission.cancelled(entry.requestId(), entry.scope(), "coordinator shutting down"));
            }
        }
        try {
            if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Worker slots did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Priority scheduler stopped ({} queued request(s) cancelled)", abandoned.size());
    }
}
