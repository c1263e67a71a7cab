package treelock.coordinator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.model.Admission;
import treelock.coordinator.model.CancelResult;
import treelock.coordinator.model.CompleteResult;
import treelock.coordinator.model.Operation;
import treelock.coordinator.model.OperationRequest;
import treelock.coordinator.model.OperationResult;
import treelock.coordinator.model.OperationStatus;
import treelock.coordinator.scheduler.PriorityScheduler;
import treelock.coordinator.scheduler.ScheduledOperation;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Service layer for operation requests.
 * Validates input and turns the scheduler's asynchronous admission into the
 * blocking calls used by controllers and in-process callers.
 */
public class OperationService {

    private static final Logger log = LoggerFactory.getLogger(OperationService.class);

    private final PriorityScheduler scheduler;

    public OperationService(PriorityScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Build a request from raw submission fields. A null
     * {@code acquireTimeoutMs} leaves the coordinator's timeout in force.
     *
     * @throws IllegalArgumentException on invalid input
     */
    public OperationRequest newRequest(String verb, String target, Integer priority, String callerId, Long pid,
            Long acquireTimeoutMs) {
        if (verb == null || verb.isBlank()) {
            throw new IllegalArgumentException("verb is required");
        }
        if (callerId == null || callerId.isBlank()) {
            throw new IllegalArgumentException("callerId is required");
        }
        return OperationRequest.builder()
                .verb(verb)
                .target(target)
                .priority(priority != null ? priority : OperationRequest.DEFAULT_PRIORITY)
                .callerId(callerId.trim())
                .pid(pid != null ? pid : 0L)
                .acquireTimeout(acquireTimeoutMs != null ? Duration.ofMillis(acquireTimeoutMs) : null)
                .build();
    }

    /**
     * Enqueue a request and block until it is granted its lock or reaches a
     * terminal state without one.
     */
    public Admission admit(OperationRequest request) throws InterruptedException {
        CompletableFuture<Admission> admission = scheduler.submit(request);
        try {
            Admission result = admission.get();
            log.debug("Admission for {} ({} on {}): {}", request.id(), request.verb(), result.scope(),
                    result.status().wireName());
            return result;
        } catch (InterruptedException e) {
            scheduler.cancel(request.id());
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("admission of " + request.id() + " failed", cause);
        }
    }

    public CompleteResult complete(String requestId, boolean success) {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId is required");
        }
        CompleteResult result = scheduler.complete(requestId, success);
        if (result == CompleteResult.COMPLETED) {
            log.info("Operation {} completed ({})", requestId, success ? "success" : "failed");
        }
        return result;
    }

    public CancelResult cancel(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId is required");
        }
        return scheduler.cancel(requestId);
    }

    public Optional<ScheduledOperation> find(String requestId) {
        return scheduler.find(requestId);
    }

    /**
     * Run {@code operation} under the coordinator in this process: admit,
     * execute while holding the lock, release.
     */
    public OperationResult execute(OperationRequest request, Operation operation) throws InterruptedException {
        long start = System.nanoTime();
        Admission admission = admit(request);
        String scopeId = admission.scope() != null ? admission.scope().id() : null;

        if (!admission.isGranted()) {
            OperationStatus status = switch (admission.status()) {
                case TIMEOUT -> OperationStatus.TIMEOUT;
                case CANCELLED -> OperationStatus.CANCELLED;
                default -> OperationStatus.CONFLICT;
            };
            return new OperationResult(status, scopeId, elapsedMs(start), admission.waitedMs(), false,
                    admission.message());
        }

        boolean success = false;
        String message = null;
        try {
            success = operation.execute();
        } catch (InterruptedException e) {
            complete(request.id(), false);
            throw e;
        } catch (Exception e) {
            message = e.getMessage();
            log.warn("Operation {} ({}) failed: {}", request.id(), request.verb(), e.toString());
        }

        CompleteResult completed = complete(request.id(), success);
        if (completed == CompleteResult.LOCK_LOST) {
            message = "lock on " + scopeId + " was reclaimed before completion";
        }
        return new OperationResult(success ? OperationStatus.SUCCESS : OperationStatus.FAILED,
                scopeId, elapsedMs(start), admission.waitedMs(), false, message);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
