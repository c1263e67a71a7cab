package treelock.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.api.v1.dto.AdmissionResponse;
import treelock.coordinator.api.v1.dto.CompleteOperationRequest;
import treelock.coordinator.api.v1.dto.SubmitOperationRequest;
import treelock.coordinator.lock.AcquisitionTimeoutException;
import treelock.coordinator.model.AdmissionStatus;
import treelock.coordinator.model.Operation;
import treelock.coordinator.model.OperationResult;
import treelock.coordinator.model.OperationStatus;
import treelock.coordinator.model.Scope;
import treelock.coordinator.scope.ScopeResolver;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Synchronous client of the coordinator.
 *
 * {@link #submit} blocks until the operation has run, timed out or been
 * refused. When no connection to the coordinator can be opened it runs the
 * operation under {@link DegradedLocks} instead. Once a connection is open the
 * coordinator owns the request, and a failure from then on is reported
 * without running the operation.
 */
public class CoordinatorClient {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorClient.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final ClientOptions options;
    private final HttpClient httpClient;
    private final DegradedLocks degradedLocks;
    private final ScopeResolver resolver = new ScopeResolver();

    public CoordinatorClient(ClientOptions options) {
        this(options, new DegradedLocks(options.lockDir()));
    }

    public CoordinatorClient(ClientOptions options, DegradedLocks degradedLocks) {
        this.options = options;
        this.degradedLocks = degradedLocks;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(options.connectTimeout())
                .build();
    }

    /**
     * Run {@code operation} once the coordinator grants its scope.
     */
    public OperationResult submit(String verb, String target, int priority, Operation operation)
            throws InterruptedException {
        long start = System.nanoTime();
        AdmissionResponse admission;
        try {
            admission = admit(verb, target, priority);
        } catch (CoordinatorFailureException e) {
            log.error("Coordinator failed to admit {} on {}: {}", verb, target, e.getMessage());
            OperationStatus result = e.timedOut() ? OperationStatus.TIMEOUT : OperationStatus.UNAVAILABLE;
            return new OperationResult(result, resolver.resolve(verb, target).id(), elapsedMs(start), 0, false,
                    e.getMessage());
        } catch (SchedulerUnavailableException e) {
            log.warn("Coordinator unavailable ({}), falling back to degraded file locks", e.getMessage());
            return runDegraded(verb, target, operation, start);
        }

        AdmissionStatus status = AdmissionStatus.fromWireName(admission.status());
        if (status != AdmissionStatus.GRANTED) {
            OperationStatus result = switch (status) {
                case TIMEOUT -> OperationStatus.TIMEOUT;
                case CANCELLED -> OperationStatus.CANCELLED;
                default -> OperationStatus.CONFLICT;
            };
            return new OperationResult(result, admission.scope(), elapsedMs(start), admission.waitedMs(), false,
                    admission.message());
        }

        boolean success = false;
        String message = null;
        try {
            success = operation.execute();
        } catch (InterruptedException e) {
            completeQuietly(admission.requestId(), false);
            throw e;
        } catch (Exception e) {
            message = e.getMessage();
            log.debug("Operation {} failed", verb, e);
        }
        completeQuietly(admission.requestId(), success);

        return new OperationResult(success ? OperationStatus.SUCCESS : OperationStatus.FAILED,
                admission.scope(), elapsedMs(start), admission.waitedMs(), false, message);
    }

    /**
     * POST /api/v1/operations - blocks until admitted. The client's acquire
     * timeout travels with the request and bounds the coordinator's wait.
     *
     * @throws CoordinatorFailureException  coordinator reached but the request failed or timed out
     * @throws SchedulerUnavailableException no connection to the coordinator
     */
    public AdmissionResponse admit(String verb, String target, int priority) throws InterruptedException {
        SubmitOperationRequest body = new SubmitOperationRequest(verb, target, priority, options.callerId(),
                options.pid(), options.acquireTimeout().toMillis());
        HttpResponse<String> response = send(HttpRequest.newBuilder()
                .uri(resolve("/api/v1/operations"))
                .timeout(options.admissionTimeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build());
        return read(response, AdmissionResponse.class);
    }

    /**
     * POST /api/v1/operations/{id}/complete
     *
     * @return the coordinator's result, e.g. {@code completed} or {@code lock_lost}
     */
    public String complete(String requestId, boolean success) throws InterruptedException {
        HttpResponse<String> response = send(HttpRequest.newBuilder()
                .uri(resolve("/api/v1/operations/" + requestId + "/complete"))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(new CompleteOperationRequest(success))))
                .build());
        return read(response, JsonNode.class).path("result").asText();
    }

    /**
     * POST /api/v1/operations/{id}/cancel
     *
     * @return true if the request was still queued and is now cancelled
     */
    public boolean cancel(String requestId) throws InterruptedException {
        HttpResponse<String> response = send(HttpRequest.newBuilder()
                .uri(resolve("/api/v1/operations/" + requestId + "/cancel"))
                .timeout(Duration.ofSeconds(10))
                .POST(HttpRequest.BodyPublishers.noBody())
                .build());
        return response.statusCode() == 200;
    }

    /**
     * GET a read-only view such as {@code /api/v1/locks}.
     */
    public JsonNode get(String path) throws InterruptedException {
        HttpResponse<String> response = send(HttpRequest.newBuilder()
                .uri(resolve(path))
                .timeout(Duration.ofSeconds(10))
                .GET()
                .build());
        return read(response, JsonNode.class);
    }

    public boolean isAvailable() throws InterruptedException {
        try {
            return "healthy".equals(get("/api/v1/health").path("status").asText());
        } catch (SchedulerUnavailableException e) {
            return false;
        }
    }

    private OperationResult runDegraded(String verb, String target, Operation operation, long start)
            throws InterruptedException {
        Scope scope = resolver.resolve(verb, target);
        long lockStart = System.nanoTime();
        try (DegradedLocks.Handle ignored = degradedLocks.acquire(scope, options.acquireTimeout())) {
            long waitedMs = elapsedMs(lockStart);
            boolean success = false;
            String message = null;
            try {
                success = operation.execute();
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                message = e.getMessage();
            }
            return new OperationResult(success ? OperationStatus.SUCCESS : OperationStatus.FAILED,
                    scope.id(), elapsedMs(start), waitedMs, true, message);
        } catch (AcquisitionTimeoutException e) {
            return new OperationResult(OperationStatus.TIMEOUT, scope.id(), elapsedMs(start),
                    e.waited().toMillis(), true, e.getMessage());
        } catch (UncheckedIOException e) {
            log.error("Degraded mode failed for {}: {}", scope, e.getMessage());
            return new OperationResult(OperationStatus.UNAVAILABLE, scope.id(), elapsedMs(start), 0, true,
                    "coordinator unavailable and degraded lock failed: " + e.getMessage());
        }
    }

    private void completeQuietly(String requestId, boolean success) throws InterruptedException {
        try {
            String result = complete(requestId, success);
            if (!"completed".equals(result) && !"already_completed".equals(result)) {
                log.warn("Completion of {} reported {}", requestId, result);
            }
        } catch (SchedulerUnavailableException | IllegalArgumentException e) {
            // the coordinator reclaims the lock once this process exits
            log.warn("Could not report completion of {}: {}", requestId, e.getMessage());
        }
    }

    private HttpResponse<String> send(HttpRequest request) throws InterruptedException {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 500) {
                throw new CoordinatorFailureException("coordinator answered " + response.statusCode()
                        + ": " + response.body());
            }
            return response;
        } catch (IOException e) {
            if (isConnectFailure(e)) {
                throw new SchedulerUnavailableException("cannot reach coordinator at " + options.coordinator(), e);
            }
            boolean timedOut = e instanceof HttpTimeoutException;
            throw new CoordinatorFailureException((timedOut ? "no answer from coordinator within "
                    + request.timeout().map(Duration::toString).orElse("the request timeout")
                    : "request to coordinator failed: " + e.getMessage()), timedOut, e);
        }
    }

    private static boolean isConnectFailure(IOException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ConnectException || t instanceof HttpConnectTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private <T> T read(HttpResponse<String> response, Class<T> type) {
        if (response.statusCode() >= 400) {
            String error = response.body();
            try {
                error = MAPPER.readTree(response.body()).path("error").asText(error);
            } catch (JsonProcessingException e) {
                log.debug("Non-JSON error body from coordinator: {}", e.getOriginalMessage());
            }
            throw new IllegalArgumentException("coordinator rejected request (" + response.statusCode() + "): "
                    + error);
        }
        try {
            return MAPPER.readValue(response.body(), type);
        } catch (JsonProcessingException e) {
            throw new CoordinatorFailureException("unreadable coordinator response: " + e.getOriginalMessage(),
                    false, e);
        }
    }

    private URI resolve(String path) {
        return options.coordinator().resolve(path);
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
