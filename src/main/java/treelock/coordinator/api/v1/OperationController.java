package treelock.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.api.Controller;
import treelock.coordinator.api.v1.dto.ActionResponse;
import treelock.coordinator.api.v1.dto.AdmissionResponse;
import treelock.coordinator.api.v1.dto.CompleteOperationRequest;
import treelock.coordinator.api.v1.dto.OperationStateResponse;
import treelock.coordinator.api.v1.dto.SubmitOperationRequest;
import treelock.coordinator.model.Admission;
import treelock.coordinator.model.CancelResult;
import treelock.coordinator.model.CompleteResult;
import treelock.coordinator.model.OperationRequest;
import treelock.coordinator.scheduler.ScheduledOperation;
import treelock.coordinator.server.RouterHandler;
import treelock.coordinator.service.OperationService;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for operation requests.
 *
 * POST /api/v1/operations - Submit and wait for admission
 * POST /api/v1/operations/{id}/complete - Report completion, release the lock
 * POST /api/v1/operations/{id}/cancel - Cancel a queued request
 * GET /api/v1/operations/{id} - Request state
 */
public class OperationController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(OperationController.class);

    private static final Pattern OPERATIONS_PATTERN = Pattern.compile("^/api/v1/operations$");
    private static final Pattern OPERATION_BY_ID_PATTERN = Pattern.compile("^/api/v1/operations/([^/]+)$");
    private static final Pattern COMPLETE_PATTERN = Pattern.compile("^/api/v1/operations/([^/]+)/complete$");
    private static final Pattern CANCEL_PATTERN = Pattern.compile("^/api/v1/operations/([^/]+)/cancel$");

    private final OperationService operationService;

    public OperationController(OperationService operationService) {
        this.operationService = operationService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return OPERATIONS_PATTERN.matcher(path).matches()
                    || COMPLETE_PATTERN.matcher(path).matches()
                    || CANCEL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return OPERATION_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST)) {
                if (OPERATIONS_PATTERN.matcher(path).matches()) {
                    return handleSubmit(req);
                }
                Matcher completeMatcher = COMPLETE_PATTERN.matcher(path);
                if (completeMatcher.matches()) {
                    return handleComplete(completeMatcher.group(1), req);
                }
                Matcher cancelMatcher = CANCEL_PATTERN.matcher(path);
                if (cancelMatcher.matches()) {
                    return handleCancel(cancelMatcher.group(1));
                }
            }

            Matcher byIdMatcher = OPERATION_BY_ID_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.GET) && byIdMatcher.matches()) {
                return handleGet(byIdMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown operation endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed request body: " + e.getOriginalMessage());
        } catch (IllegalStateException e) {
            return ControllerResponse.unavailable(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ControllerResponse.unavailable("interrupted while waiting for admission");
        } catch (Exception e) {
            log.error("Operation controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/operations - blocks until the request is admitted or gives up
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        SubmitOperationRequest request = RouterHandler.mapper().readValue(body, SubmitOperationRequest.class);
        request.validate();

        OperationRequest operation = operationService.newRequest(
                request.verb(), request.target(), request.priority(), request.callerId(), request.pid(),
                request.acquireTimeoutMs());
        Admission admission = operationService.admit(operation);

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(AdmissionResponse.from(admission)));
    }

    /**
     * POST /api/v1/operations/{id}/complete
     */
    private ControllerResponse handleComplete(String requestId, FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CompleteOperationRequest request = body.isBlank()
                ? new CompleteOperationRequest(null)
                : RouterHandler.mapper().readValue(body, CompleteOperationRequest.class);

        CompleteResult result = operationService.complete(requestId, request.succeeded());
        if (result == CompleteResult.NOT_FOUND) {
            return ControllerResponse.notFound("operation not found or not running");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(ActionResponse.of(requestId, result)));
    }

    /**
     * POST /api/v1/operations/{id}/cancel
     */
    private ControllerResponse handleCancel(String requestId) throws Exception {
        CancelResult result = operationService.cancel(requestId);
        return switch (result) {
            case CANCELLED -> ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(ActionResponse.of(requestId, result)));
            case NOT_CANCELLABLE -> ControllerResponse.json(HttpResponseStatus.CONFLICT,
                    RouterHandler.mapper().writeValueAsString(ActionResponse.of(requestId, result)));
            case NOT_FOUND -> ControllerResponse.notFound("operation not found");
        };
    }

    /**
     * GET /api/v1/operations/{id}
     */
    private ControllerResponse handleGet(String requestId) throws Exception {
        Optional<ScheduledOperation> op = operationService.find(requestId);
        if (op.isEmpty()) {
            return ControllerResponse.notFound("operation not found");
        }
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(OperationStateResponse.from(op.get())));
    }
}
