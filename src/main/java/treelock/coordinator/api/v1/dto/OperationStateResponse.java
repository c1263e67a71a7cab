package treelock.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import treelock.coordinator.scheduler.ScheduledOperation;

import java.time.Instant;

/**
 * Response DTO for one request's state.
 * GET /api/v1/operations/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationStateResponse(
        @JsonProperty("requestId") String requestId,
        @JsonProperty("verb") String verb,
        @JsonProperty("scope") String scope,
        @JsonProperty("state") String state,
        @JsonProperty("priority") int priority,
        @JsonProperty("callerId") String callerId,
        @JsonProperty("attempt") int attempt,
        @JsonProperty("generation") Long generation,
        @JsonProperty("succeeded") Boolean succeeded,
        @JsonProperty("submittedAt") Instant submittedAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static OperationStateResponse from(ScheduledOperation op) {
        return new OperationStateResponse(
                op.id(),
                op.request().verb(),
                op.scope().id(),
                op.state().name(),
                op.request().priority(),
                op.request().callerId(),
                op.attempt(),
                op.lock() != null ? op.lock().generation() : null,
                op.succeeded(),
                op.request().submittedAt(),
                op.updatedAt());
    }
}
