package treelock.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import treelock.coordinator.model.OperationRequest;
import treelock.coordinator.model.Scope;

/**
 * Request DTO for submitting an operation.
 * POST /api/v1/operations
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmitOperationRequest(
        @JsonProperty("verb") String verb,
        @JsonProperty("target") String target,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("callerId") String callerId,
        @JsonProperty("pid") Long pid,
        @JsonProperty("acquireTimeoutMs") Long acquireTimeoutMs) {

    /** Validate the request */
    public void validate() {
        if (verb == null || verb.isBlank()) {
            throw new IllegalArgumentException("verb is required");
        }
        if (callerId == null || callerId.isBlank()) {
            throw new IllegalArgumentException("callerId is required");
        }
        if (priority != null
                && (priority < OperationRequest.MIN_PRIORITY || priority > OperationRequest.MAX_PRIORITY)) {
            throw new IllegalArgumentException("priority must be between " + OperationRequest.MIN_PRIORITY
                    + " and " + OperationRequest.MAX_PRIORITY);
        }
        if (target != null && !target.isBlank() && !Scope.isValidWorktreeId(target.trim())) {
            throw new IllegalArgumentException("invalid worktree id: " + target);
        }
        if (pid != null && pid < 0) {
            throw new IllegalArgumentException("pid must not be negative");
        }
        if (acquireTimeoutMs != null && acquireTimeoutMs <= 0) {
            throw new IllegalArgumentException("acquireTimeoutMs must be positive");
        }
    }
}
