package treelock.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for reporting completion. An empty body means success.
 * POST /api/v1/operations/{id}/complete
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompleteOperationRequest(
        @JsonProperty("success") Boolean success) {

    public boolean succeeded() {
        return success == null || success;
    }
}
