package treelock.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import treelock.coordinator.model.Admission;

/**
 * Response DTO for a submission: the admission decision.
 * POST /api/v1/operations
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AdmissionResponse(
        @JsonProperty("requestId") String requestId,
        @JsonProperty("status") String status,
        @JsonProperty("scope") String scope,
        @JsonProperty("generation") Long generation,
        @JsonProperty("waitedMs") long waitedMs,
        @JsonProperty("advisory") boolean advisory,
        @JsonProperty("contendedScope") String contendedScope,
        @JsonProperty("contendedHolder") String contendedHolder,
        @JsonProperty("message") String message) {

    public static AdmissionResponse from(Admission admission) {
        return new AdmissionResponse(
                admission.requestId(),
                admission.status().wireName(),
                admission.scope() != null ? admission.scope().id() : null,
                admission.lock() != null ? admission.lock().generation() : null,
                admission.waitedMs(),
                admission.advisory(),
                admission.contendedScope() != null ? admission.contendedScope().id() : null,
                admission.contendedHolder() != null ? admission.contendedHolder().describe() : null,
                admission.message());
    }
}
