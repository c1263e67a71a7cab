package treelock.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("heldLocks") Integer heldLocks,
        @JsonProperty("queueDepth") Integer queueDepth,
        @JsonProperty("error") String error) {

    public static HealthResponse healthy(String uptime, String version, int heldLocks, int queueDepth) {
        return new HealthResponse("healthy", uptime, version, heldLocks, queueDepth, null);
    }

    public static HealthResponse unhealthy(String error) {
        return new HealthResponse("unhealthy", null, null, null, null, error);
    }
}
