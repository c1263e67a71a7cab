package treelock.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Response DTO for complete and cancel.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActionResponse(
        @JsonProperty("requestId") String requestId,
        @JsonProperty("result") String result) {

    public static ActionResponse of(String requestId, Enum<?> result) {
        return new ActionResponse(requestId, result.name().toLowerCase(Locale.ROOT));
    }
}
