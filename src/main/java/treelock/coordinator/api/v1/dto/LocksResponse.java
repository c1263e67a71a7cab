package treelock.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import treelock.coordinator.model.Holder;
import treelock.coordinator.model.Lock;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for the held-lock snapshot.
 * GET /api/v1/locks
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocksResponse(
        @JsonProperty("held") int held,
        @JsonProperty("draining") String draining,
        @JsonProperty("locks") List<LockView> locks) {

    public record LockView(
            @JsonProperty("scope") String scope,
            @JsonProperty("callerId") String callerId,
            @JsonProperty("pid") long pid,
            @JsonProperty("verb") String verb,
            @JsonProperty("requestId") String requestId,
            @JsonProperty("advisory") boolean advisory,
            @JsonProperty("generation") long generation,
            @JsonProperty("acquiredAt") Instant acquiredAt,
            @JsonProperty("ttlDeadline") Instant ttlDeadline) {

        public static LockView from(Lock lock) {
            Holder holder = lock.holder();
            return new LockView(lock.scope().id(), holder.callerId(), holder.pid(), holder.verb(),
                    holder.requestId(), holder.advisory(), lock.generation(), lock.acquiredAt(),
                    lock.ttlDeadline());
        }
    }

    public static LocksResponse from(List<Lock> locks, Holder draining) {
        return new LocksResponse(
                locks.size(),
                draining != null ? draining.describe() : null,
                locks.stream().map(LockView::from).toList());
    }
}
