package treelock.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import treelock.coordinator.model.QueueEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Response DTO for the queue snapshot, in dispatch order.
 * GET /api/v1/queue
 */
public record QueueResponse(
        @JsonProperty("depth") int depth,
        @JsonProperty("entries") List<Entry> entries) {

    public record Entry(
            @JsonProperty("requestId") String requestId,
            @JsonProperty("verb") String verb,
            @JsonProperty("scope") String scope,
            @JsonProperty("callerId") String callerId,
            @JsonProperty("priority") int priority,
            @JsonProperty("effectivePriority") int effectivePriority,
            @JsonProperty("attempt") int attempt,
            @JsonProperty("enqueuedAt") Instant enqueuedAt) {
    }

    public static QueueResponse from(List<QueueEntry> ordered, Instant now, Duration agingInterval) {
        List<Entry> entries = ordered.stream()
                .map(e -> new Entry(
                        e.requestId(),
                        e.request().verb(),
                        e.scope().id(),
                        e.request().callerId(),
                        e.request().priority(),
                        e.effectivePriority(now, agingInterval),
                        e.attempt(),
                        e.enqueueTime()))
                .toList();
        return new QueueResponse(entries.size(), entries);
    }
}
