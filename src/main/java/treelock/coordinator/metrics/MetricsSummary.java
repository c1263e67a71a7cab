package treelock.coordinator.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * On-demand summary over the rolling metrics window.
 *
 * @param byScope           acquisition latency per scope id
 * @param byScopeType       acquisition latency per scope type ({@code global}, {@code worktree})
 * @param contentionByScope waited plus timed-out events per scope id
 * @param eventsDropped     events lost because the buffer was full
 */
public record MetricsSummary(
        @JsonProperty("generatedAt") Instant generatedAt,
        @JsonProperty("byScope") Map<String, LatencyStats> byScope,
        @JsonProperty("byScopeType") Map<String, LatencyStats> byScopeType,
        @JsonProperty("contentionByScope") Map<String, Long> contentionByScope,
        @JsonProperty("staleReclaims") long staleReclaims,
        @JsonProperty("timeouts") long timeouts,
        @JsonProperty("misfires") long misfires,
        @JsonProperty("advisoryHits") long advisoryHits,
        @JsonProperty("eventsRecorded") long eventsRecorded,
        @JsonProperty("eventsDropped") long eventsDropped) {

    public static MetricsSummary empty() {
        return new MetricsSummary(Instant.now(), Map.of(), Map.of(), Map.of(), 0, 0, 0, 0, 0, 0);
    }

    public long contention() {
        return contentionByScope.values().stream().mapToLong(Long::longValue).sum();
    }
}
