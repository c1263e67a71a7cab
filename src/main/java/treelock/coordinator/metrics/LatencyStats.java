package treelock.coordinator.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wait-to-acquire latency distribution for one scope or scope type, in ms.
 */
public record LatencyStats(
        @JsonProperty("count") long count,
        @JsonProperty("p50") long p50,
        @JsonProperty("p95") long p95,
        @JsonProperty("p99") long p99,
        @JsonProperty("max") long max) {

    public static final LatencyStats EMPTY = new LatencyStats(0, 0, 0, 0, 0);
}
