package treelock.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import treelock.coordinator.model.PatternEntry;

import java.util.List;

/**
 * Response DTO for learned patterns.
 * GET /api/v1/patterns
 */
public record PatternsResponse(
        @JsonProperty("sequenceLength") int sequenceLength,
        @JsonProperty("threshold") double threshold,
        @JsonProperty("patterns") List<Pattern> patterns) {

    public record Pattern(
            @JsonProperty("antecedent") List<String> antecedent,
            @JsonProperty("successor") String successor,
            @JsonProperty("observedCount") long observedCount,
            @JsonProperty("antecedentTotal") long antecedentTotal,
            @JsonProperty("confidence") double confidence) {

        public static Pattern from(PatternEntry entry) {
            return new Pattern(entry.antecedent(), entry.successor(), entry.observedCount(),
                    entry.antecedentTotal(), entry.confidence());
        }
    }

    public static PatternsResponse from(int sequenceLength, double threshold, List<PatternEntry> entries) {
        return new PatternsResponse(sequenceLength, threshold, entries.stream().map(Pattern::from).toList());
    }
}
