package treelock.coordinator.model;

import java.util.List;

/**
 * Learned transition: after {@code antecedent}, {@code successor} followed
 * {@code observedCount} times out of {@code antecedentTotal}.
 */
public record PatternEntry(List<String> antecedent, String successor, long observedCount, long antecedentTotal) {

    public PatternEntry {
        antecedent = List.copyOf(antecedent);
    }

    public double confidence() {
        return antecedentTotal == 0 ? 0.0 : (double) observedCount / antecedentTotal;
    }
}
