package treelock.coordinator.repository;

import treelock.coordinator.model.PatternEntry;

import java.util.List;

/**
 * Repository interface for the pattern observation log.
 * Each observation is one antecedent/successor pair with a count of one;
 * replaying all observations rebuilds the pattern table.
 */
public interface PatternRepository {

    /**
     * Append one observed transition.
     */
    void append(List<String> antecedent, String successor);

    /**
     * Load every observation, oldest first. Each entry has an observed count of one.
     */
    List<PatternEntry> loadAll();
}
