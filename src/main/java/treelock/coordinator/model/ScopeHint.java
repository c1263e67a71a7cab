package treelock.coordinator.model;

/**
 * Advisory prediction of the next operation a caller will request.
 */
public record ScopeHint(String verb, Scope scope, double confidence) {
}
