package treelock.coordinator.model;

/**
 * Unit of mutual exclusion.
 */
public enum ScopeType {
    /** Repository-wide shared refs, index of the common dir, worktree list */
    GLOBAL("global"),
    /** A single worktree's private index and working tree */
    WORKTREE("worktree");

    private final String label;

    ScopeType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
