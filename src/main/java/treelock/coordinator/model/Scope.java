package treelock.coordinator.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Lock scope: either the literal {@code global} scope or {@code worktree:<id>}.
 * Scope ids are used as file names by the degraded client and as CSV fields
 * in the metrics log, so worktree ids are restricted to a safe alphabet.
 */
public record Scope(ScopeType type, String worktreeId) {

    public static final String GLOBAL_ID = "global";
    public static final String WORKTREE_PREFIX = "worktree:";

    private static final Pattern WORKTREE_ID = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    public static final Scope GLOBAL = new Scope(ScopeType.GLOBAL, null);

    public Scope {
        Objects.requireNonNull(type, "type is required");
        if (type == ScopeType.GLOBAL && worktreeId != null) {
            throw new IllegalArgumentException("global scope has no worktree id");
        }
        if (type == ScopeType.WORKTREE && !isValidWorktreeId(worktreeId)) {
            throw new IllegalArgumentException("invalid worktree id: " + worktreeId);
        }
    }

    public static Scope global() {
        return GLOBAL;
    }

    public static Scope worktree(String worktreeId) {
        return new Scope(ScopeType.WORKTREE, worktreeId);
    }

    /**
     * Parse a scope id as produced by {@link #id()}.
     */
    public static Scope parse(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("scope id is required");
        }
        if (GLOBAL_ID.equals(id)) {
            return GLOBAL;
        }
        if (id.startsWith(WORKTREE_PREFIX)) {
            return worktree(id.substring(WORKTREE_PREFIX.length()));
        }
        throw new IllegalArgumentException("unknown scope id: " + id);
    }

    public static boolean isValidWorktreeId(String worktreeId) {
        return worktreeId != null && WORKTREE_ID.matcher(worktreeId).matches();
    }

    public boolean isGlobal() {
        return type == ScopeType.GLOBAL;
    }

    public String id() {
        return isGlobal() ? GLOBAL_ID : WORKTREE_PREFIX + worktreeId;
    }

    @Override
    public String toString() {
        return id();
    }
}
