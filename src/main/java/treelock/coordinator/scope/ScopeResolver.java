package treelock.coordinator.scope;

import treelock.coordinator.model.OperationRequest;
import treelock.coordinator.model.Scope;

import java.util.Set;

/**
 * Maps an operation verb to the scope of state it touches.
 * Pure and deterministic. Verbs that move shared refs resolve to
 * {@code global}; verbs confined to one worktree's index and working tree
 * resolve to that worktree. Unknown verbs, and worktree verbs without a
 * usable worktree id, resolve to {@code global}.
 */
public final class ScopeResolver {

    /** Shared refs, remotes, the worktree list, packs and the stash */
    private static final Set<String> GLOBAL_VERBS = Set.of(
            "merge", "pull", "fetch", "push",
            "branch", "tag", "worktree", "remote",
            "stash", "gc", "prune", "repack", "pack-refs",
            "update-ref", "symbolic-ref", "reflog", "notes",
            "config", "clone", "init", "filter-branch", "submodule");

    /** Private index, working tree and the worktree's own HEAD */
    private static final Set<String> WORKTREE_VERBS = Set.of(
            "add", "stage", "rm", "mv", "restore", "reset", "clean",
            "commit", "checkout", "switch", "rebase", "cherry-pick", "revert", "apply", "am",
            "status", "diff", "log", "show", "blame", "grep", "ls-files",
            "rev-parse", "describe", "shortlog", "bisect");

    public Scope resolve(OperationRequest request) {
        return resolve(request.verb(), request.targetScopeHint());
    }

    public Scope resolve(String verb, String target) {
        if (verb == null || verb.isBlank()) {
            return Scope.global();
        }
        String normalized = OperationRequest.normalizeVerb(verb);
        if (WORKTREE_VERBS.contains(normalized) && Scope.isValidWorktreeId(target)) {
            return Scope.worktree(target);
        }
        return Scope.global();
    }

    public boolean isKnownVerb(String verb) {
        if (verb == null || verb.isBlank()) {
            return false;
        }
        String normalized = OperationRequest.normalizeVerb(verb);
        return GLOBAL_VERBS.contains(normalized) || WORKTREE_VERBS.contains(normalized);
    }
}
