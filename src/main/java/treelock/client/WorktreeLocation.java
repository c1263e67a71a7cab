package treelock.client;

import java.nio.file.Path;

/**
 * Where a working directory sits in a repository.
 *
 * @param worktreeRoot top of the worktree (the directory holding {@code .git})
 * @param worktreeId   {@code main} for the main worktree, the linked worktree's name otherwise
 * @param gitDir       this worktree's private git directory
 * @param commonDir    the repository's shared git directory
 */
public record WorktreeLocation(Path worktreeRoot, String worktreeId, Path gitDir, Path commonDir) {

    public static final String MAIN_WORKTREE = "main";

    public boolean isMain() {
        return MAIN_WORKTREE.equals(worktreeId);
    }

    /** Directory for degraded-mode lock files. */
    public Path lockDir() {
        return commonDir.resolve(".git-locks");
    }

    /** Default coordinator data directory. */
    public Path dataDir() {
        return commonDir.resolve("treelock");
    }
}
