package treelock.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.model.Scope;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Finds the worktree containing a directory by walking up to the nearest
 * {@code .git}.
 *
 * A {@code .git} directory marks the main worktree. A {@code .git} file holds
 * {@code gitdir: <common>/worktrees/<name>} and marks linked worktree
 * {@code <name>}; the shared directory is read from {@code <gitdir>/commondir}
 * when present.
 */
public final class WorktreeLocator {

    private static final Logger log = LoggerFactory.getLogger(WorktreeLocator.class);

    private static final String GITDIR_PREFIX = "gitdir:";

    private WorktreeLocator() {
    }

    public static Optional<WorktreeLocation> locate(Path start) {
        Path dir = start.toAbsolutePath().normalize();
        while (dir != null) {
            Path dotGit = dir.resolve(".git");
            if (Files.isDirectory(dotGit)) {
                return Optional.of(new WorktreeLocation(dir, WorktreeLocation.MAIN_WORKTREE, dotGit, dotGit));
            }
            if (Files.isRegularFile(dotGit)) {
                return Optional.of(linked(dir, dotGit));
            }
            dir = dir.getParent();
        }
        log.debug("No .git found above {}", start);
        return Optional.empty();
    }

    private static WorktreeLocation linked(Path root, Path dotGitFile) {
        Path gitDir = root.resolve(readGitDir(dotGitFile)).normalize();
        Path parent = gitDir.getParent();
        if (parent != null && "worktrees".equals(String.valueOf(parent.getFileName()))) {
            Path commonDir = readCommonDir(gitDir).orElse(parent.getParent());
            return new WorktreeLocation(root, sanitize(String.valueOf(gitDir.getFileName())), gitDir, commonDir);
        }
        // submodule or a separate git dir: treat as its own repository
        return new WorktreeLocation(root, WorktreeLocation.MAIN_WORKTREE, gitDir, gitDir);
    }

    private static String readGitDir(Path dotGitFile) {
        try {
            for (String line : Files.readAllLines(dotGitFile, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (trimmed.startsWith(GITDIR_PREFIX)) {
                    return trimmed.substring(GITDIR_PREFIX.length()).trim();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + dotGitFile, e);
        }
        throw new IllegalStateException("No gitdir line in " + dotGitFile);
    }

    private static Optional<Path> readCommonDir(Path gitDir) {
        Path commonFile = gitDir.resolve("commondir");
        if (!Files.isRegularFile(commonFile)) {
            return Optional.empty();
        }
        try {
            String raw = Files.readString(commonFile, StandardCharsets.UTF_8).trim();
            return raw.isEmpty() ? Optional.empty() : Optional.of(gitDir.resolve(raw).normalize());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + commonFile, e);
        }
    }

    /**
     * Map an arbitrary worktree name onto the scope id alphabet.
     */
    static String sanitize(String name) {
        String cleaned = name.replaceAll("[^A-Za-z0-9._-]", "_");
        if (cleaned.length() > 128) {
            cleaned = cleaned.substring(0, 128);
        }
        return Scope.isValidWorktreeId(cleaned) ? cleaned : WorktreeLocation.MAIN_WORKTREE;
    }
}
