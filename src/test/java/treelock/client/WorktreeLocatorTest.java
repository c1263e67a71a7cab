package treelock.client;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WorktreeLocatorTest {

    @TempDir
    Path root;

    @Test
    void testMainWorktreeFromNestedDirectory() throws Exception {
        Path repo = root.resolve("repo");
        Files.createDirectories(repo.resolve(".git"));
        Path nested = Files.createDirectories(repo.resolve("src/main"));

        WorktreeLocation location = WorktreeLocator.locate(nested).orElseThrow();

        assertTrue(location.isMain());
        assertEquals(repo.toAbsolutePath().normalize(), location.worktreeRoot());
        assertEquals(repo.resolve(".git").toAbsolutePath().normalize(), location.commonDir());
        assertEquals(location.commonDir().resolve(".git-locks"), location.lockDir());
        assertEquals(location.commonDir().resolve("treelock"), location.dataDir());
    }

    @Test
    void testLinkedWorktreeSharesCommonDir() throws Exception {
        Path common = Files.createDirectories(root.resolve("repo/.git"));
        Path privateDir = Files.createDirectories(common.resolve("worktrees/feat-1"));
        Files.writeString(privateDir.resolve("commondir"), "../..\n");

        Path linked = Files.createDirectories(root.resolve("feat-1"));
        Files.writeString(linked.resolve(".git"), "gitdir: " + privateDir.toAbsolutePath() + "\n");

        WorktreeLocation location = WorktreeLocator.locate(linked).orElseThrow();

        assertFalse(location.isMain());
        assertEquals("feat-1", location.worktreeId());
        assertEquals(privateDir.toAbsolutePath().normalize(), location.gitDir());
        assertEquals(common.toAbsolutePath().normalize(), location.commonDir());
    }

    @Test
    void testLinkedWorktreeWithoutCommondirFile() throws Exception {
        Path common = Files.createDirectories(root.resolve("repo/.git"));
        Path privateDir = Files.createDirectories(common.resolve("worktrees/hotfix"));

        Path linked = Files.createDirectories(root.resolve("hotfix"));
        Files.writeString(linked.resolve(".git"), "gitdir: " + privateDir.toAbsolutePath());

        WorktreeLocation location = WorktreeLocator.locate(linked).orElseThrow();

        assertEquals("hotfix", location.worktreeId());
        assertEquals(common.toAbsolutePath().normalize(), location.commonDir());
    }

    @Test
    void testGitFileWithoutGitdirLineIsRejected() throws Exception {
        Path broken = Files.createDirectories(root.resolve("broken"));
        Files.writeString(broken.resolve(".git"), "nonsense\n");

        assertThrows(IllegalStateException.class, () -> WorktreeLocator.locate(broken));
    }

    @Test
    void testNothingFoundOutsideRepository() throws Exception {
        Path plain = Files.createDirectories(root.resolve("plain/dir"));

        Optional<WorktreeLocation> location = WorktreeLocator.locate(plain);

        // a .git above the temp directory would make this meaningless
        if (location.isPresent()) {
            assertFalse(location.get().worktreeRoot().startsWith(root.toAbsolutePath().normalize()));
        }
    }

    @Test
    void testSanitize() {
        assertEquals("feat_1_x", WorktreeLocator.sanitize("feat/1 x"));
        assertEquals("release-1.2", WorktreeLocator.sanitize("release-1.2"));
        assertEquals("main", WorktreeLocator.sanitize(""));
        assertEquals(128, WorktreeLocator.sanitize("a".repeat(200)).length());
    }
}
