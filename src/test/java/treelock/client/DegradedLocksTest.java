package treelock.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import treelock.coordinator.lock.AcquisitionTimeoutException;
import treelock.coordinator.lock.Backoff;
import treelock.coordinator.model.Scope;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * File-lock fallback. Inside one JVM any overlapping lock on the same file
 * counts as busy, so these tests cover exclusion only; parallel worktrees
 * need separate processes.
 */
class DegradedLocksTest {

    @TempDir
    Path tempDir;

    private Path lockDir;
    private DegradedLocks locks;

    @BeforeEach
    void setUp() {
        lockDir = tempDir.resolve("common/.git-locks");
        locks = new DegradedLocks(lockDir, new Backoff(Duration.ofMillis(5), Duration.ofMillis(20), 2.0));
    }

    @Test
    void testCreatesLockFilesForScope() throws Exception {
        try (DegradedLocks.Handle handle = locks.acquire(Scope.worktree("wt1"), Duration.ofSeconds(1))) {
            assertEquals(Scope.worktree("wt1"), handle.scope());
            assertTrue(Files.exists(lockDir.resolve(DegradedLocks.GLOBAL_FILE)));
            assertTrue(Files.exists(lockDir.resolve("wt1.lock")));
        }
    }

    @Test
    void testGlobalExcludesWorktree() throws Exception {
        try (DegradedLocks.Handle ignored = locks.acquire(Scope.global(), Duration.ofSeconds(1))) {
            assertNull(locks.tryAcquire(Scope.worktree("wt1")));

            AcquisitionTimeoutException e = assertThrows(AcquisitionTimeoutException.class,
                    () -> locks.acquire(Scope.worktree("wt1"), Duration.ofMillis(100)));
            assertEquals(Scope.worktree("wt1"), e.scope());
            assertTrue(e.waited().toMillis() >= 100);
        }
    }

    @Test
    void testWorktreeExcludesGlobalAndItself() throws Exception {
        try (DegradedLocks.Handle ignored = locks.acquire(Scope.worktree("wt1"), Duration.ofSeconds(1))) {
            assertNull(locks.tryAcquire(Scope.global()));
            assertNull(locks.tryAcquire(Scope.worktree("wt1")));
        }
    }

    @Test
    void testCloseReleases() throws Exception {
        DegradedLocks.Handle first = locks.acquire(Scope.worktree("wt1"), Duration.ofSeconds(1));
        first.close();

        try (DegradedLocks.Handle global = locks.acquire(Scope.global(), Duration.ofMillis(200))) {
            assertTrue(global.scope().isGlobal());
        }
        try (DegradedLocks.Handle again = locks.acquire(Scope.worktree("wt1"), Duration.ofMillis(200))) {
            assertNotNull(again);
        }
    }

    @Test
    void testAcquireWaitsForRelease() throws Exception {
        DegradedLocks.Handle held = locks.acquire(Scope.global(), Duration.ofSeconds(1));
        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            held.close();
        });
        releaser.start();

        try (DegradedLocks.Handle handle = locks.acquire(Scope.worktree("wt2"), Duration.ofSeconds(5))) {
            assertEquals("worktree:wt2", handle.scope().id());
        }
        releaser.join();
    }
}
