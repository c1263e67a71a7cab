package treelock.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.lock.AcquisitionTimeoutException;
import treelock.coordinator.lock.Backoff;
import treelock.coordinator.model.Scope;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;

/**
 * Direct OS file locks used when the coordinator is unreachable. No queue, no
 * prediction, no metrics.
 *
 * The global scope takes {@code global.lock} exclusively. A worktree scope
 * takes {@code global.lock} shared and {@code <worktree>.lock} exclusively, so
 * worktrees run in parallel with each other but never with a global
 * operation.
 *
 * File locks belong to the whole JVM: a second lock on the same file from
 * this process counts as busy.
 */
public class DegradedLocks {

    private static final Logger log = LoggerFactory.getLogger(DegradedLocks.class);

    static final String GLOBAL_FILE = "global.lock";

    private final Path lockDir;
    private final Backoff backoff;

    public DegradedLocks(Path lockDir) {
        this(lockDir, Backoff.defaults());
    }

    public DegradedLocks(Path lockDir, Backoff backoff) {
        this.lockDir = lockDir;
        this.backoff = backoff;
    }

    /**
     * Locks held for one scope. Closing releases them.
     */
    public static final class Handle implements AutoCloseable {
        private final Scope scope;
        private final FileChannel globalChannel;
        private final FileLock globalLock;
        private final FileChannel scopeChannel;
        private final FileLock scopeLock;

        private Handle(Scope scope, FileChannel globalChannel, FileLock globalLock,
                FileChannel scopeChannel, FileLock scopeLock) {
            this.scope = scope;
            this.globalChannel = globalChannel;
            this.globalLock = globalLock;
            this.scopeChannel = scopeChannel;
            this.scopeLock = scopeLock;
        }

        public Scope scope() {
            return scope;
        }

        @Override
        public void close() {
            try {
                if (scopeLock != null) {
                    scopeLock.release();
                    scopeChannel.close();
                }
                globalLock.release();
                globalChannel.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to release degraded lock on " + scope, e);
            }
        }
    }

    /**
     * Poll with backoff until the scope's files are locked.
     *
     * @throws AcquisitionTimeoutException still busy at the deadline
     */
    public Handle acquire(Scope scope, Duration timeout) throws InterruptedException {
        long start = System.nanoTime();
        long deadline = start + timeout.toNanos();
        int attempt = 0;
        try {
            Files.createDirectories(lockDir);
            while (true) {
                Handle handle = tryAcquire(scope);
                if (handle != null) {
                    log.debug("Degraded lock on {} after {} attempt(s)", scope, attempt + 1);
                    return handle;
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw new AcquisitionTimeoutException(scope,
                            Duration.ofNanos(System.nanoTime() - start), null);
                }
                long pause = Math.min(remaining, backoff.delay(attempt++).toNanos());
                Thread.sleep(Math.max(1, pause / 1_000_000L));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Degraded lock on " + scope + " failed", e);
        }
    }

    Handle tryAcquire(Scope scope) throws IOException {
        FileChannel globalChannel = open(GLOBAL_FILE);
        FileLock globalLock = tryLock(globalChannel, !scope.isGlobal());
        if (globalLock == null) {
            globalChannel.close();
            return null;
        }
        if (scope.isGlobal()) {
            return new Handle(scope, globalChannel, globalLock, null, null);
        }

        FileChannel scopeChannel = open(scope.worktreeId() + ".lock");
        FileLock scopeLock = tryLock(scopeChannel, false);
        if (scopeLock == null) {
            scopeChannel.close();
            globalLock.release();
            globalChannel.close();
            return null;
        }
        return new Handle(scope, globalChannel, globalLock, scopeChannel, scopeLock);
    }

    private FileChannel open(String name) throws IOException {
        // shared locks need a readable channel, exclusive ones a writable one
        return FileChannel.open(lockDir.resolve(name),
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
    }

    private static FileLock tryLock(FileChannel channel, boolean shared) throws IOException {
        try {
            return channel.tryLock(0L, Long.MAX_VALUE, shared);
        } catch (OverlappingFileLockException e) {
            return null;
        }
    }

    public Path lockDir() {
        return lockDir;
    }
}
