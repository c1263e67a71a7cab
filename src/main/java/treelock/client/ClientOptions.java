package treelock.client;

import treelock.coordinator.config.CoordinatorConfig;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Client settings.
 *
 * @param coordinator    base URI of the coordinator
 * @param callerId       logical caller, by default the worktree id so that sequences are learnable
 * @param pid            liveness key of this process
 * @param connectTimeout connection timeout; a refused or timed-out connection means degraded mode
 * @param acquireTimeout per-attempt acquisition timeout, sent with every submission and also used by degraded mode
 * @param lockDir        directory for degraded-mode lock files
 */
public record ClientOptions(
        URI coordinator,
        String callerId,
        long pid,
        Duration connectTimeout,
        Duration acquireTimeout,
        Path lockDir) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(2);

    /**
     * Options for a process running in {@code location}, with host, port and
     * timeout taken from the same {@code TREELOCK_*} variables the coordinator reads.
     */
    public static ClientOptions forLocation(WorktreeLocation location, Map<String, String> env) {
        CoordinatorConfig config = CoordinatorConfig.fromEnv(env);
        return new ClientOptions(
                URI.create("http://" + config.serverHost() + ":" + config.serverPort()),
                location.worktreeId(),
                ProcessHandle.current().pid(),
                DEFAULT_CONNECT_TIMEOUT,
                config.acquireTimeout(),
                location.lockDir());
    }

    public ClientOptions withCoordinator(URI uri) {
        return new ClientOptions(uri, callerId, pid, connectTimeout, acquireTimeout, lockDir);
    }

    public ClientOptions withCallerId(String id) {
        return new ClientOptions(coordinator, id, pid, connectTimeout, acquireTimeout, lockDir);
    }

    public ClientOptions withAcquireTimeout(Duration timeout) {
        return new ClientOptions(coordinator, callerId, pid, connectTimeout, timeout, lockDir);
    }

    public ClientOptions withLockDir(Path dir) {
        return new ClientOptions(coordinator, callerId, pid, connectTimeout, acquireTimeout, dir);
    }

    /**
     * Upper bound for one blocking submission: two acquisition attempts plus slack.
     */
    public Duration admissionTimeout() {
        return acquireTimeout.multipliedBy(2).plusSeconds(30);
    }
}
