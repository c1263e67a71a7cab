package treelock.client;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import treelock.coordinator.config.CoordinatorConfig;
import treelock.coordinator.config.Dependencies;
import treelock.coordinator.lock.Backoff;
import treelock.coordinator.model.OperationResult;
import treelock.coordinator.model.OperationStatus;
import treelock.coordinator.model.Scope;
import treelock.coordinator.server.CoordinatorNettyServer;

import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorClientTest {

    @TempDir
    Path tempDir;

    private ClientOptions unreachable;

    @BeforeEach
    void setUp() throws Exception {
        unreachable = new ClientOptions(
                URI.create("http://127.0.0.1:" + freePort()),
                "wt1",
                ProcessHandle.current().pid(),
                Duration.ofMillis(500),
                Duration.ofMillis(300),
                tempDir.resolve("locks"));
    }

    @AfterEach
    void tearDown() {
        CoordinatorNettyServer.stop();
    }

    @Test
    @DisplayName("Unreachable coordinator: operation still runs, under degraded file locks")
    void testDegradedSuccess() throws Exception {
        CoordinatorClient client = new CoordinatorClient(unreachable);
        AtomicBoolean ran = new AtomicBoolean();

        OperationResult result = client.submit("commit", "wt1", 5, () -> {
            ran.set(true);
            return true;
        });

        assertTrue(ran.get());
        assertEquals(OperationStatus.SUCCESS, result.status());
        assertTrue(result.degraded());
        assertEquals("worktree:wt1", result.scopeUsed());
        assertFalse(client.isAvailable());
    }

    @Test
    void testDegradedFailureAndException() throws Exception {
        CoordinatorClient client = new CoordinatorClient(unreachable);

        OperationResult failed = client.submit("merge", null, 5, () -> false);
        assertEquals(OperationStatus.FAILED, failed.status());
        assertEquals("global", failed.scopeUsed());

        OperationResult thrown = client.submit("commit", "wt1", 5, () -> {
            throw new IllegalStateException("index is corrupt");
        });
        assertEquals(OperationStatus.FAILED, thrown.status());
        assertTrue(thrown.degraded());
        assertEquals("index is corrupt", thrown.message());
    }

    @Test
    void testDegradedTimeoutWhileFileLockHeld() throws Exception {
        DegradedLocks fileLocks = new DegradedLocks(unreachable.lockDir(),
                new Backoff(Duration.ofMillis(5), Duration.ofMillis(20), 2.0));
        CoordinatorClient client = new CoordinatorClient(unreachable, fileLocks);
        AtomicBoolean ran = new AtomicBoolean();

        try (DegradedLocks.Handle ignored = fileLocks.acquire(Scope.global(), Duration.ofSeconds(1))) {
            OperationResult result = client.submit("commit", "wt1", 5, () -> {
                ran.set(true);
                return true;
            });

            assertEquals(OperationStatus.TIMEOUT, result.status());
            assertTrue(result.degraded());
        }
        assertFalse(ran.get());
    }

    @Test
    void testRunsThroughCoordinatorWhenAvailable() throws Exception {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withServerPort(0)
                .withDataDir(tempDir.resolve("data"));
        assertTrue(CoordinatorNettyServer.start(Dependencies.create(config)));

        ClientOptions options = unreachable
                .withCoordinator(URI.create("http://127.0.0.1:" + CoordinatorNettyServer.boundPort()))
                .withAcquireTimeout(Duration.ofSeconds(2));
        CoordinatorClient client = new CoordinatorClient(options);
        assertTrue(client.isAvailable());

        OperationResult result = client.submit("commit", "wt1", 5, () -> {
            assertEquals(1, client.get("/api/v1/locks").path("held").asInt());
            return true;
        });

        assertEquals(OperationStatus.SUCCESS, result.status());
        assertFalse(result.degraded());
        assertEquals("worktree:wt1", result.scopeUsed());
        assertEquals(0, client.get("/api/v1/locks").path("held").asInt());
    }

    @Test
    void testRejectedRequestSurfacesAsIllegalArgument() throws Exception {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withServerPort(0)
                .withDataDir(tempDir.resolve("data"));
        assertTrue(CoordinatorNettyServer.start(Dependencies.create(config)));

        ClientOptions options = unreachable
                .withCoordinator(URI.create("http://127.0.0.1:" + CoordinatorNettyServer.boundPort()));
        CoordinatorClient client = new CoordinatorClient(options);

        assertThrows(IllegalArgumentException.class, () -> client.admit("commit", "wt1", 42));
        assertThrows(IllegalArgumentException.class, () -> client.complete("no-such-request", true));
        assertFalse(client.cancel("no-such-request"));
    }

    @Test
    @DisplayName("Busy scope times out on the client's own timeout and never runs unlocked")
    void testBusyScopeTimesOutWithoutDegrading() throws Exception {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withServerPort(0)
                .withDataDir(tempDir.resolve("data"))
                .withAcquireTimeout(Duration.ofSeconds(60));
        assertTrue(CoordinatorNettyServer.start(Dependencies.create(config)));
        ClientOptions base = unreachable
                .withCoordinator(URI.create("http://127.0.0.1:" + CoordinatorNettyServer.boundPort()));

        CoordinatorClient holder = new CoordinatorClient(base.withCallerId("holder")
                .withAcquireTimeout(Duration.ofSeconds(60)));
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<OperationResult> held = CompletableFuture.supplyAsync(() -> {
            try {
                return holder.submit("commit", "wt1", 5, () -> {
                    holding.countDown();
                    return release.await(30, TimeUnit.SECONDS);
                });
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        assertTrue(holding.await(10, TimeUnit.SECONDS));

        CoordinatorClient other = new CoordinatorClient(base.withCallerId("other")
                .withAcquireTimeout(Duration.ofMillis(300)));
        AtomicBoolean ran = new AtomicBoolean();
        OperationResult result = other.submit("commit", "wt1", 5, () -> {
            ran.set(true);
            return true;
        });

        assertEquals(OperationStatus.TIMEOUT, result.status());
        assertFalse(result.degraded());
        assertFalse(ran.get());
        assertTrue(result.durationMs() < 30_000);

        release.countDown();
        OperationResult first = held.get(10, TimeUnit.SECONDS);
        assertEquals(OperationStatus.SUCCESS, first.status());
        assertFalse(first.degraded());
        assertEquals(0, other.get("/api/v1/queue").path("depth").asInt());
    }

    @Test
    void testServerErrorIsReportedWithoutRunning() throws Exception {
        try (ServerSocket server = new ServerSocket(0)) {
            CompletableFuture<Void> answered = CompletableFuture.runAsync(() -> answerOnce(server,
                    "HTTP/1.1 503 Service Unavailable\r\nContent-Length: 0\r\nConnection: close\r\n\r\n"));
            CoordinatorClient client = new CoordinatorClient(unreachable
                    .withCoordinator(URI.create("http://127.0.0.1:" + server.getLocalPort())));
            AtomicBoolean ran = new AtomicBoolean();

            OperationResult result = client.submit("commit", "wt1", 5, () -> {
                ran.set(true);
                return true;
            });

            assertEquals(OperationStatus.UNAVAILABLE, result.status());
            assertFalse(result.degraded());
            assertFalse(ran.get());
            assertEquals("worktree:wt1", result.scopeUsed());
            answered.get(5, TimeUnit.SECONDS);
        }
    }

    private static void answerOnce(ServerSocket server, String response) {
        try (Socket socket = server.accept()) {
            InputStream in = socket.getInputStream();
            byte[] buffer = new byte[8192];
            in.read(buffer);
            OutputStream out = socket.getOutputStream();
            out.write(response.getBytes(StandardCharsets.US_ASCII));
            out.flush();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static int freePort() throws Exception {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
