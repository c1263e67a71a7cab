package treelock.coordinator.scheduler;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import treelock.coordinator.config.CoordinatorConfig;
import treelock.coordinator.core.LockEventBus;
import treelock.coordinator.lock.LockRegistry;
import treelock.coordinator.metrics.MetricsRecorder;
import treelock.coordinator.model.Holder;
import treelock.coordinator.model.Lock;
import treelock.coordinator.model.Scope;
import treelock.coordinator.model.ScopeHint;
import treelock.coordinator.store.FileMetricsRepository;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for advisory pre-acquisition, hand-off, claims and misfires.
 */
class AdvisoryLocksTest {

    private static final Scope WT1 = Scope.worktree("wt1");
    private static final Scope WT2 = Scope.worktree("wt2");

    @TempDir
    Path dataDir;

    private LockEventBus bus;
    private LockRegistry registry;
    private MetricsRecorder recorder;
    private AdvisoryLocks advisory;
    private final AtomicInteger freed = new AtomicInteger();

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withBackoff(Duration.ofMillis(10), Duration.ofMillis(50))
                .withAdvisoryGrace(Duration.ofMillis(200));
        bus = new LockEventBus();
        registry = new LockRegistry(config, holder -> true, bus);
        recorder = new MetricsRecorder(new FileMetricsRepository(dataDir), config);
        advisory = new AdvisoryLocks(registry, recorder, config);
        advisory.onFreed(freed::incrementAndGet);
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private static Holder holder(String caller, long pid, String verb) {
        return new Holder(caller, pid, verb, caller + "-" + verb, false);
    }

    @Test
    void otherFreeScopeIsTakenAndClaimedByTheSameCaller() throws Exception {
        Lock current = registry.tryAcquire(WT1, holder("wt1", 1, "fetch"), Duration.ofMillis(100));

        advisory.prepare(current, new ScopeHint("commit", WT2, 0.9));
        assertEquals(1, advisory.heldCount());
        assertTrue(registry.lockFor(WT2).orElseThrow().holder().advisory());

        assertTrue(advisory.claim(WT2, holder("someone-else", 3, "commit")).isEmpty());
        Lock claimed = advisory.claim(WT2, holder("wt1", 2, "commit")).orElseThrow();
        assertEquals("commit", claimed.holder().verb());
        assertEquals(0, advisory.heldCount());

        recorder.flush();
        assertEquals(1, recorder.summary().advisoryHits());
    }

    @Test
    void ownScopeIsHandedOverOnRelease() throws Exception {
        Holder owner = holder("wt1", 1, "checkout");
        Lock current = registry.tryAcquire(WT1, owner, Duration.ofMillis(100));

        advisory.prepare(current, new ScopeHint("status", WT1, 1.0));
        assertTrue(advisory.isReserved(WT1));

        Lock handed = advisory.onRelease(current).orElseThrow();
        assertTrue(handed.holder().advisory());
        assertEquals(current.generation() + 1, handed.generation());
        assertFalse(advisory.isReserved(WT1));

        // releases without a reservation go back to the caller
        assertTrue(advisory.onRelease(handed).isEmpty());
    }

    @Test
    void unusedAdvisoryLocksExpireAsMisfires() throws Exception {
        Lock current = registry.tryAcquire(WT1, holder("wt1", 1, "fetch"), Duration.ofMillis(100));
        advisory.prepare(current, new ScopeHint("commit", WT2, 0.8));

        assertEquals(0, advisory.expire(Instant.now()));
        assertEquals(1, advisory.expire(Instant.now().plusSeconds(1)));

        assertTrue(registry.lockFor(WT2).isEmpty());
        assertEquals(1, freed.get());
        recorder.flush();
        assertEquals(1, recorder.summary().misfires());
    }

    @Test
    void drainingGlobalRequestCancelsHandOffAndAdvisoryLocks() throws Exception {
        Holder owner = holder("wt1", 1, "checkout");
        Lock current = registry.tryAcquire(WT1, owner, Duration.ofMillis(100));
        advisory.prepare(current, new ScopeHint("status", WT1, 1.0));
        Lock other = registry.tryAcquire(Scope.worktree("wt3"), holder("wt3", 3, "fetch"), Duration.ofMillis(100));
        advisory.prepare(other, new ScopeHint("commit", WT2, 0.9));
        assertEquals(1, advisory.heldCount());

        CompletableFuture<Lock> global = CompletableFuture.supplyAsync(() -> {
            try {
                return registry.tryAcquire(Scope.global(), holder("main", 9, "merge"), Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        long deadline = System.currentTimeMillis() + 2000;
        while (!registry.isDraining() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(registry.isDraining());

        assertTrue(advisory.onRelease(current).isEmpty());
        registry.release(current);
        assertEquals(1, advisory.expire(Instant.now()));
        registry.release(other);

        assertTrue(global.get(2, TimeUnit.SECONDS).scope().isGlobal());
    }
}
