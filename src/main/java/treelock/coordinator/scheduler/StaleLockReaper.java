package treelock.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.lock.LockRegistry;
import treelock.coordinator.model.Lock;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Background task that reclaims locks abandoned by crashed holders.
 *
 * Locks can be abandoned if:
 * - The client process is killed while its operation runs
 * - The client never reports completion
 *
 * Each sweep hands the locks past their TTL to the registry, which
 * force-releases those whose holder process is gone and extends the rest.
 */
public class StaleLockReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StaleLockReaper.class);

    private final LockRegistry registry;
    private final Clock clock;

    public StaleLockReaper(LockRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    public StaleLockReaper(LockRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reapStaleLocks();
        } catch (Exception e) {
            log.error("Stale lock reaper error", e);
        }
    }

    /**
     * @return number of locks reclaimed
     */
    public int reapStaleLocks() {
        Instant now = clock.instant();
        List<Lock> reclaimed = registry.reclaimStale(now);
        if (reclaimed.isEmpty()) {
            log.debug("No stale locks found");
            return 0;
        }
        log.info("Stale lock reaper: {} lock(s) reclaimed", reclaimed.size());
        return reclaimed.size();
    }
}
