package treelock.coordinator.lock;

import treelock.coordinator.model.Holder;

/**
 * Liveness by OS process id.
 *
 * A holder that sent no pid has nothing to probe, so its lock is a plain
 * lease: it counts as dead once the TTL has passed and is reclaimed rather
 * than extended. Advisory holders are owned by the coordinator and expire on
 * their own grace window.
 */
public final class ProcessLiveness implements HolderLiveness {

    @Override
    public boolean isAlive(Holder holder) {
        if (holder.advisory()) {
            return true;
        }
        if (holder.pid() <= 0) {
            return false;
        }
        return ProcessHandle.of(holder.pid())
                .map(ProcessHandle::isAlive)
                .orElse(false);
    }
}
