package treelock.coordinator.lock;

import treelock.coordinator.model.Holder;

/**
 * Decides whether the session behind a lock holder still exists.
 */
@FunctionalInterface
public interface HolderLiveness {
    boolean isAlive(Holder holder);
}
