package treelock.coordinator.core;

import treelock.coordinator.model.LockEvent;

@FunctionalInterface
public interface LockEventListener {
    void onEvent(LockEvent event);
}
