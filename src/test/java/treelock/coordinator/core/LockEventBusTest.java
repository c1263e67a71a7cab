package treelock.coordinator.core;

import org.junit.jupiter.api.Test;
import treelock.coordinator.model.Holder;
import treelock.coordinator.model.LockEvent;
import treelock.coordinator.model.LockEventType;
import treelock.coordinator.model.Scope;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class LockEventBusTest {

    private static final Holder HOLDER = Holder.advisory("wt1", 1);

    @Test
    void testDeliversInPublicationOrder() throws Exception {
        try (LockEventBus bus = new LockEventBus()) {
            List<LockEventType> seen = new CopyOnWriteArrayList<>();
            bus.subscribe(event -> seen.add(event.type()));

            bus.publish(LockEvent.of(LockEventType.WAITED, Scope.worktree("wt1"), 5, HOLDER));
            bus.publish(LockEvent.of(LockEventType.ACQUIRED, Scope.worktree("wt1"), 5, HOLDER));
            bus.publish(LockEvent.of(LockEventType.RELEASED, Scope.worktree("wt1"), 20, HOLDER));

            assertTrue(bus.awaitDelivered(Duration.ofSeconds(2)));
            assertEquals(List.of(LockEventType.WAITED, LockEventType.ACQUIRED, LockEventType.RELEASED), seen);
        }
    }

    @Test
    void testFailingListenerDoesNotStarveOthers() throws Exception {
        try (LockEventBus bus = new LockEventBus()) {
            List<LockEvent> seen = new CopyOnWriteArrayList<>();
            bus.subscribe(event -> {
                throw new IllegalStateException("listener broken");
            });
            bus.subscribe(seen::add);

            bus.publish(LockEvent.of(LockEventType.ACQUIRED, Scope.global(), 0, HOLDER));
            bus.publish(LockEvent.of(LockEventType.RELEASED, Scope.global(), 3, HOLDER));

            assertTrue(bus.awaitDelivered(Duration.ofSeconds(2)));
            assertEquals(2, seen.size());
        }
    }

    @Test
    void testPublishAfterCloseIsDropped() throws Exception {
        LockEventBus bus = new LockEventBus();
        List<LockEvent> seen = new CopyOnWriteArrayList<>();
        bus.subscribe(seen::add);
        bus.close();

        bus.publish(LockEvent.of(LockEventType.ACQUIRED, Scope.global(), 0, HOLDER));

        assertFalse(bus.awaitDelivered(Duration.ofMillis(100)));
        assertTrue(seen.isEmpty());
    }
}
