package treelock.coordinator.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class QueueEntryTest {

    private static final Duration AGING = Duration.ofSeconds(5);
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static QueueEntry entry(int priority) {
        OperationRequest request = OperationRequest.builder()
                .verb("commit").target("wt1").callerId("wt1").priority(priority).build();
        return QueueEntry.first(request, Scope.worktree("wt1"), T0, 0);
    }

    @Test
    void effectivePriorityGrowsOncePerAgingInterval() {
        QueueEntry e = entry(3);

        assertEquals(3, e.effectivePriority(T0, AGING));
        assertEquals(3, e.effectivePriority(T0.plusMillis(4999), AGING));
        assertEquals(4, e.effectivePriority(T0.plusSeconds(5), AGING));
        assertEquals(6, e.effectivePriority(T0.plusSeconds(17), AGING));
    }

    @Test
    void effectivePriorityIsCappedAtMaximum() {
        assertEquals(10, entry(1).effectivePriority(T0.plusSeconds(3600), AGING));
        assertEquals(10, entry(10).effectivePriority(T0.plusSeconds(5), AGING));
    }

    @Test
    void retryKeepsAgeAndAddsBoost() {
        QueueEntry first = entry(4);
        QueueEntry retry = first.retry(1, T0.plusSeconds(30));

        assertEquals(2, retry.attempt());
        assertEquals(first.enqueueTime(), retry.enqueueTime());
        assertEquals(first.sequence(), retry.sequence());
        assertEquals(T0.plusSeconds(30), retry.attemptStartedAt());
        assertEquals(5, retry.effectivePriority(T0, AGING));
        assertTrue(first.canRetry());
        assertFalse(retry.canRetry());
    }

    @Test
    void remainingCountsFromAttemptStart() {
        QueueEntry e = entry(5);
        Duration timeout = Duration.ofSeconds(30);

        assertEquals(Duration.ofSeconds(20), e.remaining(T0.plusSeconds(10), timeout));
        assertEquals(Duration.ZERO, e.remaining(T0.plusSeconds(31), timeout));
        assertEquals(Duration.ofSeconds(30), e.retry(0, T0.plusSeconds(40)).remaining(T0.plusSeconds(40), timeout));
    }
}
