package treelock.coordinator.scheduler;

import treelock.coordinator.model.QueueEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Pending entries of the priority scheduler. Not thread-safe: the scheduler
 * guards it with its queue lock.
 *
 * Effective priority depends on the current time, so the order is computed
 * per dispatch pass rather than kept in a heap.
 */
public final class DispatchQueue {

    private final List<QueueEntry> entries = new ArrayList<>();
    private final Duration agingInterval;

    public DispatchQueue(Duration agingInterval) {
        this.agingInterval = agingInterval;
    }

    /**
     * Effective priority descending, then enqueue time ascending, then insertion order.
     */
    public static Comparator<QueueEntry> order(Instant now, Duration agingInterval) {
        return Comparator.comparingInt((QueueEntry e) -> e.effectivePriority(now, agingInterval)).reversed()
                .thenComparing(QueueEntry::enqueueTime)
                .thenComparingLong(QueueEntry::sequence);
    }

    public void add(QueueEntry entry) {
        entries.add(entry);
    }

    public List<QueueEntry> ordered(Instant now) {
        List<QueueEntry> sorted = new ArrayList<>(entries);
        sorted.sort(order(now, agingInterval));
        return sorted;
    }

    public Optional<QueueEntry> find(String requestId) {
        return entries.stream().filter(e -> e.requestId().equals(requestId)).findFirst();
    }

    public Optional<QueueEntry> remove(String requestId) {
        Iterator<QueueEntry> it = entries.iterator();
        while (it.hasNext()) {
            QueueEntry entry = it.next();
            if (entry.requestId().equals(requestId)) {
                it.remove();
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public List<QueueEntry> drain() {
        List<QueueEntry> all = new ArrayList<>(entries);
        entries.clear();
        return all;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Duration agingInterval() {
        return agingInterval;
    }
}
