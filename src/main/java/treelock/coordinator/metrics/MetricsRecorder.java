package treelock.coordinator.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.config.CoordinatorConfig;
import treelock.coordinator.core.LockEventListener;
import treelock.coordinator.model.LockEvent;
import treelock.coordinator.model.LockEventType;
import treelock.coordinator.model.MetricEvent;
import treelock.coordinator.repository.MetricsRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Best-effort metrics: {@link #record} only enqueues, {@link #flush} (run by
 * the maintenance scheduler) appends to the durable log and recomputes the
 * rolling summary. Storage failures are logged and the batch is dropped.
 */
public class MetricsRecorder implements LockEventListener {

    private static final Logger log = LoggerFactory.getLogger(MetricsRecorder.class);

    private final MetricsRepository repository;
    private final Duration retention;
    private final int capacity;

    private final ConcurrentLinkedQueue<MetricEvent> buffer = new ConcurrentLinkedQueue<>();
    private final AtomicInteger buffered = new AtomicInteger();
    private final AtomicLong recorded = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong misfires = new AtomicLong();
    private final AtomicLong advisoryHits = new AtomicLong();

    // rolling window, guarded by this
    private final Deque<MetricEvent> window = new ArrayDeque<>();
    private volatile MetricsSummary summary = MetricsSummary.empty();

    public MetricsRecorder(MetricsRepository repository, CoordinatorConfig config) {
        this.repository = repository;
        this.retention = config.metricsRetention();
        this.capacity = config.metricsBufferCapacity();
    }

    @Override
    public void onEvent(LockEvent event) {
        record(MetricEvent.from(event));
    }

    /**
     * Non-blocking enqueue. When the buffer is full the event is counted as
     * dropped instead.
     */
    public void record(MetricEvent event) {
        if (buffered.incrementAndGet() > capacity) {
            buffered.decrementAndGet();
            dropped.incrementAndGet();
            return;
        }
        buffer.add(event);
        recorded.incrementAndGet();
    }

    public void recordMisfire() {
        misfires.incrementAndGet();
    }

    public void recordAdvisoryHit() {
        advisoryHits.incrementAndGet();
    }

    /**
     * Drain the buffer to the log and refresh the summary.
     *
     * @return number of events drained
     */
    public synchronized int flush() {
        List<MetricEvent> batch = new ArrayList<>();
        MetricEvent event;
        while ((event = buffer.poll()) != null) {
            buffered.decrementAndGet();
            batch.add(event);
        }

        if (!batch.isEmpty()) {
            try {
                repository.append(batch);
            } catch (RuntimeException e) {
                log.warn("Failed to persist {} metric event(s): {}", batch.size(), e.getMessage());
            }
            window.addAll(batch);
        }

        prune(Instant.now());
        summary = compute(Instant.now());
        return batch.size();
    }

    /**
     * Load persisted events still inside the retention window.
     */
    public synchronized int loadHistory() {
        Instant cutoff = Instant.now().minus(retention);
        try {
            List<MetricEvent> history = repository.readSince(cutoff);
            window.addAll(history);
            summary = compute(Instant.now());
            log.info("Loaded {} metric event(s) since {}", history.size(), cutoff);
            return history.size();
        } catch (RuntimeException e) {
            log.warn("Failed to load metrics history: {}", e.getMessage());
            return 0;
        }
    }

    /**
     * Drop log lines older than the retention window.
     */
    public int compact() {
        try {
            return repository.retainSince(Instant.now().minus(retention));
        } catch (RuntimeException e) {
            log.warn("Failed to compact metrics log: {}", e.getMessage());
            return 0;
        }
    }

    public MetricsSummary summary() {
        return summary;
    }

    public long dropped() {
        return dropped.get();
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(retention);
        while (!window.isEmpty() && window.peekFirst().timestamp().isBefore(cutoff)) {
            window.pollFirst();
        }
    }

    private MetricsSummary compute(Instant now) {
        Map<String, List<Long>> waitsByScope = new TreeMap<>();
        Map<String, List<Long>> waitsByType = new TreeMap<>();
        Map<String, Long> contention = new TreeMap<>();
        long staleReclaims = 0;
        long timeouts = 0;

        for (MetricEvent e : window) {
            switch (e.type()) {
                case ACQUIRED -> {
                    waitsByScope.computeIfAbsent(e.scopeId(), k -> new ArrayList<>()).add(e.durationMs());
                    waitsByType.computeIfAbsent(e.scopeType().label(), k -> new ArrayList<>()).add(e.durationMs());
                }
                case WAITED -> contention.merge(e.scopeId(), 1L, Long::sum);
                case TIMED_OUT -> {
                    contention.merge(e.scopeId(), 1L, Long::sum);
                    timeouts++;
                }
                case STALE_RECLAIMED -> staleReclaims++;
                case RELEASED -> {
                }
            }
        }

        return new MetricsSummary(
                now,
                toStats(waitsByScope),
                toStats(waitsByType),
                contention,
                staleReclaims,
                timeouts,
                misfires.get(),
                advisoryHits.get(),
                recorded.get(),
                dropped.get());
    }

    private static Map<String, LatencyStats> toStats(Map<String, List<Long>> samples) {
        Map<String, LatencyStats> stats = new TreeMap<>();
        samples.forEach((key, values) -> stats.put(key,
                Percentiles.stats(values.stream().mapToLong(Long::longValue).toArray())));
        return stats;
    }

    /** Count of events of one type in the current window. */
    public synchronized long count(LockEventType type) {
        return window.stream().filter(e -> e.type() == type).count();
    }
}
