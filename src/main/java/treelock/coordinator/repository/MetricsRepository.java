package treelock.coordinator.repository;

import treelock.coordinator.model.MetricEvent;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for the append-only metrics log.
 * Implementations signal storage failures with unchecked exceptions.
 */
public interface MetricsRepository {

    /**
     * Append events in order.
     *
     * @param events events to append, oldest first
     */
    void append(List<MetricEvent> events);

    /**
     * Read events recorded at or after the cutoff.
     *
     * @param cutoff oldest timestamp to return
     * @return events in log order
     */
    List<MetricEvent> readSince(Instant cutoff);

    /**
     * Drop events older than the cutoff.
     *
     * @param cutoff oldest timestamp to keep
     * @return number of events dropped
     */
    int retainSince(Instant cutoff);
}
