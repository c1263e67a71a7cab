package treelock.coordinator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.model.LockEventType;
import treelock.coordinator.model.MetricEvent;
import treelock.coordinator.repository.MetricsRepository;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV implementation of MetricsRepository.
 * One line per event: {@code timestamp,event_type,scope_id,duration_ms,verb}
 * with an ISO-8601 timestamp. Single writer; readers tolerate a partially
 * written last line.
 */
public class FileMetricsRepository implements MetricsRepository {

    private static final Logger log = LoggerFactory.getLogger(FileMetricsRepository.class);

    public static final String FILE_NAME = "lock-metrics.csv";

    private final Path file;

    public FileMetricsRepository(Path dataDir) {
        this.file = dataDir.resolve(FILE_NAME);
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized void append(List<MetricEvent> events) {
        if (events.isEmpty())
            return;

        try {
            Files.createDirectories(file.getParent());
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                for (MetricEvent event : events) {
                    writer.write(format(event));
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append metrics to " + file, e);
        }
    }

    @Override
    public List<MetricEvent> readSince(Instant cutoff) {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<MetricEvent> events = new ArrayList<>();
        int malformed = 0;
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                MetricEvent event = parse(line);
                if (event == null) {
                    malformed++;
                } else if (!event.timestamp().isBefore(cutoff)) {
                    events.add(event);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read metrics from " + file, e);
        }
        if (malformed > 0) {
            log.debug("Skipped {} malformed metrics line(s) in {}", malformed, file);
        }
        return events;
    }

    @Override
    public synchronized int retainSince(Instant cutoff) {
        if (!Files.exists(file)) {
            return 0;
        }
        try {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            List<String> kept = new ArrayList<>(lines.size());
            for (String line : lines) {
                MetricEvent event = parse(line);
                if (event != null && !event.timestamp().isBefore(cutoff)) {
                    kept.add(line);
                }
            }
            int dropped = lines.size() - kept.size();
            if (dropped == 0) {
                return 0;
            }
            Path tmp = file.resolveSibling(FILE_NAME + ".tmp");
            Files.write(tmp, kept, StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Pruned {} metrics line(s) older than {}", dropped, cutoff);
            return dropped;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to prune metrics in " + file, e);
        }
    }

    static String format(MetricEvent event) {
        return event.timestamp() + ","
                + event.type().wireName() + ","
                + event.scopeId() + ","
                + event.durationMs() + ","
                + sanitize(event.verb());
    }

    static MetricEvent parse(String line) {
        String[] parts = line.split(",", -1);
        if (parts.length != 5) {
            return null;
        }
        try {
            return new MetricEvent(
                    Instant.parse(parts[0]),
                    LockEventType.fromWireName(parts[1]),
                    parts[2],
                    Long.parseLong(parts[3]),
                    parts[4]);
        } catch (DateTimeParseException | IllegalArgumentException e) {
            return null;
        }
    }

    private static String sanitize(String verb) {
        return verb == null ? "" : verb.replace(',', '_').replace('\n', '_').replace('\r', '_');
    }
}
