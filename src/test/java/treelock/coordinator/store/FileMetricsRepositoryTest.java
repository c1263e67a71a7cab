package treelock.coordinator.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import treelock.coordinator.model.LockEventType;
import treelock.coordinator.model.MetricEvent;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileMetricsRepositoryTest {

    @TempDir
    Path dataDir;

    @Test
    void writesOneCsvLinePerEvent() throws Exception {
        FileMetricsRepository repo = new FileMetricsRepository(dataDir.resolve("nested"));
        Instant ts = Instant.parse("2026-03-01T10:15:30Z");

        repo.append(List.of(
                new MetricEvent(ts, LockEventType.ACQUIRED, "worktree:wt1", 12, "commit"),
                new MetricEvent(ts, LockEventType.TIMED_OUT, "global", 30000, "merge")));

        List<String> lines = Files.readAllLines(repo.file(), StandardCharsets.UTF_8);
        assertEquals(List.of(
                "2026-03-01T10:15:30Z,acquired,worktree:wt1,12,commit",
                "2026-03-01T10:15:30Z,timed_out,global,30000,merge"), lines);
    }

    @Test
    void readSinceSkipsOldAndMalformedLines() throws Exception {
        FileMetricsRepository repo = new FileMetricsRepository(dataDir);
        Files.write(repo.file(), List.of(
                "2026-03-01T10:00:00Z,acquired,global,5,merge",
                "not a metrics line",
                "2026-03-01T12:00:00Z,bogus,global,5,merge",
                "",
                "2026-03-01T12:00:00Z,released,worktree:wt1,40,commit"), StandardCharsets.UTF_8);

        List<MetricEvent> events = repo.readSince(Instant.parse("2026-03-01T11:00:00Z"));

        assertEquals(1, events.size());
        assertEquals(LockEventType.RELEASED, events.get(0).type());
        assertEquals(40, events.get(0).durationMs());
    }

    @Test
    void retainSinceCompactsTheLog() throws Exception {
        FileMetricsRepository repo = new FileMetricsRepository(dataDir);
        repo.append(List.of(
                new MetricEvent(Instant.parse("2026-03-01T10:00:00Z"), LockEventType.ACQUIRED, "global", 1, "gc"),
                new MetricEvent(Instant.parse("2026-03-02T10:00:00Z"), LockEventType.ACQUIRED, "global", 2, "gc")));

        assertEquals(1, repo.retainSince(Instant.parse("2026-03-02T00:00:00Z")));
        assertEquals(0, repo.retainSince(Instant.parse("2026-03-02T00:00:00Z")));
        assertEquals(1, Files.readAllLines(repo.file()).size());
        assertFalse(Files.exists(dataDir.resolve(FileMetricsRepository.FILE_NAME + ".tmp")));
    }

    @Test
    void missingFileReadsEmpty() {
        FileMetricsRepository repo = new FileMetricsRepository(dataDir);
        assertTrue(repo.readSince(Instant.EPOCH).isEmpty());
        assertEquals(0, repo.retainSince(Instant.now()));
    }
}
