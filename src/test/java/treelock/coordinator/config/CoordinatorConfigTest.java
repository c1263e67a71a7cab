package treelock.coordinator.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorConfigTest {

    @Test
    void defaults() {
        CoordinatorConfig config = CoordinatorConfig.defaults();

        assertEquals("127.0.0.1", config.serverHost());
        assertEquals(7431, config.serverPort());
        assertEquals(Duration.ofSeconds(30), config.acquireTimeout());
        assertEquals(Duration.ofSeconds(30), config.staleTtl());
        assertEquals(Duration.ofSeconds(5), config.agingInterval());
        assertEquals(0.70, config.predictionThreshold(), 1e-9);
        assertEquals(2, config.sequenceLength());
        assertEquals(Duration.ofSeconds(2), config.advisoryGrace());
        assertEquals(Duration.ofDays(7), config.metricsRetention());
        assertEquals(16, config.workerSlots());
    }

    @Test
    void environmentOverrides() {
        CoordinatorConfig config = CoordinatorConfig.fromEnv(Map.of(
                "TREELOCK_PORT", "9000",
                "TREELOCK_DATA_DIR", "/tmp/treelock-data",
                "TREELOCK_ACQUIRE_TIMEOUT", "500ms",
                "TREELOCK_STALE_TTL", "2m",
                "TREELOCK_METRICS_RETENTION", "1d",
                "TREELOCK_PREDICTION_THRESHOLD", "0.9",
                "TREELOCK_SEQUENCE_LENGTH", "3",
                "TREELOCK_WORKER_SLOTS", "4",
                "TREELOCK_AGING_INTERVAL", "10"));

        assertEquals(9000, config.serverPort());
        assertEquals(Path.of("/tmp/treelock-data"), config.dataDir());
        assertEquals(Duration.ofMillis(500), config.acquireTimeout());
        assertEquals(Duration.ofMinutes(2), config.staleTtl());
        assertEquals(Duration.ofDays(1), config.metricsRetention());
        assertEquals(0.9, config.predictionThreshold(), 1e-9);
        assertEquals(3, config.sequenceLength());
        assertEquals(4, config.workerSlots());
        assertEquals(Duration.ofSeconds(10), config.agingInterval());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> CoordinatorConfig.parseDuration("5x"));
        assertThrows(IllegalArgumentException.class, () -> CoordinatorConfig.parseDuration("abc"));
        assertThrows(IllegalArgumentException.class, () -> CoordinatorConfig.parseDuration(" "));
        assertThrows(IllegalArgumentException.class,
                () -> CoordinatorConfig.fromEnv(Map.of("TREELOCK_PREDICTION_THRESHOLD", "1.5")));
        assertThrows(IllegalArgumentException.class,
                () -> CoordinatorConfig.fromEnv(Map.of("TREELOCK_PORT", "70000")));
        assertThrows(IllegalArgumentException.class,
                () -> CoordinatorConfig.fromEnv(Map.of("TREELOCK_WORKER_SLOTS", "0")));
    }
}
