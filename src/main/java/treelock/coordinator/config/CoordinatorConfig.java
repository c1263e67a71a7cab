package treelock.coordinator.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults; deployments override them through
 * {@code TREELOCK_*} environment variables.
 */
public final class CoordinatorConfig {

    // Server settings
    private String serverHost = "127.0.0.1";
    private int serverPort = 7431;

    // Storage
    private Path dataDir = Path.of(".treelock");

    // Lock settings
    private Duration acquireTimeout = Duration.ofSeconds(30);
    private Duration staleTtl = Duration.ofSeconds(30);
    private Duration reaperInterval = Duration.ofSeconds(5);
    private Duration backoffBase = Duration.ofMillis(100);
    private Duration backoffCap = Duration.ofSeconds(2);

    // Scheduling
    private Duration agingInterval = Duration.ofSeconds(5);
    private int workerSlots = 16;
    private int retryBoost = 1;

    // Prediction
    private double predictionThreshold = 0.70;
    private int sequenceLength = 2;
    private Duration advisoryGrace = Duration.ofSeconds(2);

    // Metrics
    private Duration metricsRetention = Duration.ofDays(7);
    private Duration metricsFlushInterval = Duration.ofSeconds(1);
    private int metricsBufferCapacity = 10_000;

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static CoordinatorConfig fromEnv(Map<String, String> env) {
        CoordinatorConfig config = new CoordinatorConfig();

        String host = env.get("TREELOCK_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host.trim();
        }

        String port = env.get("TREELOCK_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String dataDir = env.get("TREELOCK_DATA_DIR");
        if (dataDir != null && !dataDir.isBlank()) {
            config.dataDir = Path.of(dataDir.trim());
        }

        config.acquireTimeout = durationOr(env, "TREELOCK_ACQUIRE_TIMEOUT", config.acquireTimeout);
        config.staleTtl = durationOr(env, "TREELOCK_STALE_TTL", config.staleTtl);
        config.reaperInterval = durationOr(env, "TREELOCK_REAPER_INTERVAL", config.reaperInterval);
        config.agingInterval = durationOr(env, "TREELOCK_AGING_INTERVAL", config.agingInterval);
        config.advisoryGrace = durationOr(env, "TREELOCK_ADVISORY_GRACE", config.advisoryGrace);
        config.metricsRetention = durationOr(env, "TREELOCK_METRICS_RETENTION", config.metricsRetention);
        config.metricsFlushInterval = durationOr(env, "TREELOCK_METRICS_FLUSH_INTERVAL", config.metricsFlushInterval);

        String threshold = env.get("TREELOCK_PREDICTION_THRESHOLD");
        if (threshold != null && !threshold.isBlank()) {
            config.predictionThreshold = Double.parseDouble(threshold.trim());
        }

        String sequenceLength = env.get("TREELOCK_SEQUENCE_LENGTH");
        if (sequenceLength != null && !sequenceLength.isBlank()) {
            config.sequenceLength = Integer.parseInt(sequenceLength.trim());
        }

        String slots = env.get("TREELOCK_WORKER_SLOTS");
        if (slots != null && !slots.isBlank()) {
            config.workerSlots = Integer.parseInt(slots.trim());
        }

        config.validate();
        return config;
    }

    /**
     * Parse {@code 500ms}, {@code 30s}, {@code 5m}, {@code 2h}, {@code 7d} or a bare
     * number of seconds.
     */
    public static Duration parseDuration(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("duration is required");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        try {
            if (value.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2)));
            }
            char unit = value.charAt(value.length() - 1);
            if (Character.isDigit(unit)) {
                return Duration.ofSeconds(Long.parseLong(value));
            }
            long amount = Long.parseLong(value.substring(0, value.length() - 1));
            return switch (unit) {
                case 's' -> Duration.ofSeconds(amount);
                case 'm' -> Duration.ofMinutes(amount);
                case 'h' -> Duration.ofHours(amount);
                case 'd' -> Duration.ofDays(amount);
                default -> throw new IllegalArgumentException("unknown duration unit in: " + raw);
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid duration: " + raw, e);
        }
    }

    private static Duration durationOr(Map<String, String> env, String key, Duration fallback) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return parseDuration(raw);
    }

    /**
     * Reject settings the coordinator cannot run with.
     */
    public CoordinatorConfig validate() {
        if (serverPort < 0 || serverPort > 65535) {
            throw new IllegalArgumentException("port out of range: " + serverPort);
        }
        if (predictionThreshold <= 0.0 || predictionThreshold > 1.0) {
            throw new IllegalArgumentException("prediction threshold must be in (0, 1]: " + predictionThreshold);
        }
        if (sequenceLength < 1) {
            throw new IllegalArgumentException("sequence length must be positive: " + sequenceLength);
        }
        if (workerSlots < 1) {
            throw new IllegalArgumentException("worker slots must be positive: " + workerSlots);
        }
        if (acquireTimeout.isNegative() || staleTtl.isNegative() || staleTtl.isZero()) {
            throw new IllegalArgumentException("timeouts must be positive");
        }
        return this;
    }

    // Getters
    public String serverHost() {
        return serverHost;
    }

    public int serverPort() {
        return serverPort;
    }

    public Path dataDir() {
        return dataDir;
    }

    public Duration acquireTimeout() {
        return acquireTimeout;
    }

    public Duration staleTtl() {
        return staleTtl;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public Duration backoffBase() {
        return backoffBase;
    }

    public Duration backoffCap() {
        return backoffCap;
    }

    public Duration agingInterval() {
        return agingInterval;
    }

    public int workerSlots() {
        return workerSlots;
    }

    public int retryBoost() {
        return retryBoost;
    }

    public double predictionThreshold() {
        return predictionThreshold;
    }

    public int sequenceLength() {
        return sequenceLength;
    }

    public Duration advisoryGrace() {
        return advisoryGrace;
    }

    public Duration metricsRetention() {
        return metricsRetention;
    }

    public Duration metricsFlushInterval() {
        return metricsFlushInterval;
    }

    public int metricsBufferCapacity() {
        return metricsBufferCapacity;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withDataDir(Path dataDir) {
        this.dataDir = dataDir;
        return this;
    }

    public CoordinatorConfig withAcquireTimeout(Duration timeout) {
        this.acquireTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withStaleTtl(Duration ttl) {
        this.staleTtl = ttl;
        return this;
    }

    public CoordinatorConfig withReaperInterval(Duration interval) {
        this.reaperInterval = interval;
        return this;
    }

    public CoordinatorConfig withBackoff(Duration base, Duration cap) {
        this.backoffBase = base;
        this.backoffCap = cap;
        return this;
    }

    public CoordinatorConfig withAgingInterval(Duration interval) {
        this.agingInterval = interval;
        return this;
    }

    public CoordinatorConfig withWorkerSlots(int slots) {
        this.workerSlots = slots;
        return this;
    }

    public CoordinatorConfig withPredictionThreshold(double threshold) {
        this.predictionThreshold = threshold;
        return this;
    }

    public CoordinatorConfig withSequenceLength(int length) {
        this.sequenceLength = length;
        return this;
    }

    public CoordinatorConfig withAdvisoryGrace(Duration grace) {
        this.advisoryGrace = grace;
        return this;
    }

    public CoordinatorConfig withMetricsRetention(Duration retention) {
        this.metricsRetention = retention;
        return this;
    }

    public CoordinatorConfig withMetricsFlushInterval(Duration interval) {
        this.metricsFlushInterval = interval;
        return this;
    }

    public CoordinatorConfig withMetricsBufferCapacity(int capacity) {
        this.metricsBufferCapacity = capacity;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "server=" + serverHost + ":" + serverPort +
                ", dataDir=" + dataDir +
                ", acquireTimeout=" + acquireTimeout +
                ", staleTtl=" + staleTtl +
                ", agingInterval=" + agingInterval +
                ", workerSlots=" + workerSlots +
                ", predictionThreshold=" + predictionThreshold +
                ", sequenceLength=" + sequenceLength +
                '}';
    }
}
