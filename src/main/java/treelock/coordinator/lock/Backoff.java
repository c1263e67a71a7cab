package treelock.coordinator.lock;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter between re-checks of a busy scope.
 * The ceiling for attempt {@code n} is {@code min(cap, base * factor^n)};
 * the delay is drawn uniformly from the upper half of that ceiling so that
 * contending waiters spread out without ever spinning.
 */
public final class Backoff {

    public static final Duration DEFAULT_BASE = Duration.ofMillis(100);
    public static final Duration DEFAULT_CAP = Duration.ofSeconds(2);
    public static final double DEFAULT_FACTOR = 2.0;

    private final long baseMs;
    private final long capMs;
    private final double factor;

    public Backoff(Duration base, Duration cap, double factor) {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be positive");
        }
        if (cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("cap must not be below base");
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("factor must be >= 1");
        }
        this.baseMs = base.toMillis();
        this.capMs = cap.toMillis();
        this.factor = factor;
    }

    public static Backoff defaults() {
        return new Backoff(DEFAULT_BASE, DEFAULT_CAP, DEFAULT_FACTOR);
    }

    /** Upper bound of the delay for a zero-based attempt number. */
    public long ceilingMs(int attempt) {
        double raw = baseMs * Math.pow(factor, Math.max(0, attempt));
        return (long) Math.min(capMs, raw);
    }

    public Duration delay(int attempt) {
        long ceiling = ceilingMs(attempt);
        long half = ceiling / 2;
        long jitter = half == ceiling ? 0 : ThreadLocalRandom.current().nextLong(ceiling - half + 1);
        return Duration.ofMillis(half + jitter);
    }
}
