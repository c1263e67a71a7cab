package treelock.coordinator.model;

import java.util.Locale;

/**
 * Lock registry transitions. The wire name is used in the metrics log.
 */
public enum LockEventType {
    ACQUIRED,
    RELEASED,
    WAITED,
    TIMED_OUT,
    STALE_RECLAIMED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LockEventType fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("event type is required");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
