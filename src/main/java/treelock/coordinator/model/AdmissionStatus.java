package treelock.coordinator.model;

import java.util.Locale;

/**
 * Outcome of waiting for a lock grant.
 */
public enum AdmissionStatus {
    GRANTED,
    TIMEOUT,
    CANCELLED,
    CONFLICT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AdmissionStatus fromWireName(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
