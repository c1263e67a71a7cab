package treelock.coordinator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable request to run one version-control operation under the
 * coordinator. Created by a client at submission time.
 */
public final class OperationRequest {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;
    public static final int DEFAULT_PRIORITY = 5;

    private final String id;
    private final String verb;
    private final String targetScopeHint; // worktree id or null
    private final int priority;
    private final String callerId;
    private final long pid;
    private final Duration acquireTimeout; // null: coordinator default
    private final Instant submittedAt;

    private OperationRequest(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.verb = normalizeVerb(Objects.requireNonNull(builder.verb, "verb is required"));
        this.targetScopeHint = builder.targetScopeHint == null || builder.targetScopeHint.isBlank()
                ? null
                : builder.targetScopeHint.trim();
        this.priority = builder.priority;
        this.callerId = Objects.requireNonNull(builder.callerId, "callerId is required");
        this.pid = builder.pid;
        this.acquireTimeout = builder.acquireTimeout;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();

        if (verb.isEmpty()) {
            throw new IllegalArgumentException("verb is required");
        }
        if (callerId.isBlank()) {
            throw new IllegalArgumentException("callerId is required");
        }
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException(
                    "priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY + ": " + priority);
        }
        if (acquireTimeout != null && (acquireTimeout.isZero() || acquireTimeout.isNegative())) {
            throw new IllegalArgumentException("acquire timeout must be positive: " + acquireTimeout);
        }
    }

    /** Lower-case, trimmed, first word only ("worktree add" becomes "worktree"). */
    public static String normalizeVerb(String raw) {
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }

    public String id() {
        return id;
    }

    public String verb() {
        return verb;
    }

    public String targetScopeHint() {
        return targetScopeHint;
    }

    public int priority() {
        return priority;
    }

    public String callerId() {
        return callerId;
    }

    public long pid() {
        return pid;
    }

    /**
     * Per-attempt acquisition timeout the caller asked for, or null to use
     * the coordinator's configured one.
     */
    public Duration acquireTimeout() {
        return acquireTimeout;
    }

    public Instant submittedAt() {
        return submittedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String verb;
        private String targetScopeHint;
        private int priority = DEFAULT_PRIORITY;
        private String callerId;
        private long pid;
        private Duration acquireTimeout;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder verb(String verb) {
            this.verb = verb;
            return this;
        }

        public Builder target(String targetScopeHint) {
            this.targetScopeHint = targetScopeHint;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder callerId(String callerId) {
            this.callerId = callerId;
            return this;
        }

        public Builder pid(long pid) {
            this.pid = pid;
            return this;
        }

        public Builder acquireTimeout(Duration acquireTimeout) {
            this.acquireTimeout = acquireTimeout;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public OperationRequest build() {
            return new OperationRequest(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof OperationRequest that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "OperationRequest{id='" + id + "', verb='" + verb + "', target='" + targetScopeHint
                + "', priority=" + priority + ", callerId='" + callerId + "'}";
    }
}
