package treelock.coordinator.model;

import java.util.Objects;

/**
 * Identity of a lock holder.
 *
 * @param callerId  logical caller (by default the worktree id of the client)
 * @param pid       OS process id used as the liveness key, 0 if unknown
 * @param verb      operation verb the lock was taken for
 * @param requestId operation request id, null for advisory holders
 * @param advisory  true for speculative pre-acquisitions made on a caller's behalf
 */
public record Holder(String callerId, long pid, String verb, String requestId, boolean advisory) {

    public static final String ADVISORY_VERB = "advisory";

    public Holder {
        Objects.requireNonNull(callerId, "callerId is required");
        Objects.requireNonNull(verb, "verb is required");
    }

    public static Holder of(OperationRequest request) {
        return new Holder(request.callerId(), request.pid(), request.verb(), request.id(), false);
    }

    public static Holder advisory(String callerId, long pid) {
        return new Holder(callerId, pid, ADVISORY_VERB, null, true);
    }

    /**
     * Same caller in the same process. Two processes sharing a caller id are
     * independent sessions and may hold locks concurrently.
     */
    public boolean sameSession(Holder other) {
        return other != null && callerId.equals(other.callerId) && pid == other.pid;
    }

    public String describe() {
        return callerId + (pid > 0 ? " (pid " + pid + ")" : "") + " for " + verb;
    }
}
