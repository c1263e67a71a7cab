package treelock.coordinator.model;

/**
 * Terminal answer to "may I run this operation now?".
 * On timeout, {@code contendedScope} and {@code contendedHolder} name what
 * was in the way and {@code waitedMs} for how long.
 */
public record Admission(
        String requestId,
        AdmissionStatus status,
        Scope scope,
        Lock lock,
        long waitedMs,
        boolean advisory,
        Scope contendedScope,
        Holder contendedHolder,
        String message) {

    public static Admission granted(String requestId, Lock lock, long waitedMs, boolean advisory) {
        return new Admission(requestId, AdmissionStatus.GRANTED, lock.scope(), lock, waitedMs, advisory,
                null, null, null);
    }

    public static Admission timedOut(String requestId, Scope scope, long waitedMs, Holder contendedHolder,
            String message) {
        return new Admission(requestId, AdmissionStatus.TIMEOUT, scope, null, waitedMs, false,
                scope, contendedHolder, message);
    }

    public static Admission cancelled(String requestId, Scope scope, String message) {
        return new Admission(requestId, AdmissionStatus.CANCELLED, scope, null, 0, false, null, null, message);
    }

    public static Admission conflict(String requestId, Scope scope, Lock heldLock, String message) {
        return new Admission(requestId, AdmissionStatus.CONFLICT, scope, null, 0, false,
                heldLock != null ? heldLock.scope() : null,
                heldLock != null ? heldLock.holder() : null,
                message);
    }

    public boolean isGranted() {
        return status == AdmissionStatus.GRANTED;
    }
}
