package treelock.coordinator.lock;

import treelock.coordinator.model.Holder;
import treelock.coordinator.model.Scope;

import java.time.Duration;

/**
 * Scope stayed busy for the whole acquisition timeout.
 * Names the contended scope, how long the caller waited and, when known,
 * who was holding it.
 */
public class AcquisitionTimeoutException extends RuntimeException {

    private final Scope scope;
    private final Duration waited;
    private final Holder contendedHolder;

    public AcquisitionTimeoutException(Scope scope, Duration waited, Holder contendedHolder) {
        super(buildMessage(scope, waited, contendedHolder));
        this.scope = scope;
        this.waited = waited;
        this.contendedHolder = contendedHolder;
    }

    private static String buildMessage(Scope scope, Duration waited, Holder holder) {
        String message = "scope " + scope.id() + " busy for " + waited.toMillis() + "ms";
        if (holder != null) {
            message += ", held by " + holder.describe();
        }
        return message;
    }

    public Scope scope() {
        return scope;
    }

    public Duration waited() {
        return waited;
    }

    public Holder contendedHolder() {
        return contendedHolder;
    }
}
