package treelock.coordinator.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.model.LockEvent;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One-way notification channel from the lock registry to its observers.
 * Publishing only hands the event to a dedicated thread, so the registry
 * never waits on a listener. Listeners see events in publication order.
 */
public final class LockEventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LockEventBus.class);

    private final CopyOnWriteArrayList<LockEventListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "treelock-events");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean closed = false;

    public void subscribe(LockEventListener listener) {
        listeners.add(listener);
    }

    public void publish(LockEvent event) {
        if (closed) {
            return;
        }
        try {
            executor.execute(() -> dispatch(event));
        } catch (RejectedExecutionException e) {
            log.debug("Event bus closed, dropping {}", event.type());
        }
    }

    private void dispatch(LockEvent event) {
        for (LockEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Lock event listener {} failed on {}: {}",
                        listener.getClass().getSimpleName(), event.type(), e.getMessage());
            }
        }
    }

    /**
     * Wait until every event published so far has been delivered.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitDelivered(Duration timeout) throws InterruptedException {
        try {
            executor.submit(() -> {
            }).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException | RejectedExecutionException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("event bus barrier failed", e.getCause());
        }
    }

    @Override
    public void close() {
        closed = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
