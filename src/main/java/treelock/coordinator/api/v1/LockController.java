package treelock.coordinator.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.api.Controller;
import treelock.coordinator.api.v1.dto.LocksResponse;
import treelock.coordinator.api.v1.dto.QueueResponse;
import treelock.coordinator.lock.LockRegistry;
import treelock.coordinator.scheduler.PriorityScheduler;
import treelock.coordinator.server.RouterHandler;

import java.time.Instant;

/**
 * Read-only views of coordinator state.
 *
 * GET /api/v1/locks - Held locks and the draining global request, if any
 * GET /api/v1/queue - Queued requests in dispatch order
 */
public class LockController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(LockController.class);

    private final LockRegistry registry;
    private final PriorityScheduler scheduler;

    public LockController(LockRegistry registry, PriorityScheduler scheduler) {
        this.registry = registry;
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && ("/api/v1/locks".equals(path) || "/api/v1/queue".equals(path));
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            if ("/api/v1/locks".equals(path)) {
                LocksResponse response = LocksResponse.from(registry.snapshot(),
                        registry.drainingHolder().orElse(null));
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
            }
            QueueResponse response = QueueResponse.from(scheduler.queueSnapshot(), Instant.now(),
                    scheduler.agingInterval());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (Exception e) {
            log.error("Lock controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
