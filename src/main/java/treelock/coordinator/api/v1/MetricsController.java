package treelock.coordinator.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.api.Controller;
import treelock.coordinator.metrics.MetricsRecorder;
import treelock.coordinator.server.RouterHandler;

/**
 * GET /api/v1/metrics/summary
 */
public class MetricsController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(MetricsController.class);

    private final MetricsRecorder metrics;

    public MetricsController(MetricsRecorder metrics) {
        this.metrics = metrics;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/metrics/summary".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(metrics.summary()));
        } catch (Exception e) {
            log.error("Metrics controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
