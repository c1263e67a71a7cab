package treelock.coordinator.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.api.Controller;
import treelock.coordinator.api.v1.dto.PatternsResponse;
import treelock.coordinator.config.CoordinatorConfig;
import treelock.coordinator.prediction.PatternPredictor;
import treelock.coordinator.server.RouterHandler;

/**
 * GET /api/v1/patterns
 */
public class PatternController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(PatternController.class);

    private final PatternPredictor predictor;
    private final CoordinatorConfig config;

    public PatternController(PatternPredictor predictor, CoordinatorConfig config) {
        this.predictor = predictor;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/patterns".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            PatternsResponse response = PatternsResponse.from(
                    config.sequenceLength(), config.predictionThreshold(), predictor.entries());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (Exception e) {
            log.error("Pattern controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
