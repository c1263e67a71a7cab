package treelock.coordinator.api;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * One group of coordinator endpoints.
 * The router asks each registered controller in turn whether it owns a
 * method and path, and hands the request to the first that does.
 */
public interface Controller {

    /**
     * @param path request path without the query string
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle a request this controller matched. Runs on a handler thread, not
     * the event loop, and may block (submission waits for the grant).
     */
    ControllerResponse handle(FullHttpRequest req, String path);

    /**
     * Status, content type and body to write back.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        private static final String JSON = "application/json";

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, JSON, body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, JSON, body);
        }

        /** {@code {"error": message}} with the given status. */
        public static ControllerResponse failure(HttpResponseStatus status, String message) {
            return new ControllerResponse(status, JSON, errorBody(message));
        }

        public static ControllerResponse notFound(String message) {
            return failure(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return failure(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse error(String message) {
            return failure(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        public static ControllerResponse unavailable(String message) {
            return failure(HttpResponseStatus.SERVICE_UNAVAILABLE, message);
        }

        public static String errorBody(String message) {
            String text = message == null ? "" : message;
            StringBuilder out = new StringBuilder(text.length() + 12).append("{\"error\":\"");
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                switch (c) {
                    case '"' -> out.append("\\\"");
                    case '\\' -> out.append("\\\\");
                    case '\n' -> out.append("\\n");
                    case '\r' -> out.append("\\r");
                    case '\t' -> out.append("\\t");
                    default -> {
                        if (c < 0x20) {
                            out.append(String.format("\\u%04x", (int) c));
                        } else {
                            out.append(c);
                        }
                    }
                }
            }
            return out.append("\"}").toString();
        }
    }
}
