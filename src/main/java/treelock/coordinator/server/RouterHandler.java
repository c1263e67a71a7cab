package treelock.coordinator.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.api.Controller;
import treelock.coordinator.api.Controller.ControllerResponse;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches requests under {@code /api/v1/} to the registered controllers;
 * anything else is 404.
 *
 * Submission blocks until a lock is granted, so controllers never run on the
 * event loop. Each request is retained, handed to the handler executor and
 * answered from there. Sharable: it keeps no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();
    private final ExecutorService handlers;

    public RouterHandler(ExecutorService handlers) {
        this.handlers = handlers;
    }

    /**
     * Controllers are asked in registration order.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        FullHttpRequest retained = req.retain();
        boolean keepAlive = HttpUtil.isKeepAlive(req);
        try {
            handlers.execute(() -> {
                try {
                    write(ctx, route(retained), keepAlive);
                } finally {
                    retained.release();
                }
            });
        } catch (RejectedExecutionException e) {
            retained.release();
            write(ctx, ControllerResponse.unavailable("coordinator shutting down"), false);
        }
    }

    ControllerResponse route(FullHttpRequest req) {
        String path = new QueryStringDecoder(req.uri()).path();
        try {
            for (Controller controller : controllers) {
                if (controller.matches(req.method(), path)) {
                    return controller.handle(req, path);
                }
            }
            log.debug("No handler for: {} {}", req.method(), path);
            return ControllerResponse.notFound("not found");
        } catch (IllegalArgumentException e) {
            log.warn("Rejected {} {}: {}", req.method(), path, e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Handler error: {} {}", req.method(), path, e);
            return ControllerResponse.error("internal error: " + e.getClass().getSimpleName());
        }
    }

    private void write(ChannelHandlerContext ctx, ControllerResponse response, boolean keepAlive) {
        try {
            byte[] bytes = response.body() == null ? new byte[0] : response.body().getBytes(StandardCharsets.UTF_8);
            FullHttpResponse out = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                    Unpooled.wrappedBuffer(bytes));
            out.headers().set(HttpHeaderNames.CONTENT_TYPE, response.contentType() + "; charset=utf-8");
            out.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            HttpUtil.setKeepAlive(out, keepAlive);
            if (keepAlive) {
                ctx.writeAndFlush(out);
            } else {
                ctx.writeAndFlush(out).addListener(ChannelFutureListener.CLOSE);
            }
        } catch (RuntimeException e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        write(ctx, ControllerResponse.error("channel error: " + cause.getMessage()), false);
    }

    /**
     * Shared mapper for request and response bodies.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
