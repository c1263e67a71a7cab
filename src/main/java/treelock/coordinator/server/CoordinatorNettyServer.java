package treelock.coordinator.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.config.CoordinatorConfig;
import treelock.coordinator.config.Dependencies;

import java.net.InetSocketAddress;

/**
 * Loopback HTTP server of the coordinator. One instance per process.
 */
public final class CoordinatorNettyServer {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorNettyServer.class);

    private static final int MAX_CONTENT_LENGTH = 64 * 1024;

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;
    private static Dependencies dependencies;

    private CoordinatorNettyServer() {
    }

    private static ChannelInitializer<SocketChannel> pipelineInitializer(RouterHandler router) {
        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(router);
            }
        };
    }

    /**
     * Start background services and bind the HTTP port.
     * The server owns {@code deps} from here on and closes it on {@link #stop()}.
     */
    public static synchronized boolean start(Dependencies deps) {
        if (running) {
            return true;
        }
        CoordinatorConfig config = deps.config();
        try {
            deps.start();

            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(deps.routerHandler()));

            serverChannel = b.bind(config.serverHost(), config.serverPort()).syncUninterruptibly().channel();
            dependencies = deps;
            running = true;
            log.info("Coordinator listening on {}:{}", config.serverHost(), boundPort());
            return true;
        } catch (Exception e) {
            // bind failures surface as checked exceptions rethrown by syncUninterruptibly
            log.error("Failed to start coordinator on {}:{}: {}", config.serverHost(), config.serverPort(),
                    e.getMessage());
            dependencies = deps;
            running = true;
            stop();
            return false;
        }
    }

    public static synchronized void stop() {
        if (!running) {
            return;
        }
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            if (dependencies != null) {
                dependencies.close();
                dependencies = null;
            }
            running = false;
            log.info("Coordinator stopped");
        }
    }

    public static boolean isRunning() {
        return running;
    }

    /** Actual bound port, useful when configured with port 0. */
    public static synchronized int boundPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }
}
