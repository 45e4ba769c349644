package conductor.coordinator.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * HTTP server in front of the {@link RouterHandler}.
 */
public final class CoordinatorNettyServer {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorNettyServer.class);

    private final RouterHandler router;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public CoordinatorNettyServer(RouterHandler router) {
        this.router = router;
    }

    /** HTTP pipeline: idle timeout, codec, aggregation, routing */
    private ChannelHandler pipelineInitializer() {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(1024 * 1024));
                p.addLast(router);
            }
        };
    }

    /**
     * Bind and start serving. Port 0 picks a free port, see {@link #port()}.
     *
     * @return true if the server is running afterwards
     */
    public synchronized boolean start(String host, int port) {
        if (running) {
            return true;
        }
        try {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer());

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            running = true;
            log.info("Coordinator started on {}:{}", host, port());
            return true;
        } catch (Exception e) {
            log.error("Failed to start coordinator on {}:{}", host, port, e);
            stop();
            return false;
        }
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
                bossGroup = null;
            }
            if (running) {
                log.info("Coordinator stopped");
            }
            running = false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Port actually bound, or -1 when not running.
     */
    public synchronized int port() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }
}
