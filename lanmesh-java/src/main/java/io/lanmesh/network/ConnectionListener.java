package io.lanmesh.network;

import io.lanmesh.network.frame.LinePipeline;
import io.lanmesh.network.handshake.AcceptorHandshakeHandler;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.EventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * Accepts inbound connections and runs the acceptor half of the handshake on each.
 */
public class ConnectionListener {

    private static final Logger log = LoggerFactory.getLogger(ConnectionListener.class);

    private final NodeContext context;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ChannelGroup pending;
    private volatile Channel serverChannel;
    private volatile int port;

    public ConnectionListener(NodeContext context, EventLoopGroup bossGroup, EventLoopGroup workerGroup,
                              EventExecutor loop) {
        this.context = context;
        this.bossGroup = bossGroup;
        this.workerGroup = workerGroup;
        this.pending = new DefaultChannelGroup("lanmesh-inbound", loop);
        this.port = context.options().port;
    }

    /**
     * Binds {@code bindHost:port}. Completes with the bound address, or exceptionally
     * if the port cannot be bound.
     */
    public CompletableFuture<InetSocketAddress> bind() {
        CompletableFuture<InetSocketAddress> future = new CompletableFuture<>();
        if (serverChannel != null && serverChannel.isActive()) {
            future.complete((InetSocketAddress) serverChannel.localAddress());
            return future;
        }

        MeshOptions options = context.options();
        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        pending.add(ch);
                        LinePipeline.install(ch.pipeline(), options.maxFrameLength);
                        ch.pipeline().addLast(AcceptorHandshakeHandler.NAME, new AcceptorHandshakeHandler(context));
                    }
                });

            ChannelFuture bindFuture = bootstrap.bind(options.bindHost, options.port);
            bindFuture.addListener((ChannelFutureListener) f -> {
                if (f.isSuccess()) {
                    serverChannel = f.channel();
                    InetSocketAddress addr = (InetSocketAddress) serverChannel.localAddress();
                    port = addr.getPort();
                    log.info("Listening on {}:{} as {}", options.bindHost, port, context.localId());
                    future.complete(addr);
                } else {
                    future.completeExceptionally(f.cause());
                }
            });
        } catch (Exception e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Closes the server channel and any inbound connection still in handshake.
     * Admitted peers are left to the registry.
     */
    public CompletableFuture<Void> close() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        Channel channel = serverChannel;
        serverChannel = null;
        pending.stream()
            .filter(ch -> ch.pipeline().get(AcceptorHandshakeHandler.NAME) != null)
            .forEach(Channel::close);
        if (channel == null) {
            future.complete(null);
            return future;
        }
        channel.close().addListener(f -> {
            if (f.isSuccess()) {
                log.info("Stopped listening on port {}", port);
            } else {
                log.debug("Error closing listener: {}", String.valueOf(f.cause()));
            }
            future.complete(null);
        });
        return future;
    }

    public boolean isListening() {
        Channel channel = serverChannel;
        return channel != null && channel.isActive();
    }

    public int getPort() {
        return port;
    }
}
