package io.lanmesh.network;

import io.lanmesh.event.AsyncEventHandler;
import io.lanmesh.event.EventBus;
import io.lanmesh.event.EventHandler;
import io.lanmesh.network.DiscoveryScanner.SeekResult;
import io.lanmesh.network.frame.Frame;
import io.lanmesh.network.frame.FrameCodec;
import io.lanmesh.network.handshake.AdmissionPolicy;
import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Entry point of a mesh node: listener, discovery, peer registry and event bus
 * bound to one event loop.
 *
 * <p>All methods may be called from any thread. Work that touches the registry is
 * handed to the event loop; {@link #execute(Runnable)} offers the same handoff to
 * callers that need to run several operations atomically.
 *
 * <pre>{@code
 * MeshNetwork mesh = new MeshNetwork("pong");
 * mesh.on("peer_connected", e -> mesh.sendTo(e.peer().id(), "hello", Map.of("n", 1)));
 * mesh.on("hello", e -> System.out.println(e.data()));
 * mesh.startListening().join();
 * mesh.seekPeers(1);
 * }</pre>
 */
public class MeshNetwork implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MeshNetwork.class);
    private static final long CLOSE_TIMEOUT_SECONDS = 5;

    private final EventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final EventLoopGroup workerGroup = new NioEventLoopGroup(1);
    private final EventLoop loop = workerGroup.next();

    private final LocalIdentity identity;
    private final MeshOptions options;
    private final EventBus eventBus;
    private final FrameCodec codec = new FrameCodec();
    private final NetworkCounters counters = new NetworkCounters();
    private final PeerRegistry registry;
    private final ConnectionListener listener;
    private final DiscoveryScanner scanner;

    private volatile boolean closed;

    public MeshNetwork(String appName) {
        this(appName, MeshOptions.load());
    }

    public MeshNetwork(String appName, MeshOptions options) {
        this(LocalIdentity.generate(appName), options);
    }

    public MeshNetwork(LocalIdentity identity, MeshOptions options) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.options = Objects.requireNonNull(options, "options");
        this.eventBus = new EventBus(loop);
        this.registry = new PeerRegistry(identity.id(), eventBus, codec, counters);
        AdmissionPolicy policy = new AdmissionPolicy(identity, registry, options.yieldToLowerId);
        NodeContext context = new NodeContext(identity, options, registry, eventBus, codec, policy, counters);
        this.listener = new ConnectionListener(context, bossGroup, workerGroup, loop);
        this.scanner = new DiscoveryScanner(context, loop);
    }

    /**
     * Binds the listening port. Fails if the port cannot be bound.
     *
     * @return the bound port
     */
    public CompletableFuture<Integer> startListening() {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Network closed"));
        }
        return listener.bind().thenApply(InetSocketAddress::getPort);
    }

    /**
     * Closes the listener, cancels any running seek and disconnects every peer.
     */
    public CompletableFuture<Void> stopListening() {
        return onLoop(() -> {
            scanner.cancelAll();
            registry.stopSeeking();
            CompletableFuture<Void> stopped = listener.close();
            registry.removeAll();
            return stopped;
        });
    }

    /**
     * Scans the address range until {@code targetCount} peers are connected in total
     * or the attempts run out. Emits {@code all_peers_connected} or {@code seek_timeout}.
     */
    public CompletableFuture<SeekResult> seekPeers(int targetCount) {
        if (targetCount < 0) {
            throw new IllegalArgumentException("targetCount must be non-negative: " + targetCount);
        }
        return onLoop(() -> scanner.seek(targetCount));
    }

    public void on(String event, EventHandler handler) {
        eventBus.on(event, handler);
    }

    /**
     * Registers a handler that runs as its own task on the event loop instead of inline.
     */
    public void onAsync(String event, AsyncEventHandler handler) {
        eventBus.onAsync(event, handler);
    }

    public boolean off(String event, Object handler) {
        return eventBus.off(event, handler);
    }

    public boolean off(String event) {
        return eventBus.off(event);
    }

    /**
     * Broadcasts {@code event} to every connected peer. Never delivered locally.
     *
     * @param data any Jackson-serializable value; {@code null} sends an empty object
     */
    public CompletableFuture<Void> emit(String event, Object data) {
        Frame frame = new Frame(Objects.requireNonNull(event, "event"), codec.toData(data));
        return onLoop(() -> registry.emit(frame));
    }

    public CompletableFuture<Void> emit(String event) {
        return emit(event, null);
    }

    /**
     * @return completes with false if the peer is unknown or the write failed
     */
    public CompletableFuture<Boolean> sendTo(String peerId, String event, Object data) {
        Frame frame = new Frame(Objects.requireNonNull(event, "event"), codec.toData(data));
        return onLoop(() -> registry.sendTo(peerId, frame));
    }

    /**
     * Runs {@code task} on the event loop, serialized with all network activity.
     */
    public void execute(Runnable task) {
        loop.execute(task);
    }

    public String getLocalId() {
        return identity.id();
    }

    public LocalIdentity getIdentity() {
        return identity;
    }

    public int getPeerCount() {
        return query(registry::size);
    }

    public List<PeerInfo> getConnectedPeers() {
        return query(registry::snapshot);
    }

    public boolean isAcceptingConnections() {
        return query(registry::isAccepting);
    }

    public boolean isListening() {
        return listener.isListening();
    }

    public int getPort() {
        return listener.getPort();
    }

    public MeshOptions getOptions() {
        return options;
    }

    public boolean isClosed() {
        return closed;
    }

    public MeshStats getStats() {
        return query(() -> new MeshStats(
            identity.id(),
            listener.getPort(),
            listener.isListening(),
            registry.size(),
            registry.getMaxPeers(),
            registry.isAccepting(),
            counters.getInboundAdmitted(),
            counters.getOutboundAdmitted(),
            counters.getHandshakesRejected(),
            counters.getHandshakeFailures(),
            counters.getFramesSent(),
            counters.getFramesReceived(),
            counters.getFramesDropped(),
            counters.getSendFailures(),
            eventBus.getHandlerFaults()
        ));
    }

    /**
     * Stops listening, disconnects every peer and releases the event loops.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        CompletableFuture<Void> stopped = stopListening();
        if (!loop.inEventLoop()) {
            try {
                stopped.get(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                log.warn("Error stopping network {}", identity.id(), e);
            }
        }
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        log.info("Network {} closed", identity.id());
    }

    private <T> CompletableFuture<T> onLoop(Supplier<CompletableFuture<T>> task) {
        if (loop.inEventLoop()) {
            try {
                return task.get();
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            loop.execute(() -> {
                try {
                    task.get().whenComplete((value, err) -> {
                        if (err != null) {
                            future.completeExceptionally(err);
                        } else {
                            future.complete(value);
                        }
                    });
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new IllegalStateException("Network closed", e));
        }
        return future;
    }

    private <T> T query(Supplier<T> supplier) {
        if (loop.inEventLoop()) {
            return supplier.get();
        }
        try {
            return CompletableFuture.supplyAsync(supplier, loop).join();
        } catch (RejectedExecutionException e) {
            // loop gone, nothing can mutate the registry any more
            return supplier.get();
        }
    }

    public record MeshStats(
        String localId,
        int port,
        boolean listening,
        int peerCount,
        int maxPeers,
        boolean accepting,
        long inboundAdmitted,
        long outboundAdmitted,
        long handshakesRejected,
        long handshakeFailures,
        long framesSent,
        long framesReceived,
        long framesDropped,
        long sendFailures,
        long handlerFaults
    ) {}
}
