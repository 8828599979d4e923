package io.lanmesh.network;

import io.lanmesh.event.MeshEvent;
import io.lanmesh.network.frame.LinePipeline;
import io.lanmesh.network.handshake.HandshakeException;
import io.lanmesh.network.handshake.InitiatorHandshakeHandler;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoop;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Scans the configured address range for compatible peers.
 *
 * <p>Each round attempts every candidate concurrently; rounds repeat after the
 * backoff until the target is reached or the attempts are exhausted. Runs entirely
 * on the node's event loop.
 */
public class DiscoveryScanner {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryScanner.class);

    /**
     * Outcome of one {@code seekPeers} call.
     *
     * @param rounds scan rounds actually run, 0 when the target was already met
     */
    public record SeekResult(int peerCount, int targetCount, int rounds, boolean satisfied) {}

    private final NodeContext context;
    private final EventLoop loop;
    private final Bootstrap bootstrap;
    private final ChannelGroup attempts;
    private final Set<SeekRun> runs = new LinkedHashSet<>();
    private final Set<String> ownAddresses;

    public DiscoveryScanner(NodeContext context, EventLoop loop) {
        this.context = context;
        this.loop = loop;
        MeshOptions options = context.options();
        this.bootstrap = new Bootstrap()
            .group(loop)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) options.initiatorStepTimeout.toMillis())
            .option(ChannelOption.TCP_NODELAY, true)
            .option(ChannelOption.SO_KEEPALIVE, true);
        if (options.hasSpecificBindHost()) {
            bootstrap.localAddress(new InetSocketAddress(options.bindHost, 0));
        }
        this.attempts = new DefaultChannelGroup("lanmesh-outbound", loop);
        this.ownAddresses = AddressRange.ownAddresses(options.bindHost);
    }

    /**
     * Starts a seek for {@code target} peers in total. Must be called on the event loop.
     */
    public CompletableFuture<SeekResult> seek(int target) {
        if (target < 0) {
            throw new IllegalArgumentException("target must be non-negative: " + target);
        }
        PeerRegistry registry = context.registry();
        registry.beginSeek(target);
        if (registry.size() >= target) {
            log.debug("Already connected to {} of {} peers, nothing to seek", registry.size(), target);
            context.eventBus().emitLocal(MeshEvent.allPeersConnected());
            return CompletableFuture.completedFuture(new SeekResult(registry.size(), target, 0, true));
        }

        SeekRun run = new SeekRun(target);
        runs.add(run);
        registry.scanStarted();
        log.info("Seeking {} peers in {} (have {})", target, context.options().addressRange(), registry.size());
        round(run);
        return run.result;
    }

    private void round(SeekRun run) {
        run.backoff = null;
        if (run.cancelled || checkSatisfied(run)) {
            return;
        }
        run.rounds++;
        List<String> candidates = candidates();
        log.debug("Seek round {}/{}: {} candidates", run.rounds, context.options().maxSeekAttempts, candidates.size());

        List<CompletableFuture<PeerInfo>> pendingAttempts = new ArrayList<>(candidates.size());
        for (String address : candidates) {
            pendingAttempts.add(attempt(address));
        }
        CompletableFuture.allOf(pendingAttempts.toArray(new CompletableFuture[0]))
            .handle((v, err) -> null)
            .thenRun(() -> onLoop(run, () -> afterRound(run)));
    }

    private void afterRound(SeekRun run) {
        if (run.cancelled || checkSatisfied(run)) {
            return;
        }
        if (run.rounds < context.options().maxSeekAttempts) {
            run.backoff = loop.schedule(() -> round(run),
                context.options().seekBackoff.toMillis(), TimeUnit.MILLISECONDS);
            return;
        }
        int count = context.registry().size();
        log.info("Seek timed out after {} rounds with {} of {} peers", run.rounds, count, run.target);
        context.eventBus().emitLocal(MeshEvent.seekTimeout(count, run.target));
        finish(run, false);
    }

    private boolean checkSatisfied(SeekRun run) {
        if (context.registry().size() < run.target) {
            return false;
        }
        context.registry().completeSeek();
        finish(run, true);
        return true;
    }

    private void finish(SeekRun run, boolean satisfied) {
        if (runs.remove(run)) {
            context.registry().scanFinished();
        }
        run.result.complete(new SeekResult(context.registry().size(), run.target, run.rounds, satisfied));
    }

    private void onLoop(SeekRun run, Runnable task) {
        try {
            loop.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Event loop shut down during seek");
            run.cancelled = true;
            finish(run, false);
        }
    }

    List<String> candidates() {
        PeerRegistry registry = context.registry();
        List<String> result = new ArrayList<>();
        for (String address : context.options().addressRange().addresses()) {
            if (!ownAddresses.contains(address) && !registry.isConnectedAddress(address)) {
                result.add(address);
            }
        }
        return result;
    }

    private CompletableFuture<PeerInfo> attempt(String address) {
        CompletableFuture<PeerInfo> result = new CompletableFuture<>();
        MeshOptions options = context.options();
        Bootstrap b = bootstrap.clone().handler(new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                attempts.add(ch);
                LinePipeline.install(ch.pipeline(), options.maxFrameLength);
                ch.pipeline().addLast(InitiatorHandshakeHandler.NAME,
                    new InitiatorHandshakeHandler(context, address, result));
            }
        });
        try {
            b.connect(address, options.port).addListener((ChannelFutureListener) f -> {
                if (!f.isSuccess()) {
                    result.completeExceptionally(f.cause());
                }
            });
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
        result.whenComplete((peer, err) -> {
            if (err != null) {
                log.debug("Candidate {} not admitted: {}", address, describe(err));
            }
        });
        return result;
    }

    private static String describe(Throwable err) {
        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
        if (cause instanceof HandshakeException he) {
            return he.getReason() + " " + he.getMessage();
        }
        return String.valueOf(cause);
    }

    /**
     * Cancels every running seek and closes attempts still in handshake. Running
     * seeks complete unsatisfied without emitting {@code seek_timeout}.
     */
    public void cancelAll() {
        for (SeekRun run : new ArrayList<>(runs)) {
            run.cancelled = true;
            if (run.backoff != null) {
                run.backoff.cancel(false);
            }
            finish(run, false);
        }
        attempts.stream()
            .filter(ch -> ch.pipeline().get(InitiatorHandshakeHandler.NAME) != null)
            .forEach(ch -> ch.close());
    }

    public boolean isSeeking() {
        return !runs.isEmpty();
    }

    private static final class SeekRun {
        final int target;
        final CompletableFuture<SeekResult> result = new CompletableFuture<>();
        int rounds;
        boolean cancelled;
        ScheduledFuture<?> backoff;

        SeekRun(int target) {
            this.target = target;
        }
    }
}
