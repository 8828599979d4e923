package io.lanmesh.network.handshake;

import io.lanmesh.network.NodeContext;
import io.lanmesh.network.Peer;
import io.lanmesh.network.PeerSessionHandler;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Acceptor half of the handshake, installed on every inbound channel.
 *
 * <pre>
 * AWAIT_INFO_REQUEST --info_request--> AWAIT_CONNECT_REQUEST --connect_request--> DONE
 * AWAIT_INFO_REQUEST --connect_request--> DONE
 * </pre>
 *
 * Each wait is bounded by the acceptor step timeout. On admission the handler
 * replaces itself with a {@link PeerSessionHandler}.
 */
public class AcceptorHandshakeHandler extends SimpleChannelInboundHandler<String> {

    public static final String NAME = "handshake";

    private static final Logger log = LoggerFactory.getLogger(AcceptorHandshakeHandler.class);

    enum Step { AWAIT_INFO_REQUEST, AWAIT_CONNECT_REQUEST, DONE }

    private final NodeContext context;
    private Step step = Step.AWAIT_INFO_REQUEST;
    private ScheduledFuture<?> stepTimeout;

    public AcceptorHandshakeHandler(NodeContext context) {
        this.context = context;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        if (ctx.channel().isActive()) {
            armTimeout(ctx);
        }
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        armTimeout(ctx);
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line) {
        if (step == Step.DONE) {
            return;
        }
        cancelTimeout();
        try {
            HandshakeMessage message = context.codec().decodeHandshake(line);
            if (step == Step.AWAIT_INFO_REQUEST && message instanceof HandshakeMessage.InfoRequest) {
                sendInfo(ctx);
            } else if (message instanceof HandshakeMessage.ConnectRequest request) {
                onConnectRequest(ctx, request);
            } else {
                throw new HandshakeException(HandshakeException.Reason.UNEXPECTED_MESSAGE,
                    "unexpected " + message.getClass().getSimpleName() + " in " + step);
            }
        } catch (HandshakeException e) {
            fail(ctx, e);
        }
    }

    private void sendInfo(ChannelHandlerContext ctx) {
        HandshakeMessage.InfoResponse response = new HandshakeMessage.InfoResponse(
            context.identity().appName(), context.localId(),
            context.registry().isAccepting(), context.registry().isScanning());
        ctx.channel().writeAndFlush(context.codec().encode(response));
        step = Step.AWAIT_CONNECT_REQUEST;
        armTimeout(ctx);
    }

    private void onConnectRequest(ChannelHandlerContext ctx, HandshakeMessage.ConnectRequest request) {
        step = Step.DONE;
        Channel channel = ctx.channel();
        Optional<String> rejection = context.policy().evaluate(request);
        if (rejection.isPresent()) {
            context.counters().handshakeRejected();
            log.debug("Rejecting {} from {}: {}", request.peerId(), channel.remoteAddress(), rejection.get());
            channel.writeAndFlush(context.codec().encode(new HandshakeMessage.ConnectReject(rejection.get())))
                .addListener(ChannelFutureListener.CLOSE);
            return;
        }

        Peer peer = Peer.inbound(request.peerId(), remoteHost(channel), channel);
        ctx.pipeline().replace(this, PeerSessionHandler.NAME, new PeerSessionHandler(context, peer));
        String accept = context.codec().encode(new HandshakeMessage.ConnectAccept(context.localId()));
        if (context.registry().admit(peer, () -> channel.writeAndFlush(accept))) {
            context.counters().inboundAdmitted();
        } else {
            context.counters().handshakeFailed();
            log.debug("Inbound peer {} vanished before admission", request.peerId());
            channel.close();
        }
    }

    private void fail(ChannelHandlerContext ctx, HandshakeException e) {
        step = Step.DONE;
        cancelTimeout();
        context.counters().handshakeFailed();
        log.debug("Inbound handshake from {} failed: {}", ctx.channel().remoteAddress(), e.toString());
        ctx.close();
    }

    private void armTimeout(ChannelHandlerContext ctx) {
        cancelTimeout();
        long millis = context.options().acceptorStepTimeout.toMillis();
        Step armedFor = step;
        stepTimeout = ctx.executor().schedule(() -> {
            if (step == armedFor) {
                fail(ctx, new HandshakeException(HandshakeException.Reason.TIMEOUT,
                    "no message within " + millis + "ms in " + armedFor));
            }
        }, millis, TimeUnit.MILLISECONDS);
    }

    private void cancelTimeout() {
        if (stepTimeout != null) {
            stepTimeout.cancel(false);
            stepTimeout = null;
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        cancelTimeout();
        if (step != Step.DONE) {
            step = Step.DONE;
            context.counters().handshakeFailed();
            log.debug("Inbound connection from {} closed during handshake", ctx.channel().remoteAddress());
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (step == Step.DONE) {
            ctx.close();
            return;
        }
        fail(ctx, new HandshakeException(HandshakeException.Reason.CLOSED, String.valueOf(cause), cause));
    }

    static String remoteHost(Channel channel) {
        SocketAddress remote = channel.remoteAddress();
        if (remote instanceof InetSocketAddress inet) {
            return inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
        }
        return String.valueOf(remote);
    }
}
