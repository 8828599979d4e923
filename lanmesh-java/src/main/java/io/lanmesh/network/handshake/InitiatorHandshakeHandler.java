package io.lanmesh.network.handshake;

import io.lanmesh.network.NodeContext;
import io.lanmesh.network.Peer;
import io.lanmesh.network.PeerInfo;
import io.lanmesh.network.PeerSessionHandler;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Initiator half of the handshake for one discovery candidate. Completes
 * {@code result} with the admitted peer, or exceptionally with a
 * {@link HandshakeException}; either way the attempt touches nothing but its own channel.
 */
public class InitiatorHandshakeHandler extends SimpleChannelInboundHandler<String> {

    public static final String NAME = "handshake";

    enum Step { AWAIT_INFO_RESPONSE, AWAIT_CONNECT_RESPONSE, DONE }

    private final NodeContext context;
    private final String address;
    private final CompletableFuture<PeerInfo> result;
    private Step step = Step.AWAIT_INFO_RESPONSE;
    private ScheduledFuture<?> stepTimeout;
    private String remoteId;

    public InitiatorHandshakeHandler(NodeContext context, String address, CompletableFuture<PeerInfo> result) {
        this.context = context;
        this.address = address;
        this.result = result;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        if (ctx.channel().isActive()) {
            start(ctx);
        }
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        start(ctx);
        super.channelActive(ctx);
    }

    private void start(ChannelHandlerContext ctx) {
        if (stepTimeout != null || step != Step.AWAIT_INFO_RESPONSE) {
            return;
        }
        ctx.channel().writeAndFlush(context.codec().encode(new HandshakeMessage.InfoRequest(context.localId())));
        armTimeout(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line) {
        if (step == Step.DONE) {
            return;
        }
        cancelTimeout();
        try {
            HandshakeMessage message = context.codec().decodeHandshake(line);
            switch (step) {
                case AWAIT_INFO_RESPONSE -> onInfoResponse(ctx, message);
                case AWAIT_CONNECT_RESPONSE -> onConnectResponse(ctx, message);
                default -> { }
            }
        } catch (HandshakeException e) {
            fail(ctx, e);
        }
    }

    private void onInfoResponse(ChannelHandlerContext ctx, HandshakeMessage message) throws HandshakeException {
        if (!(message instanceof HandshakeMessage.InfoResponse info)) {
            throw new HandshakeException(HandshakeException.Reason.UNEXPECTED_MESSAGE,
                "expected info_response, got " + message.getClass().getSimpleName());
        }
        context.policy().checkInfo(info);
        remoteId = info.peerId();
        ctx.channel().writeAndFlush(context.codec().encode(
            new HandshakeMessage.ConnectRequest(context.localId(), context.identity().appName())));
        step = Step.AWAIT_CONNECT_RESPONSE;
        armTimeout(ctx);
    }

    private void onConnectResponse(ChannelHandlerContext ctx, HandshakeMessage message) throws HandshakeException {
        if (message instanceof HandshakeMessage.ConnectReject reject) {
            context.counters().handshakeRejected();
            throw new HandshakeException(HandshakeException.Reason.REJECTED, String.valueOf(reject.reason()));
        }
        if (!(message instanceof HandshakeMessage.ConnectAccept)) {
            throw new HandshakeException(HandshakeException.Reason.UNEXPECTED_MESSAGE,
                "expected connect_accept, got " + message.getClass().getSimpleName());
        }
        if (context.registry().contains(remoteId)
            && !context.registry().wouldReplace(remoteId, PeerInfo.Direction.OUTBOUND)) {
            throw new HandshakeException(HandshakeException.Reason.DUPLICATE,
                "admitted " + remoteId + " through the connection it opened");
        }

        step = Step.DONE;
        Channel channel = ctx.channel();
        Peer peer = Peer.outbound(remoteId, address, channel);
        ctx.pipeline().replace(this, PeerSessionHandler.NAME, new PeerSessionHandler(context, peer));
        if (context.registry().admit(peer, null)) {
            context.counters().outboundAdmitted();
            result.complete(peer.info());
        } else {
            context.counters().handshakeFailed();
            channel.close();
            result.completeExceptionally(new HandshakeException(HandshakeException.Reason.CLOSED,
                "connection to " + remoteId + " closed before admission"));
        }
    }

    private void fail(ChannelHandlerContext ctx, HandshakeException e) {
        step = Step.DONE;
        cancelTimeout();
        if (e.getReason() != HandshakeException.Reason.YIELDED) {
            context.counters().handshakeFailed();
        }
        result.completeExceptionally(e);
        ctx.close();
    }

    private void armTimeout(ChannelHandlerContext ctx) {
        cancelTimeout();
        long millis = context.options().initiatorStepTimeout.toMillis();
        Step armedFor = step;
        stepTimeout = ctx.executor().schedule(() -> {
            if (step == armedFor) {
                fail(ctx, new HandshakeException(HandshakeException.Reason.TIMEOUT,
                    address + " did not answer within " + millis + "ms in " + armedFor));
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
            result.completeExceptionally(new HandshakeException(HandshakeException.Reason.CLOSED,
                address + " closed the connection during " + "handshake"));
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
}
