package io.lanmesh.network;

import io.lanmesh.event.MeshEvent;
import io.lanmesh.network.frame.Frame;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Dispatch loop of one admitted connection: decodes each line and hands it to the
 * event bus. Undecodable lines are dropped; closing the channel removes the peer.
 */
public class PeerSessionHandler extends SimpleChannelInboundHandler<String> {

    public static final String NAME = "session";

    private static final Logger log = LoggerFactory.getLogger(PeerSessionHandler.class);

    private final NodeContext context;
    private final Peer peer;

    public PeerSessionHandler(NodeContext context, Peer peer) {
        this.context = context;
        this.peer = peer;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line) {
        Optional<Frame> decoded = context.codec().decode(line);
        if (decoded.isEmpty()) {
            context.counters().frameDropped();
            log.debug("Dropping malformed frame from {}", peer);
            return;
        }
        Frame frame = decoded.get();
        context.counters().frameReceived();
        context.eventBus().emitLocal(MeshEvent.fromPeer(frame.event(), peer.info(), frame.data()));
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        context.registry().remove(peer);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            // oversized or undecodable line; the decoder has already skipped it
            context.counters().frameDropped();
            log.debug("Dropping frame from {}: {}", peer, cause.toString());
            return;
        }
        log.debug("Connection to peer {} lost: {}", peer.id(), cause.toString());
        ctx.close();
    }
}
