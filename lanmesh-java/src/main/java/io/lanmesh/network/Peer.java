package io.lanmesh.network;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;

/**
 * A live, admitted connection. Instances are owned by {@link PeerRegistry}.
 */
public final class Peer {

    private final PeerInfo info;
    private final Channel channel;

    Peer(String id, String address, PeerInfo.Direction direction, Channel channel) {
        this.info = new PeerInfo(id, address, direction, System.currentTimeMillis());
        this.channel = channel;
    }

    public static Peer inbound(String id, String address, Channel channel) {
        return new Peer(id, address, PeerInfo.Direction.INBOUND, channel);
    }

    public static Peer outbound(String id, String address, Channel channel) {
        return new Peer(id, address, PeerInfo.Direction.OUTBOUND, channel);
    }

    public String id() { return info.id(); }
    public String address() { return info.address(); }
    public PeerInfo info() { return info; }

    ChannelFuture send(String line) {
        return channel.writeAndFlush(line);
    }

    boolean isActive() {
        return channel.isActive();
    }

    ChannelFuture close() {
        return channel.close();
    }

    @Override
    public String toString() {
        return "Peer[" + info.id() + "@" + info.address() + "]";
    }
}
