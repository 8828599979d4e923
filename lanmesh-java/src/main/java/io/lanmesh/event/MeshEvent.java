package io.lanmesh.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lanmesh.network.PeerInfo;

import java.util.Objects;

/**
 * A locally dispatched event: either a frame received from a peer or a lifecycle
 * transition of the local node.
 *
 * @param name  event name, e.g. {@code "message"} or {@link #PEER_CONNECTED}
 * @param peer  originating or affected peer, {@code null} for node-wide events
 * @param data  payload, never {@code null} (an empty object when absent)
 */
public record MeshEvent(String name, PeerInfo peer, JsonNode data) {

    public static final String PEER_CONNECTED = "peer_connected";
    public static final String PEER_DISCONNECTED = "peer_disconnected";
    public static final String ALL_PEERS_CONNECTED = "all_peers_connected";
    public static final String SEEK_TIMEOUT = "seek_timeout";

    public MeshEvent {
        Objects.requireNonNull(name, "name");
        if (data == null) {
            data = JsonNodeFactory.instance.objectNode();
        }
    }

    public static MeshEvent fromPeer(String name, PeerInfo peer, JsonNode data) {
        return new MeshEvent(name, peer, data);
    }

    public static MeshEvent peerConnected(PeerInfo peer) {
        return new MeshEvent(PEER_CONNECTED, peer, null);
    }

    public static MeshEvent peerDisconnected(PeerInfo peer) {
        return new MeshEvent(PEER_DISCONNECTED, peer, null);
    }

    public static MeshEvent allPeersConnected() {
        return new MeshEvent(ALL_PEERS_CONNECTED, null, null);
    }

    public static MeshEvent seekTimeout(int currentCount, int targetCount) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("current", currentCount);
        data.put("target", targetCount);
        return new MeshEvent(SEEK_TIMEOUT, null, data);
    }

    public boolean hasPeer() {
        return peer != null;
    }
}
