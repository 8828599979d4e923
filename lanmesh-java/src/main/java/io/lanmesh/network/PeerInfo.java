package io.lanmesh.network;

/**
 * Immutable snapshot of an admitted peer. Holders look the live connection up
 * by {@link #id()} through the registry; the snapshot never keeps it alive.
 */
public record PeerInfo(String id, String address, Direction direction, long connectedAt) {

    public enum Direction {
        /** We sent the connect_request. */
        OUTBOUND,
        /** The remote sent the connect_request. */
        INBOUND
    }
}
