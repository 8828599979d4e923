package io.lanmesh.network;

import io.lanmesh.event.EventBus;
import io.lanmesh.network.frame.FrameCodec;
import io.lanmesh.network.handshake.AdmissionPolicy;

/**
 * Collaborators shared by every channel handler of one node.
 */
public record NodeContext(
    LocalIdentity identity,
    MeshOptions options,
    PeerRegistry registry,
    EventBus eventBus,
    FrameCodec codec,
    AdmissionPolicy policy,
    NetworkCounters counters
) {
    public String localId() {
        return identity.id();
    }
}
