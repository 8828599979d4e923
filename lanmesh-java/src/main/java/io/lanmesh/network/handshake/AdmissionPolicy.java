package io.lanmesh.network.handshake;

import io.lanmesh.network.LocalIdentity;
import io.lanmesh.network.PeerInfo;
import io.lanmesh.network.PeerRegistry;

import java.util.Optional;

/**
 * Acceptance predicate for both handshake roles.
 */
public class AdmissionPolicy {

    public static final String NOT_ACCEPTING = "Not accepting connections";
    public static final String APP_MISMATCH = "Application mismatch";
    public static final String ALREADY_CONNECTED = "Already connected";
    public static final String SELF_CONNECTION = "Cannot connect to self";

    private final LocalIdentity identity;
    private final PeerRegistry registry;
    private final boolean yieldToLowerId;

    public AdmissionPolicy(LocalIdentity identity, PeerRegistry registry, boolean yieldToLowerId) {
        this.identity = identity;
        this.registry = registry;
        this.yieldToLowerId = yieldToLowerId;
    }

    /**
     * Acceptor side: decides on an incoming connect_request.
     *
     * @return the rejection reason, or empty to admit
     */
    public Optional<String> evaluate(HandshakeMessage.ConnectRequest request) {
        if (!identity.isCompatibleWith(request.appName())) {
            return Optional.of(APP_MISMATCH);
        }
        if (registry.wouldReplace(request.peerId(), PeerInfo.Direction.INBOUND)) {
            return Optional.empty();
        }
        if (!registry.isAccepting()) {
            return Optional.of(NOT_ACCEPTING);
        }
        if (request.peerId() == null || request.peerId().equals(identity.id())) {
            return Optional.of(SELF_CONNECTION);
        }
        if (registry.contains(request.peerId())) {
            return Optional.of(ALREADY_CONNECTED);
        }
        return Optional.empty();
    }

    /**
     * Initiator side: decides whether to send connect_request after an info_response.
     * When the remote is itself scanning, only the lower id initiates; the other side
     * waits to be admitted through its own listener. A remote that merely accepts is
     * always contacted.
     */
    public void checkInfo(HandshakeMessage.InfoResponse info) throws HandshakeException {
        if (info.peerId() == null || !identity.isCompatibleWith(info.appName())) {
            throw new HandshakeException(HandshakeException.Reason.INCOMPATIBLE,
                "remote app '" + info.appName() + "' does not match '" + identity.appName() + "'");
        }
        if (info.peerId().equals(identity.id())) {
            throw new HandshakeException(HandshakeException.Reason.INCOMPATIBLE, "reached our own listener");
        }
        if (!info.accepting()) {
            throw new HandshakeException(HandshakeException.Reason.REJECTED, "remote is not accepting");
        }
        boolean replacing = registry.wouldReplace(info.peerId(), PeerInfo.Direction.OUTBOUND);
        if (registry.contains(info.peerId()) && !replacing) {
            throw new HandshakeException(HandshakeException.Reason.DUPLICATE, "already connected to " + info.peerId());
        }
        if (!registry.isAccepting() && !replacing) {
            throw new HandshakeException(HandshakeException.Reason.REJECTED, "local registry is full");
        }
        if (yieldToLowerId && info.seeking() && info.peerId().compareTo(identity.id()) < 0) {
            throw new HandshakeException(HandshakeException.Reason.YIELDED,
                "remote " + info.peerId() + " has the lower id and initiates");
        }
    }
}
