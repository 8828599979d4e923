package io.lanmesh.network;

import io.lanmesh.event.EventBus;
import io.lanmesh.event.MeshEvent;
import io.lanmesh.network.frame.Frame;
import io.lanmesh.network.frame.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Authoritative mapping from peer id to live connection.
 *
 * <p>Not thread-safe: every method must be called from the node's event loop.
 * {@link MeshNetwork} marshals calls from other threads onto that loop.
 */
public class PeerRegistry {

    private static final Logger log = LoggerFactory.getLogger(PeerRegistry.class);

    private final String localId;
    private final EventBus eventBus;
    private final FrameCodec codec;
    private final NetworkCounters counters;

    private final Map<String, Peer> peers = new LinkedHashMap<>();
    private final Set<String> connectedAddresses = new HashSet<>();
    private int maxPeers;
    private int seekingPeers;
    private int activeScans;

    public PeerRegistry(String localId, EventBus eventBus, FrameCodec codec, NetworkCounters counters) {
        this.localId = localId;
        this.eventBus = eventBus;
        this.codec = codec;
        this.counters = counters;
    }

    /**
     * Opens the registry for admissions until {@code target} peers are connected.
     */
    public void beginSeek(int target) {
        maxPeers = target;
        seekingPeers = peers.size() < target ? target : 0;
    }

    /**
     * Closes the registry for admissions and announces completion if it was still seeking.
     *
     * @return whether {@code all_peers_connected} was emitted
     */
    public boolean completeSeek() {
        if (seekingPeers == 0) {
            return false;
        }
        seekingPeers = 0;
        eventBus.emitLocal(MeshEvent.allPeersConnected());
        return true;
    }

    public void stopSeeking() {
        seekingPeers = 0;
    }

    public boolean isAccepting() {
        return peers.size() < maxPeers && seekingPeers > 0;
    }

    void scanStarted() {
        activeScans++;
    }

    void scanFinished() {
        if (activeScans > 0) {
            activeScans--;
        }
    }

    /**
     * Whether a discovery scan is running, as opposed to merely accepting inbound peers.
     */
    public boolean isScanning() {
        return activeScans > 0;
    }

    /**
     * Inserts {@code peer}, runs {@code onInserted}, then announces it.
     * {@code onInserted} runs before any handler so that nothing a handler writes
     * can overtake it on the wire.
     *
     * <p>If the id is already registered, {@code peer} replaces the existing
     * connection only when it {@linkplain #supersedes supersedes} it; the replacement
     * is silent and the old connection is closed.
     *
     * @return false if the id is local, already present on a preferred connection,
     *         or the channel is gone
     */
    public boolean admit(Peer peer, Runnable onInserted) {
        if (peer.id() == null || peer.id().equals(localId) || !peer.isActive()) {
            return false;
        }
        Peer existing = peers.get(peer.id());
        if (existing != null) {
            if (!supersedes(peer.info().direction(), existing)) {
                return false;
            }
            replace(existing, peer, onInserted);
            return true;
        }
        peers.put(peer.id(), peer);
        connectedAddresses.add(peer.address());

        boolean filled = peers.size() >= maxPeers && seekingPeers > 0;
        if (peers.size() >= maxPeers) {
            seekingPeers = 0;
        }
        if (onInserted != null) {
            onInserted.run();
        }

        log.info("Peer connected: {} ({} of {})", peer, peers.size(), maxPeers);
        eventBus.emitLocal(MeshEvent.peerConnected(peer.info()));
        if (filled) {
            eventBus.emitLocal(MeshEvent.allPeersConnected());
        }
        return true;
    }

    /**
     * Of two connections between the same pair of nodes, both sides keep the one
     * opened by the lower id.
     *
     * @return whether a connection in {@code direction} would replace {@code existing}
     */
    public boolean supersedes(PeerInfo.Direction direction, Peer existing) {
        PeerInfo.Direction preferred = localId.compareTo(existing.id()) < 0
            ? PeerInfo.Direction.OUTBOUND
            : PeerInfo.Direction.INBOUND;
        return direction == preferred && existing.info().direction() != preferred;
    }

    /**
     * Whether a new connection to {@code peerId} in {@code direction} would be admitted
     * over the one already registered.
     */
    public boolean wouldReplace(String peerId, PeerInfo.Direction direction) {
        Peer existing = peerId == null ? null : peers.get(peerId);
        return existing != null && supersedes(direction, existing);
    }

    private void replace(Peer existing, Peer peer, Runnable onInserted) {
        peers.put(peer.id(), peer);
        if (peers.values().stream().noneMatch(p -> p.address().equals(existing.address()))) {
            connectedAddresses.remove(existing.address());
        }
        connectedAddresses.add(peer.address());
        if (onInserted != null) {
            onInserted.run();
        }
        log.debug("Replacing {} connection to {} with {}", existing.info().direction(), existing, peer.info().direction());
        existing.close().addListener(f -> {
            if (!f.isSuccess()) {
                log.debug("Error closing {}: {}", existing, f.cause().toString());
            }
        });
    }

    /**
     * Removes the peer with {@code peerId}. Idempotent.
     */
    public boolean remove(String peerId) {
        Peer peer = peerId == null ? null : peers.get(peerId);
        return peer != null && remove(peer);
    }

    /**
     * Removes {@code peer} only if it is still the registered connection for its id.
     */
    public boolean remove(Peer peer) {
        if (peers.get(peer.id()) != peer) {
            return false;
        }
        peers.remove(peer.id());
        if (peers.values().stream().noneMatch(p -> p.address().equals(peer.address()))) {
            connectedAddresses.remove(peer.address());
        }
        peer.close().addListener(f -> {
            if (!f.isSuccess()) {
                log.debug("Error closing {}: {}", peer, f.cause().toString());
            }
        });
        log.info("Peer disconnected: {}", peer);
        eventBus.emitLocal(MeshEvent.peerDisconnected(peer.info()));
        return true;
    }

    public void removeAll() {
        for (Peer peer : new ArrayList<>(peers.values())) {
            remove(peer);
        }
    }

    /**
     * Best-effort broadcast; any peer whose write fails is removed.
     */
    public CompletableFuture<Void> emit(Frame frame) {
        String line = codec.encode(frame);
        List<CompletableFuture<Boolean>> writes = new ArrayList<>(peers.size());
        for (Peer peer : new ArrayList<>(peers.values())) {
            writes.add(write(peer, line));
        }
        return CompletableFuture.allOf(writes.toArray(new CompletableFuture[0]));
    }

    /**
     * @return completes with false if the peer is unknown or the write failed
     */
    public CompletableFuture<Boolean> sendTo(String peerId, Frame frame) {
        Peer peer = peerId == null ? null : peers.get(peerId);
        if (peer == null) {
            log.debug("sendTo: no such peer {}", peerId);
            return CompletableFuture.completedFuture(false);
        }
        return write(peer, codec.encode(frame));
    }

    private CompletableFuture<Boolean> write(Peer peer, String line) {
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        peer.send(line).addListener(f -> {
            if (f.isSuccess()) {
                counters.frameSent();
                result.complete(true);
            } else {
                counters.sendFailed();
                log.warn("Error sending to peer {}: {}", peer.id(), String.valueOf(f.cause()));
                remove(peer);
                result.complete(false);
            }
        });
        return result;
    }

    public boolean contains(String peerId) {
        return peerId != null && peers.containsKey(peerId);
    }

    public Optional<PeerInfo> get(String peerId) {
        Peer peer = peerId == null ? null : peers.get(peerId);
        return peer == null ? Optional.empty() : Optional.of(peer.info());
    }

    public boolean isConnectedAddress(String address) {
        return connectedAddresses.contains(address);
    }

    public List<PeerInfo> snapshot() {
        return peers.values().stream().map(Peer::info).toList();
    }

    public int size() {
        return peers.size();
    }

    public int getMaxPeers() {
        return maxPeers;
    }

    public int getSeekingPeers() {
        return seekingPeers;
    }
}
