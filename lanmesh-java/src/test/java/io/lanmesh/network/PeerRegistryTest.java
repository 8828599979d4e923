package io.lanmesh.network;

import com.fasterxml.jackson.databind.JsonNode;
import io.lanmesh.event.MeshEvent;
import io.lanmesh.network.frame.Frame;
import io.lanmesh.network.frame.FrameCodec;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.ReferenceCountUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PeerRegistry")
class PeerRegistryTest {

    private NodeContext context;
    private PeerRegistry registry;
    private List<String> events;

    @BeforeEach
    void setUp() {
        context = NodeContexts.create("local");
        registry = context.registry();
        events = new ArrayList<>();
        for (String name : List.of(MeshEvent.PEER_CONNECTED, MeshEvent.PEER_DISCONNECTED,
                MeshEvent.ALL_PEERS_CONNECTED, MeshEvent.SEEK_TIMEOUT)) {
            context.eventBus().on(name, e -> events.add(e.hasPeer() ? e.name() + ":" + e.peer().id() : e.name()));
        }
    }

    private static Peer peer(String id, String address) {
        return Peer.inbound(id, address, new EmbeddedChannel());
    }

    private static JsonNode read(EmbeddedChannel channel) throws Exception {
        String line = channel.readOutbound();
        assertNotNull(line, "expected an outbound line");
        return FrameCodec.mapper().readTree(line);
    }

    @Nested
    @DisplayName("Seeking")
    class SeekingTests {

        @Test
        @DisplayName("should not accept before a seek")
        void shouldNotAcceptInitially() {
            assertFalse(registry.isAccepting());
            assertEquals(0, registry.getMaxPeers());
        }

        @Test
        @DisplayName("should accept until the target is reached")
        void shouldAcceptUntilTarget() {
            registry.beginSeek(2);
            assertTrue(registry.isAccepting());

            assertTrue(registry.admit(peer("a", "10.0.0.2"), null));
            assertTrue(registry.isAccepting());
            assertTrue(registry.admit(peer("b", "10.0.0.3"), null));

            assertFalse(registry.isAccepting());
            assertEquals(0, registry.getSeekingPeers());
            assertEquals(List.of("peer_connected:a", "peer_connected:b", "all_peers_connected"), events);
        }

        @Test
        @DisplayName("should not seek when the target is already met")
        void shouldNotSeekWhenSatisfied() {
            registry.beginSeek(1);
            registry.admit(peer("a", "10.0.0.2"), null);
            events.clear();

            registry.beginSeek(1);

            assertFalse(registry.isAccepting());
            assertFalse(registry.completeSeek());
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("should announce completion once")
        void shouldCompleteOnce() {
            registry.beginSeek(3);

            assertTrue(registry.completeSeek());
            assertFalse(registry.completeSeek());
            assertEquals(List.of("all_peers_connected"), events);
        }
    }

    @Nested
    @DisplayName("Admission")
    class AdmissionTests {

        @BeforeEach
        void open() {
            registry.beginSeek(5);
        }

        @Test
        @DisplayName("should refuse duplicate and local ids")
        void shouldRefuseDuplicates() {
            assertTrue(registry.admit(peer("a", "10.0.0.2"), null));

            assertFalse(registry.admit(peer("a", "10.0.0.4"), null));
            assertFalse(registry.admit(peer("local", "10.0.0.5"), null));
            assertEquals(1, registry.size());
        }

        @Test
        @DisplayName("should keep the connection opened by the lower id")
        void shouldReplaceWithPreferredConnection() {
            EmbeddedChannel inbound = new EmbeddedChannel();
            EmbeddedChannel outbound = new EmbeddedChannel();
            assertTrue(registry.admit(Peer.inbound("z", "10.0.0.2", inbound), null));

            assertTrue(registry.wouldReplace("z", PeerInfo.Direction.OUTBOUND));
            assertTrue(registry.admit(Peer.outbound("z", "10.0.0.2", outbound), null));

            assertEquals(PeerInfo.Direction.OUTBOUND, registry.get("z").orElseThrow().direction());
            assertFalse(inbound.isOpen());
            assertTrue(outbound.isOpen());
            assertEquals(1, registry.size());
            assertTrue(registry.isConnectedAddress("10.0.0.2"));
            assertEquals(List.of("peer_connected:z"), events);

            assertFalse(registry.wouldReplace("z", PeerInfo.Direction.INBOUND));
            assertFalse(registry.admit(Peer.inbound("z", "10.0.0.2", new EmbeddedChannel()), null));
        }

        @Test
        @DisplayName("should refuse a closed connection")
        void shouldRefuseClosedChannel() {
            EmbeddedChannel channel = new EmbeddedChannel();
            channel.close();

            assertFalse(registry.admit(Peer.inbound("a", "10.0.0.2", channel), null));
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("should run the insertion hook before announcing the peer")
        void shouldRunHookFirst() {
            List<String> order = new ArrayList<>();
            context.eventBus().on(MeshEvent.PEER_CONNECTED, e -> order.add("handler"));

            registry.admit(peer("a", "10.0.0.2"), () -> order.add("hook"));

            assertEquals(List.of("hook", "handler"), order);
        }

        @Test
        @DisplayName("should expose snapshots rather than live peers")
        void shouldExposeSnapshots() {
            registry.admit(peer("a", "10.0.0.2"), null);

            List<PeerInfo> snapshot = registry.snapshot();
            assertEquals(1, snapshot.size());
            assertEquals("a", snapshot.get(0).id());
            assertEquals(PeerInfo.Direction.INBOUND, snapshot.get(0).direction());
            assertTrue(registry.get("a").isPresent());
            assertTrue(registry.isConnectedAddress("10.0.0.2"));
            assertThrows(UnsupportedOperationException.class, () -> snapshot.add(snapshot.get(0)));
        }
    }

    @Nested
    @DisplayName("Removal")
    class RemovalTests {

        @BeforeEach
        void open() {
            registry.beginSeek(5);
        }

        @Test
        @DisplayName("should remove idempotently and announce once")
        void shouldRemoveOnce() {
            Peer a = peer("a", "10.0.0.2");
            registry.admit(a, null);
            events.clear();

            assertTrue(registry.remove("a"));
            assertFalse(registry.remove("a"));
            assertFalse(registry.remove(a));

            assertEquals(List.of("peer_disconnected:a"), events);
            assertFalse(a.isActive());
            assertFalse(registry.isConnectedAddress("10.0.0.2"));
        }

        @Test
        @DisplayName("should ignore a stale connection for a re-admitted id")
        void shouldIgnoreStalePeer() {
            Peer first = peer("a", "10.0.0.2");
            registry.admit(first, null);
            registry.remove(first);
            Peer second = peer("a", "10.0.0.2");
            registry.admit(second, null);

            assertFalse(registry.remove(first));
            assertTrue(registry.contains("a"));
            assertTrue(second.isActive());
        }

        @Test
        @DisplayName("should keep an address shared by another peer")
        void shouldKeepSharedAddress() {
            registry.admit(peer("a", "10.0.0.2"), null);
            registry.admit(peer("b", "10.0.0.2"), null);

            registry.remove("a");

            assertTrue(registry.isConnectedAddress("10.0.0.2"));
        }

        @Test
        @DisplayName("should remove every peer")
        void shouldRemoveAll() {
            registry.admit(peer("a", "10.0.0.2"), null);
            registry.admit(peer("b", "10.0.0.3"), null);
            events.clear();

            registry.removeAll();

            assertEquals(0, registry.size());
            assertEquals(List.of("peer_disconnected:a", "peer_disconnected:b"), events);
        }
    }

    @Nested
    @DisplayName("Messaging")
    class MessagingTests {

        @BeforeEach
        void open() {
            registry.beginSeek(5);
        }

        @Test
        @DisplayName("should broadcast to every peer")
        void shouldBroadcast() throws Exception {
            EmbeddedChannel ca = new EmbeddedChannel();
            EmbeddedChannel cb = new EmbeddedChannel();
            registry.admit(Peer.inbound("a", "10.0.0.2", ca), null);
            registry.admit(Peer.outbound("b", "10.0.0.3", cb), null);

            registry.emit(new Frame("message", context.codec().toData(Map.of("text", "hi")))).join();

            assertEquals("hi", read(ca).get("data").get("text").asText());
            assertEquals("message", read(cb).get("event").asText());
            assertEquals(2, context.counters().getFramesSent());
        }

        @Test
        @DisplayName("should send to one peer only")
        void shouldSendToOne() throws Exception {
            EmbeddedChannel ca = new EmbeddedChannel();
            EmbeddedChannel cb = new EmbeddedChannel();
            registry.admit(Peer.inbound("a", "10.0.0.2", ca), null);
            registry.admit(Peer.inbound("b", "10.0.0.3", cb), null);

            assertTrue(registry.sendTo("b", new Frame("move", null)).join());

            assertNull(ca.readOutbound());
            assertEquals("move", read(cb).get("event").asText());
        }

        @Test
        @DisplayName("should report an unknown peer")
        void shouldReportUnknown() {
            assertFalse(registry.sendTo("ghost", new Frame("move", null)).join());
        }

        @Test
        @DisplayName("should remove a peer whose write fails")
        void shouldRemoveOnWriteFailure() {
            EmbeddedChannel broken = new EmbeddedChannel(new ChannelOutboundHandlerAdapter() {
                @Override
                public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
                    ReferenceCountUtil.release(msg);
                    promise.setFailure(new IOException("broken pipe"));
                }
            });
            EmbeddedChannel healthy = new EmbeddedChannel();
            registry.admit(Peer.inbound("a", "10.0.0.2", broken), null);
            registry.admit(Peer.inbound("b", "10.0.0.3", healthy), null);
            events.clear();

            registry.emit(new Frame("message", null)).join();

            assertFalse(registry.contains("a"));
            assertTrue(registry.contains("b"));
            assertEquals(List.of("peer_disconnected:a"), events);
            assertEquals(1, context.counters().getSendFailures());
        }
    }
}
