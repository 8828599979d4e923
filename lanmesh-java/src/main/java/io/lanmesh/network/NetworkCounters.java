package io.lanmesh.network;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic counters shared by the listener, scanner and session handlers.
 */
public final class NetworkCounters {

    final AtomicLong inboundAdmitted = new AtomicLong();
    final AtomicLong outboundAdmitted = new AtomicLong();
    final AtomicLong handshakesRejected = new AtomicLong();
    final AtomicLong handshakeFailures = new AtomicLong();
    final AtomicLong framesSent = new AtomicLong();
    final AtomicLong framesReceived = new AtomicLong();
    final AtomicLong framesDropped = new AtomicLong();
    final AtomicLong sendFailures = new AtomicLong();

    public void inboundAdmitted() { inboundAdmitted.incrementAndGet(); }
    public void outboundAdmitted() { outboundAdmitted.incrementAndGet(); }
    public void handshakeRejected() { handshakesRejected.incrementAndGet(); }
    public void handshakeFailed() { handshakeFailures.incrementAndGet(); }
    public void frameSent() { framesSent.incrementAndGet(); }
    public void frameReceived() { framesReceived.incrementAndGet(); }
    public void frameDropped() { framesDropped.incrementAndGet(); }
    public void sendFailed() { sendFailures.incrementAndGet(); }

    public long getInboundAdmitted() { return inboundAdmitted.get(); }
    public long getOutboundAdmitted() { return outboundAdmitted.get(); }
    public long getHandshakesRejected() { return handshakesRejected.get(); }
    public long getHandshakeFailures() { return handshakeFailures.get(); }
    public long getFramesSent() { return framesSent.get(); }
    public long getFramesReceived() { return framesReceived.get(); }
    public long getFramesDropped() { return framesDropped.get(); }
    public long getSendFailures() { return sendFailures.get(); }
}
