package io.lanmesh.network.handshake;

/**
 * Failure of a single handshake attempt. Never fatal to the node.
 */
public class HandshakeException extends Exception {

    public enum Reason {
        TIMEOUT,
        MALFORMED,
        UNEXPECTED_MESSAGE,
        INCOMPATIBLE,
        REJECTED,
        DUPLICATE,
        YIELDED,
        CLOSED
    }

    private final Reason reason;

    public HandshakeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public HandshakeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "HandshakeException[" + reason + "]: " + getMessage();
    }
}
