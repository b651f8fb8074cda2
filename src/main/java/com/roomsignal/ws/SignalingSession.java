package com.roomsignal.ws;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-session protocol state: unbound until a join succeeds, then bound to one
 * room. The dispatcher serializes a session's events on this object.
 */
public class SignalingSession {
    private final String sessionId;
    private final String participantId;
    private final String remoteAddress;
    private final AtomicReference<String> roomId = new AtomicReference<>();
    private volatile boolean closed;

    public SignalingSession(SessionOrigin origin) {
        this.sessionId = origin.getSessionId();
        this.participantId = origin.getParticipantId();
        this.remoteAddress = origin.getRemoteAddress();
    }

    public String getSessionId() { return sessionId; }

    public String getParticipantId() { return participantId; }

    public String getRemoteAddress() { return remoteAddress; }

    public String getRoomId() { return roomId.get(); }

    public boolean isBound() { return roomId.get() != null; }

    public boolean isClosed() { return closed; }

    /** Marks the transport as gone; the dispatcher drops any later event. */
    public void close() {
        closed = true;
    }

    public void bind(String roomId) {
        this.roomId.set(roomId);
    }

    /**
     * Only the first caller gets the room back; later or concurrent callers get null.
     *
     * @return the room the session was bound to, or null if it was not bound
     */
    public String unbind() {
        return roomId.getAndSet(null);
    }
}
