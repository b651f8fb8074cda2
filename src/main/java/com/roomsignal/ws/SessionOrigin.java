package com.roomsignal.ws;

/**
 * Where an inbound event came from: the transport session, the participant id
 * bound to its connection, and the client address.
 */
public class SessionOrigin {
    private final String sessionId;
    private final String participantId;
    private final String remoteAddress;

    public SessionOrigin(String sessionId, String participantId, String remoteAddress) {
        this.sessionId = sessionId;
        this.participantId = participantId;
        this.remoteAddress = remoteAddress;
    }

    public String getSessionId() { return sessionId; }

    public String getParticipantId() { return participantId; }

    public String getRemoteAddress() { return remoteAddress; }

    @Override
    public String toString() {
        return participantId + "@" + sessionId;
    }
}
