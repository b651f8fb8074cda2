package com.roomsignal.model;

import java.time.Instant;

/**
 * Signaling relationship between two participants. One instance per unordered
 * pair, referenced from both participants' {@link PeerEntry}; the initiator is
 * whoever sent the latest offer.
 */
public class PeerLink {
    private final String connectionId;
    private final String initiatorId;
    private final String targetId;
    private final Instant createdAt;
    private PeerLinkStatus status = PeerLinkStatus.CONNECTING;

    public PeerLink(String initiatorId, String targetId, Instant createdAt) {
        this.connectionId = connectionId(initiatorId, targetId);
        this.initiatorId = initiatorId;
        this.targetId = targetId;
        this.createdAt = createdAt;
    }

    public static String connectionId(String fromId, String toId) {
        return fromId + "-" + toId;
    }

    /** Order-independent key of the pair. */
    public static String pairKey(String a, String b) {
        return a.compareTo(b) < 0 ? a + '|' + b : b + '|' + a;
    }

    public String getConnectionId() { return connectionId; }

    public String getInitiatorId() { return initiatorId; }

    public String getTargetId() { return targetId; }

    public Instant getCreatedAt() { return createdAt; }

    public PeerLinkStatus getStatus() { return status; }
    public void setStatus(PeerLinkStatus status) { this.status = status; }

    public String peerOf(String participantId) {
        return initiatorId.equals(participantId) ? targetId : initiatorId;
    }
}
