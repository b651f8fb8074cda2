package com.roomsignal.model;

import java.time.Instant;

public class PendingOffer {
    private final String roomId;
    private final String fromId;
    private final String toId;
    private final Object offer;
    private final Instant timestamp;

    public PendingOffer(String roomId, String fromId, String toId, Object offer, Instant timestamp) {
        this.roomId = roomId;
        this.fromId = fromId;
        this.toId = toId;
        this.offer = offer;
        this.timestamp = timestamp;
    }

    public String getRoomId() { return roomId; }
    public String getFromId() { return fromId; }
    public String getToId() { return toId; }
    public Object getOffer() { return offer; }
    public Instant getTimestamp() { return timestamp; }

    public boolean involves(String participantId) {
        return fromId.equals(participantId) || toId.equals(participantId);
    }
}
