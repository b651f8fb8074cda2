package com.roomsignal.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-participant signaling state inside {@link com.roomsignal.service.PeerConnectionTracker}.
 */
public class PeerEntry {
    private final String sessionHandle;
    private final MediaState mediaState;
    private final Map<String, PeerLink> peers = new LinkedHashMap<>();
    private boolean initiator;

    public PeerEntry(String sessionHandle, MediaState mediaState) {
        this.sessionHandle = sessionHandle;
        this.mediaState = mediaState;
    }

    public String getSessionHandle() { return sessionHandle; }

    public MediaState getMediaState() { return mediaState; }

    /** Peer id to link. */
    public Map<String, PeerLink> getPeers() { return peers; }

    public boolean isInitiator() { return initiator; }
    public void setInitiator(boolean initiator) { this.initiator = initiator; }
}
