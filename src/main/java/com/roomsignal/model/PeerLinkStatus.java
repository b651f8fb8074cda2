package com.roomsignal.model;

public enum PeerLinkStatus {
    CONNECTING("connecting"),
    CONNECTED("connected");

    private final String label;

    PeerLinkStatus(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }
}
