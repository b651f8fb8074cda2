package com.roomsignal.model;

public enum MediaKind {
    AUDIO("audio"),
    VIDEO("video"),
    SCREEN("screen");

    private final String label;

    MediaKind(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }
}
