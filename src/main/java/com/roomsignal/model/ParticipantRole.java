package com.roomsignal.model;

public enum ParticipantRole {
    HOST("host"),
    PARTICIPANT("participant");

    private final String label;

    ParticipantRole(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }
}
