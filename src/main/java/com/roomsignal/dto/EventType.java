package com.roomsignal.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Every event the server sends to a session. The wire name goes out in the
 * {@code type} field.
 */
public enum EventType {
    ROOM_JOINED("room-joined"),
    USER_CONNECTED("user-connected"),
    USER_DISCONNECTED("user-disconnected"),
    OFFER("offer"),
    ANSWER("answer"),
    ICE_CANDIDATE("ice-candidate"),
    USER_MEDIA_CHANGED("user-media-changed"),
    USER_STARTED_SCREEN_SHARE("user-started-screen-share"),
    USER_STOPPED_SCREEN_SHARE("user-stopped-screen-share"),
    RECORDING_STARTED("recording-started"),
    RECORDING_STOPPED("recording-stopped"),
    PARTICIPANT_MUTED("participant-muted"),
    REMOVED_FROM_ROOM("removed-from-room"),
    HAND_RAISED("hand-raised"),
    NEW_MESSAGE("new-message"),
    NEW_FILE("new-file"),
    USER_CONNECTION_QUALITY("user-connection-quality"),
    ERROR("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() { return wireName; }
}
