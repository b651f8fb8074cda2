package com.roomsignal.model;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

public class Participant {
    private final String id;
    private final String name;
    private final String sessionHandle;
    private final LocalDateTime joinedAt;
    private final MediaState mediaState;
    private volatile boolean handRaised;
    private volatile ParticipantRole role = ParticipantRole.PARTICIPANT;

    public Participant(String id, String name, String sessionHandle,
                       LocalDateTime joinedAt, MediaState mediaState) {
        this.id = id;
        this.name = name;
        this.sessionHandle = sessionHandle;
        this.joinedAt = joinedAt;
        this.mediaState = mediaState;
    }

    public String getId() { return id; }

    public String getName() { return name; }

    public String getSessionHandle() { return sessionHandle; }

    public LocalDateTime getJoinedAt() { return joinedAt; }

    public MediaState getMediaState() { return mediaState; }

    public boolean isAudioEnabled() { return mediaState.isAudio(); }
    public boolean isVideoEnabled() { return mediaState.isVideo(); }
    public boolean isScreenSharing() { return mediaState.isScreen(); }

    public boolean isHandRaised() { return handRaised; }
    public void setHandRaised(boolean handRaised) { this.handRaised = handRaised; }

    public ParticipantRole getRole() { return role; }
    public void setRole(ParticipantRole role) { this.role = role; }

    public boolean isHost() { return role == ParticipantRole.HOST; }

    public Map<String, Object> toInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("userId", id);
        info.put("name", name);
        info.put("role", role.getLabel());
        info.put("isAudioEnabled", isAudioEnabled());
        info.put("isVideoEnabled", isVideoEnabled());
        info.put("isScreenSharing", isScreenSharing());
        info.put("isHandRaised", handRaised);
        info.put("joinedAt", joinedAt.toString());
        return info;
    }
}
