package com.roomsignal.dto;

/**
 * Payload of the host moderation events (mute, remove).
 */
public class TargetParticipantRequest {
    private String targetUserId;

    public TargetParticipantRequest() {}

    public TargetParticipantRequest(String targetUserId) {
        this.targetUserId = targetUserId;
    }

    public String getTargetUserId() { return targetUserId; }
    public void setTargetUserId(String targetUserId) { this.targetUserId = targetUserId; }
}
