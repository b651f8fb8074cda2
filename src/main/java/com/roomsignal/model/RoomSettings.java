package com.roomsignal.model;

import java.util.LinkedHashMap;
import java.util.Map;

public class RoomSettings {
    private boolean allowScreenShare = true;
    private boolean allowChat = true;
    private boolean requirePassword;
    private String password;
    private boolean recordingEnabled;

    public RoomSettings() {}

    public boolean isAllowScreenShare() { return allowScreenShare; }
    public void setAllowScreenShare(boolean allowScreenShare) { this.allowScreenShare = allowScreenShare; }

    public boolean isAllowChat() { return allowChat; }
    public void setAllowChat(boolean allowChat) { this.allowChat = allowChat; }

    public boolean isRequirePassword() { return requirePassword; }
    public void setRequirePassword(boolean requirePassword) { this.requirePassword = requirePassword; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public boolean isRecordingEnabled() { return recordingEnabled; }
    public void setRecordingEnabled(boolean recordingEnabled) { this.recordingEnabled = recordingEnabled; }

    /** Public view; the password itself is never exposed. */
    public Map<String, Object> toInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("allowScreenShare", allowScreenShare);
        info.put("allowChat", allowChat);
        info.put("requirePassword", requirePassword);
        info.put("recordingEnabled", recordingEnabled);
        return info;
    }
}
