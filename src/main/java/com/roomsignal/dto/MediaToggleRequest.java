package com.roomsignal.dto;

public class MediaToggleRequest {
    private Boolean enabled;

    public MediaToggleRequest() {}

    public MediaToggleRequest(Boolean enabled) {
        this.enabled = enabled;
    }

    public Boolean getEnabled() { return enabled; }
    public void setEnabled(Boolean enabled) { this.enabled = enabled; }
}
