package com.roomsignal.dto;

public class ScreenShareRequest {
    private String streamId;

    public ScreenShareRequest() {}

    public ScreenShareRequest(String streamId) {
        this.streamId = streamId;
    }

    public String getStreamId() { return streamId; }
    public void setStreamId(String streamId) { this.streamId = streamId; }
}
