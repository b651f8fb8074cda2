package com.roomsignal.dto;

public class ConnectionQualityRequest {
    private String quality;
    private Object stats;

    public ConnectionQualityRequest() {}

    public ConnectionQualityRequest(String quality, Object stats) {
        this.quality = quality;
        this.stats = stats;
    }

    public String getQuality() { return quality; }
    public void setQuality(String quality) { this.quality = quality; }

    public Object getStats() { return stats; }
    public void setStats(Object stats) { this.stats = stats; }
}
