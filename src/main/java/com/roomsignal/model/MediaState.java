package com.roomsignal.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audio/video/screen flags of one participant. A single instance per participant
 * lives in {@link com.roomsignal.service.MediaStateTable}; rooms and peer entries
 * hold references to it, never copies.
 */
public class MediaState {
    private volatile boolean audio = true;
    private volatile boolean video = true;
    private volatile boolean screen;

    public boolean isAudio() { return audio; }
    public boolean isVideo() { return video; }
    public boolean isScreen() { return screen; }

    public boolean get(MediaKind kind) {
        switch (kind) {
            case AUDIO: return audio;
            case VIDEO: return video;
            default: return screen;
        }
    }

    public void set(MediaKind kind, boolean enabled) {
        switch (kind) {
            case AUDIO:
                audio = enabled;
                break;
            case VIDEO:
                video = enabled;
                break;
            case SCREEN:
                screen = enabled;
                break;
        }
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("audio", audio);
        map.put("video", video);
        map.put("screen", screen);
        return map;
    }
}
