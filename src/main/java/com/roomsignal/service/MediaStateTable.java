package com.roomsignal.service;

import com.roomsignal.model.MediaState;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Canonical media flags keyed by participant id. {@link ConnectionRegistry} and
 * {@link PeerConnectionTracker} both hold the instance handed out here, so a
 * toggle is visible through either store.
 */
@Service
public class MediaStateTable {
    private final Map<String, MediaState> states = new ConcurrentHashMap<>();

    /** Starts a fresh state for a participant that is joining a room. */
    public MediaState register(String participantId) {
        MediaState state = new MediaState();
        states.put(participantId, state);
        return state;
    }

    public MediaState getOrRegister(String participantId) {
        return states.computeIfAbsent(participantId, k -> new MediaState());
    }

    public Optional<MediaState> get(String participantId) {
        return Optional.ofNullable(states.get(participantId));
    }

    public void remove(String participantId) {
        states.remove(participantId);
    }

    public int size() {
        return states.size();
    }
}
