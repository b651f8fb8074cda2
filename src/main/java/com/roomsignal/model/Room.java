package com.roomsignal.model;

import com.roomsignal.exception.ErrorType;
import com.roomsignal.exception.SignalingException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A signaling room. Participants are kept in join order: the earliest remaining
 * participant inherits the host role when the host leaves.
 * Not thread-safe on its own; guarded by {@link com.roomsignal.service.ConnectionRegistry}.
 */
public class Room {
    public static final int DEFAULT_CAPACITY = 10;
    public static final int MAX_CAPACITY = 50;

    private final String id;
    private final String createdBy;
    private final LocalDateTime createdAt;
    private boolean active = true;
    private int maxParticipants = DEFAULT_CAPACITY;
    private final RoomSettings settings = new RoomSettings();

    private final Map<String, Participant> participants = new LinkedHashMap<>();

    public Room(String id, String createdBy, LocalDateTime createdAt) {
        this.id = id;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }

    public String getCreatedBy() { return createdBy; }

    public LocalDateTime getCreatedAt() { return createdAt; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public int getMaxParticipants() { return maxParticipants; }
    public void setMaxParticipants(int maxParticipants) {
        this.maxParticipants = Math.min(maxParticipants, MAX_CAPACITY);
    }

    public RoomSettings getSettings() { return settings; }

    public Optional<Participant> getParticipant(String participantId) {
        return Optional.ofNullable(participants.get(participantId));
    }

    public Collection<Participant> getParticipants() {
        return Collections.unmodifiableCollection(participants.values());
    }

    public int size() { return participants.size(); }

    public boolean isEmpty() { return participants.isEmpty(); }

    public boolean isFull() { return participants.size() >= maxParticipants; }

    public Participant addParticipant(Participant participant) {
        if (isFull()) {
            throw roomFull();
        }
        if (participants.containsKey(participant.getId())) {
            throw new SignalingException(ErrorType.DUPLICATE_PARTICIPANT, "User already in room");
        }
        participant.setRole(participants.isEmpty() ? ParticipantRole.HOST : ParticipantRole.PARTICIPANT);
        participants.put(participant.getId(), participant);
        return participant;
    }

    public SignalingException roomFull() {
        return new SignalingException(ErrorType.ROOM_FULL,
                "Room is full. Maximum " + maxParticipants + " users allowed.");
    }

    /**
     * Removes the participant and, if it was the host, promotes the earliest
     * remaining participant.
     */
    public Optional<Participant> removeParticipant(String participantId) {
        Participant removed = participants.remove(participantId);
        if (removed == null) {
            return Optional.empty();
        }
        if (removed.isHost() && !participants.isEmpty()) {
            participants.values().iterator().next().setRole(ParticipantRole.HOST);
        }
        return Optional.of(removed);
    }

    public Optional<Participant> getHost() {
        return participants.values().stream().filter(Participant::isHost).findFirst();
    }

    public boolean validatePassword(String password) {
        if (!settings.isRequirePassword()) return true;
        return Objects.equals(settings.getPassword(), password);
    }

    public Map<String, Object> toInfo() {
        List<Map<String, Object>> users = new ArrayList<>();
        for (Participant participant : participants.values()) {
            users.add(participant.toInfo());
        }

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("roomId", id);
        info.put("createdBy", createdBy);
        info.put("userCount", participants.size());
        info.put("maxUsers", maxParticipants);
        info.put("isActive", active);
        info.put("createdAt", createdAt.toString());
        info.put("settings", settings.toInfo());
        info.put("users", users);
        return info;
    }
}
