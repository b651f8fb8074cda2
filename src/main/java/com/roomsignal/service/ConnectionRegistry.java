package com.roomsignal.service;

import com.roomsignal.config.SignalingProperties;
import com.roomsignal.dto.RoomSettingsRequest;
import com.roomsignal.exception.ErrorType;
import com.roomsignal.exception.SignalingException;
import com.roomsignal.model.MediaKind;
import com.roomsignal.model.MediaState;
import com.roomsignal.model.Participant;
import com.roomsignal.model.Room;
import com.roomsignal.model.RoomMembership;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory room directory plus the participant → room index.
 * <p>
 * Every public method synchronizes on this instance. Callers that must change
 * this registry and {@link PeerConnectionTracker} as one step lock the registry
 * first, then the tracker.
 */
@Service
public class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, Room> rooms = new HashMap<>();
    private final Map<String, String> participantRooms = new HashMap<>();

    private final MediaStateTable mediaStates;
    private final SignalingProperties properties;
    private final Clock clock;

    public ConnectionRegistry(MediaStateTable mediaStates, SignalingProperties properties, Clock clock) {
        this.mediaStates = mediaStates;
        this.properties = properties;
        this.clock = clock;
    }

    public synchronized Room createRoom(String createdBy, RoomSettingsRequest settings) {
        Room room = new Room(generateRoomId(), createdBy, LocalDateTime.now(clock));
        room.setMaxParticipants(properties.getDefaultRoomCapacity());

        if (settings != null) {
            if (settings.getMaxUsers() != null && settings.getMaxUsers() > 0) {
                room.setMaxParticipants(settings.getMaxUsers());
            }
            if (Boolean.TRUE.equals(settings.getRequirePassword())) {
                room.getSettings().setRequirePassword(true);
                room.getSettings().setPassword(settings.getPassword());
            }
            if (settings.getAllowScreenShare() != null) {
                room.getSettings().setAllowScreenShare(settings.getAllowScreenShare());
            }
            if (settings.getAllowChat() != null) {
                room.getSettings().setAllowChat(settings.getAllowChat());
            }
        }

        rooms.put(room.getId(), room);
        log.info("Room created: {} by {} (capacity {})",
                room.getId(), createdBy != null ? createdBy : "anonymous", room.getMaxParticipants());
        return room;
    }

    public synchronized Optional<Room> getRoom(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    /** Snapshot of the room for the outside world. */
    public synchronized Optional<Map<String, Object>> roomInfo(String roomId) {
        return getRoom(roomId).map(Room::toInfo);
    }

    public synchronized Optional<Room> getRoomOf(String participantId) {
        String roomId = participantRooms.get(participantId);
        return roomId != null ? getRoom(roomId) : Optional.empty();
    }

    /**
     * Adds the participant to the room, leaving whatever room it was in before.
     * Every check on the new room runs first, so a refused join leaves the
     * current membership untouched.
     *
     * @return the new membership; {@link RoomMembership#getPrevious()} holds the
     *         room that was left, if any
     */
    public synchronized RoomMembership joinRoom(String roomId, String participantId,
                                                String name, String sessionHandle, String password) {
        Room room = rooms.get(roomId);
        if (room == null) {
            throw SignalingException.roomNotFound(roomId);
        }
        if (!room.isActive()) {
            throw new SignalingException(ErrorType.ROOM_INACTIVE, "Room is not active");
        }
        if (!room.validatePassword(password)) {
            throw new SignalingException(ErrorType.INVALID_PASSWORD, "Invalid room password");
        }
        if (room.isFull() && !roomId.equals(participantRooms.get(participantId))) {
            throw room.roomFull();
        }

        RoomMembership previous = leaveRoom(participantId).orElse(null);
        // re-joining the same room as its last member deletes it on the way out
        rooms.putIfAbsent(roomId, room);

        String displayName = name != null && !name.isBlank()
                ? name
                : "User " + participantId.substring(0, Math.min(8, participantId.length()));
        MediaState mediaState = mediaStates.register(participantId);
        Participant participant = new Participant(participantId, displayName, sessionHandle,
                LocalDateTime.now(clock), mediaState);
        room.addParticipant(participant);
        participantRooms.put(participantId, roomId);

        log.info("User {} joined room {} as {}", participantId, roomId, participant.getRole().getLabel());
        return new RoomMembership(room, participant, previous);
    }

    public synchronized Optional<RoomMembership> leaveRoom(String participantId) {
        String roomId = participantRooms.remove(participantId);
        if (roomId == null) {
            return Optional.empty();
        }
        Room room = rooms.get(roomId);
        if (room == null) {
            return Optional.empty();
        }

        Optional<Participant> removed = room.removeParticipant(participantId);
        mediaStates.remove(participantId);
        log.info("User {} left room {}", participantId, roomId);

        if (room.isEmpty()) {
            rooms.remove(roomId);
            log.info("Room {} deleted (empty)", roomId);
        } else if (removed.map(Participant::isHost).orElse(false)) {
            room.getHost().ifPresent(host ->
                    log.info("Host of room {} passed to {}", roomId, host.getId()));
        }

        return removed.map(participant -> new RoomMembership(room, participant));
    }

    public synchronized Optional<Participant> updateParticipantMedia(String participantId,
                                                                    MediaKind kind, boolean enabled) {
        Optional<Participant> participant = getRoomOf(participantId)
                .flatMap(room -> room.getParticipant(participantId));
        participant.ifPresent(p -> p.getMediaState().set(kind, enabled));
        return participant;
    }

    public synchronized Optional<Participant> setHandRaised(String participantId, boolean raised) {
        Optional<Participant> participant = getRoomOf(participantId)
                .flatMap(room -> room.getParticipant(participantId));
        participant.ifPresent(p -> p.setHandRaised(raised));
        return participant;
    }

    public synchronized void setRecording(String roomId, boolean enabled) {
        Room room = rooms.get(roomId);
        if (room == null) {
            throw SignalingException.roomNotFound(roomId);
        }
        room.getSettings().setRecordingEnabled(enabled);
    }

    /**
     * Drops rooms that ended up empty without going through {@link #leaveRoom}.
     * Rooms younger than the configured grace period are kept, so a room created
     * over HTTP survives until its first participant arrives.
     *
     * @return number of rooms removed
     */
    public synchronized int cleanupEmptyRooms() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getEmptyRoomGracePeriod());
        List<String> emptyRooms = new ArrayList<>();
        for (Room room : rooms.values()) {
            if (room.isEmpty() && room.getCreatedAt().isBefore(cutoff)) {
                emptyRooms.add(room.getId());
            }
        }

        emptyRooms.forEach(roomId -> {
            rooms.remove(roomId);
            log.info("Cleaned up empty room: {}", roomId);
        });
        if (!emptyRooms.isEmpty()) {
            log.info("Cleaned up {} empty rooms", emptyRooms.size());
        }
        return emptyRooms.size();
    }

    public synchronized List<Map<String, Object>> allRooms() {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Room room : rooms.values()) {
            result.add(room.toInfo());
        }
        return result;
    }

    public synchronized Map<String, Object> stats() {
        List<Map<String, Object>> roomDetails = new ArrayList<>();
        for (Room room : rooms.values()) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("roomId", room.getId());
            detail.put("userCount", room.size());
            detail.put("createdAt", room.getCreatedAt().toString());
            roomDetails.add(detail);
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalRooms", rooms.size());
        stats.put("totalUsers", participantRooms.size());
        stats.put("roomDetails", roomDetails);
        return stats;
    }

    private String generateRoomId() {
        return UUID.randomUUID().toString();
    }
}
