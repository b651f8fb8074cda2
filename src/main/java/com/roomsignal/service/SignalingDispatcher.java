package com.roomsignal.service;

import com.roomsignal.dto.AnswerRequest;
import com.roomsignal.dto.ChatMessageRequest;
import com.roomsignal.dto.ConnectionQualityRequest;
import com.roomsignal.dto.EventType;
import com.roomsignal.dto.FileShareRequest;
import com.roomsignal.dto.IceCandidateRequest;
import com.roomsignal.dto.JoinRoomRequest;
import com.roomsignal.dto.MediaToggleRequest;
import com.roomsignal.dto.OfferRequest;
import com.roomsignal.dto.RaiseHandRequest;
import com.roomsignal.dto.ScreenShareRequest;
import com.roomsignal.dto.SignalEvent;
import com.roomsignal.dto.TargetParticipantRequest;
import com.roomsignal.exception.ErrorType;
import com.roomsignal.exception.SignalingException;
import com.roomsignal.model.MediaKind;
import com.roomsignal.model.MediaState;
import com.roomsignal.model.Participant;
import com.roomsignal.model.Room;
import com.roomsignal.model.RoomMembership;
import com.roomsignal.ws.SessionGateway;
import com.roomsignal.ws.SessionOrigin;
import com.roomsignal.ws.SignalingSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Signaling protocol: turns inbound session events into changes of
 * {@link ConnectionRegistry} and {@link PeerConnectionTracker} and fans the
 * results out through the {@link SessionGateway}.
 * <p>
 * Events of one session run one at a time under that session's monitor. Store
 * changes that span both stores take the registry monitor, then the tracker
 * monitor. Failures become an {@code error} event for the sender only.
 */
@Service
public class SignalingDispatcher {
    private static final Logger log = LoggerFactory.getLogger(SignalingDispatcher.class);
    private static final int CLOSED_SESSION_MEMORY = 10_000;

    private final ConnectionRegistry registry;
    private final PeerConnectionTracker tracker;
    private final RateLimiter rateLimiter;
    private final SessionGateway gateway;
    private final Clock clock;

    private final Map<String, SignalingSession> sessions = new ConcurrentHashMap<>();
    /** Recently disconnected session ids; frames still in flight for them are dropped. */
    private final Set<String> closedSessions = Collections.synchronizedSet(Collections.newSetFromMap(
            new LinkedHashMap<String, Boolean>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > CLOSED_SESSION_MEMORY;
                }
            }));

    public SignalingDispatcher(ConnectionRegistry registry,
                               PeerConnectionTracker tracker,
                               RateLimiter rateLimiter,
                               SessionGateway gateway,
                               Clock clock) {
        this.registry = registry;
        this.tracker = tracker;
        this.rateLimiter = rateLimiter;
        this.gateway = gateway;
        this.clock = clock;
    }

    public void join(SessionOrigin origin, JoinRoomRequest request) {
        process(origin, "join-room", session -> {
            String roomId = requireText(request.getRoomId(), "roomId");
            String userName = requireText(request.getUserName(), "userName");
            String participantId = session.getParticipantId();

            Arrival arrival = atomically(() -> {
                RoomMembership membership = registry.joinRoom(roomId, participantId, userName,
                        session.getSessionId(), request.getPassword());
                RoomView left = membership.getPrevious()
                        .map(previous -> {
                            tracker.removeParticipant(previous.getRoom().getId(), participantId);
                            return new RoomView(previous.getRoom(), previous.getParticipant());
                        })
                        .orElse(null);
                tracker.addParticipant(roomId, participantId, session.getSessionId());
                session.bind(roomId);
                return new Arrival(new RoomView(membership.getRoom(), membership.getParticipant()), left);
            });

            if (arrival.left != null) {
                announceDeparture(participantId, arrival.left);
            }

            RoomView view = arrival.joined;
            gateway.send(participantId, SignalEvent.of(EventType.ROOM_JOINED)
                    .with("roomId", roomId)
                    .with("userId", participantId)
                    .with("user", view.user)
                    .with("roomInfo", view.roomInfo)
                    .with("existingUsers", view.existingUsers)
                    .with("iceServers", tracker.iceServers()));

            SignalEvent connected = SignalEvent.of(EventType.USER_CONNECTED)
                    .with("userId", participantId)
                    .with("user", view.user)
                    .with("roomInfo", view.roomInfo);
            view.others.forEach(other -> gateway.send(other, connected));

            log.info("User {} successfully joined room {}", participantId, roomId);
        });
    }

    public void leave(SessionOrigin origin) {
        process(origin, "leave-room", this::leave);
    }

    /**
     * Transport-level disconnect. Runs the same cleanup as an explicit leave;
     * a session that already left is a no-op.
     */
    public void disconnect(String sessionId) {
        closedSessions.add(sessionId);
        SignalingSession session = sessions.remove(sessionId);
        if (session == null) {
            return;
        }
        synchronized (session) {
            session.close();
            try {
                leave(session);
            } catch (RuntimeException e) {
                log.error("Cleanup after disconnect of session {} failed", sessionId, e);
            }
        }
        log.info("Client disconnected: {}", sessionId);
    }

    public void offer(SessionOrigin origin, OfferRequest request) {
        process(origin, "offer", session -> {
            String roomId = requireBound(session);
            String target = requireText(request.getTarget(), "target");
            Object offer = requirePresent(request.getOffer(), "offer");
            String sender = session.getParticipantId();

            String connectionId = tracker.handleOffer(roomId, sender, target, offer)
                    .orElseThrow(() -> new SignalingException(ErrorType.OFFER_FAILED, "Failed to process offer"));

            gateway.send(target, SignalEvent.of(EventType.OFFER)
                    .with("offer", offer)
                    .with("sender", sender)
                    .with("target", target)
                    .with("connectionId", connectionId));
            log.info("Offer forwarded: {} -> {}", sender, target);
        });
    }

    public void answer(SessionOrigin origin, AnswerRequest request) {
        process(origin, "answer", session -> {
            String roomId = requireBound(session);
            String target = requireText(request.getTarget(), "target");
            Object answer = requirePresent(request.getAnswer(), "answer");
            String sender = session.getParticipantId();

            if (!tracker.handleAnswer(roomId, sender, target, answer)) {
                throw new SignalingException(ErrorType.ANSWER_FAILED, "Failed to process answer");
            }

            gateway.send(target, SignalEvent.of(EventType.ANSWER)
                    .with("answer", answer)
                    .with("sender", sender)
                    .with("target", target));
            log.info("Answer forwarded: {} -> {}", sender, target);
        });
    }

    public void iceCandidate(SessionOrigin origin, IceCandidateRequest request) {
        process(origin, "ice-candidate", session -> {
            String roomId = requireBound(session);
            String target = requireText(request.getTarget(), "target");
            Object candidate = requirePresent(request.getCandidate(), "candidate");
            String sender = session.getParticipantId();

            if (!tracker.isTracked(roomId, target)) {
                throw new SignalingException(ErrorType.TARGET_NOT_FOUND, "Target user not found in room: " + target);
            }

            gateway.send(target, SignalEvent.of(EventType.ICE_CANDIDATE)
                    .with("candidate", candidate)
                    .with("sender", sender)
                    .with("target", target));
            log.debug("ICE candidate forwarded: {} -> {}", sender, target);
        });
    }

    public void toggleMedia(SessionOrigin origin, MediaKind kind, MediaToggleRequest request) {
        process(origin, "toggle-" + kind.getLabel(), session -> {
            boolean enabled = requirePresent(request.getEnabled(), "enabled");
            changeMedia(session, kind, enabled, (participant, mediaState) ->
                    SignalEvent.of(EventType.USER_MEDIA_CHANGED)
                            .with("userId", participant.getId())
                            .with("mediaType", kind.getLabel())
                            .with("enabled", enabled)
                            .with("mediaState", mediaState)
                            .with("user", participant.toInfo()));
        });
    }

    public void startScreenShare(SessionOrigin origin, ScreenShareRequest request) {
        process(origin, "start-screen-share", session -> {
            changeMedia(session, MediaKind.SCREEN, true, (participant, mediaState) ->
                    SignalEvent.of(EventType.USER_STARTED_SCREEN_SHARE)
                            .with("userId", participant.getId())
                            .with("userName", participant.getName())
                            .with("streamId", request != null ? request.getStreamId() : null)
                            .with("mediaState", mediaState)
                            .with("user", participant.toInfo()));
            log.info("Screen sharing started by {} in room {}", session.getParticipantId(), session.getRoomId());
        });
    }

    public void stopScreenShare(SessionOrigin origin) {
        process(origin, "stop-screen-share", session -> {
            changeMedia(session, MediaKind.SCREEN, false, (participant, mediaState) ->
                    SignalEvent.of(EventType.USER_STOPPED_SCREEN_SHARE)
                            .with("userId", participant.getId())
                            .with("userName", participant.getName())
                            .with("mediaState", mediaState)
                            .with("user", participant.toInfo()));
            log.info("Screen sharing stopped by {} in room {}", session.getParticipantId(), session.getRoomId());
        });
    }

    public void startRecording(SessionOrigin origin) {
        process(origin, "start-recording", session -> changeRecording(session, true));
    }

    public void stopRecording(SessionOrigin origin) {
        process(origin, "stop-recording", session -> changeRecording(session, false));
    }

    public void muteParticipant(SessionOrigin origin, TargetParticipantRequest request) {
        process(origin, "mute-participant", session -> {
            String roomId = requireBound(session);
            String targetId = requireText(request.getTargetUserId(), "targetUserId");

            Moderation moderation = atomically(() -> {
                Room room = currentRoom(session);
                Participant host = requireHost(room, session, "Only host can mute participants");
                Participant target = requireParticipant(room, targetId);
                registry.updateParticipantMedia(targetId, MediaKind.AUDIO, false);
                tracker.updateMediaState(roomId, targetId, MediaKind.AUDIO, false);
                return new Moderation(host, target, participantIds(room, null));
            });

            SignalEvent muted = SignalEvent.of(EventType.PARTICIPANT_MUTED)
                    .with("targetUserId", targetId)
                    .with("targetUserName", moderation.target.getName())
                    .with("mutedBy", moderation.host.getId())
                    .with("mutedByName", moderation.host.getName());
            moderation.audience.forEach(id -> gateway.send(id, muted));
            log.info("User {} muted by host {} in room {}", targetId, session.getParticipantId(), roomId);
        });
    }

    public void removeParticipant(SessionOrigin origin, TargetParticipantRequest request) {
        process(origin, "remove-participant", session -> {
            String roomId = requireBound(session);
            String targetId = requireText(request.getTargetUserId(), "targetUserId");
            if (targetId.equals(session.getParticipantId())) {
                throw SignalingException.invalidPayload("Host cannot remove itself; use leave-room");
            }

            Moderation moderation = atomically(() -> {
                Room room = currentRoom(session);
                Participant host = requireHost(room, session, "Only host can remove participants");
                Participant target = requireParticipant(room, targetId);
                return new Moderation(host, target, List.of());
            });

            String targetHandle = moderation.target.getSessionHandle();
            SignalingSession targetSession = sessions.get(targetHandle);
            if (targetSession == null || !roomId.equals(targetSession.getRoomId())) {
                throw new SignalingException(ErrorType.TARGET_NOT_FOUND, "Participant is not connected: " + targetId);
            }

            gateway.send(targetId, SignalEvent.of(EventType.REMOVED_FROM_ROOM)
                    .with("removedBy", moderation.host.getId())
                    .with("removedByName", moderation.host.getName())
                    .with("reason", "Removed by host"));
            leave(targetSession);
            gateway.disconnect(targetHandle);

            log.info("User {} removed by host {} from room {}", targetId, session.getParticipantId(), roomId);
        });
    }

    public void raiseHand(SessionOrigin origin, RaiseHandRequest request) {
        process(origin, "raise-hand", session -> {
            requireBound(session);
            boolean raised = requirePresent(request.getRaised(), "raised");

            RoomView view = atomically(() -> {
                Participant participant = registry.setHandRaised(session.getParticipantId(), raised)
                        .orElseThrow(SignalingException::notInRoom);
                return new RoomView(currentRoom(session), participant);
            });

            SignalEvent event = SignalEvent.of(EventType.HAND_RAISED)
                    .with("userId", session.getParticipantId())
                    .with("userName", view.participant.getName())
                    .with("raised", raised)
                    .with("timestamp", now());
            view.others.forEach(id -> gateway.send(id, event));
            log.info("Hand {} by {} in room {}", raised ? "raised" : "lowered",
                    session.getParticipantId(), session.getRoomId());
        });
    }

    public void sendMessage(SessionOrigin origin, ChatMessageRequest request) {
        process(origin, "send-message", session -> {
            requireBound(session);
            String text = requireText(request.getMessage(), "message");

            RoomView view = chatView(session);
            SignalEvent message = SignalEvent.of(EventType.NEW_MESSAGE)
                    .with("id", UUID.randomUUID().toString())
                    .with("userId", session.getParticipantId())
                    .with("userName", view.participant.getName())
                    .with("message", text)
                    .with("timestamp", now())
                    .with("type", request.getType() != null ? request.getType() : "text");
            view.everyone().forEach(id -> gateway.send(id, message));
            log.info("Message sent in room {} by {}", session.getRoomId(), session.getParticipantId());
        });
    }

    public void shareFile(SessionOrigin origin, FileShareRequest request) {
        process(origin, "share-file", session -> {
            requireBound(session);
            String fileName = requireText(request.getFileName(), "fileName");
            String fileUrl = requireText(request.getFileUrl(), "fileUrl");

            RoomView view = chatView(session);
            SignalEvent file = SignalEvent.of(EventType.NEW_FILE)
                    .with("id", UUID.randomUUID().toString())
                    .with("userId", session.getParticipantId())
                    .with("userName", view.participant.getName())
                    .with("fileName", fileName)
                    .with("fileSize", request.getFileSize())
                    .with("fileType", request.getFileType())
                    .with("fileUrl", fileUrl)
                    .with("timestamp", now())
                    .with("type", "file");
            view.everyone().forEach(id -> gateway.send(id, file));
            log.info("File shared in room {} by {}: {}", session.getRoomId(), session.getParticipantId(), fileName);
        });
    }

    public void connectionQuality(SessionOrigin origin, ConnectionQualityRequest request) {
        process(origin, "connection-quality", session -> {
            requireBound(session);
            String quality = requireText(request.getQuality(), "quality");

            RoomView view = atomically(() -> {
                Room room = currentRoom(session);
                return new RoomView(room, requireParticipant(room, session.getParticipantId()));
            });
            SignalEvent event = SignalEvent.of(EventType.USER_CONNECTION_QUALITY)
                    .with("userId", session.getParticipantId())
                    .with("quality", quality)
                    .with("stats", request.getStats());
            view.others.forEach(id -> gateway.send(id, event));
        });
    }

    /**
     * Reports a failure that happened before a handler could run, e.g. an
     * unreadable payload.
     */
    public void reportError(SessionOrigin origin, ErrorType type, String message) {
        log.warn("Rejected event from {}: {}", origin, message);
        gateway.send(origin.getParticipantId(), SignalEvent.error(type, message));
    }

    public Optional<SignalingSession> getSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public int sessionCount() {
        return sessions.size();
    }

    private void process(SessionOrigin origin, String eventName, Consumer<SignalingSession> handler) {
        SignalingSession session = sessions.computeIfAbsent(origin.getSessionId(), id -> new SignalingSession(origin));
        synchronized (session) {
            if (session.isClosed() || closedSessions.contains(origin.getSessionId())) {
                sessions.remove(origin.getSessionId(), session);
                log.debug("Dropped {} from closed session {}", eventName, origin.getSessionId());
                return;
            }
            try {
                String address = origin.getRemoteAddress() != null ? origin.getRemoteAddress() : "unknown";
                rateLimiter.check(RateLimiter.Policy.SIGNALING, address + "-" + eventName);
                log.debug("{} from {}", eventName, origin);
                handler.accept(session);
            } catch (SignalingException e) {
                log.warn("{} from {} rejected: {}", eventName, origin, e.getMessage());
                gateway.send(origin.getParticipantId(),
                        SignalEvent.error(e.getType(), e.getMessage()).with("event", eventName));
            } catch (RuntimeException e) {
                log.error("Failed to handle {} from {}", eventName, origin, e);
                gateway.send(origin.getParticipantId(),
                        SignalEvent.error(ErrorType.INTERNAL_ERROR, "Failed to process " + eventName)
                                .with("event", eventName));
            }
        }
    }

    private void leave(SignalingSession session) {
        String roomId = session.unbind();
        if (roomId == null) {
            return;
        }
        String participantId = session.getParticipantId();

        Optional<RoomView> departure = atomically(() -> {
            Optional<RoomMembership> left = registry.leaveRoom(participantId);
            tracker.removeParticipant(roomId, participantId);
            return left.map(membership -> new RoomView(membership.getRoom(), membership.getParticipant()));
        });

        departure.ifPresent(view -> announceDeparture(participantId, view));
        log.info("User {} left room {}", participantId, roomId);
    }

    private void announceDeparture(String participantId, RoomView view) {
        SignalEvent disconnected = SignalEvent.of(EventType.USER_DISCONNECTED)
                .with("userId", participantId)
                .with("user", view.user)
                .with("roomInfo", view.roomInfo);
        view.others.forEach(id -> gateway.send(id, disconnected));
    }

    private void changeMedia(SignalingSession session, MediaKind kind, boolean enabled,
                             MediaEventFactory eventFactory) {
        String roomId = requireBound(session);
        String participantId = session.getParticipantId();

        MediaChange change = atomically(() -> {
            Room room = currentRoom(session);
            if (kind == MediaKind.SCREEN && enabled && !room.getSettings().isAllowScreenShare()) {
                throw SignalingException.permissionDenied("Screen sharing is disabled in this room");
            }
            Optional<Participant> participant = registry.updateParticipantMedia(participantId, kind, enabled);
            Optional<MediaState> mediaState = tracker.updateMediaState(roomId, participantId, kind, enabled);
            if (!participant.isPresent() || !mediaState.isPresent()) {
                throw SignalingException.notInRoom();
            }
            return new MediaChange(participant.get(), mediaState.get().toMap(),
                    participantIds(room, participantId));
        });

        SignalEvent event = eventFactory.create(change.participant, change.mediaState);
        change.others.forEach(id -> gateway.send(id, event));
    }

    private void changeRecording(SignalingSession session, boolean enabled) {
        String roomId = requireBound(session);

        Moderation moderation = atomically(() -> {
            Room room = currentRoom(session);
            Participant host = requireHost(room, session,
                    "Only host can " + (enabled ? "start" : "stop") + " recording");
            registry.setRecording(roomId, enabled);
            return new Moderation(host, host, participantIds(room, host.getId()));
        });

        SignalEvent event = SignalEvent.of(enabled ? EventType.RECORDING_STARTED : EventType.RECORDING_STOPPED)
                .with(enabled ? "startedBy" : "stoppedBy", moderation.host.getId())
                .with("userName", moderation.host.getName())
                .with("timestamp", now());
        moderation.audience.forEach(id -> gateway.send(id, event));
        log.info("Recording {} in room {} by {}", enabled ? "started" : "stopped", roomId, moderation.host.getId());
    }

    private RoomView chatView(SignalingSession session) {
        return atomically(() -> {
            Room room = currentRoom(session);
            if (!room.getSettings().isAllowChat()) {
                throw SignalingException.permissionDenied("Chat is disabled in this room");
            }
            return new RoomView(room, requireParticipant(room, session.getParticipantId()));
        });
    }

    /** Runs {@code action} while holding both store monitors, registry first. */
    private <T> T atomically(Supplier<T> action) {
        synchronized (registry) {
            synchronized (tracker) {
                return action.get();
            }
        }
    }

    private Room currentRoom(SignalingSession session) {
        String roomId = requireBound(session);
        return registry.getRoom(roomId).orElseThrow(() -> SignalingException.roomNotFound(roomId));
    }

    private static String requireBound(SignalingSession session) {
        String roomId = session.getRoomId();
        if (roomId == null) {
            throw SignalingException.notInRoom();
        }
        return roomId;
    }

    private static Participant requireHost(Room room, SignalingSession session, String message) {
        Participant participant = room.getParticipant(session.getParticipantId())
                .orElseThrow(SignalingException::notInRoom);
        if (!participant.isHost()) {
            throw SignalingException.permissionDenied(message);
        }
        return participant;
    }

    private static Participant requireParticipant(Room room, String participantId) {
        return room.getParticipant(participantId)
                .orElseThrow(() -> new SignalingException(ErrorType.TARGET_NOT_FOUND,
                        "User not found in room: " + participantId));
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw SignalingException.invalidPayload("Missing required field: " + field);
        }
        return value;
    }

    private static <T> T requirePresent(T value, String field) {
        if (value == null) {
            throw SignalingException.invalidPayload("Missing required field: " + field);
        }
        return value;
    }

    private static List<String> participantIds(Room room, String excluded) {
        return room.getParticipants().stream()
                .map(Participant::getId)
                .filter(id -> !id.equals(excluded))
                .collect(Collectors.toList());
    }

    private String now() {
        return LocalDateTime.now(clock).toString();
    }

    @FunctionalInterface
    private interface MediaEventFactory {
        SignalEvent create(Participant participant, Map<String, Object> mediaState);
    }

    /**
     * Snapshot of a room taken while the stores are locked, so events can be sent
     * after the locks are released.
     */
    private static final class RoomView {
        final Participant participant;
        final Map<String, Object> user;
        final Map<String, Object> roomInfo;
        final List<Map<String, Object>> existingUsers = new ArrayList<>();
        final List<String> others;

        RoomView(Room room, Participant participant) {
            this.participant = participant;
            this.user = participant.toInfo();
            this.roomInfo = room.toInfo();
            this.others = participantIds(room, participant.getId());
            for (Participant other : room.getParticipants()) {
                if (!other.getId().equals(participant.getId())) {
                    Map<String, Object> info = other.toInfo();
                    info.put("mediaState", other.getMediaState().toMap());
                    existingUsers.add(info);
                }
            }
        }

        List<String> everyone() {
            List<String> all = new ArrayList<>(others);
            all.add(participant.getId());
            return all;
        }
    }

    private static final class Arrival {
        final RoomView joined;
        final RoomView left;

        Arrival(RoomView joined, RoomView left) {
            this.joined = joined;
            this.left = left;
        }
    }

    private static final class MediaChange {
        final Participant participant;
        final Map<String, Object> mediaState;
        final List<String> others;

        MediaChange(Participant participant, Map<String, Object> mediaState, List<String> others) {
            this.participant = participant;
            this.mediaState = mediaState;
            this.others = others;
        }
    }

    private static final class Moderation {
        final Participant host;
        final Participant target;
        final List<String> audience;

        Moderation(Participant host, Participant target, List<String> audience) {
            this.host = host;
            this.target = target;
            this.audience = audience;
        }
    }
}
