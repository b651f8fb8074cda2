package com.roomsignal.service;

import com.roomsignal.config.SignalingProperties;
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
import com.roomsignal.dto.RoomSettingsRequest;
import com.roomsignal.dto.ScreenShareRequest;
import com.roomsignal.dto.SignalEvent;
import com.roomsignal.dto.TargetParticipantRequest;
import com.roomsignal.model.MediaKind;
import com.roomsignal.model.Room;
import com.roomsignal.support.MutableClock;
import com.roomsignal.support.RecordingSessionGateway;
import com.roomsignal.ws.SessionOrigin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SignalingDispatcherTest {

    private final SessionOrigin alice = new SessionOrigin("s-A", "A", "10.0.0.1");
    private final SessionOrigin bob = new SessionOrigin("s-B", "B", "10.0.0.2");
    private final SessionOrigin carol = new SessionOrigin("s-C", "C", "10.0.0.3");

    private ConnectionRegistry registry;
    private PeerConnectionTracker tracker;
    private RecordingSessionGateway gateway;
    private SignalingDispatcher dispatcher;
    private Room room;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        SignalingProperties properties = new SignalingProperties();
        MediaStateTable mediaStates = new MediaStateTable();
        registry = new ConnectionRegistry(mediaStates, properties, clock);
        tracker = new PeerConnectionTracker(mediaStates, properties, clock);
        gateway = new RecordingSessionGateway();
        dispatcher = new SignalingDispatcher(registry, tracker, new RateLimiter(properties, clock), gateway, clock);
        room = registry.createRoom("host", null);
    }

    @Test
    void joinAnnouncesNewcomerToOthers() {
        join(alice, "Alice");
        join(bob, "Bob");

        SignalEvent joined = single(gateway.eventsFor("B", EventType.ROOM_JOINED));
        assertThat(joined.get("roomId")).isEqualTo(room.getId());
        assertThat(joined.get("userId")).isEqualTo("B");
        assertThat((List<?>) joined.get("existingUsers")).hasSize(1);
        assertThat((List<?>) joined.get("iceServers")).hasSize(3);

        SignalEvent connected = single(gateway.eventsFor("A", EventType.USER_CONNECTED));
        assertThat(connected.get("userId")).isEqualTo("B");
        assertThat(gateway.eventsFor("B", EventType.USER_CONNECTED)).isEmpty();
        assertThat(tracker.isTracked(room.getId(), "B")).isTrue();
    }

    @Test
    void joinToFullRoomReportsError() {
        RoomSettingsRequest settings = new RoomSettingsRequest();
        settings.setMaxUsers(2);
        room = registry.createRoom("host", settings);
        join(alice, "Alice");
        join(bob, "Bob");

        join(carol, "Carol");

        assertError("C", "room-full", "join-room");
        assertThat(room.size()).isEqualTo(2);
        assertThat(dispatcher.getSession("s-C")).hasValueSatisfying(s -> assertThat(s.isBound()).isFalse());
    }

    @Test
    void eventBeforeJoinIsRejected() {
        dispatcher.offer(alice, new OfferRequest("B", Map.of("sdp", "x")));

        assertError("A", "not-in-room", "offer");
        assertThat(gateway.eventsFor("B")).isEmpty();
    }

    @Test
    void offerAndAnswerAreRelayed() {
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.offer(alice, new OfferRequest("B", Map.of("sdp", "offer")));
        SignalEvent offer = single(gateway.eventsFor("B", EventType.OFFER));
        assertThat(offer.get("sender")).isEqualTo("A");
        assertThat(offer.get("connectionId")).isEqualTo("A-B");

        dispatcher.answer(bob, new AnswerRequest("A", Map.of("sdp", "answer")));
        SignalEvent answer = single(gateway.eventsFor("A", EventType.ANSWER));
        assertThat(answer.get("sender")).isEqualTo("B");
        assertThat(tracker.pendingOfferCount()).isZero();
    }

    @Test
    void answerWithoutOfferFails() {
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.answer(bob, new AnswerRequest("A", Map.of("sdp", "answer")));

        assertError("B", "answer-failed", "answer");
        assertThat(gateway.eventsFor("A", EventType.ANSWER)).isEmpty();
    }

    @Test
    void iceCandidateToUnknownTargetFails() {
        join(alice, "Alice");

        dispatcher.iceCandidate(alice, new IceCandidateRequest("ghost", Map.of("candidate", "c")));

        assertError("A", "target-not-found", "ice-candidate");
    }

    @Test
    void nonHostCannotStartRecording() {
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.startRecording(bob);

        assertError("B", "permission-denied", "start-recording");
        assertThat(room.getSettings().isRecordingEnabled()).isFalse();
        assertThat(gateway.recipientsOf(EventType.RECORDING_STARTED)).isEmpty();
    }

    @Test
    void hostStartsRecordingForOthers() {
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.startRecording(alice);

        assertThat(room.getSettings().isRecordingEnabled()).isTrue();
        assertThat(gateway.recipientsOf(EventType.RECORDING_STARTED)).containsExactly("B");
        assertThat(single(gateway.eventsFor("B", EventType.RECORDING_STARTED)).get("startedBy")).isEqualTo("A");
    }

    @Test
    void hostMuteReachesEveryone() {
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.muteParticipant(alice, new TargetParticipantRequest("B"));

        assertThat(gateway.recipientsOf(EventType.PARTICIPANT_MUTED)).containsExactlyInAnyOrder("A", "B");
        assertThat(room.getParticipant("B")).hasValueSatisfying(p -> assertThat(p.isAudioEnabled()).isFalse());
    }

    @Test
    void hostRemovesParticipant() {
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.removeParticipant(alice, new TargetParticipantRequest("B"));

        assertThat(single(gateway.eventsFor("B", EventType.REMOVED_FROM_ROOM)).get("reason"))
                .isEqualTo("Removed by host");
        assertThat(gateway.getDisconnected()).containsExactly("s-B");
        assertThat(room.getParticipant("B")).isEmpty();
        assertThat(tracker.isTracked(room.getId(), "B")).isFalse();

        // the transport disconnect that follows is a no-op
        dispatcher.disconnect("s-B");
        assertThat(gateway.eventsFor("A", EventType.USER_DISCONNECTED)).hasSize(1);
    }

    @Test
    void participantCannotRemoveOthers() {
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.removeParticipant(bob, new TargetParticipantRequest("A"));

        assertError("B", "permission-denied", "remove-participant");
        assertThat(gateway.getDisconnected()).isEmpty();
    }

    @Test
    void leaveThenDisconnectCleansUpOnce() {
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.leave(bob);
        dispatcher.disconnect("s-B");

        assertThat(gateway.eventsFor("A", EventType.USER_DISCONNECTED)).hasSize(1);
        assertThat(room.getParticipant("B")).isEmpty();
        assertThat(dispatcher.getSession("s-B")).isEmpty();
    }

    @Test
    void concurrentLeaveAndDisconnectCleanUpOnce() throws Exception {
        join(alice, "Alice");
        join(bob, "Bob");

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            pool.submit(() -> {
                start.await();
                dispatcher.leave(bob);
                return null;
            });
            pool.submit(() -> {
                start.await();
                dispatcher.disconnect("s-B");
                return null;
            });
            start.countDown();
        } finally {
            pool.shutdown();
        }
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(gateway.eventsFor("A", EventType.USER_DISCONNECTED)).hasSize(1);
        assertThat(room.getParticipant("B")).isEmpty();
        assertThat(tracker.isTracked(room.getId(), "B")).isFalse();
    }

    @Test
    void lastLeaverRemovesRoom() {
        join(alice, "Alice");

        dispatcher.disconnect("s-A");

        assertThat(registry.getRoom(room.getId())).isEmpty();
        assertThat(tracker.roomSnapshot(room.getId())).isEmpty();
    }

    @Test
    void chatMessageGoesToEveryoneIncludingSender() {
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.sendMessage(alice, new ChatMessageRequest("hello", null));

        assertThat(gateway.recipientsOf(EventType.NEW_MESSAGE)).containsExactlyInAnyOrder("A", "B");
        SignalEvent message = single(gateway.eventsFor("B", EventType.NEW_MESSAGE));
        assertThat(message.get("message")).isEqualTo("hello");
        assertThat(message.get("type")).isEqualTo("text");
        assertThat(message.get("userName")).isEqualTo("Alice");
    }

    @Test
    void chatIsRefusedWhenDisabled() {
        RoomSettingsRequest settings = new RoomSettingsRequest();
        settings.setAllowChat(false);
        room = registry.createRoom("host", settings);
        join(alice, "Alice");

        dispatcher.sendMessage(alice, new ChatMessageRequest("hello", null));

        assertError("A", "permission-denied", "send-message");
        assertThat(gateway.recipientsOf(EventType.NEW_MESSAGE)).isEmpty();
    }

    @Test
    void mediaToggleUpdatesBothStoresAndNotifiesOthers() {
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.toggleMedia(alice, MediaKind.AUDIO, new MediaToggleRequest(false));

        SignalEvent changed = single(gateway.eventsFor("B", EventType.USER_MEDIA_CHANGED));
        assertThat(changed.get("mediaType")).isEqualTo("audio");
        assertThat(changed.get("enabled")).isEqualTo(false);
        assertThat(gateway.eventsFor("A", EventType.USER_MEDIA_CHANGED)).isEmpty();
        assertThat(room.getParticipant("A")).hasValueSatisfying(p -> assertThat(p.isAudioEnabled()).isFalse());
    }

    @Test
    void raisedHandIsBroadcastToOthers() {
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.raiseHand(bob, new RaiseHandRequest(true));

        assertThat(gateway.recipientsOf(EventType.HAND_RAISED)).containsExactly("A");
        assertThat(room.getParticipant("B")).hasValueSatisfying(p -> assertThat(p.isHandRaised()).isTrue());
    }

    @Test
    void missingFieldIsInvalidPayload() {
        join(alice, "Alice");

        dispatcher.sendMessage(alice, new ChatMessageRequest("  ", null));

        assertError("A", "invalid-payload", "send-message");
    }

    @Test
    void floodOfOneEventTypeIsRateLimited() {
        join(alice, "Alice");

        for (int i = 0; i < 51; i++) {
            dispatcher.raiseHand(alice, new RaiseHandRequest(i % 2 == 0));
        }

        assertError("A", "rate-limited", "raise-hand");
    }

    @Test
    void refusedJoinKeepsCurrentRoom() {
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.join(alice, new JoinRoomRequest("no-such-room", "Alice", null));

        assertError("A", "room-not-found", "join-room");
        assertThat(room.getParticipant("A")).hasValueSatisfying(p -> assertThat(p.isHost()).isTrue());
        assertThat(registry.getRoomOf("A")).map(Room::getId).contains(room.getId());
        assertThat(tracker.isTracked(room.getId(), "A")).isTrue();
        assertThat(dispatcher.getSession("s-A")).hasValueSatisfying(s ->
                assertThat(s.getRoomId()).isEqualTo(room.getId()));
        assertThat(gateway.eventsFor("B", EventType.USER_DISCONNECTED)).isEmpty();
    }

    @Test
    void refusedJoinIntoFullOrProtectedRoomKeepsCurrentRoom() {
        RoomSettingsRequest settings = new RoomSettingsRequest();
        settings.setMaxUsers(1);
        Room full = registry.createRoom("host", settings);
        settings = new RoomSettingsRequest();
        settings.setRequirePassword(true);
        settings.setPassword("secret");
        Room locked = registry.createRoom("host", settings);
        dispatcher.join(carol, new JoinRoomRequest(full.getId(), "Carol", null));
        join(alice, "Alice");

        dispatcher.join(alice, new JoinRoomRequest(full.getId(), "Alice", null));
        assertError("A", "room-full", "join-room");

        dispatcher.join(alice, new JoinRoomRequest(locked.getId(), "Alice", "wrong"));
        assertError("A", "invalid-password", "join-room");

        assertThat(registry.getRoomOf("A")).map(Room::getId).contains(room.getId());
        assertThat(tracker.isTracked(room.getId(), "A")).isTrue();
    }

    @Test
    void switchingRoomsCleansUpOldRoom() {
        Room other = registry.createRoom("host", null);
        join(alice, "Alice");
        join(bob, "Bob");
        tracker.handleOffer(room.getId(), "A", "B", Map.of("sdp", "offer"));

        dispatcher.join(alice, new JoinRoomRequest(other.getId(), "Alice", null));

        assertThat(single(gateway.eventsFor("B", EventType.USER_DISCONNECTED)).get("userId")).isEqualTo("A");
        assertThat(tracker.isTracked(room.getId(), "A")).isFalse();
        assertThat(tracker.findLink(room.getId(), "A", "B")).isEmpty();
        assertThat(tracker.pendingOfferCount()).isZero();
        assertThat(tracker.isTracked(other.getId(), "A")).isTrue();
        assertThat(room.getParticipant("B")).hasValueSatisfying(p -> assertThat(p.isHost()).isTrue());
        assertThat(registry.getRoomOf("A")).map(Room::getId).contains(other.getId());
        assertThat(gateway.eventsFor("A", EventType.ROOM_JOINED)).hasSize(2);
    }

    @Test
    void eventsAfterDisconnectAreDropped() {
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.disconnect("s-B");
        join(bob, "Bob");
        dispatcher.disconnect("s-C");
        join(carol, "Carol");

        assertThat(room.getParticipant("B")).isEmpty();
        assertThat(room.getParticipant("C")).isEmpty();
        assertThat(registry.getRoomOf("B")).isEmpty();
        assertThat(dispatcher.getSession("s-B")).isEmpty();
        assertThat(dispatcher.getSession("s-C")).isEmpty();
        assertThat(gateway.eventsFor("B", EventType.ROOM_JOINED)).hasSize(1);
        assertThat(gateway.eventsFor("C")).isEmpty();
        assertThat(dispatcher.sessionCount()).isEqualTo(1);
    }

    @Test
    void screenShareStartAndStopAreAnnounced() {
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.startScreenShare(alice, new ScreenShareRequest("stream-1"));

        SignalEvent started = single(gateway.eventsFor("B", EventType.USER_STARTED_SCREEN_SHARE));
        assertThat(started.get("streamId")).isEqualTo("stream-1");
        assertThat(started.get("userName")).isEqualTo("Alice");
        assertThat(room.getParticipant("A")).hasValueSatisfying(p -> assertThat(p.isScreenSharing()).isTrue());

        dispatcher.stopScreenShare(alice);

        assertThat(gateway.recipientsOf(EventType.USER_STOPPED_SCREEN_SHARE)).containsExactly("B");
        assertThat(room.getParticipant("A")).hasValueSatisfying(p -> assertThat(p.isScreenSharing()).isFalse());
    }

    @Test
    void screenShareIsRefusedWhenDisabled() {
        RoomSettingsRequest settings = new RoomSettingsRequest();
        settings.setAllowScreenShare(false);
        room = registry.createRoom("host", settings);
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.startScreenShare(alice, null);

        assertError("A", "permission-denied", "start-screen-share");
        assertThat(room.getParticipant("A")).hasValueSatisfying(p -> assertThat(p.isScreenSharing()).isFalse());
        assertThat(gateway.recipientsOf(EventType.USER_STARTED_SCREEN_SHARE)).isEmpty();
    }

    @Test
    void hostStopsRecording() {
        join(alice, "Alice");
        join(bob, "Bob");
        dispatcher.startRecording(alice);

        dispatcher.stopRecording(bob);
        assertError("B", "permission-denied", "stop-recording");
        assertThat(room.getSettings().isRecordingEnabled()).isTrue();

        dispatcher.stopRecording(alice);

        assertThat(room.getSettings().isRecordingEnabled()).isFalse();
        assertThat(single(gateway.eventsFor("B", EventType.RECORDING_STOPPED)).get("stoppedBy")).isEqualTo("A");
    }

    @Test
    void sharedFileGoesToEveryone() {
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.shareFile(bob, new FileShareRequest("notes.pdf", 2048L, "application/pdf",
                "https://files.example/notes.pdf"));

        assertThat(gateway.recipientsOf(EventType.NEW_FILE)).containsExactlyInAnyOrder("A", "B");
        SignalEvent file = single(gateway.eventsFor("A", EventType.NEW_FILE));
        assertThat(file.get("fileName")).isEqualTo("notes.pdf");
        assertThat(file.get("fileSize")).isEqualTo(2048L);
        assertThat(file.get("type")).isEqualTo("file");
        assertThat(file.get("userName")).isEqualTo("Bob");
    }

    @Test
    void connectionQualityGoesToOthers() {
        join(alice, "Alice");
        join(bob, "Bob");

        dispatcher.connectionQuality(alice, new ConnectionQualityRequest("poor", Map.of("rtt", 420)));

        assertThat(gateway.recipientsOf(EventType.USER_CONNECTION_QUALITY)).containsExactly("B");
        SignalEvent quality = single(gateway.eventsFor("B", EventType.USER_CONNECTION_QUALITY));
        assertThat(quality.get("quality")).isEqualTo("poor");
        assertThat(quality.get("userId")).isEqualTo("A");
    }

    private void join(SessionOrigin origin, String name) {
        dispatcher.join(origin, new JoinRoomRequest(room.getId(), name, null));
    }

    private void assertError(String participantId, String errorType, String event) {
        SignalEvent error = gateway.lastFor(participantId);
        assertThat(error).isNotNull();
        assertThat(error.getType()).isEqualTo(EventType.ERROR);
        assertThat(error.get("errorType")).isEqualTo(errorType);
        assertThat(error.get("event")).isEqualTo(event);
    }

    private static SignalEvent single(List<SignalEvent> events) {
        assertThat(events).hasSize(1);
        return events.get(0);
    }
}
