package com.roomsignal.service;

import com.roomsignal.config.SignalingProperties;
import com.roomsignal.model.IceServer;
import com.roomsignal.model.MediaKind;
import com.roomsignal.model.MediaState;
import com.roomsignal.model.PeerEntry;
import com.roomsignal.model.PeerLink;
import com.roomsignal.model.PeerLinkStatus;
import com.roomsignal.model.PendingOffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Signaling state per room: who is tracked, which pairs have exchanged an offer,
 * and which offers still wait for an answer.
 * <p>
 * A pair has at most one {@link PeerLink}. It is stored under the order-independent
 * pair key and referenced from both participants' entries, so offer, answer and
 * departure all find it the same way. Every public method synchronizes on this
 * instance.
 */
@Service
public class PeerConnectionTracker {
    private static final Logger log = LoggerFactory.getLogger(PeerConnectionTracker.class);

    /** roomId → participantId → entry */
    private final Map<String, Map<String, PeerEntry>> connections = new HashMap<>();
    /** roomId → pair key → link */
    private final Map<String, Map<String, PeerLink>> links = new HashMap<>();
    /** connectionId → offer */
    private final Map<String, PendingOffer> pendingOffers = new LinkedHashMap<>();

    private final MediaStateTable mediaStates;
    private final SignalingProperties properties;
    private final Clock clock;

    public PeerConnectionTracker(MediaStateTable mediaStates, SignalingProperties properties, Clock clock) {
        this.mediaStates = mediaStates;
        this.properties = properties;
        this.clock = clock;
    }

    public synchronized PeerEntry addParticipant(String roomId, String participantId, String sessionHandle) {
        Map<String, PeerEntry> roomConnections = connections.computeIfAbsent(roomId, k -> {
            log.info("WebRTC connections initialized for room: {}", roomId);
            return new LinkedHashMap<>();
        });

        PeerEntry entry = roomConnections.get(participantId);
        if (entry == null) {
            entry = new PeerEntry(sessionHandle, mediaStates.getOrRegister(participantId));
            roomConnections.put(participantId, entry);
            log.info("User {} added to WebRTC room {}", participantId, roomId);
        }
        return entry;
    }

    /**
     * Forgets the participant, every link it takes part in and every pending offer
     * it sent or received.
     */
    public synchronized boolean removeParticipant(String roomId, String participantId) {
        Map<String, PeerEntry> roomConnections = connections.get(roomId);
        if (roomConnections == null || !roomConnections.containsKey(participantId)) {
            return false;
        }

        PeerEntry entry = roomConnections.remove(participantId);
        Map<String, PeerLink> roomLinks = links.get(roomId);
        for (Map.Entry<String, PeerLink> peer : entry.getPeers().entrySet()) {
            PeerEntry other = roomConnections.get(peer.getKey());
            if (other != null) {
                other.getPeers().remove(participantId);
            }
            if (roomLinks != null) {
                roomLinks.remove(PeerLink.pairKey(participantId, peer.getKey()));
            }
        }
        entry.getPeers().clear();
        pendingOffers.values().removeIf(offer ->
                offer.getRoomId().equals(roomId) && offer.involves(participantId));

        if (roomConnections.isEmpty()) {
            connections.remove(roomId);
            links.remove(roomId);
            log.info("WebRTC room {} cleaned up (empty)", roomId);
        }
        log.info("User {} removed from WebRTC room {}", participantId, roomId);
        return true;
    }

    /**
     * Records that {@code fromId} is negotiating with {@code toId}. A newer offer
     * from either side replaces the pair's previous link.
     */
    public synchronized Optional<String> createPeerLink(String roomId, String fromId, String toId) {
        Map<String, PeerEntry> roomConnections = connections.get(roomId);
        if (roomConnections == null || fromId.equals(toId)) return Optional.empty();

        PeerEntry from = roomConnections.get(fromId);
        PeerEntry to = roomConnections.get(toId);
        if (from == null || to == null) return Optional.empty();

        String pairKey = PeerLink.pairKey(fromId, toId);
        Map<String, PeerLink> roomLinks = links.computeIfAbsent(roomId, k -> new HashMap<>());
        PeerLink previous = roomLinks.get(pairKey);
        if (previous != null) {
            pendingOffers.remove(previous.getConnectionId());
        }

        PeerLink link = new PeerLink(fromId, toId, clock.instant());
        roomLinks.put(pairKey, link);
        from.getPeers().put(toId, link);
        to.getPeers().put(fromId, link);
        from.setInitiator(true);

        log.info("Peer connection created: {} in room {}", link.getConnectionId(), roomId);
        return Optional.of(link.getConnectionId());
    }

    public synchronized Optional<String> handleOffer(String roomId, String fromId, String toId, Object offer) {
        Optional<String> connectionId = createPeerLink(roomId, fromId, toId);
        connectionId.ifPresent(id -> {
            pendingOffers.put(id, new PendingOffer(roomId, fromId, toId, offer, clock.instant()));
            log.info("Offer stored for connection: {}", id);
        });
        return connectionId;
    }

    /**
     * Completes the pair's negotiation.
     *
     * @param fromId the answering participant
     * @param toId   the participant whose offer is being answered
     * @return false when no offer from {@code toId} to {@code fromId} is on record
     */
    public synchronized boolean handleAnswer(String roomId, String fromId, String toId, Object answer) {
        Optional<PeerLink> link = findLink(roomId, fromId, toId);
        if (!link.isPresent() || !link.get().getInitiatorId().equals(toId)) {
            log.warn("Answer from {} to {} in room {} has no matching offer", fromId, toId, roomId);
            return false;
        }

        link.get().setStatus(PeerLinkStatus.CONNECTED);
        pendingOffers.remove(link.get().getConnectionId());
        log.info("Answer processed for connection: {}", link.get().getConnectionId());
        return true;
    }

    public synchronized Optional<PeerLink> findLink(String roomId, String a, String b) {
        Map<String, PeerLink> roomLinks = links.get(roomId);
        if (roomLinks == null) return Optional.empty();
        return Optional.ofNullable(roomLinks.get(PeerLink.pairKey(a, b)));
    }

    public synchronized boolean isTracked(String roomId, String participantId) {
        Map<String, PeerEntry> roomConnections = connections.get(roomId);
        return roomConnections != null && roomConnections.containsKey(participantId);
    }

    public synchronized Optional<MediaState> updateMediaState(String roomId, String participantId,
                                                             MediaKind kind, boolean enabled) {
        Map<String, PeerEntry> roomConnections = connections.get(roomId);
        PeerEntry entry = roomConnections != null ? roomConnections.get(participantId) : null;
        if (entry == null) {
            log.error("Failed to update media state for {} in room {}: User not found", participantId, roomId);
            return Optional.empty();
        }

        boolean previous = entry.getMediaState().get(kind);
        entry.getMediaState().set(kind, enabled);
        log.info("Media state updated for {}: {} changed from {} to {}",
                participantId, kind.getLabel(), previous, enabled);
        return Optional.of(entry.getMediaState());
    }

    public synchronized Optional<Map<String, Object>> roomSnapshot(String roomId) {
        Map<String, PeerEntry> roomConnections = connections.get(roomId);
        if (roomConnections == null) return Optional.empty();

        Map<String, Object> users = new LinkedHashMap<>();
        for (Map.Entry<String, PeerEntry> e : roomConnections.entrySet()) {
            PeerEntry entry = e.getValue();
            Map<String, Object> user = new LinkedHashMap<>();
            user.put("sessionHandle", entry.getSessionHandle());
            user.put("peerCount", entry.getPeers().size());
            user.put("mediaState", entry.getMediaState().toMap());
            user.put("isInitiator", entry.isInitiator());
            user.put("peers", new ArrayList<>(entry.getPeers().keySet()));
            users.put(e.getKey(), user);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("roomId", roomId);
        result.put("userCount", roomConnections.size());
        result.put("users", users);
        result.put("totalConnections", linkCount(roomId));
        return Optional.of(result);
    }

    public List<IceServer> iceServers() {
        return Collections.unmodifiableList(properties.getIceServers());
    }

    /**
     * Drops offers older than {@code maxAge}. A link still waiting on an expired
     * offer is dropped as well; a link that has since been answered or replaced
     * by a newer offer is kept.
     *
     * @return number of offers removed
     */
    public synchronized int sweepExpiredOffers(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;

        Iterator<Map.Entry<String, PendingOffer>> it = pendingOffers.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, PendingOffer> e = it.next();
            PendingOffer offer = e.getValue();
            if (!offer.getTimestamp().isBefore(cutoff)) continue;

            it.remove();
            removed++;
            findLink(offer.getRoomId(), offer.getFromId(), offer.getToId())
                    .filter(link -> link.getStatus() == PeerLinkStatus.CONNECTING)
                    .filter(link -> link.getConnectionId().equals(e.getKey()))
                    .ifPresent(link -> dropLink(offer.getRoomId(), link));
            log.info("Expired offer cleaned up: {}", e.getKey());
        }
        return removed;
    }

    public int sweepExpiredOffers() {
        return sweepExpiredOffers(properties.getOfferMaxAge());
    }

    public synchronized int pendingOfferCount() {
        return pendingOffers.size();
    }

    public synchronized Map<String, Object> stats() {
        int totalUsers = 0;
        int totalConnections = 0;
        Map<String, Object> rooms = new LinkedHashMap<>();

        for (Map.Entry<String, Map<String, PeerEntry>> e : connections.entrySet()) {
            int roomConnectionCount = linkCount(e.getKey());
            totalUsers += e.getValue().size();
            totalConnections += roomConnectionCount;

            Map<String, Object> room = new LinkedHashMap<>();
            room.put("userCount", e.getValue().size());
            room.put("connectionCount", roomConnectionCount);
            rooms.put(e.getKey(), room);
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalRooms", connections.size());
        stats.put("totalUsers", totalUsers);
        stats.put("totalConnections", totalConnections);
        stats.put("pendingOffers", pendingOffers.size());
        stats.put("rooms", rooms);
        return stats;
    }

    private int linkCount(String roomId) {
        Map<String, PeerLink> roomLinks = links.get(roomId);
        return roomLinks != null ? roomLinks.size() : 0;
    }

    private void dropLink(String roomId, PeerLink link) {
        Map<String, PeerLink> roomLinks = links.get(roomId);
        if (roomLinks != null) {
            roomLinks.remove(PeerLink.pairKey(link.getInitiatorId(), link.getTargetId()));
        }
        Map<String, PeerEntry> roomConnections = connections.get(roomId);
        if (roomConnections == null) return;

        for (String id : List.of(link.getInitiatorId(), link.getTargetId())) {
            PeerEntry entry = roomConnections.get(id);
            if (entry != null) {
                entry.getPeers().remove(link.peerOf(id));
            }
        }
    }
}
