package com.roomsignal.controller;

import com.roomsignal.exception.ErrorType;
import com.roomsignal.exception.SignalingException;
import com.roomsignal.service.PeerConnectionTracker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/webrtc")
public class WebRTCStatusController {

    private final PeerConnectionTracker tracker;

    public WebRTCStatusController(PeerConnectionTracker tracker) {
        this.tracker = tracker;
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(tracker.stats());
    }

    @GetMapping("/rooms/{roomId}")
    public ResponseEntity<Map<String, Object>> getRoomConnections(@PathVariable String roomId) {
        return tracker.roomSnapshot(roomId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new SignalingException(ErrorType.ROOM_NOT_FOUND,
                        "Room not found in WebRTC manager"));
    }

    @GetMapping("/ice-servers")
    public ResponseEntity<Map<String, Object>> getIceServers() {
        return ResponseEntity.ok(Map.of("iceServers", tracker.iceServers()));
    }
}
