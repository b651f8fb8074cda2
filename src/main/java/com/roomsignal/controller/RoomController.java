package com.roomsignal.controller;

import com.roomsignal.dto.CreateRoomRequest;
import com.roomsignal.exception.SignalingException;
import com.roomsignal.model.Room;
import com.roomsignal.service.ConnectionRegistry;
import com.roomsignal.service.RateLimiter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.servlet.http.HttpServletRequest;
import javax.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class RoomController {

    private final ConnectionRegistry registry;
    private final RateLimiter rateLimiter;

    public RoomController(ConnectionRegistry registry, RateLimiter rateLimiter) {
        this.registry = registry;
        this.rateLimiter = rateLimiter;
    }

    @PostMapping("/rooms")
    public ResponseEntity<Map<String, Object>> createRoom(@Valid @RequestBody(required = false) CreateRoomRequest request,
                                                          HttpServletRequest httpRequest) {
        rateLimiter.check(RateLimiter.Policy.ROOM_CREATION, httpRequest.getRemoteAddr());

        CreateRoomRequest body = request != null ? request : new CreateRoomRequest();
        Room room = registry.createRoom(body.getCreatedBy(), body.getSettings());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("roomId", room.getId());
        response.put("message", "Room created successfully");
        response.put("roomInfo", registry.roomInfo(room.getId()).orElse(null));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/rooms")
    public ResponseEntity<List<Map<String, Object>>> listRooms() {
        return ResponseEntity.ok(registry.allRooms());
    }

    @GetMapping("/rooms/{roomId}")
    public ResponseEntity<Map<String, Object>> getRoomInfo(@PathVariable String roomId) {
        return registry.roomInfo(roomId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> SignalingException.roomNotFound(roomId));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(registry.stats());
    }
}
