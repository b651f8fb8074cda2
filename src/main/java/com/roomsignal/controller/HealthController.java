package com.roomsignal.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final Clock clock;
    private final Instant startedAt;

    public HealthController(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> index() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Room Signaling API");
        response.put("status", "running");
        response.put("timestamp", clock.instant().toString());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "healthy");
        response.put("uptime", Duration.between(startedAt, clock.instant()).getSeconds());
        return ResponseEntity.ok(response);
    }
}
