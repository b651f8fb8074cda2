package com.roomsignal.controller;

import com.roomsignal.config.SignalingProperties;
import com.roomsignal.service.MediaStateTable;
import com.roomsignal.service.PeerConnectionTracker;
import com.roomsignal.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class WebRTCStatusControllerTest {

    private MutableClock clock;
    private PeerConnectionTracker tracker;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        tracker = new PeerConnectionTracker(new MediaStateTable(), new SignalingProperties(), clock);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new WebRTCStatusController(tracker), new HealthController(clock))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void reportsRoomSnapshot() throws Exception {
        tracker.addParticipant("r1", "A", "s-A");
        tracker.addParticipant("r1", "B", "s-B");
        tracker.handleOffer("r1", "A", "B", "offer");

        mockMvc.perform(get("/api/webrtc/rooms/{roomId}", "r1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userCount").value(2))
                .andExpect(jsonPath("$.totalConnections").value(1))
                .andExpect(jsonPath("$.users.A.isInitiator").value(true))
                .andExpect(jsonPath("$.users.B.mediaState.audio").value(true));

        mockMvc.perform(get("/api/webrtc/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pendingOffers").value(1))
                .andExpect(jsonPath("$.rooms.r1.connectionCount").value(1));
    }

    @Test
    void unknownRoomIsNotFound() throws Exception {
        mockMvc.perform(get("/api/webrtc/rooms/{roomId}", "missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Room not found in WebRTC manager"));
    }

    @Test
    void listsIceServers() throws Exception {
        mockMvc.perform(get("/api/webrtc/ice-servers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.iceServers", hasSize(3)))
                .andExpect(jsonPath("$.iceServers[0].urls[0]").value("stun:stun.l.google.com:19302"));
    }

    @Test
    void healthReportsUptime() throws Exception {
        clock.advance(Duration.ofSeconds(42));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.uptime").value(42));

        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Room Signaling API"));
    }
}
