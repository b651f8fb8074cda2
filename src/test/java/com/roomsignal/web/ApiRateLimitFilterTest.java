package com.roomsignal.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomsignal.config.SignalingProperties;
import com.roomsignal.controller.HealthController;
import com.roomsignal.service.RateLimiter;
import com.roomsignal.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ApiRateLimitFilterTest {

    @RestController
    static class PingController {
        @GetMapping("/api/ping")
        public String ping() {
            return "pong";
        }
    }

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        SignalingProperties properties = new SignalingProperties();
        properties.getRateLimit().setApi(new SignalingProperties.Policy(3, Duration.ofMinutes(15)));
        RateLimiter rateLimiter = new RateLimiter(properties, clock);

        mockMvc = MockMvcBuilders
                .standaloneSetup(new PingController(), new HealthController(clock))
                .addFilters(new ApiRateLimitFilter(rateLimiter, new ObjectMapper()))
                .build();
    }

    @Test
    void rejectsApiRequestsOverTheLimit() throws Exception {
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(get("/api/ping")).andExpect(status().isOk());
        }

        mockMvc.perform(get("/api/ping"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("rate-limited"))
                .andExpect(jsonPath("$.message").value("Too many requests from this IP, please try again later."));
    }

    @Test
    void leavesNonApiPathsAlone() throws Exception {
        for (int i = 0; i < 5; i++) {
            mockMvc.perform(get("/health")).andExpect(status().isOk());
        }
    }
}
