package com.roomsignal.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomsignal.exception.ErrorType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SignalEventTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void serializesFlatWithWireName() throws Exception {
        String json = objectMapper.writeValueAsString(SignalEvent.of(EventType.USER_CONNECTED)
                .with("userId", "A"));

        assertThat(json).isEqualTo("{\"type\":\"user-connected\",\"userId\":\"A\"}");
    }

    @Test
    void errorCarriesTagAndMessage() throws Exception {
        JsonNode node = objectMapper.readTree(objectMapper.writeValueAsString(
                SignalEvent.error(ErrorType.ROOM_FULL, "Room is full. Maximum 2 users allowed.")
                        .with("event", "join-room")));

        assertThat(node.get("type").asText()).isEqualTo("error");
        assertThat(node.get("errorType").asText()).isEqualTo("room-full");
        assertThat(node.get("event").asText()).isEqualTo("join-room");
    }
}
