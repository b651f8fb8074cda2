package com.roomsignal.ws;

import org.springframework.http.server.ServerHttpRequest;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.support.DefaultHandshakeHandler;

import java.security.Principal;
import java.util.Map;
import java.util.UUID;

/**
 * Gives every WebSocket connection its own principal. The principal name is the
 * participant id and the address for user-destined messages.
 */
public class ParticipantHandshakeHandler extends DefaultHandshakeHandler {

    @Override
    protected Principal determineUser(ServerHttpRequest request,
                                      WebSocketHandler wsHandler,
                                      Map<String, Object> attributes) {
        String participantId = UUID.randomUUID().toString();
        return () -> participantId;
    }
}
