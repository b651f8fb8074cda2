package com.roomsignal.ws;

import com.roomsignal.service.SignalingDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

@Component
public class SessionDisconnectListener {
    private static final Logger log = LoggerFactory.getLogger(SessionDisconnectListener.class);

    private final SignalingDispatcher dispatcher;

    public SessionDisconnectListener(SignalingDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @EventListener
    public void handleSessionConnected(SessionConnectedEvent event) {
        Principal user = event.getUser();
        log.info("User connected: {}", user != null ? user.getName() : "anonymous");
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        dispatcher.disconnect(event.getSessionId());
    }
}
